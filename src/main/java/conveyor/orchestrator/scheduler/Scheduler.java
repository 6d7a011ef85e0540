package conveyor.orchestrator.scheduler;

import conveyor.orchestrator.config.OrchestratorConfig;
import conveyor.orchestrator.util.Debouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - RunSweeper: steps every active run
 * - StaleExecutionReaper: recovers executions stuck in STARTING
 * 
 * Uses a single-threaded executor so sweeps never overlap. Change notifications
 * request an extra sweep through {@link #requestSweep()}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);
    private static final long SWEEP_DEBOUNCE_MS = 20;

    private final ScheduledExecutorService executor;
    private final RunSweeper runSweeper;
    private final StaleExecutionReaper reaper;
    private final OrchestratorConfig config;
    private final Debouncer sweepDebouncer;

    private volatile boolean running = false;

    public Scheduler(RunSweeper runSweeper, StaleExecutionReaper reaper, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conveyor-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.runSweeper = runSweeper;
        this.reaper = reaper;
        this.config = config;
        this.sweepDebouncer = new Debouncer(executor, SWEEP_DEBOUNCE_MS);
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long sweepIntervalMs = config.sweepInterval().toMillis();
        executor.scheduleWithFixedDelay(runSweeper, 0, sweepIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Run sweeper scheduled every {}ms", sweepIntervalMs);

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleAtFixedRate(reaper, reaperIntervalMs, reaperIntervalMs, TimeUnit.MILLISECONDS);
        log.info("Stale execution reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Run an extra sweep soon. Bursts of requests collapse into one sweep.
     */
    public void requestSweep() {
        if (!running) {
            return;
        }
        try {
            sweepDebouncer.submit(runSweeper);
        } catch (RejectedExecutionException e) {
            log.debug("Sweep request ignored, scheduler is stopping");
        }
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public RunSweeper runSweeper() {
        return runSweeper;
    }

    public StaleExecutionReaper reaper() {
        return reaper;
    }
}
