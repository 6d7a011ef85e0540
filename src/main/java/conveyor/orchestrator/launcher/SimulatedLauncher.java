package conveyor.orchestrator.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * In-process launcher that pretends to run containers: each attempt sleeps for a
 * configured duration, then succeeds (reporting every requested output URI) or
 * fails at the configured rate.
 * <p>
 * Task annotations can override the behaviour of a single task:
 * {@value #DURATION_ANNOTATION} (milliseconds) and {@value #FAIL_ANNOTATION} ({@code true}).
 * Handles live in memory only, so after a restart every handle polls as UNKNOWN.
 */
public final class SimulatedLauncher implements Launcher {

    private static final Logger log = LoggerFactory.getLogger(SimulatedLauncher.class);

    public static final String DURATION_ANNOTATION = "simulated.durationMs";
    public static final String FAIL_ANNOTATION = "simulated.fail";

    private final ScheduledExecutorService executor;
    private final Duration duration;
    private final double failRate;
    private final Map<String, PollResult> results = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<CompletionListener> listeners = new CopyOnWriteArrayList<>();

    public SimulatedLauncher(Duration duration, double failRate) {
        this.duration = duration;
        this.failRate = failRate;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "conveyor-sim-launcher");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String launch(LaunchSpec spec) {
        String handle = "sim-" + spec.executionId();
        long delayMs = annotationLong(spec, DURATION_ANNOTATION, duration.toMillis());
        boolean shouldFail = Boolean.parseBoolean(String.valueOf(spec.annotations().get(FAIL_ANNOTATION)))
                || (failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate);

        results.put(handle, PollResult.running());
        pending.put(handle, executor.schedule(() -> finish(handle, spec, shouldFail), delayMs, TimeUnit.MILLISECONDS));

        log.debug("Sim launched {} for task {} ({}ms, fail={})", handle, spec.taskId(), delayMs, shouldFail);
        return handle;
    }

    private void finish(String handle, LaunchSpec spec, boolean shouldFail) {
        pending.remove(handle);
        PollResult result = shouldFail
                ? PollResult.failed("Simulated failure")
                : PollResult.succeeded(spec.outputUris());
        if (results.replace(handle, PollResult.running(), result)) {
            log.debug("Sim {} finished: {}", handle, result.status());
            notifyListeners(handle);
        }
    }

    @Override
    public PollResult poll(String handle) {
        PollResult result = results.get(handle);
        return result != null ? result : PollResult.unknown("Unknown handle: " + handle);
    }

    @Override
    public boolean cancel(String handle) {
        ScheduledFuture<?> future = pending.remove(handle);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        results.put(handle, PollResult.failed("Cancelled"));
        log.debug("Sim {} cancelled", handle);
        return true;
    }

    @Override
    public void onCompletion(CompletionListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(String handle) {
        for (CompletionListener listener : listeners) {
            try {
                listener.completed(handle);
            } catch (RuntimeException e) {
                log.warn("Completion listener failed for {}: {}", handle, e.getMessage());
            }
        }
    }

    private static long annotationLong(LaunchSpec spec, String key, long fallback) {
        Object value = spec.annotations().get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Long.parseLong(String.valueOf(value));
        } catch (NumberFormatException e) {
            log.warn("Ignoring annotation {}={} on task {}", key, value, spec.taskId());
            return fallback;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
