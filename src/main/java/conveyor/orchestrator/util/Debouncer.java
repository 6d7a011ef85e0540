package conveyor.orchestrator.util;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces bursts of submissions into one execution, run on the given executor
 * once no new submission arrived for the delay.
 */
public final class Debouncer {
    private final ScheduledExecutorService ses;
    private final long delayMs;
    private ScheduledFuture<?> future;

    public Debouncer(ScheduledExecutorService ses, long delayMs) {
        this.ses = ses;
        this.delayMs = delayMs;
    }

    public synchronized void submit(Runnable task) {
        if (future != null) future.cancel(false);
        future = ses.schedule(task, delayMs, TimeUnit.MILLISECONDS);
    }
}
