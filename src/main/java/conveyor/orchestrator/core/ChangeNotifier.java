package conveyor.orchestrator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Signals that task state changed somewhere (a dispatch finished, a launcher pushed
 * a completion). Run loops block on {@link #awaitChange(long, Duration)} instead of
 * sleeping for the whole poll interval.
 */
public final class ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final CopyOnWriteArrayList<Runnable> listeners = new CopyOnWriteArrayList<>();
    private long version = 0;

    public void onChange(Runnable listener) {
        listeners.add(listener);
    }

    public void fire() {
        synchronized (this) {
            version++;
            notifyAll();
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Change listener failed: {}", e.getMessage());
            }
        }
    }

    public synchronized long version() {
        return version;
    }

    /**
     * Wait until the version moves past {@code seen} or the timeout elapses.
     *
     * @return true if a change was observed
     */
    public synchronized boolean awaitChange(long seen, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (version == seen) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }
}
