package conveyor.orchestrator.launcher;

/**
 * Backend that runs task containers. The orchestrator relies on these operations
 * only and never on a specific container runtime.
 */
public interface Launcher extends AutoCloseable {

    /**
     * Start one attempt.
     *
     * @param spec what to run
     * @return opaque handle used for polling and cancellation
     * @throws LaunchFailureException       if the backend refused the container
     * @throws LauncherUnreachableException if the backend could not be reached
     */
    String launch(LaunchSpec spec);

    /**
     * Report the current status of an attempt.
     *
     * @param handle handle returned by {@link #launch(LaunchSpec)}
     * @return current status, UNKNOWN if the handle is not known
     * @throws LauncherUnreachableException if the backend could not be reached
     */
    PollResult poll(String handle);

    /**
     * Best-effort cancellation.
     *
     * @param handle handle returned by {@link #launch(LaunchSpec)}
     * @return true if the backend accepted the cancellation
     */
    boolean cancel(String handle);

    /**
     * Register a listener called when an attempt finishes. Backends without a push
     * channel ignore it and are observed by polling only.
     */
    default void onCompletion(CompletionListener listener) {
    }

    @Override
    default void close() {
    }

    /**
     * Push notification that the attempt behind a handle finished.
     */
    @FunctionalInterface
    interface CompletionListener {
        void completed(String handle);
    }
}
