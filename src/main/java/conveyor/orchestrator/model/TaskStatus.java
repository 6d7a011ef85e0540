package conveyor.orchestrator.model;

/**
 * Status of a task execution inside a pipeline run.
 */
public enum TaskStatus {
    /** Waiting for upstream tasks (or backoff) before it can be dispatched */
    PENDING,
    /** Claimed by a dispatcher, launch in progress */
    STARTING,
    /** Acknowledged by the launcher, container is executing */
    RUNNING,
    /** Completed and every declared output was recorded */
    SUCCEEDED,
    /** Failed with no retries left */
    FAILED,
    /** Not executed because an upstream task did not succeed */
    SKIPPED,
    /** Cancelled by a run cancellation or failure policy */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /** STARTING or RUNNING: occupies a launcher slot. */
    public boolean isInFlight() {
        return this == STARTING || this == RUNNING;
    }

    /** Terminal and not successful: downstream tasks can never run. */
    public boolean blocksDownstream() {
        return this == FAILED || this == SKIPPED || this == CANCELLED;
    }
}
