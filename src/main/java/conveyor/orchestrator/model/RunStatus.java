package conveyor.orchestrator.model;

/**
 * Pipeline run status.
 */
public enum RunStatus {
    /** Run created, no task dispatched yet */
    PENDING,
    /** At least one controller step has been taken */
    RUNNING,
    /** Every task succeeded or was skipped, no required task failed */
    SUCCEEDED,
    /** A required task failed and nothing is left to do */
    FAILED,
    /** Cancelled by the user */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
