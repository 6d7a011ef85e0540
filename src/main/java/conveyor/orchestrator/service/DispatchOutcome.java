package conveyor.orchestrator.service;

/**
 * What a single dispatcher call did to a task.
 */
public enum DispatchOutcome {
    /** Claimed and acknowledged by the launcher, now RUNNING */
    LAUNCHED,
    /** Another dispatcher won the claim, or the task is no longer in the expected status */
    NOT_CLAIMED,
    /** Launcher reports the attempt is still executing */
    STILL_RUNNING,
    /** Every declared output recorded, task SUCCEEDED */
    SUCCEEDED,
    /** Attempt failed, task back to PENDING with backoff */
    RETRY_SCHEDULED,
    /** Launcher unreachable, task back to PENDING without using its retry budget */
    INFRA_RETRY,
    /** Attempt failed with no retries left, or the failure was fatal */
    FAILED,
    /** Task was cancelled */
    CANCELLED
}
