package conveyor.orchestrator.model;

/**
 * What a run does with the rest of its graph once a required task has failed.
 */
public enum FailurePolicy {
    /** Keep dispatching every branch that does not depend on the failure */
    CONTINUE,
    /** Stop dispatching, let in-flight tasks finish, skip the remaining pending tasks */
    DRAIN,
    /** Cancel in-flight tasks and skip the remaining pending tasks */
    CANCEL
}
