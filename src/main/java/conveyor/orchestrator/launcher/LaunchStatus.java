package conveyor.orchestrator.launcher;

/**
 * Status of a launched container as reported by {@link Launcher#poll(String)}.
 */
public enum LaunchStatus {
    /** Still executing */
    RUNNING,
    /** Exited successfully */
    SUCCEEDED,
    /** Exited with an error */
    FAILED,
    /** The backend no longer knows the handle */
    UNKNOWN
}
