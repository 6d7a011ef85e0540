package conveyor.orchestrator.launcher;

/**
 * The backend rejected or could not start a container. Counts against the task's retry budget.
 */
public class LaunchFailureException extends RuntimeException {

    public LaunchFailureException(String message) {
        super(message);
    }

    public LaunchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
