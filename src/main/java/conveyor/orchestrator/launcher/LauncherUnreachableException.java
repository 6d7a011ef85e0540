package conveyor.orchestrator.launcher;

/**
 * The backend itself could not be reached. Retried on a separate infrastructure budget.
 */
public class LauncherUnreachableException extends RuntimeException {

    public LauncherUnreachableException(String message) {
        super(message);
    }

    public LauncherUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
