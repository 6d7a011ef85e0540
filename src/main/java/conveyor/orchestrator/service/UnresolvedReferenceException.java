package conveyor.orchestrator.service;

/**
 * An input of a task references a value that is not available. Fatal to the task:
 * retrying cannot change a structural problem.
 */
public class UnresolvedReferenceException extends RuntimeException {

    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
