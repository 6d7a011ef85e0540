package conveyor.orchestrator.repository;

/**
 * The execution state store could not be read or written.
 * CAS conflicts are not errors and never raise this.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
