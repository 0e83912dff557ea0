package survey.model.repository;

/** A store read or write failed; any open transaction has been rolled back. */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message) { super(message); }

    public PersistenceException(String message, Throwable cause) { super(message, cause); }
}
