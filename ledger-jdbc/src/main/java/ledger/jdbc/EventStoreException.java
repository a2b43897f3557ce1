package ledger.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised by the JDBC stores.
 *
 * <p>Appends and snapshot writes convert it to a {@link ledger.ErrorKind#STORAGE} result;
 * reads let it propagate to the caller.
 */
public final class EventStoreException extends RuntimeException {
    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
