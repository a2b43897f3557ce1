package ledger.cache;

/**
 * Thrown by network-backed cache services when the backing store cannot be reached.
 * The query path absorbs it and treats the lookup as a miss.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
