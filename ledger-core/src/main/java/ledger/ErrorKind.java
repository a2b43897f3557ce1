package ledger;

/**
 * Classification carried by {@link Result.Err}.
 */
public enum ErrorKind {
    /** Malformed input. */
    VALIDATION,
    /** A referenced aggregate or projection does not exist. */
    NOT_FOUND,
    /** The caller does not own the aggregate it tried to act on. */
    UNAUTHORIZED,
    /** A domain rule rejected the operation, or an optimistic version check failed. */
    CONFLICT,
    /** The event store, a repository or the cache could not be read or written. */
    STORAGE,
    /** Some items of a bulk operation were skipped. */
    PARTIAL_FAILURE,
    /** A programming error caught at a bus boundary. */
    INTERNAL
}
