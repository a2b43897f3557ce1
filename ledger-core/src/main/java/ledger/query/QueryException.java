package ledger.query;

import ledger.ErrorKind;

import java.util.Objects;

/**
 * Failure of a query, classified the same way as command errors.
 */
public class QueryException extends RuntimeException {
    private final ErrorKind kind;

    public QueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public QueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
