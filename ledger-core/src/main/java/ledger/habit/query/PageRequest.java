package ledger.habit.query;

import java.io.Serializable;

/**
 * One-based page number and page size.
 */
public record PageRequest(int page, int limit) implements Serializable {
    public static final PageRequest FIRST = new PageRequest(1, 10);

    public PageRequest {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1 || limit > 100) {
            throw new IllegalArgumentException("limit must be between 1 and 100");
        }
    }
}
