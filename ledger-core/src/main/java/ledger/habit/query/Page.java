package ledger.habit.query;

import java.io.Serializable;
import java.util.List;

/**
 * A page of results.
 *
 * @param data       items on this page
 * @param page       one-based page number
 * @param limit      page size
 * @param total      total matching items
 * @param totalPages number of pages, {@code 0} when nothing matched
 */
public record Page<T>(List<T> data, int page, int limit, long total, int totalPages) implements Serializable {
    public Page {
        data = List.copyOf(data);
    }

    static <T> Page<T> of(List<T> all, PageRequest request) {
        int from = (int) Math.min(all.size(), (long) (request.page() - 1) * request.limit());
        int to = Math.min(all.size(), from + request.limit());
        int totalPages = (all.size() + request.limit() - 1) / request.limit();
        return new Page<>(all.subList(from, to), request.page(), request.limit(), all.size(), totalPages);
    }
}
