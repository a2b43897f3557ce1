package ledger.query;

import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable read request, dispatched through the {@link QueryBus} to exactly one
 * {@link QueryHandler}.
 *
 * <p>When a query is cached, its key is derived from {@link #type()} and
 * {@link #cacheArguments()}, and tagged with {@link #userId()} so the entry is dropped by
 * per-user invalidation.
 *
 * @param <R> the result type
 */
public interface Query<R> {

    /**
     * The user the query runs for, or {@code null} for queries not scoped to a user.
     */
    default String userId() {
        return null;
    }

    /**
     * Name used in cache keys and logs. Defaults to the simple class name.
     */
    default String type() {
        return getClass().getSimpleName();
    }

    /**
     * Arguments that identify the query's result, sorted by name. Two queries of one type with
     * equal arguments share a cache entry. Build with {@link #arguments(Object...)}.
     */
    Map<String, String> cacheArguments();

    /**
     * Sorted argument map from alternating names and values. Values are rendered with
     * {@link String#valueOf(Object)}; {@code null} values are left out.
     *
     * @throws IllegalArgumentException if a name is missing or not a string
     */
    static Map<String, String> arguments(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " items");
        }
        Map<String, String> arguments = new TreeMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            if (!(namesAndValues[i] instanceof String name)) {
                throw new IllegalArgumentException("Argument name at " + i + " must be a string");
            }
            Object value = namesAndValues[i + 1];
            if (value != null) {
                arguments.put(name, String.valueOf(value));
            }
        }
        return arguments;
    }
}
