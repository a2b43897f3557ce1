package ledger.model;

/**
 * Counters reported by a cache service.
 *
 * @param hits             successful lookups
 * @param misses           lookups that found nothing or an expired entry
 * @param keys             live entries, or {@code -1} when unknown
 * @param connectionStatus {@code "connected"}, {@code "disconnected"} or {@code "in-memory"}
 */
public record CacheStats(long hits, long misses, long keys, String connectionStatus) {
    public static final String CONNECTED = "connected";
    public static final String DISCONNECTED = "disconnected";
    public static final String IN_MEMORY = "in-memory";

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0d : (double) hits / total;
    }
}
