package ledger.query;

import ledger.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Deterministic cache keys for queries.
 *
 * <p>Format: {@code query:<type>:<base64url(json arguments)>}, followed by
 * {@code :user:<userId>} when the query is scoped to a user. The user suffix matches the
 * {@code *:user:<userId>} invalidation pattern.
 */
public final class CacheKeys {
    public static final String QUERY_PREFIX = "query:";
    public static final String ALL_QUERIES = QUERY_PREFIX + "*";

    private CacheKeys() {
    }

    public static String queryKey(Query<?> query, JsonCodec codec) {
        String json = codec.toJson(query.cacheArguments());
        String encoded = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(json.getBytes(StandardCharsets.UTF_8));
        StringBuilder key = new StringBuilder(QUERY_PREFIX).append(query.type()).append(':').append(encoded);
        if (query.userId() != null) {
            key.append(":user:").append(query.userId());
        }
        return key.toString();
    }

    /**
     * Pattern matching every cached result of one query type.
     */
    public static String typePattern(String queryType) {
        return QUERY_PREFIX + queryType + ":*";
    }
}
