package ledger.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} objects, used for event payloads, snapshot
 * state and query cache keys.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies. Applications
 * that already carry a JSON library can implement this interface to delegate to it.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. Entries are written in the map's iteration order; a
     * {@code null} or empty map encodes as {@code {}}.
     *
     * @param values the map to encode
     * @return the JSON object text
     * @throws IllegalArgumentException if the map contains a null key
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object whose values are strings or {@code null}. Null values are dropped.
     *
     * @param json the JSON text; {@code null}, blank and {@code "null"} parse to an empty map
     * @return the parsed map in document order (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
