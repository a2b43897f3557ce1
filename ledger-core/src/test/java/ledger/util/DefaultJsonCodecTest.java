package ledger.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJsonCodecTest {
    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void emptyAndNullMapsEncodeAsEmptyObject() {
        assertEquals("{}", codec.toJson(Map.of()));
        assertEquals("{}", codec.toJson(null));
    }

    @Test
    void encodesInIterationOrder() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("habitId", "h1");
        values.put("userId", "u1");

        assertEquals("{\"habitId\":\"h1\",\"userId\":\"u1\"}", codec.toJson(values));
    }

    @Test
    void escapesQuotesBackslashesAndControlCharacters() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("title", "Say \"hi\"\\\n\tnow");

        Map<String, String> parsed = codec.parseObject(codec.toJson(values));

        assertEquals(values, parsed);
    }

    @Test
    void keepsUnicodeText() {
        Map<String, String> values = Map.of("title", "Méditer 🧘");

        assertEquals(values, codec.parseObject(codec.toJson(values)));
    }

    @Test
    void parseDropsNullValues() {
        Map<String, String> parsed = codec.parseObject("{\"a\":\"1\",\"b\":null}");

        assertEquals(Map.of("a", "1"), parsed);
    }

    @Test
    void parsePreservesDocumentOrder() {
        Map<String, String> parsed = codec.parseObject("{\"z\":\"1\",\"a\":\"2\",\"m\":\"3\"}");

        assertEquals(List.of("z", "a", "m"), List.copyOf(parsed.keySet()));
    }

    @Test
    void blankAndNullLiteralParseToEmptyMap() {
        assertTrue(codec.parseObject(null).isEmpty());
        assertTrue(codec.parseObject("  ").isEmpty());
        assertTrue(codec.parseObject("null").isEmpty());
        assertTrue(codec.parseObject("{}").isEmpty());
    }

    @Test
    void rejectsNullKeys() {
        Map<String, String> values = new HashMap<>();
        values.put(null, "x");

        assertThrows(IllegalArgumentException.class, () -> codec.toJson(values));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"1\""));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"1\"} trailing"));
    }
}
