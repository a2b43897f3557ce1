package ledger.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string-to-string objects.
 */
public final class DefaultJsonCodec implements JsonCodec {
    static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

    DefaultJsonCodec() {
    }

    @Override
    public String toJson(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        for (Map.Entry<String, String> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("JSON object cannot contain null keys");
            }
            if (sb.length() > 1) {
                sb.append(',');
            }
            appendString(sb, entry.getKey());
            sb.append(':');
            if (entry.getValue() == null) {
                sb.append("null");
            } else {
                appendString(sb, entry.getValue());
            }
        }
        return sb.append('}').toString();
    }

    @Override
    public Map<String, String> parseObject(String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return Collections.emptyMap();
        }
        Cursor cursor = new Cursor(json);
        cursor.expect('{');
        Map<String, String> result = new LinkedHashMap<>();
        if (cursor.peek() == '}') {
            cursor.next();
            cursor.expectEnd();
            return result;
        }
        while (true) {
            cursor.expect('"');
            String key = cursor.readString();
            cursor.expect(':');
            if (cursor.peek() == 'n') {
                cursor.readLiteral("null");
            } else {
                cursor.expect('"');
                result.put(key, cursor.readString());
            }
            char separator = cursor.next();
            if (separator == '}') {
                cursor.expectEnd();
                return result;
            }
            if (separator != ',') {
                throw new IllegalArgumentException("Expected ',' or '}' at offset " + (cursor.pos - 1));
            }
        }
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static final class Cursor {
        private final String input;
        private int pos;

        private Cursor(String input) {
            this.input = input;
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        private char peek() {
            skipWhitespace();
            if (pos >= input.length()) {
                throw new IllegalArgumentException("Unexpected end of JSON object");
            }
            return input.charAt(pos);
        }

        private char next() {
            char c = peek();
            pos++;
            return c;
        }

        private void expect(char expected) {
            char c = next();
            if (c != expected) {
                throw new IllegalArgumentException("Expected '" + expected + "' at offset " + (pos - 1));
            }
        }

        private void expectEnd() {
            skipWhitespace();
            if (pos != input.length()) {
                throw new IllegalArgumentException("Trailing content after JSON object");
            }
        }

        private void readLiteral(String literal) {
            if (!input.startsWith(literal, pos)) {
                throw new IllegalArgumentException("Expected string value or null at offset " + pos);
            }
            pos += literal.length();
        }

        // Called with pos just past the opening quote.
        private String readString() {
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = input.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c != '\\') {
                    sb.append(c);
                    continue;
                }
                if (pos >= input.length()) {
                    throw new IllegalArgumentException("Invalid escape sequence");
                }
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> sb.append(escaped);
                    case 'b' -> sb.append('\b');
                    case 'f' -> sb.append('\f');
                    case 'n' -> sb.append('\n');
                    case 'r' -> sb.append('\r');
                    case 't' -> sb.append('\t');
                    case 'u' -> {
                        if (pos + 4 > input.length()) {
                            throw new IllegalArgumentException("Invalid unicode escape");
                        }
                        try {
                            sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException ex) {
                            throw new IllegalArgumentException("Invalid unicode escape", ex);
                        }
                        pos += 4;
                    }
                    default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }
    }
}
