package ledger.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Redis-style glob matcher for cache keys: {@code *} matches any run of characters and
 * {@code ?} matches exactly one. Every other character matches itself.
 */
public final class GlobPattern {
    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(toRegex(glob), Pattern.DOTALL);
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        if (glob.isEmpty()) {
            throw new IllegalArgumentException("glob cannot be empty");
        }
        return new GlobPattern(glob);
    }

    public boolean matches(String key) {
        return key != null && regex.matcher(key).matches();
    }

    public String glob() {
        return glob;
    }

    private static String toRegex(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return glob;
    }
}
