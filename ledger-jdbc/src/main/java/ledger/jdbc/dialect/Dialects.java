package ledger.jdbc.dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Dialects discovered through {@code META-INF/services/ledger.jdbc.dialect.Dialect}.
 *
 * <p>A data source is matched by the URL its connections report, then by the database product
 * name, which covers wrapping drivers whose URLs no dialect claims.
 */
public final class Dialects {

    private static final Map<String, Dialect> BY_NAME = load();

    private Dialects() {
    }

    private static Map<String, Dialect> load() {
        Map<String, Dialect> byName = new LinkedHashMap<>();
        for (Dialect dialect : ServiceLoader.load(Dialect.class)) {
            Dialect previous = byName.putIfAbsent(key(dialect.name()), dialect);
            if (previous != null) {
                throw new IllegalStateException("Dialects " + previous.getClass().getName() + " and "
                        + dialect.getClass().getName() + " share the name " + dialect.name());
            }
        }
        return Map.copyOf(byName);
    }

    public static List<Dialect> all() {
        return List.copyOf(BY_NAME.values());
    }

    /**
     * @throws IllegalArgumentException if no dialect is registered under {@code name}
     */
    public static Dialect get(String name) {
        Dialect dialect = name == null ? null : BY_NAME.get(key(name));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect " + name + ", registered: " + BY_NAME.keySet());
        }
        return dialect;
    }

    public static Optional<Dialect> forUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return Optional.empty();
        }
        return BY_NAME.values().stream()
                .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if the URL is blank or no dialect claims it
     */
    public static Dialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("JDBC URL is required");
        }
        return forUrl(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
                "No dialect for " + jdbcUrl + ", known prefixes: " + prefixes()));
    }

    /**
     * @throws IllegalStateException if no connection can be opened or no dialect matches
     */
    public static Dialect detect(DataSource dataSource) {
        String url;
        String product;
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            url = meta.getURL();
            product = meta.getDatabaseProductName();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot open a connection to detect the dialect", e);
        }
        return forUrl(url)
                .or(() -> Optional.ofNullable(product).map(p -> BY_NAME.get(key(p))))
                .orElseThrow(() -> new IllegalStateException(
                        "No dialect for " + product + " at " + url + ", registered: " + BY_NAME.keySet()));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String prefixes() {
        return BY_NAME.values().stream()
                .flatMap(d -> d.jdbcUrlPrefixes().stream())
                .collect(Collectors.joining(", "));
    }
}
