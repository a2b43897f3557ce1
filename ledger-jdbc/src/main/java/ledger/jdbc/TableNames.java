package ledger.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Default table names of the JDBC stores.
 *
 * <p>Names are concatenated into SQL, so {@link #validate} admits only unquoted identifiers
 * short enough for every supported database.
 */
public final class TableNames {
    public static final String EVENT_TABLE = "ledger_events";
    public static final String SNAPSHOT_TABLE = "ledger_snapshots";
    public static final String PROJECTION_TABLE = "ledger_projections";

    // PostgreSQL truncates identifiers beyond 63 bytes.
    static final int MAX_LENGTH = 63;
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    private TableNames() {
    }

    public static String validate(String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        if (tableName.length() > MAX_LENGTH || !IDENTIFIER.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Table name must be an identifier of at most "
                    + MAX_LENGTH + " characters: " + tableName);
        }
        return tableName;
    }
}
