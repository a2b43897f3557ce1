package ledger.habit;

/**
 * How often a habit is due.
 */
public enum Frequency {
    DAILY,
    WEEKLY,
    CUSTOM
}
