package ledger.command;

/**
 * Immutable request to change state, dispatched through the {@link CommandBus} to exactly
 * one {@link CommandHandler}.
 *
 * <p>Commands are usually records whose {@code userId} component implements
 * {@link #userId()}.
 *
 * @param <R> the value returned on success
 */
public interface Command<R> {

    /**
     * The user issuing the command; handlers check aggregate ownership against it.
     */
    String userId();

    /**
     * Correlation identifier copied onto every event the command produces, or {@code null}.
     */
    default String correlationId() {
        return null;
    }

    /**
     * Name used in logs. Defaults to the simple class name.
     */
    default String type() {
        return getClass().getSimpleName();
    }
}
