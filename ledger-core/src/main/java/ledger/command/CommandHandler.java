package ledger.command;

import ledger.Result;

/**
 * Executes one command type.
 *
 * <p>Expected failures (missing aggregate, ownership mismatch, rule violation, storage
 * failure) are returned as {@link Result.Err}. Anything thrown is treated as a programming
 * error by the bus.
 *
 * @param <C> the command type
 * @param <R> the success value type
 */
@FunctionalInterface
public interface CommandHandler<C extends Command<R>, R> {

    Result<R> handle(C command);
}
