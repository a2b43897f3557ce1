package ledger.command;

import ledger.Result;

/**
 * Observes every command result returned by the {@link CommandBus}.
 */
@FunctionalInterface
public interface CommandListener {

    void onCompleted(Command<?> command, Result<?> result);
}
