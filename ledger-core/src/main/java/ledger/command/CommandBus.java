package ledger.command;

import ledger.ErrorKind;
import ledger.Result;
import ledger.spi.MetricsExporter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes each command to the single handler registered for its class and runs it
 * synchronously on the calling thread.
 *
 * <p>Registration is explicit and happens at startup:
 * <pre>{@code
 * CommandBus bus = CommandBus.builder().metrics(metrics).build()
 *     .register(CreateHabitCommand.class, new CreateHabitHandler(plans, habits, eventBus))
 *     .register(CompleteHabitCommand.class, new CompleteHabitHandler(habits, eventBus, clock));
 * }</pre>
 *
 * <p>The bus does not cache or retry. A handler that throws is logged and reported as
 * {@code Err(INTERNAL, "Internal server error")}.
 *
 * <p>This class is thread-safe.
 */
public final class CommandBus {
    private static final Logger logger = Logger.getLogger(CommandBus.class.getName());
    static final String INTERNAL_ERROR = "Internal server error";

    private final MetricsExporter metrics;
    private final Map<Class<?>, CommandHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final List<CommandListener> listeners = new CopyOnWriteArrayList<>();

    private CommandBus(Builder builder) {
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the handler for a command class.
     *
     * @return this bus for chaining
     * @throws IllegalStateException if a handler is already registered for the class
     */
    public <C extends Command<R>, R> CommandBus register(Class<C> commandType, CommandHandler<C, R> handler) {
        Objects.requireNonNull(commandType, "commandType");
        Objects.requireNonNull(handler, "handler");
        if (handlers.putIfAbsent(commandType, handler) != null) {
            throw new IllegalStateException("Command handler for " + commandType.getSimpleName()
                    + " is already registered");
        }
        return this;
    }

    /**
     * Adds a listener notified after every dispatch that reached a handler.
     */
    public CommandBus addListener(CommandListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Executes a command.
     *
     * @return the handler's result, or {@code Err(INTERNAL)} if it threw
     * @throws IllegalStateException if no handler is registered for the command's class
     */
    @SuppressWarnings("unchecked")
    public <R> Result<R> dispatch(Command<R> command) {
        Objects.requireNonNull(command, "command");
        CommandHandler<Command<R>, R> handler = (CommandHandler<Command<R>, R>) handlers.get(command.getClass());
        if (handler == null) {
            throw new IllegalStateException("No handler registered for command type: " + command.type());
        }
        logger.log(Level.FINE, "Executing {0} for user {1} (correlationId={2})",
                new Object[]{command.type(), command.userId(), command.correlationId()});

        Result<R> result;
        try {
            result = handler.handle(command);
            if (result == null) {
                throw new IllegalStateException("Handler for " + command.type() + " returned null");
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Command " + command.type() + " failed for user " + command.userId(), e);
            result = Result.err(ErrorKind.INTERNAL, INTERNAL_ERROR);
        }

        if (result instanceof Result.Err<R> err) {
            metrics.incrementCommandFailure();
            logger.log(Level.WARNING, "Command {0} for user {1} returned {2}: {3} (correlationId={4})",
                    new Object[]{command.type(), command.userId(), err.kind(), err.message(), command.correlationId()});
        } else {
            metrics.incrementCommandSuccess();
            logger.log(Level.FINE, "Command {0} succeeded for user {1}", new Object[]{command.type(), command.userId()});
        }
        notifyListeners(command, result);
        return result;
    }

    private void notifyListeners(Command<?> command, Result<?> result) {
        for (CommandListener listener : listeners) {
            try {
                listener.onCompleted(command, result);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Command listener failed after " + command.type(), e);
            }
        }
    }

    public boolean hasHandler(Class<?> commandType) {
        return handlers.containsKey(commandType);
    }

    /**
     * Returns the simple names of every command class with a handler.
     */
    public Set<String> registeredCommandTypes() {
        Set<String> names = new TreeSet<>();
        handlers.keySet().forEach(type -> names.add(type.getSimpleName()));
        return names;
    }

    /**
     * Builder for {@link CommandBus}.
     */
    public static final class Builder {
        private MetricsExporter metrics;

        private Builder() {
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public CommandBus build() {
            return new CommandBus(this);
        }
    }
}
