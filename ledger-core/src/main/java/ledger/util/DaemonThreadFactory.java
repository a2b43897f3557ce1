package ledger.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates named daemon threads ({@code <prefix>1}, {@code <prefix>2}, ...) for the catch-up
 * loop and the cache sweeper, so neither keeps the JVM alive. Anything a task lets escape is
 * logged at {@code SEVERE} instead of going to standard error.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    public DaemonThreadFactory(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task) {
        Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
                logger.log(Level.SEVERE, "Uncaught exception on " + t.getName(), e));
        return thread;
    }
}
