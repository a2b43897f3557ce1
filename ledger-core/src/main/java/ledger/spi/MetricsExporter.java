package ledger.spi;

/**
 * Observability hook for exporting ledger counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events durably appended.
     *
     * @param count number of events in the appended batch
     */
    void incrementEventsAppended(int count);

    /**
     * Increments the count of batches the event store rejected.
     */
    void incrementAppendFailed();

    /**
     * Increments the count of event handler invocations that threw.
     */
    void incrementHandlerFailure();

    void incrementCommandSuccess();

    void incrementCommandFailure();

    void incrementQueryCacheHit();

    void incrementQueryCacheMiss();

    /**
     * Increments the count of cache operations that failed and were treated as a miss.
     */
    default void incrementQueryCacheError() {
    }

    /**
     * Increments the count of events applied to a projection.
     */
    default void incrementProjectionApplied() {
    }

    default void incrementProjectionFailure() {
    }

    /**
     * Records how far the slowest running projection trails the log.
     *
     * @param lag highest event number minus the lowest running checkpoint (never negative)
     */
    void recordProjectionLag(long lag);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsAppended(int count) {
        }

        @Override
        public void incrementAppendFailed() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void incrementCommandSuccess() {
        }

        @Override
        public void incrementCommandFailure() {
        }

        @Override
        public void incrementQueryCacheHit() {
        }

        @Override
        public void incrementQueryCacheMiss() {
        }

        @Override
        public void recordProjectionLag(long lag) {
        }
    }
}
