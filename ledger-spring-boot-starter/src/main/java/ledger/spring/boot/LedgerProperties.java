package ledger.spring.boot;

import ledger.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the ledger runtime.
 *
 * @see LedgerAutoConfiguration
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * Table holding the event log when a DataSource is present.
     */
    private String eventTable = TableNames.EVENT_TABLE;

    private String snapshotTable = TableNames.SNAPSHOT_TABLE;

    /**
     * Table holding projection checkpoints when a DataSource is present.
     */
    private String projectionTable = TableNames.PROJECTION_TABLE;

    private final Projections projections = new Projections();
    private final Cache cache = new Cache();
    private final Habits habits = new Habits();
    private final Metrics metrics = new Metrics();

    public String getEventTable() {
        return eventTable;
    }

    public void setEventTable(String eventTable) {
        this.eventTable = eventTable;
    }

    public String getSnapshotTable() {
        return snapshotTable;
    }

    public void setSnapshotTable(String snapshotTable) {
        this.snapshotTable = snapshotTable;
    }

    public String getProjectionTable() {
        return projectionTable;
    }

    public void setProjectionTable(String projectionTable) {
        this.projectionTable = projectionTable;
    }

    public Projections getProjections() {
        return projections;
    }

    public Cache getCache() {
        return cache;
    }

    public Habits getHabits() {
        return habits;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum CacheType {
        MEMORY,
        REDIS,
        NONE
    }

    public static class Projections {
        /**
         * Whether the ledger catches projections up on startup and runs the background loop.
         */
        private boolean enabled = true;
        private long intervalMs = 1000;
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Cache {
        private CacheType type = CacheType.MEMORY;
        private long defaultTtlSeconds = 300;
        private int maxSize = 1000;
        private long cleanupIntervalMs = 60000;

        /**
         * Key namespace used by the Redis cache.
         */
        private String keyPrefix = "ledger:";

        /**
         * Whether an unreachable Redis at startup falls back to the in-memory cache.
         */
        private boolean fallbackToMemory = true;

        public CacheType getType() {
            return type;
        }

        public void setType(CacheType type) {
            this.type = type;
        }

        public long getDefaultTtlSeconds() {
            return defaultTtlSeconds;
        }

        public void setDefaultTtlSeconds(long defaultTtlSeconds) {
            this.defaultTtlSeconds = defaultTtlSeconds;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public long getCleanupIntervalMs() {
            return cleanupIntervalMs;
        }

        public void setCleanupIntervalMs(long cleanupIntervalMs) {
            this.cleanupIntervalMs = cleanupIntervalMs;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public boolean isFallbackToMemory() {
            return fallbackToMemory;
        }

        public void setFallbackToMemory(boolean fallbackToMemory) {
            this.fallbackToMemory = fallbackToMemory;
        }
    }

    public static class Habits {
        /**
         * Whether the habit commands, queries and analytics projection are registered.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ledger";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
