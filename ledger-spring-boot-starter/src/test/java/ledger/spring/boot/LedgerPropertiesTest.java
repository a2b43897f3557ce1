package ledger.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LedgerPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            LedgerProperties props = ctx.getBean(LedgerProperties.class);
            assertEquals("ledger_events", props.getEventTable());
            assertEquals("ledger_snapshots", props.getSnapshotTable());
            assertEquals("ledger_projections", props.getProjectionTable());
            assertTrue(props.getProjections().isEnabled());
            assertEquals(1000, props.getProjections().getIntervalMs());
            assertEquals(100, props.getProjections().getBatchSize());
            assertEquals(LedgerProperties.CacheType.MEMORY, props.getCache().getType());
            assertEquals(300, props.getCache().getDefaultTtlSeconds());
            assertEquals(1000, props.getCache().getMaxSize());
            assertEquals(60000, props.getCache().getCleanupIntervalMs());
            assertEquals("ledger:", props.getCache().getKeyPrefix());
            assertTrue(props.getCache().isFallbackToMemory());
            assertTrue(props.getHabits().isEnabled());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("ledger", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "ledger.event-table=habit_events",
                "ledger.projection-table=habit_projections",
                "ledger.projections.enabled=false",
                "ledger.projections.interval-ms=250",
                "ledger.projections.batch-size=20",
                "ledger.cache.type=redis",
                "ledger.cache.default-ttl-seconds=60",
                "ledger.cache.max-size=50",
                "ledger.cache.cleanup-interval-ms=5000",
                "ledger.cache.key-prefix=habits:",
                "ledger.cache.fallback-to-memory=false",
                "ledger.habits.enabled=false",
                "ledger.metrics.enabled=false",
                "ledger.metrics.name-prefix=habits.ledger"
        ).run(ctx -> {
            LedgerProperties props = ctx.getBean(LedgerProperties.class);
            assertEquals("habit_events", props.getEventTable());
            assertEquals("habit_projections", props.getProjectionTable());
            assertFalse(props.getProjections().isEnabled());
            assertEquals(250, props.getProjections().getIntervalMs());
            assertEquals(20, props.getProjections().getBatchSize());
            assertEquals(LedgerProperties.CacheType.REDIS, props.getCache().getType());
            assertEquals(60, props.getCache().getDefaultTtlSeconds());
            assertEquals(50, props.getCache().getMaxSize());
            assertEquals(5000, props.getCache().getCleanupIntervalMs());
            assertEquals("habits:", props.getCache().getKeyPrefix());
            assertFalse(props.getCache().isFallbackToMemory());
            assertFalse(props.getHabits().isEnabled());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("habits.ledger", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(LedgerProperties.class)
    static class PropsConfig {
    }
}
