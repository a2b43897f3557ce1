package ledger.spring.boot;

import ledger.Ledger;
import ledger.LedgerModule;
import ledger.bus.EventBus;
import ledger.command.CommandBus;
import ledger.habit.HabitModule;
import ledger.habit.HabitRepository;
import ledger.habit.InMemoryHabitRepository;
import ledger.habit.InMemoryPlanRepository;
import ledger.habit.PlanRepository;
import ledger.projection.ProjectionManager;
import ledger.query.QueryBus;
import ledger.spi.CacheService;
import ledger.spi.EventStore;
import ledger.spi.MetricsExporter;
import ledger.spi.ProjectionStateStore;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.time.Duration;

/**
 * Auto-configuration for the ledger runtime.
 *
 * <p>Wires a {@link Ledger} composite from {@link LedgerProperties}. The event log and
 * projection checkpoints live in JDBC tables when a {@link javax.sql.DataSource} is present
 * and in memory otherwise. Every {@link LedgerModule} bean is registered with the ledger,
 * including the habit module unless {@code ledger.habits.enabled=false}.
 *
 * @see LedgerProperties
 * @see LedgerMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class,
        afterName = {"org.redisson.spring.starter.RedissonAutoConfiguration",
                "org.redisson.spring.starter.RedissonAutoConfigurationV2"})
@ConditionalOnClass(Ledger.class)
@EnableConfigurationProperties(LedgerProperties.class)
@Import({
        LedgerStoreConfigurations.Jdbc.class,
        LedgerStoreConfigurations.InMemory.class,
        LedgerCacheConfigurations.Redis.class,
        LedgerCacheConfigurations.Memory.class
})
public class LedgerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @DependsOnDatabaseInitialization
    public Ledger ledger(LedgerProperties props,
                         EventStore eventStore,
                         ProjectionStateStore stateStore,
                         ObjectProvider<CacheService> cacheProvider,
                         ObjectProvider<MetricsExporter> metricsProvider,
                         ObjectProvider<LedgerModule> moduleProvider) {
        LedgerProperties.CacheType cacheType = props.getCache().getType();
        CacheService cache = cacheType == LedgerProperties.CacheType.NONE ? null : cacheProvider.getIfAvailable();
        if (cache == null && cacheType == LedgerProperties.CacheType.REDIS) {
            throw new IllegalStateException(
                    "ledger.cache.type=redis requires a RedissonClient bean and ledger-redis on the classpath");
        }

        Ledger.Builder builder = Ledger.builder()
                .eventStore(eventStore)
                .stateStore(stateStore)
                .cache(cache)
                .projectionBatchSize(props.getProjections().getBatchSize())
                .projectionIntervalMs(props.getProjections().getIntervalMs())
                .defaultCacheTime(Duration.ofSeconds(props.getCache().getDefaultTtlSeconds()));
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        moduleProvider.orderedStream().forEach(builder::module);

        Ledger ledger = builder.build();
        if (props.getProjections().isEnabled()) {
            ledger.start();
        }
        return ledger;
    }

    // The ledger owns the lifecycle of its parts, so Spring must not close them again.

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public CommandBus commandBus(Ledger ledger) {
        return ledger.commandBus();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public QueryBus queryBus(Ledger ledger) {
        return ledger.queryBus();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public EventBus eventBus(Ledger ledger) {
        return ledger.eventBus();
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public ProjectionManager projectionManager(Ledger ledger) {
        return ledger.projectionManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public LedgerEventHandlerRegistrar ledgerEventHandlerRegistrar(ListableBeanFactory beanFactory,
                                                                   EventBus eventBus) {
        return new LedgerEventHandlerRegistrar(beanFactory, eventBus);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "ledger.habits", name = "enabled", matchIfMissing = true)
    static class HabitConfiguration {

        @Bean
        @ConditionalOnMissingBean
        HabitRepository habitRepository() {
            return new InMemoryHabitRepository();
        }

        @Bean
        @ConditionalOnMissingBean
        PlanRepository planRepository() {
            return new InMemoryPlanRepository();
        }

        @Bean
        @ConditionalOnMissingBean
        HabitModule habitModule(HabitRepository habitRepository, PlanRepository planRepository) {
            return new HabitModule(habitRepository, planRepository);
        }
    }
}
