package ledger.spring.boot;

import ledger.jdbc.DataSourceConnectionProvider;
import ledger.jdbc.JdbcEventStore;
import ledger.jdbc.JdbcProjectionStateStore;
import ledger.jdbc.dialect.Dialect;
import ledger.jdbc.dialect.Dialects;
import ledger.spi.ConnectionProvider;
import ledger.spi.EventStore;
import ledger.spi.ProjectionStateStore;
import ledger.store.InMemoryEventStore;
import ledger.store.InMemoryProjectionStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Event store and checkpoint store configurations, imported by {@link LedgerAutoConfiguration}
 * in order so the in-memory stores only back the ledger when no JDBC store was created.
 */
abstract class LedgerStoreConfigurations {

    private LedgerStoreConfigurations() {
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcEventStore.class)
    @ConditionalOnBean(DataSource.class)
    static class Jdbc {

        @Bean
        @ConditionalOnMissingBean
        Dialect ledgerDialect(DataSource dataSource) {
            return Dialects.detect(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean(ConnectionProvider.class)
        DataSourceConnectionProvider ledgerConnectionProvider(DataSource dataSource) {
            return new DataSourceConnectionProvider(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean(EventStore.class)
        JdbcEventStore ledgerEventStore(ConnectionProvider connectionProvider, Dialect dialect,
                                        LedgerProperties props) {
            return JdbcEventStore.builder()
                    .connectionProvider(connectionProvider)
                    .dialect(dialect)
                    .eventTable(props.getEventTable())
                    .snapshotTable(props.getSnapshotTable())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean(ProjectionStateStore.class)
        JdbcProjectionStateStore ledgerProjectionStateStore(ConnectionProvider connectionProvider, Dialect dialect,
                                                            LedgerProperties props) {
            return new JdbcProjectionStateStore(connectionProvider, dialect, props.getProjectionTable());
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class InMemory {

        @Bean
        @ConditionalOnMissingBean(EventStore.class)
        InMemoryEventStore ledgerEventStore() {
            return new InMemoryEventStore();
        }

        @Bean
        @ConditionalOnMissingBean(ProjectionStateStore.class)
        InMemoryProjectionStateStore ledgerProjectionStateStore() {
            return new InMemoryProjectionStateStore();
        }
    }
}
