package ledger.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import ledger.micrometer.MicrometerMetricsExporter;
import ledger.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code ledger.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LedgerAutoConfiguration} so the {@link MetricsExporter} bean is
 * available for injection into the ledger.
 */
@AutoConfiguration(before = LedgerAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "ledger.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry, LedgerProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
