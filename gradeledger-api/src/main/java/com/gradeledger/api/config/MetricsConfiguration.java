package com.gradeledger.api.config;

import com.gradeledger.engine.metrics.LedgerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Ledger meters. Every meter carries the application name and the active
 * store type, so memory and jdbc deployments can be told apart.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> ledgerCommonTags(GradeLedgerProperties properties) {
        String store = properties.getStore().getType().name().toLowerCase(Locale.ROOT);
        return registry -> registry.config()
            .commonTags("application", "gradeledger", "store", store);
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry meterRegistry) {
        return new LedgerMetrics(meterRegistry);
    }
}
