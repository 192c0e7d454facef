package com.stepflow.engine.metrics;

import com.stepflow.core.repository.ExecutionStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration.
 *
 * Configures:
 * - Common tags for all metrics
 * - The execution metrics binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "stepflow");
    }

    @Bean
    public ExecutionMetrics executionMetrics(MeterRegistry registry, ExecutionStore store) {
        return new ExecutionMetrics(registry, store);
    }
}
