package com.botstate.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Registers common tags applied to all metrics. The metric definitions live in
 * {@link com.botstate.observability.StateMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final SnapshotConfig snapshotConfig;

    public MetricsConfig(MeterRegistry meterRegistry, SnapshotConfig snapshotConfig) {
        this.meterRegistry = meterRegistry;
        this.snapshotConfig = snapshotConfig;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "botstate", "run", snapshotConfig.getRunId());
    }
}
