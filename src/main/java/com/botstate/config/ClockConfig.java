package com.botstate.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the market-zone clock every timestamp in the state files is taken from.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock marketClock(ReconcileConfig reconcileConfig) {
        return Clock.system(ZoneId.of(reconcileConfig.getZone()));
    }
}
