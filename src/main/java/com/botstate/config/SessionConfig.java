package com.botstate.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the state cycle run when the application starts.
 */
@Configuration
@ConfigurationProperties(prefix = "botstate.session")
@Getter
@Setter
public class SessionConfig {

    /** Run restore, reconcile and persist once the context is ready. */
    private boolean runOnStartup = false;

    /** Codes of today's rebalance bucket, as supplied by the scheduler. */
    private List<String> rebalanceTargets = new ArrayList<>();
}
