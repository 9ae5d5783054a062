package com.botstate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the broker balance export read by
 * {@link com.botstate.broker.FileBrokerBalanceClient}.
 */
@Configuration
@ConfigurationProperties(prefix = "botstate.broker")
@Getter
@Setter
public class BrokerConfig {

    /** JSON file with the account balance as exported by the broker client. */
    private String balanceFile = "data/broker/balance.json";
}
