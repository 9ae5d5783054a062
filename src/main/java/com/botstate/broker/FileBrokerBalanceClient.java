package com.botstate.broker;

import com.botstate.config.BrokerConfig;
import com.botstate.domain.model.BrokerHolding;
import com.botstate.exception.SourceUnavailableException;
import com.botstate.mapper.StateJson;
import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the balance from the JSON export the broker client writes before each run: an
 * array of {@code {code, qty, avg_price}} rows.
 */
@Component
public class FileBrokerBalanceClient implements BrokerBalanceClient {

    private static final Logger log = LoggerFactory.getLogger(FileBrokerBalanceClient.class);

    private final BrokerConfig brokerConfig;

    public FileBrokerBalanceClient(BrokerConfig brokerConfig) {
        this.brokerConfig = brokerConfig;
    }

    @Override
    public Map<String, BrokerHolding> getBalance() {
        Path path = Path.of(brokerConfig.getBalanceFile());
        if (!Files.exists(path)) {
            throw new SourceUnavailableException("Broker balance export not found: " + path);
        }
        List<BrokerHolding> rows;
        try {
            rows = StateJson.mapper().readValue(path.toFile(), new TypeReference<List<BrokerHolding>>() {});
        } catch (IOException e) {
            throw new SourceUnavailableException("Broker balance export unreadable: " + path, e);
        }
        if (rows == null) {
            throw new SourceUnavailableException("Broker balance export is empty: " + path);
        }

        Map<String, BrokerHolding> balance = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            BrokerHolding row = rows.get(i);
            String key = row != null && row.getCode() != null ? row.getCode() : "row#" + i;
            if (balance.putIfAbsent(key, row) != null) {
                log.warn("[BROKER] Duplicate balance row for {} in {}, keeping the first", key, path);
            }
        }
        log.info("[BROKER] Read {} balance rows from {}", balance.size(), path);
        return balance;
    }
}
