package com.botstate.config;

import java.nio.file.Path;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the live working copy of the state files.
 *
 * <p>The working copy is what the running process reads and appends to. It is
 * overwritten by every restore and read back by every persist.
 */
@Configuration
@ConfigurationProperties(prefix = "botstate.storage")
@Getter
@Setter
public class StorageConfig {

    /** Directory holding positions.json, ledger.jsonl, intents.jsonl and intent_cursor.json. */
    private String workingDirectory = "data/state";

    public Path positionsFile() {
        return Path.of(workingDirectory, "positions.json");
    }

    public Path ledgerFile() {
        return Path.of(workingDirectory, "ledger.jsonl");
    }

    public Path intentsFile() {
        return Path.of(workingDirectory, "intents.jsonl");
    }

    public Path intentCursorFile() {
        return Path.of(workingDirectory, "intent_cursor.json");
    }
}
