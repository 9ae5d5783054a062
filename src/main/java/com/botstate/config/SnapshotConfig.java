package com.botstate.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the snapshot namespace.
 *
 * <p>The namespace is kept apart from the working copy so that a crashed run never
 * leaves a half-written snapshot visible to the next one.
 */
@Configuration
@ConfigurationProperties(prefix = "botstate.snapshot")
@Getter
@Setter
public class SnapshotConfig {

    /** Root directory of the file-system snapshot backend. */
    private String rootDirectory = "data/bot-state";

    /** Number of diagnostic dumps kept in the snapshot. Older dumps are pruned on persist. */
    private int diagnosticsRetention = 20;

    /** Number of superseded revisions kept by the backend besides HEAD. */
    private int revisionHistory = 10;

    /** Identifier of the scheduler run, written to the manifest. */
    private String runId = "local";

    /** Source revision of the running bot, written to the manifest. */
    private String commitSha = "";
}
