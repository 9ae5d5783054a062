package com.botstate.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary written next to every committed snapshot. Derived from the staged files on
 * each persist and never edited by hand.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotManifest {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion;
    private OffsetDateTime updatedAt;
    private String runId;
    private String commitSha;
    private Counts counts;

    @Builder.Default
    private List<FileEntry> files = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> recoveryStats = new TreeMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counts {

        @JsonProperty("n_lots")
        private int lots;

        @JsonProperty("n_unknown")
        private int unknown;

        @JsonProperty("n_manual")
        private int manual;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {

        private String path;
        private long size;
    }
}
