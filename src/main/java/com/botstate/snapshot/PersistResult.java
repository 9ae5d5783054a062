package com.botstate.snapshot;

import com.botstate.domain.enums.PersistStatus;
import com.botstate.domain.model.SnapshotManifest;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Outcome of a persist. */
@Value
@Builder
public class PersistResult {

    PersistStatus status;

    /** HEAD after the persist: the new revision, or the unchanged base for NO_CHANGES. */
    String revision;

    /** Paths that differed from the base revision, sorted. */
    List<String> changedPaths;

    /** Manifest written with the commit; null for NO_CHANGES. */
    SnapshotManifest manifest;

    public boolean isCommitted() {
        return status == PersistStatus.COMMITTED;
    }
}
