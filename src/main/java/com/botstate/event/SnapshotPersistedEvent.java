package com.botstate.event;

import com.botstate.domain.enums.PersistStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Published after each persist attempt that reached the storage backend, whether it
 * committed a new revision or found nothing to commit. Conflicts are published too.
 */
public class SnapshotPersistedEvent extends ApplicationEvent {

    private final PersistStatus status;
    private final String revision;
    private final boolean conflict;

    public SnapshotPersistedEvent(Object source, PersistStatus status, String revision, boolean conflict) {
        super(source);
        this.status = status;
        this.revision = revision;
        this.conflict = conflict;
    }

    public PersistStatus getStatus() {
        return status;
    }

    /** Revision now at HEAD; for a conflict the base revision the persist started from. */
    public String getRevision() {
        return revision;
    }

    public boolean isConflict() {
        return conflict;
    }
}
