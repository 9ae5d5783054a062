package com.botstate.domain.enums;

/** Outcome of a snapshot persist. Conflicts are raised, not returned. */
public enum PersistStatus {
    COMMITTED,
    NO_CHANGES
}
