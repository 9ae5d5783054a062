package com.botstate.snapshot;

import com.botstate.exception.ConflictException;
import com.botstate.exception.NotFoundException;
import java.util.Map;
import java.util.Optional;

/**
 * Versioned blob namespace the snapshot is persisted to.
 *
 * <p>A revision is an immutable tree of files; HEAD names the current one. The only way
 * to move HEAD is {@link #commit}, which succeeds only if HEAD still is the revision the
 * caller based its work on.
 */
public interface SnapshotBackend {

    /** Current HEAD revision; empty when nothing was ever committed. */
    Optional<String> headRevision();

    /**
     * Files of a revision keyed by their path in the layout.
     *
     * @throws NotFoundException if the revision does not exist
     */
    Map<String, byte[]> readTree(String revision);

    /**
     * Stores {@code tree} as a new revision and moves HEAD to it.
     *
     * @param expectedHead the HEAD the tree was built on; null when there was none
     * @return id of the new revision
     * @throws ConflictException if HEAD moved since {@code expectedHead} or another
     *     writer holds the HEAD lock
     */
    String commit(String expectedHead, Map<String, byte[]> tree, String message);
}
