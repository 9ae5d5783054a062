package com.botstate.snapshot;

import com.botstate.config.SnapshotConfig;
import com.botstate.exception.ConflictException;
import com.botstate.exception.NotFoundException;
import com.botstate.exception.StateStorageException;
import com.botstate.exception.ValidationException;
import com.botstate.io.AtomicFiles;
import com.botstate.mapper.StateJson;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Snapshot namespace on a local or mounted file system.
 *
 * <pre>
 * root/
 *   HEAD                  id of the current revision
 *   HEAD.lock             guards the HEAD swap
 *   revisions/&lt;id&gt;/
 *     commit.json         parent, message, created_at
 *     tree/...            the files of the revision
 * </pre>
 *
 * <p>Revisions are written to a staging directory and moved into place, and never
 * change afterwards. HEAD is swapped with an atomic rename while holding a
 * non-blocking lock; a held lock counts as a conflict, never a wait. Revision ids are
 * derived from parent and content. Every file of a revision is forced to disk before
 * HEAD can name it. Ancestors of HEAD older than {@code revisionHistory} are pruned.
 */
@Component
public class FileSystemSnapshotBackend implements SnapshotBackend {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSnapshotBackend.class);

    private static final String HEAD = "HEAD";
    private static final String HEAD_LOCK = "HEAD.lock";
    private static final String REVISIONS = "revisions";
    private static final String COMMIT_FILE = "commit.json";
    private static final String TREE = "tree";
    private static final String STAGING_PREFIX = ".staging-";
    private static final int REVISION_ID_LENGTH = 16;

    private final SnapshotConfig snapshotConfig;
    private final Clock clock;

    public FileSystemSnapshotBackend(SnapshotConfig snapshotConfig, Clock clock) {
        this.snapshotConfig = snapshotConfig;
        this.clock = clock;
    }

    @Override
    public Optional<String> headRevision() {
        Path head = root().resolve(HEAD);
        try {
            if (!Files.exists(head)) {
                return Optional.empty();
            }
            String id = Files.readString(head, StandardCharsets.UTF_8).strip();
            return id.isEmpty() ? Optional.empty() : Optional.of(id);
        } catch (IOException e) {
            throw new StateStorageException("Failed to read " + head, e);
        }
    }

    @Override
    public Map<String, byte[]> readTree(String revision) {
        Path tree = revisionDir(revision).resolve(TREE);
        if (!Files.isDirectory(tree)) {
            throw new NotFoundException("Revision", revision);
        }
        Map<String, byte[]> files = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(tree)) {
            for (Path file : (Iterable<Path>) walk.filter(Files::isRegularFile)::iterator) {
                String relative = tree.relativize(file).toString().replace('\\', '/');
                files.put(relative, Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new StateStorageException("Failed to read revision " + revision, e);
        }
        return files;
    }

    @Override
    public synchronized String commit(String expectedHead, Map<String, byte[]> tree, String message) {
        tree.keySet().forEach(FileSystemSnapshotBackend::checkPath);
        String id = revisionId(expectedHead, tree);
        try {
            Files.createDirectories(root().resolve(REVISIONS));
            stage(id, expectedHead, tree, message);
            swapHead(expectedHead, id);
        } catch (IOException e) {
            throw new StateStorageException("Failed to commit revision " + id, e);
        }
        log.info("[SNAPSHOT] HEAD {} -> {} ({} files)", expectedHead, id, tree.size());
        prune(id);
        return id;
    }

    /** Revision ids from HEAD back through its parents, newest first. */
    public List<String> history() {
        List<String> chain = new ArrayList<>();
        String current = headRevision().orElse(null);
        while (current != null && Files.isDirectory(revisionDir(current)) && !chain.contains(current)) {
            chain.add(current);
            current = readCommit(current).getParent();
        }
        return chain;
    }

    Path root() {
        return Path.of(snapshotConfig.getRootDirectory());
    }

    private Path revisionDir(String revision) {
        return root().resolve(REVISIONS).resolve(revision);
    }

    private void stage(String id, String parent, Map<String, byte[]> tree, String message) throws IOException {
        Path target = revisionDir(id);
        if (Files.isDirectory(target)) {
            log.debug("[SNAPSHOT] Revision {} already staged", id);
            return;
        }
        Path staging = root().resolve(REVISIONS).resolve(STAGING_PREFIX + UUID.randomUUID());
        try {
            for (Map.Entry<String, byte[]> file : tree.entrySet()) {
                AtomicFiles.writeNew(staging.resolve(TREE).resolve(file.getKey()), file.getValue());
            }
            CommitRecord record = new CommitRecord(parent, message, OffsetDateTime.now(clock));
            AtomicFiles.writeNew(staging.resolve(COMMIT_FILE), StateJson.toDocument(record));
            syncDirectories(staging);
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            AtomicFiles.syncDirectory(target.getParent());
        } catch (FileAlreadyExistsException | DirectoryNotEmptyException e) {
            log.debug("[SNAPSHOT] Revision {} staged concurrently", id);
        } finally {
            deleteRecursively(staging);
        }
    }

    private void swapHead(String expectedHead, String id) throws IOException {
        Path lockFile = root().resolve(HEAD_LOCK);
        try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                FileLock lock = channel.tryLock()) {
            if (lock == null) {
                throw new ConflictException("HEAD is locked by another writer");
            }
            String actual = headRevision().orElse(null);
            if (!Objects.equals(actual, expectedHead)) {
                throw new ConflictException(expectedHead, actual);
            }
            AtomicFiles.write(root().resolve(HEAD), (id + "\n").getBytes(StandardCharsets.UTF_8));
        } catch (OverlappingFileLockException e) {
            throw new ConflictException("HEAD is locked by another writer in this process");
        }
    }

    /**
     * Deletes the ancestors of {@code head} beyond the configured history. Revisions off
     * that chain are left alone: one may be another writer's commit staged on top of HEAD.
     */
    private void prune(String head) {
        try {
            String current = head;
            for (int i = 0; i <= snapshotConfig.getRevisionHistory() && current != null; i++) {
                current = parentOf(current);
            }
            while (current != null) {
                String parent = parentOf(current);
                deleteRecursively(revisionDir(current));
                log.debug("[SNAPSHOT] Pruned revision {}", current);
                current = parent;
            }
        } catch (IOException | StateStorageException e) {
            log.warn("[SNAPSHOT] Failed to prune old revisions: {}", e.getMessage());
        }
    }

    private String parentOf(String revision) {
        return Files.isDirectory(revisionDir(revision)) ? readCommit(revision).getParent() : null;
    }

    private static void syncDirectories(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> dirs = walk.filter(Files::isDirectory).sorted(Comparator.reverseOrder()).toList();
            for (Path path : dirs) {
                AtomicFiles.syncDirectory(path);
            }
        }
    }

    private CommitRecord readCommit(String revision) {
        Path file = revisionDir(revision).resolve(COMMIT_FILE);
        try {
            return StateJson.fromDocument(Files.readAllBytes(file), CommitRecord.class);
        } catch (IOException e) {
            throw new StateStorageException("Failed to read " + file, e);
        }
    }

    private static String revisionId(String parent, Map<String, byte[]> tree) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(String.valueOf(parent).getBytes(StandardCharsets.UTF_8));
            for (Map.Entry<String, byte[]> file : new TreeMap<>(tree).entrySet()) {
                digest.update(("\n" + file.getKey() + "\n" + file.getValue().length + "\n").getBytes(StandardCharsets.UTF_8));
                digest.update(file.getValue());
            }
            return HexFormat.of().formatHex(digest.digest()).substring(0, REVISION_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static void checkPath(String path) {
        if (path.isEmpty() || path.startsWith("/") || path.contains("\\") || List.of(path.split("/")).contains("..")) {
            throw new ValidationException("Illegal snapshot path: '" + path + "'");
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path path : paths) {
                Files.delete(path);
            }
        }
    }

    /** Content of {@code commit.json}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class CommitRecord {

        private String parent;
        private String message;
        private OffsetDateTime createdAt;
    }
}
