package com.notevault.backup.store;

import com.notevault.backup.config.BackupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * The on-disk half of the workspace store.
 *
 * Layout under the configured blob root:
 * <pre>
 *   &lt;blob-root&gt;/&lt;workspaceId&gt;/documents/...   uploaded files
 *   &lt;blob-root&gt;/&lt;workspaceId&gt;/notes/...       markdown exports, named by note id
 *   &lt;blob-root&gt;/&lt;workspaceId&gt;/vectors/...     derived vector data, keyed by document id
 * </pre>
 * Every sub-tree is optional.
 */
@Component
public class BlobStore {

    private static final Logger log = LoggerFactory.getLogger(BlobStore.class);

    /** Sub-trees of a workspace blob root, in the order they are copied. */
    public static final String DOCUMENTS = "documents";
    public static final String NOTES     = "notes";
    public static final String VECTORS   = "vectors";

    public static final List<String> SUBTREES = List.of(DOCUMENTS, NOTES, VECTORS);

    static final String TRASH_PREFIX = ".trash-";

    private final Path root;

    public BlobStore(BackupProperties properties) {
        this.root = properties.blobRoot().toAbsolutePath().normalize();
        log.info("Workspace blob root: {}", root);
    }

    public Path root() {
        return root;
    }

    public Path workspaceRoot(String workspaceId) {
        return root.resolve(workspaceId);
    }

    /**
     * Copy every existing sub-tree of a workspace into {@code target/<name>}.
     *
     * @return names of the sub-trees that were copied; absent ones are skipped
     */
    public List<String> exportSubtrees(String workspaceId, Path target) throws IOException {
        Path source = workspaceRoot(workspaceId);
        List<String> copied = new ArrayList<>();
        for (String name : SUBTREES) {
            Path subtree = source.resolve(name);
            if (!Files.isDirectory(subtree)) {
                log.warn("No '{}' directory for workspace {} at {}, skipping", name, workspaceId, subtree);
                continue;
            }
            FileSystemUtils.copyRecursively(subtree, target.resolve(name));
            copied.add(name);
        }
        return copied;
    }

    /**
     * Start replacing a workspace's blob tree.
     *
     * The current tree, if any, is moved aside rather than deleted, so the
     * caller can still roll back. Exactly one of {@link BlobReplacement#commit()}
     * or {@link BlobReplacement#rollback()} must follow.
     */
    public BlobReplacement beginReplace(String workspaceId) throws IOException {
        Files.createDirectories(root);
        Path current = workspaceRoot(workspaceId);
        Path aside = null;
        if (Files.exists(current)) {
            aside = root.resolve(TRASH_PREFIX + workspaceId + "-" + UUID.randomUUID());
            Files.move(current, aside, StandardCopyOption.ATOMIC_MOVE);
            // A rename keeps the old mtime; stamp it so the sweeper measures age from now.
            Files.setLastModifiedTime(aside, FileTime.from(Instant.now()));
            log.info("Moved existing blob tree of workspace {} aside to {}", workspaceId, aside);
        }
        return new BlobReplacement(workspaceId, current, aside);
    }

    /**
     * Delete moved-aside trees older than {@code cutoff}; these only exist when
     * a process died between {@link #beginReplace} and commit/rollback.
     */
    public int sweepTrash(Instant cutoff) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        List<Path> trash;
        try (Stream<Path> children = Files.list(root)) {
            trash = children.filter(p -> p.getFileName().toString().startsWith(TRASH_PREFIX)).toList();
        } catch (IOException e) {
            log.warn("Could not list blob root {}: {}", root, e.getMessage());
            return 0;
        }
        int removed = 0;
        for (Path dir : trash) {
            try {
                if (Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)) {
                    FileSystemUtils.deleteRecursively(dir);
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Could not remove stale blob tree {}: {}", dir, e.getMessage());
            }
        }
        return removed;
    }
}
