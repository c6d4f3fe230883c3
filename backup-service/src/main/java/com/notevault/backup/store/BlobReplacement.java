package com.notevault.backup.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * An in-flight replacement of one workspace's blob tree.
 *
 * Created by {@link BlobStore#beginReplace}. The previous tree sits in a
 * hidden sibling directory until {@link #commit()} deletes it or
 * {@link #rollback()} puts it back, so the tree is never left half-written.
 */
public final class BlobReplacement {

    private static final Logger log = LoggerFactory.getLogger(BlobReplacement.class);

    private final String workspaceId;
    private final Path   root;
    private final Path   aside;     // null when the workspace had no blob tree
    private boolean      finished;

    BlobReplacement(String workspaceId, Path root, Path aside) {
        this.workspaceId = workspaceId;
        this.root        = root;
        this.aside       = aside;
    }

    /** True when an earlier blob tree existed and was moved aside. */
    public boolean hadPreviousTree() {
        return aside != null;
    }

    public Path root() {
        return root;
    }

    /** Create the (empty) workspace blob root. */
    public void createRoot() throws IOException {
        Files.createDirectories(root);
    }

    /**
     * Copy {@code source} into {@code <root>/<name>}.
     *
     * @return false when {@code source} does not exist and nothing was copied
     */
    public boolean copySubtree(String name, Path source) throws IOException {
        return copySubtree(name, source, Set.of());
    }

    /**
     * Copy {@code source} into {@code <root>/<name>}, leaving out the direct
     * child directories named in {@code skipDirs}.
     *
     * @return false when {@code source} does not exist and nothing was copied
     */
    public boolean copySubtree(String name, Path source, Set<String> skipDirs) throws IOException {
        if (!Files.isDirectory(source)) {
            return false;
        }
        Path target = Files.createDirectories(root.resolve(name));
        List<Path> children;
        try (Stream<Path> list = Files.list(source)) {
            children = list.toList();
        }
        for (Path child : children) {
            String childName = child.getFileName().toString();
            if (skipDirs.contains(childName) && Files.isDirectory(child)) {
                continue;
            }
            FileSystemUtils.copyRecursively(child, target.resolve(childName));
        }
        return true;
    }

    /** Keep the new tree and drop the old one. Cleanup failures are logged only. */
    public void commit() {
        if (finished) return;
        finished = true;
        if (aside == null) return;
        try {
            FileSystemUtils.deleteRecursively(aside);
        } catch (IOException e) {
            log.warn("Could not delete previous blob tree {} of workspace {}, leaving it for the sweeper: {}",
                    aside, workspaceId, e.getMessage());
        }
    }

    /** Drop whatever was written and put the previous tree back. */
    public void rollback() {
        if (finished) return;
        finished = true;
        try {
            FileSystemUtils.deleteRecursively(root);
            if (aside != null) {
                Files.move(aside, root, StandardCopyOption.ATOMIC_MOVE);
            }
            log.info("Rolled back blob tree of workspace {}", workspaceId);
        } catch (IOException e) {
            log.error("Could not roll back blob tree of workspace {} (previous tree kept at {})",
                    workspaceId, aside, e);
        }
    }
}
