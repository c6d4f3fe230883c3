package com.notevault.backup.temp;

import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.service.BackupException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Allocates and removes the scratch directories used by backup and restore.
 *
 * Directories are named {@code notevault-<purpose>-<16 hex chars>} under the
 * configured temp root, with the suffix drawn from {@link SecureRandom} so
 * concurrent operations never collide.
 *
 * <p>Removal happens on three paths:
 * <ol>
 *   <li>the owner releases its {@link TempWorkspace} (normal and error paths);</li>
 *   <li>application shutdown releases everything still live;</li>
 *   <li>{@link #sweepStale} removes directories a killed process left behind.</li>
 * </ol>
 */
@Component
public class TempWorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(TempWorkspaceManager.class);

    static final String PREFIX = "notevault-";

    private final SecureRandom       random = new SecureRandom();
    private final Path               root;
    private final Set<TempWorkspace> live   = ConcurrentHashMap.newKeySet();

    public TempWorkspaceManager(BackupProperties properties) {
        this.root = properties.tempRoot().toAbsolutePath().normalize();
        log.info("Temporary directories under {}", root);
    }

    /**
     * Create a fresh, empty directory for one operation.
     *
     * @param purpose short label embedded in the directory name ("backup", "restore", "upload")
     * @throws BackupException of kind IO if the directory cannot be created
     */
    public TempWorkspace acquire(String purpose) {
        byte[] suffix = new byte[8];
        random.nextBytes(suffix);
        Path dir = root.resolve(PREFIX + purpose + "-" + HexFormat.of().formatHex(suffix));
        try {
            Files.createDirectories(root);
            Files.createDirectory(dir);
        } catch (IOException e) {
            throw BackupException.io("Could not create temporary directory " + dir, e);
        }
        TempWorkspace workspace = new TempWorkspace(dir, this);
        live.add(workspace);
        log.debug("Acquired temporary directory {}", dir);
        return workspace;
    }

    public Path root() {
        return root;
    }

    /** Number of directories handed out and not yet released. */
    public int liveCount() {
        return live.size();
    }

    /**
     * Delete orphaned directories older than {@code cutoff}.
     *
     * Only names carrying our prefix are touched, and never a directory that
     * is still owned by a running operation.
     *
     * @return how many directories were removed
     */
    public int sweepStale(Instant cutoff) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        Set<Path> owned = ConcurrentHashMap.newKeySet();
        live.forEach(w -> owned.add(w.path()));

        List<Path> candidates;
        try (Stream<Path> children = Files.list(root)) {
            candidates = children
                    .filter(p -> p.getFileName().toString().startsWith(PREFIX))
                    .filter(Files::isDirectory)
                    .filter(p -> !owned.contains(p))
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list temp root {}: {}", root, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path dir : candidates) {
            try {
                if (Files.getLastModifiedTime(dir).toInstant().isBefore(cutoff)) {
                    FileSystemUtils.deleteRecursively(dir);
                    removed++;
                    log.info("Swept orphaned temporary directory {}", dir);
                }
            } catch (IOException e) {
                log.warn("Could not sweep temporary directory {}: {}", dir, e.getMessage());
            }
        }
        return removed;
    }

    /** Release everything still live when the application context closes. */
    @PreDestroy
    public void releaseAll() {
        if (!live.isEmpty()) {
            log.info("Releasing {} temporary directories on shutdown", live.size());
        }
        List.copyOf(live).forEach(TempWorkspace::release);
    }

    /**
     * Called once per workspace by {@link TempWorkspace#release()}.
     *
     * Errors are logged, never thrown: a failed cleanup must not replace the
     * result (or the original exception) of the operation that owned the
     * directory. A directory that survives is picked up by the sweeper later.
     */
    void delete(TempWorkspace workspace) {
        live.remove(workspace);
        try {
            FileSystemUtils.deleteRecursively(workspace.path());
            log.debug("Released temporary directory {}", workspace.path());
        } catch (IOException | RuntimeException e) {
            log.warn("Could not remove temporary directory {}, leaving it for the sweeper: {}",
                    workspace.path(), e.getMessage());
        }
    }
}
