package com.notevault.backup.temp;

import com.notevault.backup.config.BackupProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for scratch directory allocation and cleanup, against a real
 * filesystem under JUnit's {@code @TempDir}.
 */
class TempWorkspaceManagerTest {

    @TempDir Path base;

    TempWorkspaceManager manager;

    @BeforeEach
    void setUp() {
        manager = new TempWorkspaceManager(BackupProperties.of(base.resolve("blobs"), base.resolve("tmp")));
    }

    @Test
    void acquire_createsUniquePrefixedDirectories() {
        TempWorkspace a = manager.acquire("backup");
        TempWorkspace b = manager.acquire("backup");

        assertThat(a.path()).isDirectory();
        assertThat(b.path()).isDirectory();
        assertThat(a.path()).isNotEqualTo(b.path());
        assertThat(a.path().getFileName().toString()).matches("notevault-backup-[0-9a-f]{16}");
        assertThat(manager.liveCount()).isEqualTo(2);
    }

    @Test
    void close_removesTreeWithContents() throws Exception {
        Path dir;
        try (TempWorkspace ws = manager.acquire("restore")) {
            dir = ws.path();
            Files.createDirectories(ws.resolve("a/b"));
            Files.writeString(ws.resolve("a/b/file.txt"), "data");
        }

        assertThat(dir).doesNotExist();
        assertThat(manager.liveCount()).isZero();
    }

    @Test
    void close_onExceptionPath_stillRemovesTree() {
        Path[] dir = new Path[1];
        try (TempWorkspace ws = manager.acquire("backup")) {
            dir[0] = ws.path();
            throw new IllegalStateException("boom");
        } catch (IllegalStateException expected) {
            // the directory must be gone by now
        }
        assertThat(dir[0]).doesNotExist();
    }

    @Test
    void release_twice_isNoOp() {
        TempWorkspace ws = manager.acquire("backup");
        ws.release();
        ws.release();

        assertThat(ws.isReleased()).isTrue();
        assertThat(ws.path()).doesNotExist();
    }

    @Test
    void release_directoryAlreadyGone_doesNotThrow() throws Exception {
        TempWorkspace ws = manager.acquire("backup");
        Files.delete(ws.path());

        ws.release();

        assertThat(manager.liveCount()).isZero();
    }

    @Test
    void sweepStale_removesOldOrphansOnly() throws Exception {
        Path root = manager.root();
        Path oldOrphan = Files.createDirectory(root.resolve("notevault-backup-0000000000000001"));
        Path newOrphan = Files.createDirectory(root.resolve("notevault-backup-0000000000000002"));
        Path foreign   = Files.createDirectory(root.resolve("someone-else"));
        Instant old = Instant.now().minus(Duration.ofDays(1));
        Files.setLastModifiedTime(oldOrphan, FileTime.from(old));
        Files.setLastModifiedTime(foreign, FileTime.from(old));

        TempWorkspace live = manager.acquire("restore");
        Files.setLastModifiedTime(live.path(), FileTime.from(old));

        int removed = manager.sweepStale(Instant.now().minus(Duration.ofHours(6)));

        assertThat(removed).isEqualTo(1);
        assertThat(oldOrphan).doesNotExist();
        assertThat(newOrphan).exists();
        assertThat(foreign).exists();
        assertThat(live.path()).exists();
    }

    @Test
    void releaseAll_removesEveryLiveDirectory() {
        TempWorkspace a = manager.acquire("backup");
        TempWorkspace b = manager.acquire("upload");

        manager.releaseAll();

        assertThat(a.path()).doesNotExist();
        assertThat(b.path()).doesNotExist();
        assertThat(manager.liveCount()).isZero();
    }
}
