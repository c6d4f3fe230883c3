package com.notevault.backup.archive;

import com.notevault.backup.archive.dto.BackupManifest;
import com.notevault.backup.temp.TempWorkspace;

import java.nio.file.Path;

/**
 * A validated archive unpacked into its own temp directory.
 *
 * Closing it removes the directory; use try-with-resources.
 */
public final class ExtractedBackup implements AutoCloseable {

    private final TempWorkspace  workspace;
    private final BackupManifest manifest;

    ExtractedBackup(TempWorkspace workspace, BackupManifest manifest) {
        this.workspace = workspace;
        this.manifest  = manifest;
    }

    public Path root() {
        return workspace.path();
    }

    public BackupManifest manifest() {
        return manifest;
    }

    public Path foldersFile() {
        return workspace.resolve(ArchiveLayout.FOLDERS);
    }

    public Path workspaceDir(String workspaceId) {
        return workspace.resolve(workspaceId);
    }

    @Override
    public void close() {
        workspace.release();
    }
}
