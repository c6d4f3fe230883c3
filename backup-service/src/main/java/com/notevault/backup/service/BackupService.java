package com.notevault.backup.service;

import com.notevault.backup.archive.ArchiveBuilder;
import com.notevault.backup.archive.ArchiveExtractor;
import com.notevault.backup.archive.ArchiveStream;
import com.notevault.backup.archive.ExtractedBackup;
import com.notevault.backup.archive.dto.WorkspaceBackupRequest;
import com.notevault.backup.restore.RestoreOrchestrator;
import com.notevault.backup.restore.RestoreResult;
import com.notevault.backup.restore.WorkspaceRestoreReport;
import com.notevault.backup.temp.TempWorkspace;
import com.notevault.backup.temp.TempWorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * The two operations the rest of the application calls: create a backup and
 * restore one.
 *
 * Every call is timed and counted:
 * <pre>
 *   notevault.backup.duration{operation="create|restore", status="success|validation|conflict|store|io|error"}
 *   notevault.restore.workspaces{status="restored|failed"}
 * </pre>
 */
@Service
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private static final String UPLOAD_FILE_NAME = "upload.zip";

    private final ArchiveBuilder       builder;
    private final ArchiveExtractor     extractor;
    private final RestoreOrchestrator  orchestrator;
    private final TempWorkspaceManager temps;
    private final MeterRegistry        meterRegistry;

    public BackupService(ArchiveBuilder builder,
                         ArchiveExtractor extractor,
                         RestoreOrchestrator orchestrator,
                         TempWorkspaceManager temps,
                         MeterRegistry meterRegistry) {
        this.builder       = builder;
        this.extractor     = extractor;
        this.orchestrator  = orchestrator;
        this.temps         = temps;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Build a backup of the given workspaces.
     *
     * The caller must close the returned stream; that is what removes the
     * archive's temp directory.
     */
    public ArchiveStream createBackup(List<WorkspaceBackupRequest> workspaces) {
        return timed("create", () -> builder.build(workspaces));
    }

    /**
     * Restore from an archive on disk. The archive file itself is left alone;
     * the extraction directory is always removed.
     */
    public RestoreResult restoreFromBackup(Path archivePath) {
        return timed("restore", () -> {
            RestoreResult result;
            try (ExtractedBackup backup = extractor.extract(archivePath)) {
                result = orchestrator.restore(backup);
            }
            countWorkspaces(result);
            return result;
        });
    }

    /**
     * Restore from an uploaded archive: the stream is copied to a temp file
     * first, and that file is deleted whatever the outcome.
     */
    public RestoreResult restoreUpload(InputStream upload) {
        try (TempWorkspace staging = temps.acquire("upload")) {
            Path archive = staging.resolve(UPLOAD_FILE_NAME);
            try {
                long bytes = Files.copy(upload, archive);
                log.info("Staged uploaded backup archive ({} bytes)", bytes);
            } catch (IOException e) {
                throw BackupException.io("Could not store uploaded backup archive: " + e.getMessage(), e);
            }
            return restoreFromBackup(archive);
        }
    }

    // ------------------------------------------------------------------
    // Metrics
    // ------------------------------------------------------------------

    private <T> T timed(String operation, Supplier<T> work) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return work.get();
        } catch (BackupException e) {
            status = e.getKind().name().toLowerCase();
            log.error("Backup operation '{}' failed ({}): {}", operation, status, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            log.error("Backup operation '{}' failed unexpectedly", operation, e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("notevault.backup.duration",
                    "operation", operation, "status", status));
        }
    }

    private void countWorkspaces(RestoreResult result) {
        for (WorkspaceRestoreReport report : result.workspaces()) {
            meterRegistry.counter("notevault.restore.workspaces",
                    "status", report.status().name().toLowerCase()).increment();
        }
    }
}
