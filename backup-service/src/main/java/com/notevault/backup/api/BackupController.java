package com.notevault.backup.api;

import com.notevault.backup.api.dto.CreateBackupRequest;
import com.notevault.backup.archive.ArchiveStream;
import com.notevault.backup.restore.RestoreResult;
import com.notevault.backup.service.BackupService;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * REST API for backup and restore.
 *
 * POST /backup/create   : JSON list of workspaces in, zip download out
 * POST /backup/restore  : multipart upload (field "backupFile") of a .zip, restore report out
 */
@RestController
@RequestMapping("/backup")
public class BackupController {

    private final BackupService backupService;

    public BackupController(BackupService backupService) {
        this.backupService = backupService;
    }

    /**
     * Create and download a backup.
     *
     * Example:
     *   curl -X POST http://localhost:8080/backup/create \
     *     -H "Content-Type: application/json" \
     *     -d '{"workspaces":[{"id":"ws1","legacyNotePayload":"{\"notes\":[]}"}]}' \
     *     -o backup.zip
     *
     * The archive stream is closed by the resource converter once the body
     * has been written (or the client went away), which removes its temp
     * directory.
     */
    @PostMapping(path = "/create", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Resource> create(@RequestBody CreateBackupRequest request) {
        ArchiveStream archive = backupService.createBackup(request.workspaces());
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(archive.contentType()))
                .contentLength(archive.sizeBytes())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(archive.fileName()).build().toString())
                .body(new InputStreamResource(archive));
    }

    /**
     * Restore from an uploaded archive.
     *
     * Returns 400 if no file was sent or it is not a .zip.
     */
    @PostMapping(path = "/restore", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public RestoreResult restore(@RequestParam("backupFile") MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No backup file uploaded");
        }
        String name = file.getOriginalFilename();
        if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Only .zip backup files are accepted");
        }
        try (InputStream in = file.getInputStream()) {
            return backupService.restoreUpload(in);
        }
    }
}
