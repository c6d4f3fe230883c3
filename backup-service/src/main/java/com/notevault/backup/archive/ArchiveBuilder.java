package com.notevault.backup.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notevault.backup.archive.dto.BackupManifest;
import com.notevault.backup.archive.dto.DocumentEntry;
import com.notevault.backup.archive.dto.FolderEntry;
import com.notevault.backup.archive.dto.NoteEntry;
import com.notevault.backup.archive.dto.WorkspaceBackupRequest;
import com.notevault.backup.archive.dto.WorkspaceEntry;
import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.model.Document;
import com.notevault.backup.model.Workspace;
import com.notevault.backup.service.BackupException;
import com.notevault.backup.store.BlobStore;
import com.notevault.backup.store.WorkspaceStore;
import com.notevault.backup.temp.TempWorkspace;
import com.notevault.backup.temp.TempWorkspaceManager;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Builds a backup archive for a list of workspaces.
 *
 * Everything is first staged as plain files under {@code <temp>/content},
 * then streamed entry by entry into {@code <temp>/<name>.zip}, so memory use
 * does not grow with the size of the blob trees. The finished archive is
 * handed out as an {@link ArchiveStream}; closing that stream removes the
 * temp directory. If the build fails, the directory is removed before the
 * exception leaves this class.
 */
@Component
public class ArchiveBuilder {

    private static final Logger log = LoggerFactory.getLogger(ArchiveBuilder.class);

    private static final String CONTENT_DIR = "content";

    private final WorkspaceStore       store;
    private final BlobStore            blobs;
    private final TempWorkspaceManager temps;
    private final ObjectMapper         json;
    private final int                  compressionLevel;

    public ArchiveBuilder(WorkspaceStore store,
                          BlobStore blobs,
                          TempWorkspaceManager temps,
                          ObjectMapper objectMapper,
                          BackupProperties properties) {
        this.store            = store;
        this.blobs            = blobs;
        this.temps            = temps;
        this.json             = objectMapper;
        this.compressionLevel = properties.compressionLevel();
    }

    /**
     * Snapshot the given workspaces into a zip archive.
     *
     * @throws BackupException VALIDATION for an empty request, a malformed or
     *                         duplicate id, or an unknown workspace; IO when
     *                         staging or compression fails
     */
    public ArchiveStream build(List<WorkspaceBackupRequest> requests) {
        List<String> workspaceIds = validate(requests);
        log.info("Starting backup of {} workspaces: {}", workspaceIds.size(), workspaceIds);

        TempWorkspace temp = temps.acquire("backup");
        try {
            Path content = Files.createDirectory(temp.resolve(CONTENT_DIR));

            // 1. Manifest first: it names exactly the directories staged below.
            writeJson(content.resolve(ArchiveLayout.MANIFEST), BackupManifest.current(workspaceIds));

            // 2. The whole folder forest, so restore never needs a separate folder export.
            List<FolderEntry> folders = store.findAllFolders().stream().map(FolderEntry::from).toList();
            writeJson(content.resolve(ArchiveLayout.FOLDERS), folders);
            log.info("Backing up {} folders", folders.size());

            // 3. One directory per workspace.
            for (WorkspaceBackupRequest request : requests) {
                stageWorkspace(content, request);
            }

            // 4. Compress, then drop the staging copy to halve the disk footprint.
            String fileName = archiveFileName(Instant.now());
            Path zip = temp.resolve(fileName);
            int entries = compress(content, zip);
            FileSystemUtils.deleteRecursively(content);

            long size = Files.size(zip);
            log.info("Backup archive {} finalized: {} entries, {} bytes", fileName, entries, size);
            return new ArchiveStream(new BufferedInputStream(Files.newInputStream(zip)), fileName, size, temp);

        } catch (IOException e) {
            log.error("Backup creation failed, removing {}", temp, e);
            temp.release();
            throw BackupException.io("Backup creation failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Backup creation failed, removing {}: {}", temp, e.getMessage());
            temp.release();
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Staging
    // ------------------------------------------------------------------

    private void stageWorkspace(Path content, WorkspaceBackupRequest request) throws IOException {
        String id = request.id();
        Workspace workspace = store.findWorkspace(id)
                .orElseThrow(() -> BackupException.validation("Workspace not found: " + id));

        Path dir = Files.createDirectory(content.resolve(id));
        writeJson(dir.resolve(ArchiveLayout.METADATA), WorkspaceEntry.from(workspace));

        List<DocumentEntry> documents = new ArrayList<>();
        for (Document doc : store.findDocuments(id)) {
            documents.add(DocumentEntry.from(doc, json));
        }
        writeJson(dir.resolve(ArchiveLayout.DOCUMENTS_META), documents);

        // The client's payload is opaque: store it byte for byte.
        String payload = request.legacyNotePayload() != null
                ? request.legacyNotePayload()
                : ArchiveLayout.EMPTY_NOTES_PAYLOAD;
        Files.writeString(dir.resolve(ArchiveLayout.LEGACY_NOTES), payload, StandardCharsets.UTF_8);

        List<NoteEntry> notes = store.findNotes(id).stream().map(NoteEntry::from).toList();
        if (!notes.isEmpty()) {
            writeJson(dir.resolve(ArchiveLayout.NOTEPAD_NOTES), notes);
        }

        List<String> subtrees = blobs.exportSubtrees(id, dir);
        log.info("Staged workspace {}: {} documents, {} notes, blob trees {}",
                id, documents.size(), notes.size(), subtrees);
    }

    private void writeJson(Path file, Object value) throws IOException {
        json.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
    }

    // ------------------------------------------------------------------
    // Compression
    // ------------------------------------------------------------------

    /**
     * Write every file and directory under {@code source} into {@code zip},
     * in sorted path order, streaming each file.
     *
     * @return number of entries written
     */
    private int compress(Path source, Path zip) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.filter(p -> !p.equals(source)).sorted().toList();
        }

        try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(zip)) {
            out.setLevel(compressionLevel);
            for (Path path : paths) {
                String name = source.relativize(path).toString().replace(File.separatorChar, '/');
                ZipArchiveEntry entry = out.createArchiveEntry(path, name);
                out.putArchiveEntry(entry);
                if (Files.isRegularFile(path)) {
                    Files.copy(path, out);
                }
                out.closeArchiveEntry();
            }
            // Writes the central directory; the archive is complete after this.
            out.finish();
        }
        return paths.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<String> validate(List<WorkspaceBackupRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw BackupException.validation("At least one workspace must be selected for backup");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (WorkspaceBackupRequest request : requests) {
            String id = request == null ? null : request.id();
            if (!ArchiveLayout.isValidWorkspaceId(id)) {
                throw BackupException.validation("Invalid workspace id: " + id);
            }
            if (!ids.add(id)) {
                throw BackupException.validation("Duplicate workspace id: " + id);
            }
        }
        return List.copyOf(ids);
    }

    static String archiveFileName(Instant at) {
        String stamp = at.truncatedTo(ChronoUnit.SECONDS).toString().replace(':', '-');
        return "notebook_backup_" + stamp + ".zip";
    }
}
