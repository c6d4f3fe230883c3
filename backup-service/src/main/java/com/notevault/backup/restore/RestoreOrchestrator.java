package com.notevault.backup.restore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notevault.backup.archive.ArchiveLayout;
import com.notevault.backup.archive.ExtractedBackup;
import com.notevault.backup.archive.dto.DocumentEntry;
import com.notevault.backup.archive.dto.FolderEntry;
import com.notevault.backup.archive.dto.NoteEntry;
import com.notevault.backup.archive.dto.WorkspaceEntry;
import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.config.RestoreFailurePolicy;
import com.notevault.backup.model.Document;
import com.notevault.backup.service.BackupException;
import com.notevault.backup.store.BlobReplacement;
import com.notevault.backup.store.BlobStore;
import com.notevault.backup.store.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds workspaces from an extracted backup.
 *
 * <h3>Order of work</h3>
 * <ol>
 *   <li><b>Pre-flight</b>: every workspace directory is read and parsed up
 *       front. A missing {@code metadata.json}, an id that differs from its
 *       directory name, or unparsable JSON aborts the restore before anything
 *       is written.</li>
 *   <li><b>Folder pass</b>: folders from {@code folders.json} are created with
 *       their original ids, parents first; existing folders are left alone.
 *       The ids that end up present form the "known" set.</li>
 *   <li><b>Per workspace</b>, in manifest order and inside one store
 *       transaction: destroy the old rows, move the old blob tree aside,
 *       insert the workspace (clearing a folder reference that is not known),
 *       copy the blob trees, insert documents and notes, collect the legacy
 *       payload. The moved-aside tree is deleted after commit and put back
 *       on rollback.</li>
 * </ol>
 *
 * <h3>Format 1 archives</h3>
 * The original exporter copied a workspace's whole upload directory into
 * {@code documents/}, so that tree also holds its own {@code notes/} and
 * {@code vectors/}. Those are restored as the top-level trees, not nested
 * under {@code documents/}, and each document's upload path is rewritten to
 * the restored file.
 *
 * <h3>Failures</h3>
 * A workspace that fails is always rolled back as a unit. What happens next
 * depends on {@link RestoreFailurePolicy}: ABORT_ALL rethrows, leaving the
 * workspaces restored so far committed; CONTINUE records the failure and
 * moves on to the next workspace.
 */
@Component
public class RestoreOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RestoreOrchestrator.class);

    private static final TypeReference<List<FolderEntry>>   FOLDER_LIST   = new TypeReference<>() {};
    private static final TypeReference<List<DocumentEntry>> DOCUMENT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<NoteEntry>>     NOTE_LIST     = new TypeReference<>() {};

    // Trees a format 1 archive repeats inside documents/.
    private static final Set<String> NESTED_IN_FORMAT_ONE = Set.of(BlobStore.NOTES, BlobStore.VECTORS);

    private final WorkspaceStore       store;
    private final BlobStore            blobStore;
    private final WorkspaceLocks       locks;
    private final ObjectMapper         json;
    private final RestoreFailurePolicy failurePolicy;

    public RestoreOrchestrator(WorkspaceStore store,
                               BlobStore blobStore,
                               WorkspaceLocks locks,
                               ObjectMapper objectMapper,
                               BackupProperties properties) {
        this.store         = store;
        this.blobStore     = blobStore;
        this.locks         = locks;
        this.json          = objectMapper;
        this.failurePolicy = properties.failurePolicy();
    }

    /**
     * Restore every workspace listed in the backup's manifest.
     *
     * @throws BackupException VALIDATION when pre-flight rejects the archive,
     *                         CONFLICT when the workspace locks are busy, and
     *                         under ABORT_ALL the STORE or IO error of the
     *                         first workspace that failed
     */
    public RestoreResult restore(ExtractedBackup backup) {
        List<String> ids = backup.manifest().workspaceIds();
        log.info("Restore stage {}: {} workspaces {}", RestoreStage.EXTRACTED, ids.size(), ids);

        log.info("Restore stage {}", RestoreStage.VALIDATING_MANIFEST);
        StagedBackup staged;
        try {
            staged = preflight(backup);
        } catch (BackupException e) {
            log.error("Restore stage {}: {}", RestoreStage.ABORTED, e.getMessage());
            throw e;
        }

        try (WorkspaceLocks.Lease lease = locks.acquire(ids)) {
            Set<String> knownFolders;
            try (WorkspaceLocks.Lease folderLease = locks.acquireFolderPass()) {
                knownFolders = restoreFolders(staged.folders());
            }
            log.info("Restore stage {}: {} known folders", RestoreStage.FOLDER_PASS_DONE, knownFolders.size());

            List<RestoredPayload>        payloads = new ArrayList<>();
            List<WorkspaceRestoreReport> reports  = new ArrayList<>();
            for (StagedWorkspace workspace : staged.workspaces()) {
                WorkspaceRun run = new WorkspaceRun(workspace.id());
                try {
                    String payload = restoreWorkspace(workspace, knownFolders, run);
                    payloads.add(new RestoredPayload(workspace.id(), payload));
                    reports.add(WorkspaceRestoreReport.restored(workspace.id(), run.outcomes));
                } catch (BackupException e) {
                    if (failurePolicy == RestoreFailurePolicy.ABORT_ALL) {
                        log.error("Restore stage {}: workspace {} failed, {} of {} restored before it",
                                RestoreStage.ABORTED, workspace.id(), payloads.size(), ids.size());
                        throw e;
                    }
                    log.warn("Workspace {} failed and was rolled back, continuing: {}",
                            workspace.id(), e.getMessage());
                    reports.add(WorkspaceRestoreReport.failed(workspace.id(), run.outcomes, e.getMessage()));
                }
            }

            RestoreResult result = new RestoreResult(message(reports), List.copyOf(payloads), List.copyOf(reports));
            log.info("Restore stage {}: {}", RestoreStage.COMPLETED, result.message());
            return result;
        }
    }

    private static String message(List<WorkspaceRestoreReport> reports) {
        long failed = reports.stream().filter(WorkspaceRestoreReport::isFailed).count();
        if (failed == 0) {
            return "Restore completed successfully.";
        }
        return "Restore completed with " + failed + " of " + reports.size() + " workspaces failed.";
    }

    // ------------------------------------------------------------------
    // Pre-flight
    // ------------------------------------------------------------------

    private StagedBackup preflight(ExtractedBackup backup) {
        List<FolderEntry> folders = null;
        Path foldersFile = backup.foldersFile();
        if (Files.isRegularFile(foldersFile)) {
            folders = readList(foldersFile, FOLDER_LIST);
        }

        boolean formatOne = backup.manifest().majorVersion() == 1;
        List<StagedWorkspace> workspaces = new ArrayList<>();
        for (String id : backup.manifest().workspaceIds()) {
            workspaces.add(stageWorkspace(id, backup.workspaceDir(id), formatOne));
        }
        return new StagedBackup(folders, workspaces);
    }

    private StagedWorkspace stageWorkspace(String id, Path dir, boolean formatOne) {
        Path metadataFile = dir.resolve(ArchiveLayout.METADATA);
        if (!Files.isRegularFile(metadataFile)) {
            throw BackupException.validation("Missing " + ArchiveLayout.METADATA + " for workspace " + id);
        }
        WorkspaceEntry metadata = read(metadataFile, WorkspaceEntry.class);
        if (!id.equals(metadata.id())) {
            throw BackupException.validation("Workspace id mismatch: directory " + id
                    + " holds metadata for " + metadata.id());
        }
        if (metadata.title() == null) {
            throw BackupException.validation("Workspace " + id + " has no title");
        }

        List<DocumentEntry> documents = null;
        Path documentsFile = dir.resolve(ArchiveLayout.DOCUMENTS_META);
        if (Files.isRegularFile(documentsFile)) {
            documents = readList(documentsFile, DOCUMENT_LIST);
            for (DocumentEntry doc : documents) {
                if (doc == null || doc.id() == null || doc.fileName() == null) {
                    throw BackupException.validation("Document without id or fileName in workspace " + id);
                }
            }
        }

        List<NoteEntry> notes = null;
        Path notesFile = dir.resolve(ArchiveLayout.NOTEPAD_NOTES);
        if (Files.isRegularFile(notesFile)) {
            notes = readList(notesFile, NOTE_LIST);
            for (NoteEntry note : notes) {
                if (note == null || note.id() == null) {
                    throw BackupException.validation("Note without id in workspace " + id);
                }
            }
        }

        String payload = null;
        Path payloadFile = dir.resolve(ArchiveLayout.LEGACY_NOTES);
        if (Files.isRegularFile(payloadFile)) {
            try {
                payload = Files.readString(payloadFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw BackupException.validation("Unreadable " + ArchiveLayout.LEGACY_NOTES + " in workspace " + id, e);
            }
        }

        return new StagedWorkspace(id, dir, formatOne, metadata, documents, notes, payload);
    }

    private <T> T read(Path file, Class<T> type) {
        try {
            T value = json.readValue(file.toFile(), type);
            if (value == null) {
                throw BackupException.validation("Empty " + file.getFileName() + " in backup");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw BackupException.validation("Invalid JSON in " + relative(file) + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw BackupException.io("Could not read " + relative(file), e);
        }
    }

    private <T> List<T> readList(Path file, TypeReference<List<T>> type) {
        try {
            List<T> value = json.readValue(file.toFile(), type);
            return value == null ? List.of() : value;
        } catch (JsonProcessingException e) {
            throw BackupException.validation("Invalid JSON in " + relative(file) + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw BackupException.io("Could not read " + relative(file), e);
        }
    }

    private static String relative(Path file) {
        Path parent = file.getParent();
        return parent == null ? file.toString() : parent.getFileName() + "/" + file.getFileName();
    }

    // ------------------------------------------------------------------
    // Folder pass
    // ------------------------------------------------------------------

    /**
     * Create the archived folders that are missing from the store.
     *
     * @return ids of archived folders now present in the store
     */
    private Set<String> restoreFolders(List<FolderEntry> entries) {
        Set<String> known = new HashSet<>();
        if (entries == null) {
            log.warn("No {} in backup; workspace folder references will be cleared", ArchiveLayout.FOLDERS);
            return known;
        }

        Map<String, FolderEntry> byId = new LinkedHashMap<>();
        for (FolderEntry entry : entries) {
            if (entry == null || entry.id() == null || entry.name() == null) {
                log.warn("Skipping folder entry without id or name: {}", entry);
                continue;
            }
            byId.putIfAbsent(entry.id(), entry);
        }

        FolderPass pass = new FolderPass(byId, known);
        for (String id : byId.keySet()) {
            pass.place(id);
        }
        log.info("Folder pass: {} created, {} already present, {} failed",
                pass.created, pass.existing, byId.size() - known.size());
        return known;
    }

    /** Depth-first placement so a parent is always inserted before its children. */
    private final class FolderPass {

        private final Map<String, FolderEntry> byId;
        private final Set<String>              known;
        private final Set<String>              done       = new HashSet<>();
        private final Set<String>              inProgress = new HashSet<>();
        private int created;
        private int existing;

        FolderPass(Map<String, FolderEntry> byId, Set<String> known) {
            this.byId  = byId;
            this.known = known;
        }

        void place(String id) {
            if (done.contains(id)) return;
            if (store.folderExists(id)) {
                known.add(id);
                done.add(id);
                existing++;
                return;
            }

            FolderEntry entry = byId.get(id);
            inProgress.add(id);
            String parentId = entry.parentId();
            if (parentId != null) {
                if (inProgress.contains(parentId)) {
                    log.warn("Folder {} is part of a parent cycle; restoring it as a root folder", id);
                    parentId = null;
                } else if (byId.containsKey(parentId)) {
                    place(parentId);
                    if (!known.contains(parentId)) {
                        log.warn("Parent {} of folder {} could not be restored; clearing the reference", parentId, id);
                        parentId = null;
                    }
                } else if (!store.folderExists(parentId)) {
                    log.warn("Parent {} of folder {} not found; clearing the reference", parentId, id);
                    parentId = null;
                }
            }

            try {
                store.insertFolder(entry.toFolder(parentId));
                known.add(id);
                created++;
            } catch (RuntimeException e) {
                log.error("Could not restore folder {} ({}): {}", id, entry.name(), e.getMessage());
            }
            inProgress.remove(id);
            done.add(id);
        }
    }

    // ------------------------------------------------------------------
    // Per workspace
    // ------------------------------------------------------------------

    /**
     * Destroy and recreate one workspace as a unit.
     *
     * @return the legacy payload to hand back to the client
     * @throws BackupException after rolling the workspace back
     */
    private String restoreWorkspace(StagedWorkspace workspace, Set<String> knownFolders, WorkspaceRun run) {
        log.info("Restoring workspace {}", workspace.id());
        try {
            String payload = store.inTransaction(() -> {
                String collected = apply(workspace, knownFolders, run);
                run.enter(RestoreStage.COMMITTING);
                return collected;
            });
            if (run.blobs != null) {
                run.blobs.commit();
            }
            run.applied("transaction committed");
            log.info("Workspace {} restored", workspace.id());
            return payload;
        } catch (RuntimeException e) {
            if (run.blobs != null) {
                run.blobs.rollback();
            }
            run.failed(e.getMessage());
            if (e instanceof BackupException be) {
                throw be;
            }
            throw new BackupException(BackupException.Kind.STORE,
                    "Restore of workspace " + workspace.id() + " failed at " + run.stage + ": " + e.getMessage(), e);
        }
    }

    // Runs inside the store transaction.
    private String apply(StagedWorkspace workspace, Set<String> knownFolders, WorkspaceRun run) {
        String id = workspace.id();
        try {
            run.enter(RestoreStage.DESTROYING);
            int notes = store.deleteNotes(id);
            int docs  = store.deleteDocuments(id);
            if (store.deleteWorkspace(id)) {
                run.applied("deleted existing workspace with " + docs + " documents and " + notes + " notes");
            } else {
                run.skipped("workspace did not exist");
            }

            run.enter(RestoreStage.BLOB_REMOVING);
            run.blobs = blobStore.beginReplace(id);
            if (run.blobs.hadPreviousTree()) {
                run.applied("previous blob tree moved aside");
            } else {
                run.skipped("no previous blob tree");
            }

            run.enter(RestoreStage.METADATA_RESTORING);
            WorkspaceEntry metadata = workspace.metadata();
            String folderId = metadata.folderId();
            if (folderId != null && !knownFolders.contains(folderId)) {
                log.warn("Workspace {} refers to unknown folder {}; clearing the reference", id, folderId);
                metadata = metadata.withFolderId(null);
                store.insertWorkspace(metadata.toWorkspace());
                run.applied("folder " + folderId + " not found, reference cleared");
            } else {
                store.insertWorkspace(metadata.toWorkspace());
                run.applied(folderId == null ? "no folder" : "in folder " + folderId);
            }

            run.enter(RestoreStage.BLOB_RESTORING);
            run.blobs.createRoot();
            List<String> copied = new ArrayList<>();
            Path documentsTree = workspace.dir().resolve(BlobStore.DOCUMENTS);
            for (String name : ArchiveLayout.BLOB_SUBTREES) {
                boolean done;
                if (!workspace.formatOne()) {
                    done = run.blobs.copySubtree(name, workspace.dir().resolve(name));
                } else if (BlobStore.DOCUMENTS.equals(name)) {
                    done = run.blobs.copySubtree(name, documentsTree, NESTED_IN_FORMAT_ONE);
                } else {
                    Path source = workspace.dir().resolve(name);
                    done = run.blobs.copySubtree(name, Files.isDirectory(source) ? source : documentsTree.resolve(name));
                }
                if (done) {
                    copied.add(name);
                } else {
                    log.warn("No '{}' tree in backup for workspace {}, skipping", name, id);
                }
            }
            if (copied.isEmpty()) {
                run.skipped("no blob trees in backup");
            } else {
                run.applied("copied " + copied);
            }

            run.enter(RestoreStage.DOCS_RESTORING);
            if (workspace.documents() == null) {
                log.warn("No {} for workspace {}, skipping document rows", ArchiveLayout.DOCUMENTS_META, id);
                run.skipped(ArchiveLayout.DOCUMENTS_META + " not present");
            } else {
                List<Document> rows = workspace.documents().stream().map(d -> d.toDocument(id)).toList();
                if (workspace.formatOne()) {
                    int dropped = relocateUploadPaths(id, rows, run.blobs.root());
                    store.insertDocuments(rows);
                    run.applied(rows.size() + " documents, " + dropped + " upload paths not found");
                } else {
                    store.insertDocuments(rows);
                    run.applied(rows.size() + " documents");
                }
            }

            run.enter(RestoreStage.NOTES_RESTORING);
            if (workspace.notes() == null) {
                log.info("No {} for workspace {}, skipping note rows", ArchiveLayout.NOTEPAD_NOTES, id);
                run.skipped(ArchiveLayout.NOTEPAD_NOTES + " not present");
            } else {
                store.insertNotes(workspace.notes().stream().map(n -> n.toNote(id)).toList());
                run.applied(workspace.notes().size() + " notes");
            }

            run.enter(RestoreStage.PAYLOAD_COLLECTED);
            if (workspace.payload() == null) {
                run.skipped(ArchiveLayout.LEGACY_NOTES + " not present, returning empty payload");
                return ArchiveLayout.EMPTY_NOTES_PAYLOAD;
            }
            run.applied(workspace.payload().length() + " characters");
            return workspace.payload();

        } catch (IOException e) {
            throw BackupException.io("Blob copy for workspace " + id + " failed at " + run.stage + ": "
                    + e.getMessage(), e);
        }
    }

    /**
     * Point format 1 rows, which hold the exporter's upload path (for example
     * {@code uploads/nb1/a.pdf}), at the restored file under {@code documents/}.
     * A path whose file is not in the restored tree is cleared.
     *
     * @return number of paths cleared
     */
    private static int relocateUploadPaths(String workspaceId, List<Document> rows, Path blobRoot) {
        int dropped = 0;
        for (Document doc : rows) {
            String uploadPath = doc.getStoragePath();
            if (uploadPath == null) continue;
            int slash = Math.max(uploadPath.lastIndexOf('/'), uploadPath.lastIndexOf('\\'));
            String fileName = uploadPath.substring(slash + 1);
            String relative = BlobStore.DOCUMENTS + "/" + fileName;
            if (!fileName.isEmpty() && Files.isRegularFile(blobRoot.resolve(relative))) {
                doc.setStoragePath(relative);
            } else {
                log.warn("Document {} of workspace {}: no restored file for upload path {}, clearing it",
                        doc.getId(), workspaceId, uploadPath);
                doc.setStoragePath(null);
                dropped++;
            }
        }
        return dropped;
    }

    // ------------------------------------------------------------------
    // Internal state
    // ------------------------------------------------------------------

    private record StagedBackup(List<FolderEntry> folders, List<StagedWorkspace> workspaces) {}

    /** One workspace directory, parsed; null lists mean the optional file was absent. */
    private record StagedWorkspace(
            String              id,
            Path                dir,
            boolean             formatOne,
            WorkspaceEntry      metadata,
            List<DocumentEntry> documents,
            List<NoteEntry>     notes,
            String              payload) {}

    /** Progress of one workspace through the per-workspace stages. */
    private static final class WorkspaceRun {

        private final String            workspaceId;
        private final List<StepOutcome> outcomes = new ArrayList<>();
        private RestoreStage            stage = RestoreStage.DESTROYING;
        private BlobReplacement         blobs;

        WorkspaceRun(String workspaceId) {
            this.workspaceId = workspaceId;
        }

        void enter(RestoreStage next) {
            stage = next;
            log.debug("Workspace {}: {}", workspaceId, next);
        }

        void applied(String detail) {
            outcomes.add(StepOutcome.applied(stage, detail));
        }

        void skipped(String detail) {
            outcomes.add(StepOutcome.skipped(stage, detail));
        }

        void failed(String detail) {
            outcomes.add(StepOutcome.failed(stage, detail));
        }
    }
}
