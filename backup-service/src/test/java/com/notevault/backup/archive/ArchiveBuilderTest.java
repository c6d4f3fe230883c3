package com.notevault.backup.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notevault.backup.archive.dto.WorkspaceBackupRequest;
import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.model.Document;
import com.notevault.backup.model.Folder;
import com.notevault.backup.model.Note;
import com.notevault.backup.model.Workspace;
import com.notevault.backup.service.BackupException;
import com.notevault.backup.store.BlobStore;
import com.notevault.backup.support.InMemoryWorkspaceStore;
import com.notevault.backup.support.TestFixtures;
import com.notevault.backup.temp.TempWorkspaceManager;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Builds real archives from an in-memory store and a temp blob root, then
 * opens them again with commons-compress to check the layout.
 */
class ArchiveBuilderTest {

    @TempDir Path base;

    InMemoryWorkspaceStore store;
    BlobStore              blobs;
    TempWorkspaceManager   temps;
    ObjectMapper           json;
    ArchiveBuilder         builder;

    @BeforeEach
    void setUp() throws Exception {
        BackupProperties props = TestFixtures.properties(base);
        store   = new InMemoryWorkspaceStore();
        blobs   = new BlobStore(props);
        temps   = new TempWorkspaceManager(props);
        json    = TestFixtures.objectMapper();
        builder = new ArchiveBuilder(store, blobs, temps, json, props);

        store.insertFolder(new Folder("f-root", "Root", null));
        store.insertFolder(new Folder("f-child", "Child", "f-root"));
        store.insertFolder(new Folder("f-unused", "Unused", null));

        Workspace ws1 = new Workspace("ws1", "Research");
        ws1.setFolderId("f-child");
        store.insertWorkspace(ws1);
        store.insertWorkspace(new Workspace("ws2", "Empty"));

        Document doc = new Document("doc-1", "ws1", "paper.pdf");
        doc.setSizeBytes(3);
        doc.setVectorized(true);
        doc.setTextChunks("[\"intro\",\"body\"]");
        store.insertDocuments(List.of(doc));
        store.insertNotes(List.of(new Note("note-1", "ws1", "Summary", "# hi")));

        TestFixtures.write(blobs.workspaceRoot("ws1").resolve("documents/paper.pdf"), "pdf");
        TestFixtures.write(blobs.workspaceRoot("ws1").resolve("notes/note-1.md"), "# hi");
        TestFixtures.write(blobs.workspaceRoot("ws1").resolve("vectors/doc-1/index.bin"), "vectors");
    }

    @Test
    void build_manifestAndDirectoriesMatchRequest() throws Exception {
        Path zip = download(builder.build(List.of(
                new WorkspaceBackupRequest("ws1", "{\"notes\":[1]}"),
                new WorkspaceBackupRequest("ws2", null))));

        try (ZipFile zf = ZipFile.builder().setPath(zip).get()) {
            JsonNode manifest = json.readTree(read(zf, "manifest.json"));
            assertThat(manifest.get("formatVersion").asText()).isEqualTo("2.0");
            assertThat(manifest.get("createdAt").asText()).isNotBlank();
            assertThat(manifest.get("workspaceIds")).extracting(JsonNode::asText).containsExactly("ws1", "ws2");

            assertThat(topLevelDirectories(zf)).containsExactly("ws1", "ws2");
        }
    }

    @Test
    void build_writesAllFoldersAndWorkspaceFiles() throws Exception {
        Path zip = download(builder.build(List.of(new WorkspaceBackupRequest("ws1", "{\"notes\":[1]}"))));

        try (ZipFile zf = ZipFile.builder().setPath(zip).get()) {
            JsonNode folders = json.readTree(read(zf, "folders.json"));
            assertThat(folders).extracting(f -> f.get("id").asText())
                    .containsExactlyInAnyOrder("f-root", "f-child", "f-unused");

            JsonNode metadata = json.readTree(read(zf, "ws1/metadata.json"));
            assertThat(metadata.get("id").asText()).isEqualTo("ws1");
            assertThat(metadata.get("folderId").asText()).isEqualTo("f-child");

            JsonNode docs = json.readTree(read(zf, "ws1/documents_meta.json"));
            assertThat(docs).hasSize(1);
            assertThat(docs.get(0).get("fileName").asText()).isEqualTo("paper.pdf");
            assertThat(docs.get(0).get("vectorized").asBoolean()).isTrue();
            assertThat(docs.get(0).get("textChunks")).extracting(JsonNode::asText).containsExactly("intro", "body");
            assertThat(docs.get(0).get("embeddings").isNull()).isTrue();

            assertThat(json.readTree(read(zf, "ws1/notepad_notes.json"))).hasSize(1);
            assertThat(read(zf, "ws1/notes.json")).isEqualTo("{\"notes\":[1]}");

            assertThat(read(zf, "ws1/documents/paper.pdf")).isEqualTo("pdf");
            assertThat(read(zf, "ws1/notes/note-1.md")).isEqualTo("# hi");
            assertThat(read(zf, "ws1/vectors/doc-1/index.bin")).isEqualTo("vectors");
        }
    }

    @Test
    void build_workspaceWithoutNotesOrBlobs_writesPlaceholderAndSkipsOptionalFiles() throws Exception {
        Path zip = download(builder.build(List.of(new WorkspaceBackupRequest("ws2", null))));

        try (ZipFile zf = ZipFile.builder().setPath(zip).get()) {
            assertThat(read(zf, "ws2/notes.json")).isEqualTo(ArchiveLayout.EMPTY_NOTES_PAYLOAD);
            assertThat(zf.getEntry("ws2/notepad_notes.json")).isNull();
            assertThat(zf.getEntry("ws2/documents/")).isNull();
            assertThat(json.readTree(read(zf, "ws2/documents_meta.json"))).isEmpty();
        }
    }

    @Test
    void build_streamMetadata() throws Exception {
        try (ArchiveStream archive = builder.build(List.of(new WorkspaceBackupRequest("ws1", null)))) {
            assertThat(archive.contentType()).isEqualTo("application/zip");
            assertThat(archive.fileName()).matches("notebook_backup_.+\\.zip");
            assertThat(archive.sizeBytes()).isPositive();
        }
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    @Test
    void close_removesTempDirectory() throws Exception {
        ArchiveStream archive = builder.build(List.of(new WorkspaceBackupRequest("ws1", null)));
        assertThat(TestFixtures.childCount(temps.root())).isEqualTo(1);

        archive.readAllBytes();
        archive.close();

        assertThat(TestFixtures.childCount(temps.root())).isZero();
        assertThat(temps.liveCount()).isZero();
    }

    @Test
    void close_beforeReadingAnything_stillRemovesTempDirectory() throws Exception {
        builder.build(List.of(new WorkspaceBackupRequest("ws1", null))).close();

        assertThat(TestFixtures.childCount(temps.root())).isZero();
    }

    @Test
    void build_unknownWorkspace_failsAndLeavesNoTempDirectory() throws Exception {
        assertThatThrownBy(() -> builder.build(List.of(
                new WorkspaceBackupRequest("ws1", null),
                new WorkspaceBackupRequest("ghost", null))))
                .isInstanceOf(BackupException.class)
                .hasMessageContaining("ghost")
                .extracting(e -> ((BackupException) e).getKind())
                .isEqualTo(BackupException.Kind.VALIDATION);

        assertThat(TestFixtures.childCount(temps.root())).isZero();
    }

    @Test
    void build_emptyDuplicateOrMalformedRequest_isValidationError() {
        assertThatThrownBy(() -> builder.build(List.of()))
                .isInstanceOf(BackupException.class);
        assertThatThrownBy(() -> builder.build(List.of(
                new WorkspaceBackupRequest("ws1", null), new WorkspaceBackupRequest("ws1", null))))
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> builder.build(List.of(new WorkspaceBackupRequest("../etc", null))))
                .hasMessageContaining("Invalid workspace id");
        assertThat(temps.liveCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path download(ArchiveStream archive) throws Exception {
        Path target = base.resolve("download-" + System.nanoTime() + ".zip");
        try (archive) {
            Files.copy(archive, target);
        }
        return target;
    }

    private static String read(ZipFile zf, String name) throws Exception {
        ZipArchiveEntry entry = zf.getEntry(name);
        assertThat(entry).as("entry %s", name).isNotNull();
        try (InputStream in = zf.getInputStream(entry)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Set<String> topLevelDirectories(ZipFile zf) {
        Set<String> dirs = new TreeSet<>();
        List<ZipArchiveEntry> entries = new ArrayList<>(Collections.list(zf.getEntries()));
        for (ZipArchiveEntry entry : entries) {
            String name = entry.getName();
            int slash = name.indexOf('/');
            if (slash > 0) {
                dirs.add(name.substring(0, slash));
            }
        }
        return dirs;
    }
}
