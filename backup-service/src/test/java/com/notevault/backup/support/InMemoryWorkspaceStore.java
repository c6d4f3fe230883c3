package com.notevault.backup.support;

import com.notevault.backup.model.Document;
import com.notevault.backup.model.Folder;
import com.notevault.backup.model.Note;
import com.notevault.backup.model.Workspace;
import com.notevault.backup.store.WorkspaceStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Map-backed {@link WorkspaceStore} for orchestrator tests.
 *
 * {@link #inTransaction} snapshots every table and restores the snapshot if
 * the work or the commit throws, which is all the orchestrator relies on. Foreign keys are
 * checked on insert the way the database would: a folder parent, a
 * workspace folder and a document or note owner must exist.
 */
public class InMemoryWorkspaceStore implements WorkspaceStore {

    private Map<String, Folder>    folders    = new LinkedHashMap<>();
    private Map<String, Workspace> workspaces = new LinkedHashMap<>();
    private Map<String, Document>  documents  = new LinkedHashMap<>();
    private Map<String, Note>      notes      = new LinkedHashMap<>();

    private final Set<String> failDocumentInsertsFor = new HashSet<>();
    private final Set<String> failFolderInserts      = new HashSet<>();
    private final List<String> insertedFolderOrder   = new ArrayList<>();
    private int transactions;
    private boolean failNextCommit;

    // ------------------------------------------------------------------
    // Failure injection
    // ------------------------------------------------------------------

    public void failDocumentInserts(String workspaceId) {
        failDocumentInsertsFor.add(workspaceId);
    }

    public void failFolderInsert(String folderId) {
        failFolderInserts.add(folderId);
    }

    /** The next transaction runs its work and then fails to commit, like a deferred constraint. */
    public void failNextCommit() {
        failNextCommit = true;
    }

    public List<String> insertedFolderOrder() {
        return insertedFolderOrder;
    }

    public int transactionCount() {
        return transactions;
    }

    // ------------------------------------------------------------------
    // WorkspaceStore
    // ------------------------------------------------------------------

    @Override
    public List<Folder> findAllFolders() {
        return List.copyOf(folders.values());
    }

    @Override
    public boolean folderExists(String id) {
        return folders.containsKey(id);
    }

    @Override
    public void insertFolder(Folder folder) {
        if (failFolderInserts.contains(folder.getId())) {
            throw new IllegalStateException("simulated failure inserting folder " + folder.getId());
        }
        requireAbsent(folders, folder.getId());
        if (folder.getParentId() != null && !folders.containsKey(folder.getParentId())) {
            throw new IllegalStateException("foreign key violation: parent " + folder.getParentId());
        }
        folders.put(folder.getId(), folder);
        insertedFolderOrder.add(folder.getId());
    }

    @Override
    public Optional<Workspace> findWorkspace(String id) {
        return Optional.ofNullable(workspaces.get(id));
    }

    @Override
    public void insertWorkspace(Workspace workspace) {
        requireAbsent(workspaces, workspace.getId());
        if (workspace.getFolderId() != null && !folders.containsKey(workspace.getFolderId())) {
            throw new IllegalStateException("foreign key violation: folder " + workspace.getFolderId());
        }
        workspaces.put(workspace.getId(), workspace);
    }

    @Override
    public boolean deleteWorkspace(String id) {
        return workspaces.remove(id) != null;
    }

    @Override
    public List<Document> findDocuments(String workspaceId) {
        return documents.values().stream().filter(d -> d.getWorkspaceId().equals(workspaceId)).toList();
    }

    @Override
    public void insertDocuments(List<Document> docs) {
        for (Document doc : docs) {
            if (failDocumentInsertsFor.contains(doc.getWorkspaceId())) {
                throw new IllegalStateException("simulated failure inserting documents of " + doc.getWorkspaceId());
            }
            requireAbsent(documents, doc.getId());
            requireOwner(doc.getWorkspaceId());
            documents.put(doc.getId(), doc);
        }
    }

    @Override
    public int deleteDocuments(String workspaceId) {
        return removeOwnedBy(documents, workspaceId, Document::getWorkspaceId);
    }

    @Override
    public List<Note> findNotes(String workspaceId) {
        return notes.values().stream().filter(n -> n.getWorkspaceId().equals(workspaceId)).toList();
    }

    @Override
    public void insertNotes(List<Note> list) {
        for (Note note : list) {
            requireAbsent(notes, note.getId());
            requireOwner(note.getWorkspaceId());
            notes.put(note.getId(), note);
        }
    }

    @Override
    public int deleteNotes(String workspaceId) {
        return removeOwnedBy(notes, workspaceId, Note::getWorkspaceId);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        transactions++;
        Map<String, Folder>    savedFolders    = new LinkedHashMap<>(folders);
        Map<String, Workspace> savedWorkspaces = new LinkedHashMap<>(workspaces);
        Map<String, Document>  savedDocuments  = new LinkedHashMap<>(documents);
        Map<String, Note>      savedNotes      = new LinkedHashMap<>(notes);
        try {
            T result = work.get();
            if (failNextCommit) {
                failNextCommit = false;
                throw new IllegalStateException("simulated constraint violation at commit");
            }
            return result;
        } catch (RuntimeException e) {
            folders    = savedFolders;
            workspaces = savedWorkspaces;
            documents  = savedDocuments;
            notes      = savedNotes;
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void requireAbsent(Map<String, ?> table, String id) {
        if (table.containsKey(id)) {
            throw new IllegalStateException("duplicate key " + id);
        }
    }

    private void requireOwner(String workspaceId) {
        if (!workspaces.containsKey(workspaceId)) {
            throw new IllegalStateException("foreign key violation: workspace " + workspaceId);
        }
    }

    private static <E> int removeOwnedBy(Map<String, E> table, String workspaceId,
                                         java.util.function.Function<E, String> owner) {
        int before = table.size();
        table.values().removeIf(e -> owner.apply(e).equals(workspaceId));
        return before - table.size();
    }
}
