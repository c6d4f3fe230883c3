package com.notevault.backup.store;

import com.notevault.backup.model.Document;
import com.notevault.backup.model.Folder;
import com.notevault.backup.model.Note;
import com.notevault.backup.model.Workspace;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational side of the workspace graph, as the backup engine sees it.
 *
 * All inserts keep the id carried by the entity: restored rows get their
 * original identity back, never a generated one.
 */
public interface WorkspaceStore {

    // ------------------------------------------------------------------
    // Folders
    // ------------------------------------------------------------------

    List<Folder> findAllFolders();

    boolean folderExists(String id);

    void insertFolder(Folder folder);

    // ------------------------------------------------------------------
    // Workspaces
    // ------------------------------------------------------------------

    Optional<Workspace> findWorkspace(String id);

    void insertWorkspace(Workspace workspace);

    /** @return false when there was no such workspace (not an error) */
    boolean deleteWorkspace(String id);

    // ------------------------------------------------------------------
    // Documents and notes
    // ------------------------------------------------------------------

    List<Document> findDocuments(String workspaceId);

    void insertDocuments(List<Document> documents);

    int deleteDocuments(String workspaceId);

    List<Note> findNotes(String workspaceId);

    void insertNotes(List<Note> notes);

    int deleteNotes(String workspaceId);

    // ------------------------------------------------------------------
    // Transactions
    // ------------------------------------------------------------------

    /**
     * Run {@code work} in one transaction: everything it wrote is committed
     * together, or nothing is if it throws.
     */
    <T> T inTransaction(Supplier<T> work);
}
