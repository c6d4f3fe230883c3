package com.notevault.backup.store;

import com.notevault.backup.model.Document;
import com.notevault.backup.model.Folder;
import com.notevault.backup.model.Note;
import com.notevault.backup.model.Workspace;
import com.notevault.backup.repository.DocumentRepository;
import com.notevault.backup.repository.FolderRepository;
import com.notevault.backup.repository.NoteRepository;
import com.notevault.backup.repository.WorkspaceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link WorkspaceStore} backed by the Spring Data repositories.
 *
 * Single-row writes use the repositories' own transactions; callers that need
 * several writes to commit together wrap them in {@link #inTransaction}, whose
 * transaction the repository calls then join.
 */
@Component
public class JpaWorkspaceStore implements WorkspaceStore {

    private final FolderRepository    folderRepo;
    private final WorkspaceRepository workspaceRepo;
    private final DocumentRepository  documentRepo;
    private final NoteRepository      noteRepo;
    private final TransactionTemplate tx;

    public JpaWorkspaceStore(FolderRepository folderRepo,
                             WorkspaceRepository workspaceRepo,
                             DocumentRepository documentRepo,
                             NoteRepository noteRepo,
                             TransactionTemplate transactionTemplate) {
        this.folderRepo    = folderRepo;
        this.workspaceRepo = workspaceRepo;
        this.documentRepo  = documentRepo;
        this.noteRepo      = noteRepo;
        this.tx            = transactionTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Folder> findAllFolders() {
        return folderRepo.findAllByOrderByCreatedAtAsc();
    }

    @Override
    public boolean folderExists(String id) {
        return folderRepo.existsById(id);
    }

    @Override
    public void insertFolder(Folder folder) {
        folderRepo.save(folder);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Workspace> findWorkspace(String id) {
        return workspaceRepo.findById(id);
    }

    @Override
    public void insertWorkspace(Workspace workspace) {
        workspaceRepo.save(workspace);
    }

    @Override
    @Transactional
    public boolean deleteWorkspace(String id) {
        return workspaceRepo.deleteRowById(id) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Document> findDocuments(String workspaceId) {
        return documentRepo.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId);
    }

    @Override
    public void insertDocuments(List<Document> documents) {
        if (!documents.isEmpty()) {
            documentRepo.saveAll(documents);
        }
    }

    @Override
    @Transactional
    public int deleteDocuments(String workspaceId) {
        return documentRepo.deleteAllByWorkspaceId(workspaceId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Note> findNotes(String workspaceId) {
        return noteRepo.findByWorkspaceIdOrderByCreatedAtAsc(workspaceId);
    }

    @Override
    public void insertNotes(List<Note> notes) {
        if (!notes.isEmpty()) {
            noteRepo.saveAll(notes);
        }
    }

    @Override
    @Transactional
    public int deleteNotes(String workspaceId) {
        return noteRepo.deleteAllByWorkspaceId(workspaceId);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return tx.execute(status -> work.get());
    }
}
