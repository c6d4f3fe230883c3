package com.notevault.backup.store;

import com.notevault.backup.model.Document;
import com.notevault.backup.model.Folder;
import com.notevault.backup.repository.DocumentRepository;
import com.notevault.backup.repository.FolderRepository;
import com.notevault.backup.repository.NoteRepository;
import com.notevault.backup.repository.WorkspaceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaWorkspaceStore.
 *
 * Repositories and the transaction template are mocked; these tests pin the
 * delegation and the "not found is not an error" contract.
 */
@ExtendWith(MockitoExtension.class)
class JpaWorkspaceStoreTest {

    @Mock FolderRepository    folderRepo;
    @Mock WorkspaceRepository workspaceRepo;
    @Mock DocumentRepository  documentRepo;
    @Mock NoteRepository      noteRepo;
    @Mock TransactionTemplate tx;

    @Captor ArgumentCaptor<List<Document>> savedDocuments;

    JpaWorkspaceStore store;

    @BeforeEach
    void setUp() {
        store = new JpaWorkspaceStore(folderRepo, workspaceRepo, documentRepo, noteRepo, tx);
    }

    @Test
    void deleteWorkspace_noRow_returnsFalseInsteadOfThrowing() {
        when(workspaceRepo.deleteRowById("ghost")).thenReturn(0);

        assertThat(store.deleteWorkspace("ghost")).isFalse();
    }

    @Test
    void deleteWorkspace_existingRow_returnsTrue() {
        when(workspaceRepo.deleteRowById("ws1")).thenReturn(1);

        assertThat(store.deleteWorkspace("ws1")).isTrue();
    }

    @Test
    void deleteDocumentsAndNotes_returnRowCounts() {
        when(documentRepo.deleteAllByWorkspaceId("ws1")).thenReturn(3);
        when(noteRepo.deleteAllByWorkspaceId("ws1")).thenReturn(0);

        assertThat(store.deleteDocuments("ws1")).isEqualTo(3);
        assertThat(store.deleteNotes("ws1")).isZero();
    }

    @Test
    void insertDocuments_emptyList_skipsRepository() {
        store.insertDocuments(List.of());
        store.insertNotes(List.of());

        verify(documentRepo, never()).saveAll(any());
        verify(noteRepo, never()).saveAll(any());
    }

    @Test
    void insertDocuments_keepsCallerAssignedIds() {
        store.insertDocuments(List.of(new Document("d1", "ws1", "a.pdf")));

        verify(documentRepo).saveAll(savedDocuments.capture());
        Document saved = savedDocuments.getValue().get(0);
        assertThat(saved.getId()).isEqualTo("d1");
        assertThat(saved.isNew()).isTrue();   // persisted with its own id, never merged
    }

    @Test
    void insertFolder_delegatesToRepository() {
        Folder folder = new Folder("f1", "Root", null);

        store.insertFolder(folder);

        verify(folderRepo).save(folder);
    }

    @Test
    void inTransaction_runsWorkThroughTemplate() {
        when(tx.execute(any())).thenAnswer(inv -> {
            TransactionCallback<?> callback = inv.getArgument(0);
            return callback.doInTransaction(null);
        });

        String result = store.inTransaction(() -> "done");

        assertThat(result).isEqualTo("done");
        verify(tx).execute(any());
    }
}
