package com.notevault.backup.repository;

import com.notevault.backup.model.Note;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CRUD operations for the notes table.
 */
public interface NoteRepository extends JpaRepository<Note, String> {

    List<Note> findByWorkspaceIdOrderByCreatedAtAsc(String workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Note n WHERE n.workspaceId = :workspaceId")
    int deleteAllByWorkspaceId(@Param("workspaceId") String workspaceId);
}
