package com.notevault.backup.repository;

import com.notevault.backup.model.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * CRUD operations for the documents table.
 */
public interface DocumentRepository extends JpaRepository<Document, String> {

    List<Document> findByWorkspaceIdOrderByCreatedAtAsc(String workspaceId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Document d WHERE d.workspaceId = :workspaceId")
    int deleteAllByWorkspaceId(@Param("workspaceId") String workspaceId);
}
