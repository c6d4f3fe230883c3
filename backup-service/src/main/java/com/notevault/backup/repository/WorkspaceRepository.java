package com.notevault.backup.repository;

import com.notevault.backup.model.Workspace;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * CRUD operations for the workspaces table.
 */
public interface WorkspaceRepository extends JpaRepository<Workspace, String> {

    /**
     * Bulk delete by id.
     *
     * Returns the number of removed rows instead of throwing when the row is
     * absent, which is what makes the restore destroy step idempotent.
     * Runs as a JPQL bulk statement, so the persistence context is flushed
     * first and cleared afterwards.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Workspace w WHERE w.id = :id")
    int deleteRowById(@Param("id") String id);
}
