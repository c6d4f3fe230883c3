package com.notevault.backup.repository;

import com.notevault.backup.model.Folder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * CRUD operations for the folders table.
 */
public interface FolderRepository extends JpaRepository<Folder, String> {

    /** Every folder, oldest first; backups always carry the whole forest. */
    List<Folder> findAllByOrderByCreatedAtAsc();
}
