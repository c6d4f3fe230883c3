package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notevault.backup.model.Folder;

import java.time.Instant;

/**
 * One element of {@code folders.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FolderEntry(
        String  id,
        String  name,
        String  parentId,
        Instant createdAt,
        Instant updatedAt
) {
    public static FolderEntry from(Folder f) {
        return new FolderEntry(f.getId(), f.getName(), f.getParentId(), f.getCreatedAt(), f.getUpdatedAt());
    }

    /** Build a new row with this entry's id and the given (possibly repaired) parent. */
    public Folder toFolder(String repairedParentId) {
        Folder folder = new Folder(id, name, repairedParentId);
        if (createdAt != null) folder.setCreatedAt(createdAt);
        if (updatedAt != null) folder.setUpdatedAt(updatedAt);
        return folder;
    }
}
