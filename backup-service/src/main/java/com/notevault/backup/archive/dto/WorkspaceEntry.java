package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notevault.backup.model.Workspace;

import java.time.Instant;

/**
 * Content of {@code {workspaceId}/metadata.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceEntry(
                           String  id,
                           String  title,
                           String  folderId,
        @JsonAlias("notes") String legacyNotes,
                           Instant createdAt,
                           Instant updatedAt
) {
    public static WorkspaceEntry from(Workspace w) {
        return new WorkspaceEntry(w.getId(), w.getTitle(), w.getFolderId(), w.getLegacyNotes(),
                w.getCreatedAt(), w.getUpdatedAt());
    }

    public WorkspaceEntry withFolderId(String newFolderId) {
        return new WorkspaceEntry(id, title, newFolderId, legacyNotes, createdAt, updatedAt);
    }

    public Workspace toWorkspace() {
        Workspace workspace = new Workspace(id, title);
        workspace.setFolderId(folderId);
        workspace.setLegacyNotes(legacyNotes);
        if (createdAt != null) workspace.setCreatedAt(createdAt);
        if (updatedAt != null) workspace.setUpdatedAt(updatedAt);
        return workspace;
    }
}
