package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notevault.backup.model.Note;

import java.time.Instant;

/**
 * One element of {@code {workspaceId}/notepad_notes.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NoteEntry(
                                 String  id,
        @JsonAlias("notebookId") String  workspaceId,
                                 String  title,
                                 String  content,
                                 Instant createdAt,
                                 Instant updatedAt
) {
    public static NoteEntry from(Note n) {
        return new NoteEntry(n.getId(), n.getWorkspaceId(), n.getTitle(), n.getContent(),
                n.getCreatedAt(), n.getUpdatedAt());
    }

    public Note toNote(String ownerId) {
        Note note = new Note(id, ownerId, title, content);
        if (createdAt != null) note.setCreatedAt(createdAt);
        if (updatedAt != null) note.setUpdatedAt(updatedAt);
        return note;
    }
}
