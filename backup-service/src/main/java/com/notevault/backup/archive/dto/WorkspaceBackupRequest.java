package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One workspace to include in a backup, with the notes payload the client
 * holds for it. The payload is opaque and written verbatim to
 * {@code notes.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceBackupRequest(
                                      String id,
        @JsonAlias("notesJsonString") String legacyNotePayload
) {}
