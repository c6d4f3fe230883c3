package com.notevault.backup.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notevault.backup.archive.dto.WorkspaceBackupRequest;

import java.util.List;

/**
 * Request body for POST /backup/create.
 *
 * Older clients send {@code {"notebooks":[{"id":..., "notesJsonString":...}]}};
 * both spellings are accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateBackupRequest(
        @JsonAlias("notebooks") List<WorkspaceBackupRequest> workspaces
) {}
