package com.notevault.backup.archive.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

/**
 * Top-level archive descriptor, stored as {@code manifest.json}.
 *
 * Unknown fields are ignored so newer minor versions stay readable. The
 * aliases accept {@code backup_manifest.json} written by the original
 * notebook exporter ({@code backupVersion}, {@code notebooks}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupManifest(
        @JsonAlias("backupVersion") String       formatVersion,
                                    Instant      createdAt,
        @JsonAlias("notebooks")     List<String> workspaceIds
) {
    public static final String CURRENT_FORMAT_VERSION = "2.0";

    /** Highest major version this build can read. */
    public static final int MAX_SUPPORTED_MAJOR = 2;

    public static BackupManifest current(List<String> workspaceIds) {
        return new BackupManifest(CURRENT_FORMAT_VERSION, Instant.now(), List.copyOf(workspaceIds));
    }

    /** Major component of {@code formatVersion}, e.g. 2 for "2.0"; -1 if unparsable. */
    public int majorVersion() {
        if (formatVersion == null || formatVersion.isBlank()) return -1;
        String major = formatVersion.strip().split("\\.", 2)[0];
        try {
            return Integer.parseInt(major);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
