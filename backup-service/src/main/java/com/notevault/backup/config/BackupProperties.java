package com.notevault.backup.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed settings for the backup engine, bound from {@code notevault.backup.*}.
 *
 * Every field is defaulted here, at construction time, so the rest of the
 * engine never has to merge or null-check configuration.
 *
 * @param blobRoot             root directory; each workspace owns {@code <blobRoot>/<id>/}
 * @param tempRoot             parent of all temporary directories (defaults to java.io.tmpdir)
 * @param compressionLevel     deflate level 0-9 used when writing archives
 * @param failurePolicy        behaviour when one workspace fails during restore
 * @param maxArchiveEntries    extraction guard: maximum number of zip entries
 * @param maxUncompressedBytes extraction guard: maximum bytes written while extracting
 * @param staleTempAge         age after which an orphaned temp directory is swept
 * @param lockTimeout          how long a restore waits for the workspace locks
 */
@ConfigurationProperties(prefix = "notevault.backup")
public record BackupProperties(
        @DefaultValue("uploads")      Path                 blobRoot,
                                      Path                 tempRoot,
        @DefaultValue("9")            int                  compressionLevel,
        @DefaultValue("ABORT_ALL")    RestoreFailurePolicy failurePolicy,
        @DefaultValue("1000000")      long                 maxArchiveEntries,
        @DefaultValue("21474836480")  long                 maxUncompressedBytes,
        @DefaultValue("6h")           Duration             staleTempAge,
        @DefaultValue("30s")          Duration             lockTimeout) {

    public BackupProperties {
        if (blobRoot == null)      blobRoot = Path.of("uploads");
        if (tempRoot == null)      tempRoot = Path.of(System.getProperty("java.io.tmpdir"));
        if (failurePolicy == null) failurePolicy = RestoreFailurePolicy.ABORT_ALL;
        if (staleTempAge == null)  staleTempAge = Duration.ofHours(6);
        if (lockTimeout == null)   lockTimeout = Duration.ofSeconds(30);
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException(
                    "notevault.backup.compression-level must be 0-9, got " + compressionLevel);
        }
        if (maxArchiveEntries <= 0)    maxArchiveEntries = 1_000_000L;
        if (maxUncompressedBytes <= 0) maxUncompressedBytes = 20L * 1024 * 1024 * 1024;
    }

    /** Defaults for everything except the two directories. */
    public static BackupProperties of(Path blobRoot, Path tempRoot) {
        return new BackupProperties(blobRoot, tempRoot, 9, RestoreFailurePolicy.ABORT_ALL,
                1_000_000L, 20L * 1024 * 1024 * 1024, Duration.ofHours(6), Duration.ofSeconds(30));
    }

    public BackupProperties withFailurePolicy(RestoreFailurePolicy policy) {
        return new BackupProperties(blobRoot, tempRoot, compressionLevel, policy,
                maxArchiveEntries, maxUncompressedBytes, staleTempAge, lockTimeout);
    }

    public BackupProperties withExtractionLimits(long maxEntries, long maxBytes) {
        return new BackupProperties(blobRoot, tempRoot, compressionLevel, failurePolicy,
                maxEntries, maxBytes, staleTempAge, lockTimeout);
    }
}
