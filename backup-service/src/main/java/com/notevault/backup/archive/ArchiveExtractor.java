package com.notevault.backup.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notevault.backup.archive.dto.BackupManifest;
import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.service.BackupException;
import com.notevault.backup.temp.TempWorkspace;
import com.notevault.backup.temp.TempWorkspaceManager;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Unpacks a backup archive into a fresh temp directory and validates it.
 *
 * Nothing here touches the workspace store: a corrupt or hostile archive is
 * rejected with a VALIDATION error and its temp directory removed before
 * the restore proper ever starts.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>the file is a readable zip;</li>
 *   <li>no entry escapes the target directory, and the entry count and total
 *       unpacked size stay within the configured limits;</li>
 *   <li>a manifest exists ({@code manifest.json}, or {@code backup_manifest.json}
 *       from older exports) and parses;</li>
 *   <li>its major format version is supported;</li>
 *   <li>its workspace ids are well-formed and unique, and match the top-level
 *       directories exactly.</li>
 * </ol>
 */
@Component
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    private static final int BUFFER_SIZE = 8192;

    private final TempWorkspaceManager temps;
    private final ObjectMapper         json;
    private final long                 maxEntries;
    private final long                 maxBytes;

    public ArchiveExtractor(TempWorkspaceManager temps,
                            ObjectMapper objectMapper,
                            BackupProperties properties) {
        this.temps      = temps;
        this.json       = objectMapper;
        this.maxEntries = properties.maxArchiveEntries();
        this.maxBytes   = properties.maxUncompressedBytes();
    }

    /**
     * @throws BackupException VALIDATION for a missing, unreadable or
     *                         inconsistent archive; IO when the disk fails
     */
    public ExtractedBackup extract(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw BackupException.validation("Backup archive not found: " + archive);
        }

        TempWorkspace temp = temps.acquire("restore");
        try {
            int entries = unzip(archive, temp.path());
            BackupManifest manifest = readManifest(temp.path());
            verifyContents(temp.path(), manifest);
            log.info("Extracted {} entries from {}; manifest version {} lists {} workspaces",
                    entries, archive.getFileName(), manifest.formatVersion(), manifest.workspaceIds().size());
            return new ExtractedBackup(temp, manifest);

        } catch (IOException e) {
            temp.release();
            throw BackupException.io("Could not extract backup archive: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("Rejected backup archive {}: {}", archive.getFileName(), e.getMessage());
            temp.release();
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Unpacking
    // ------------------------------------------------------------------

    private int unzip(Path archive, Path root) throws IOException {
        int  count   = 0;
        long written = 0;
        try (ZipFile zip = open(archive)) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                if (++count > maxEntries) {
                    throw BackupException.validation("Archive has more than " + maxEntries + " entries");
                }
                Path target = resolveEntry(root, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry);
                     OutputStream out = Files.newOutputStream(target)) {
                    written += copyBounded(in, out, maxBytes - written);
                }
            }
        }
        return count;
    }

    private static ZipFile open(Path archive) {
        try {
            return ZipFile.builder().setPath(archive).get();
        } catch (IOException e) {
            throw BackupException.validation("Not a readable zip archive: " + e.getMessage(), e);
        }
    }

    /** Map an entry name into {@code root}, refusing anything that would land outside it. */
    static Path resolveEntry(Path root, String entryName) {
        String name = entryName.replace('\\', '/');
        Path target = root.resolve(name).normalize();
        if (name.startsWith("/") || !target.startsWith(root) || target.equals(root)) {
            throw BackupException.validation("Illegal entry path in archive: " + entryName);
        }
        return target;
    }

    // Counts actual bytes; the sizes declared in the zip headers can lie.
    private static long copyBounded(InputStream in, OutputStream out, long remaining) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long copied = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            copied += n;
            if (copied > remaining) {
                throw BackupException.validation("Archive expands beyond the allowed uncompressed size");
            }
            out.write(buffer, 0, n);
        }
        return copied;
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private BackupManifest readManifest(Path root) throws IOException {
        Path file = root.resolve(ArchiveLayout.MANIFEST);
        if (!Files.isRegularFile(file)) {
            file = root.resolve(ArchiveLayout.LEGACY_MANIFEST);
        }
        if (!Files.isRegularFile(file)) {
            throw BackupException.validation("Invalid backup file: manifest.json not found");
        }

        BackupManifest manifest;
        try {
            manifest = json.readValue(file.toFile(), BackupManifest.class);
        } catch (JsonProcessingException e) {
            throw BackupException.validation("Invalid backup file: manifest is not valid JSON", e);
        }
        if (manifest == null) {
            throw BackupException.validation("Invalid backup file: manifest is empty");
        }

        int major = manifest.majorVersion();
        if (major < 1 || major > BackupManifest.MAX_SUPPORTED_MAJOR) {
            throw BackupException.validation("Unsupported backup format version: " + manifest.formatVersion());
        }

        List<String> ids = manifest.workspaceIds();
        if (ids == null) {
            throw BackupException.validation("Invalid manifest: missing workspace id list");
        }
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (!ArchiveLayout.isValidWorkspaceId(id)) {
                throw BackupException.validation("Invalid manifest: bad workspace id " + id);
            }
            if (!seen.add(id)) {
                throw BackupException.validation("Invalid manifest: workspace id listed twice: " + id);
            }
        }
        return manifest;
    }

    private static void verifyContents(Path root, BackupManifest manifest) throws IOException {
        Set<String> present;
        try (Stream<Path> children = Files.list(root)) {
            present = children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toCollection(TreeSet::new));
        }
        Set<String> listed = new TreeSet<>(manifest.workspaceIds());
        if (!present.equals(listed)) {
            Set<String> missing = new TreeSet<>(listed);
            missing.removeAll(present);
            Set<String> extra = new TreeSet<>(present);
            extra.removeAll(listed);
            throw BackupException.validation("Archive content does not match manifest: missing "
                    + missing + ", unlisted " + extra);
        }
    }
}
