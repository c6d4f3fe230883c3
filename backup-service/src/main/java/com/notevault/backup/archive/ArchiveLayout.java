package com.notevault.backup.archive;

import com.notevault.backup.store.BlobStore;

import java.util.List;
import java.util.regex.Pattern;

/**
 * File names of the backup archive format.
 * <pre>
 *   manifest.json
 *   folders.json                        (optional)
 *   {workspaceId}/metadata.json
 *   {workspaceId}/documents_meta.json
 *   {workspaceId}/notepad_notes.json    (optional)
 *   {workspaceId}/notes.json
 *   {workspaceId}/documents|notes|vectors/...   (optional blob trees)
 * </pre>
 */
public final class ArchiveLayout {

    public static final String MANIFEST        = "manifest.json";
    public static final String LEGACY_MANIFEST = "backup_manifest.json";
    public static final String FOLDERS         = "folders.json";

    public static final String METADATA       = "metadata.json";
    public static final String DOCUMENTS_META = "documents_meta.json";
    public static final String NOTEPAD_NOTES  = "notepad_notes.json";
    public static final String LEGACY_NOTES   = "notes.json";

    public static final List<String> BLOB_SUBTREES = BlobStore.SUBTREES;

    /** Written to notes.json, and returned on restore, when there is no payload. */
    public static final String EMPTY_NOTES_PAYLOAD = "{\"notes\":[]}";

    public static final String CONTENT_TYPE = "application/zip";

    // Workspace ids become directory names, so keep them to a safe alphabet.
    private static final Pattern WORKSPACE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private ArchiveLayout() {}

    public static boolean isValidWorkspaceId(String id) {
        return id != null && WORKSPACE_ID.matcher(id).matches();
    }
}
