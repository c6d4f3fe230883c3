package com.notevault.backup.restore;

/**
 * States a restore moves through.
 *
 * The restore as a whole goes EXTRACTED → VALIDATING_MANIFEST → (ABORTED |
 * FOLDER_PASS_DONE) → ... → COMPLETED. Each workspace in between walks the
 * per-workspace states DESTROYING through COMMITTING in order; COMMITTING
 * covers the store commit and the release of the previous blob tree.
 */
public enum RestoreStage {
    EXTRACTED,
    VALIDATING_MANIFEST,
    ABORTED,
    FOLDER_PASS_DONE,

    DESTROYING,
    BLOB_REMOVING,
    METADATA_RESTORING,
    BLOB_RESTORING,
    DOCS_RESTORING,
    NOTES_RESTORING,
    PAYLOAD_COLLECTED,
    COMMITTING,

    COMPLETED
}
