package com.notevault.backup.service;

/**
 * Thrown when a backup or restore cannot complete.
 *
 * Unchecked so the engine only catches it where it has a recovery strategy;
 * optional resources that are simply missing never raise it (they are
 * reported as skipped step outcomes instead).
 */
public class BackupException extends RuntimeException {

    public enum Kind {
        /** Bad input or corrupt archive; raised before any store mutation. */
        VALIDATION,
        /** Another restore holds one of the workspace locks. */
        CONFLICT,
        /** A store transaction failed while destroying or recreating a workspace. */
        STORE,
        /** Filesystem failure while building, extracting or copying blobs. */
        IO
    }

    private final Kind kind;

    public BackupException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackupException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static BackupException validation(String message) {
        return new BackupException(Kind.VALIDATION, message);
    }

    public static BackupException validation(String message, Throwable cause) {
        return new BackupException(Kind.VALIDATION, message, cause);
    }

    public static BackupException io(String message, Throwable cause) {
        return new BackupException(Kind.IO, message, cause);
    }
}
