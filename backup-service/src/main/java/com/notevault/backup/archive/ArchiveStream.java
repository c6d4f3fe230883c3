package com.notevault.backup.archive;

import com.notevault.backup.temp.TempWorkspace;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Read side of a finished backup archive.
 *
 * The archive lives inside the temp directory of the build that produced it.
 * Closing this stream, whether it was read to the end or abandoned halfway,
 * releases that directory.
 */
public class ArchiveStream extends FilterInputStream {

    private final String        fileName;
    private final long          sizeBytes;
    private final TempWorkspace workspace;

    public ArchiveStream(InputStream in, String fileName, long sizeBytes, TempWorkspace workspace) {
        super(in);
        this.fileName  = fileName;
        this.sizeBytes = sizeBytes;
        this.workspace = workspace;
    }

    /** Suggested download name, e.g. {@code notebook_backup_2026-10-17T09-30-00Z.zip}. */
    public String fileName() {
        return fileName;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public String contentType() {
        return ArchiveLayout.CONTENT_TYPE;
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            workspace.release();
        }
    }
}
