package com.notevault.backup.temp;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A uniquely-named scratch directory owned by one backup or restore call.
 *
 * Always use it in try-with-resources (or release it in a catch block before
 * rethrowing): {@link #close()} removes the whole tree. Releasing twice is a
 * no-op, and a failed removal is logged rather than thrown.
 */
public final class TempWorkspace implements AutoCloseable {

    private final Path                 path;
    private final TempWorkspaceManager owner;
    private final AtomicBoolean        released = new AtomicBoolean();

    TempWorkspace(Path path, TempWorkspaceManager owner) {
        this.path  = path;
        this.owner = owner;
    }

    public Path path() {
        return path;
    }

    public Path resolve(String other) {
        return path.resolve(other);
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Remove the directory tree. Never throws. */
    public void release() {
        if (released.compareAndSet(false, true)) {
            owner.delete(this);
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
