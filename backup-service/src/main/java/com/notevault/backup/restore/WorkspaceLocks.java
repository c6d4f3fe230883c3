package com.notevault.backup.restore;

import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.service.BackupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-workspace mutexes that keep two restores off the same workspace.
 *
 * A restore locks its workspace ids in sorted order for its whole run, and
 * takes the folder pass key only while it creates folders. Ids are always
 * locked before the folder key and the folder key is released before any
 * other lock is taken, so two restores can never deadlock. Restores of
 * disjoint workspaces run side by side. Waiting is bounded by
 * {@code lock-timeout}; running out of time is a CONFLICT error.
 *
 * Entries are reference counted and removed once no lease holds or waits
 * for them.
 *
 * Backups never lock: they only read the store.
 */
@Component
public class WorkspaceLocks {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLocks.class);

    // '#' cannot occur in a workspace id, so this key never collides with one.
    static final String FOLDER_PASS_KEY = "#folders";

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public WorkspaceLocks(BackupProperties properties) {
        this.timeout = properties.lockTimeout();
    }

    /**
     * Take one lock per workspace id.
     *
     * @throws BackupException CONFLICT if any lock is not obtained in time
     */
    public Lease acquire(Collection<String> workspaceIds) {
        return lockAll(new ArrayList<>(new TreeSet<>(workspaceIds)));
    }

    /**
     * Take the lock that serializes folder creation.
     *
     * @throws BackupException CONFLICT if it is not obtained in time
     */
    public Lease acquireFolderPass() {
        return lockAll(List.of(FOLDER_PASS_KEY));
    }

    /** True if some thread holds the lock of {@code workspaceId}. */
    public boolean isLocked(String workspaceId) {
        Entry entry = locks.get(workspaceId);
        return entry != null && entry.lock.isLocked();
    }

    /** Number of keys currently held or waited for. */
    int trackedKeys() {
        return locks.size();
    }

    private Lease lockAll(List<String> keys) {
        List<String> held = new ArrayList<>();
        try {
            for (String key : keys) {
                ReentrantLock lock = retain(key);
                if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    forget(key);
                    throw new BackupException(BackupException.Kind.CONFLICT,
                            "Another restore is in progress for " + describe(key) + "; try again later");
                }
                held.add(key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forget(keys.get(held.size()));
            unlock(held);
            throw new BackupException(BackupException.Kind.CONFLICT, "Interrupted while waiting for workspace locks", e);
        } catch (RuntimeException e) {
            unlock(held);
            throw e;
        }
        log.debug("Acquired restore locks {}", keys);
        return new Lease(held);
    }

    private ReentrantLock retain(String key) {
        return locks.compute(key, (k, entry) -> {
            Entry e = entry == null ? new Entry() : entry;
            e.users++;
            return e;
        }).lock;
    }

    private void forget(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    private void unlock(List<String> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            String key = held.get(i);
            locks.get(key).lock.unlock();
            forget(key);
        }
    }

    private static String describe(String key) {
        return FOLDER_PASS_KEY.equals(key) ? "the folder tree" : "workspace " + key;
    }

    // users is only read and written inside compute calls on its key.
    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    /** Releases every lock of one acquire call; closing twice is a no-op. */
    public final class Lease implements AutoCloseable {

        private final List<String> held;
        private boolean released;

        private Lease(List<String> held) {
            this.held = held;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            unlock(held);
        }
    }
}
