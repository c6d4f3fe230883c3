package com.notevault.backup.temp;

import com.notevault.backup.config.BackupProperties;
import com.notevault.backup.store.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Background cleanup for state that a killed process could not release.
 *
 * Runs once at startup and then every 10 minutes. Two kinds of leftovers are
 * removed once they are older than {@code stale-temp-age}:
 * <ul>
 *   <li>{@code notevault-*} scratch directories under the temp root;</li>
 *   <li>moved-aside blob trees from restores that never reached commit or rollback.</li>
 * </ul>
 */
@Component
@EnableScheduling
public class TempWorkspaceSweeper {

    private static final Logger log = LoggerFactory.getLogger(TempWorkspaceSweeper.class);

    private final TempWorkspaceManager temps;
    private final BlobStore            blobStore;
    private final Duration             staleAge;

    public TempWorkspaceSweeper(TempWorkspaceManager temps,
                                BlobStore blobStore,
                                BackupProperties properties) {
        this.temps     = temps;
        this.blobStore = blobStore;
        this.staleAge  = properties.staleTempAge();
    }

    @Scheduled(fixedDelay = 600_000)
    public void sweep() {
        Instant cutoff = Instant.now().minus(staleAge);
        int tempDirs  = temps.sweepStale(cutoff);
        int blobTrash = blobStore.sweepTrash(cutoff);
        if (tempDirs + blobTrash > 0) {
            log.info("Sweep removed {} temporary directories and {} stale blob trees", tempDirs, blobTrash);
        }
    }
}
