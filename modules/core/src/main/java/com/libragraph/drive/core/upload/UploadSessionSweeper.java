package com.libragraph.drive.core.upload;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

@ApplicationScoped
public class UploadSessionSweeper {

    private static final Logger log = Logger.getLogger(UploadSessionSweeper.class);

    static final int SWEEP_LIMIT = 500;

    @Inject
    UploadSessionManager uploads;

    @Scheduled(every = "${drive.upload.sweep-interval:60s}", concurrentExecution = SKIP)
    public void sweep() {
        int expired = uploads.expireStaleSessions(SWEEP_LIMIT);
        int purged = uploads.purgeTombstones(SWEEP_LIMIT);
        if (expired > 0 || purged > 0) {
            log.infof("Upload sweep: %d stale session(s) resolved, %d tombstone(s) purged", expired, purged);
        }
    }
}
