package com.libragraph.drive.core.directory;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

@ApplicationScoped
public class DeletionBatchRecovery {

    private static final Logger log = Logger.getLogger(DeletionBatchRecovery.class);

    @Inject
    FileDirectory directory;

    @Scheduled(every = "${drive.directory.recovery-interval:60s}", concurrentExecution = SKIP)
    public void sweep() {
        int completed = directory.resumePendingDeletions();
        if (completed > 0) {
            log.infof("Completed %d interrupted folder deletion(s)", completed);
        }
    }
}
