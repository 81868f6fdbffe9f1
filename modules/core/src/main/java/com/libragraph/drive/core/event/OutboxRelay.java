package com.libragraph.drive.core.event;

import com.libragraph.drive.core.dao.OutboxDao;
import com.libragraph.drive.core.dao.OutboxRecord;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Drains the outbox in insertion order. A publish failure stops the pass so later
 * events are never delivered ahead of an earlier one.
 */
@ApplicationScoped
public class OutboxRelay {

    private static final Logger log = Logger.getLogger(OutboxRelay.class);

    private final Jdbi jdbi;
    private final EventOutbox outbox;
    private final StorageEventPublisher publisher;
    private final Clock clock;
    private final int batchSize;

    @Inject
    public OutboxRelay(Jdbi jdbi,
                       EventOutbox outbox,
                       StorageEventPublisher publisher,
                       Clock clock,
                       @ConfigProperty(name = "drive.events.relay-batch-size", defaultValue = "100")
                       int batchSize) {
        this.jdbi = jdbi;
        this.outbox = outbox;
        this.publisher = publisher;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Scheduled(every = "${drive.events.relay-interval:5s}", concurrentExecution = SKIP)
    void scheduledRelay() {
        relay();
    }

    /**
     * @return number of events published in this pass
     */
    public int relay() {
        int published = 0;
        while (true) {
            List<OutboxRecord> pending = jdbi.withExtension(OutboxDao.class, dao -> dao.findPending(batchSize));
            if (pending.isEmpty()) {
                return published;
            }
            for (OutboxRecord row : pending) {
                try {
                    publisher.publish(outbox.deserialize(row.payload()));
                } catch (RuntimeException e) {
                    jdbi.useExtension(OutboxDao.class, dao -> dao.recordFailure(row.id(), truncate(e.toString())));
                    log.warnf(e, "Publishing outbox event %d (%s) failed on attempt %d; will retry",
                            row.id(), row.eventType(), row.attempts() + 1);
                    return published;
                }
                jdbi.useExtension(OutboxDao.class, dao -> dao.markPublished(row.id(), clock.instant()));
                published++;
            }
            if (pending.size() < batchSize) {
                return published;
            }
        }
    }

    private static String truncate(String s) {
        return s.length() <= 2000 ? s : s.substring(0, 2000);
    }
}
