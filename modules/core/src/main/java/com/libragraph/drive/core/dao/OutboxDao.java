package com.libragraph.drive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(OutboxRecord.class)
public interface OutboxDao {

    @SqlUpdate("INSERT INTO event_outbox (event_id, event_type, payload, created_at, attempts) " +
            "VALUES (:eventId, :eventType, :payload, :now, 0)")
    @GetGeneratedKeys("id")
    long insert(@Bind("eventId") UUID eventId,
                @Bind("eventType") String eventType,
                @Bind("payload") String payload,
                @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM event_outbox WHERE published_at IS NULL ORDER BY id LIMIT :limit")
    List<OutboxRecord> findPending(@Bind("limit") int limit);

    @SqlUpdate("UPDATE event_outbox SET published_at = :now, attempts = attempts + 1, last_error = NULL " +
            "WHERE id = :id")
    void markPublished(@Bind("id") long id, @Bind("now") Instant now);

    @SqlUpdate("UPDATE event_outbox SET attempts = attempts + 1, last_error = :error WHERE id = :id")
    void recordFailure(@Bind("id") long id, @Bind("error") String error);

    @SqlQuery("SELECT COUNT(*) FROM event_outbox WHERE published_at IS NULL")
    int countPending();
}
