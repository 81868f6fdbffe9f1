package com.libragraph.drive.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.drive.core.dao.OutboxDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jboss.logging.Logger;

import java.time.Clock;

/**
 * Transactional outbox: events are written through the caller's handle, so they
 * commit or roll back together with the state change they describe.
 */
@ApplicationScoped
public class EventOutbox {

    private static final Logger log = Logger.getLogger(EventOutbox.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Inject
    public EventOutbox(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public long append(Handle handle, StorageEvent event) {
        long id = handle.attach(OutboxDao.class)
                .insert(event.eventId(), event.eventType(), serialize(event), clock.instant());
        log.debugf("Outbox %d: %s %s", id, event.eventType(), event.dedupKey());
        return id;
    }

    String serialize(StorageEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.eventId(), e);
        }
    }

    StorageEvent deserialize(String payload) {
        try {
            return objectMapper.readValue(payload, StorageEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed outbox payload: " + payload, e);
        }
    }
}
