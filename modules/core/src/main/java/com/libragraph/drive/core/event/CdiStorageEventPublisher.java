package com.libragraph.drive.core.event;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

/**
 * Fires relayed events as synchronous CDI events. Replaced by any other
 * {@link StorageEventPublisher} bean, e.g. a broker producer.
 */
@DefaultBean
@ApplicationScoped
public class CdiStorageEventPublisher implements StorageEventPublisher {

    @Inject
    Event<StorageEvent> events;

    @Override
    public void publish(StorageEvent event) {
        events.fire(event);
    }
}
