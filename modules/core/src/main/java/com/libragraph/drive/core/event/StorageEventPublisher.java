package com.libragraph.drive.core.event;

/**
 * Hands relayed events to the messaging collaborator. Throwing leaves the event
 * pending for the next relay pass.
 */
public interface StorageEventPublisher {

    void publish(StorageEvent event);
}
