package com.libragraph.drive.core.storage;

import com.libragraph.drive.util.BlobLocation;

/**
 * Thrown when a read, copy or delete targets an object that does not exist.
 */
public class BlobNotFoundException extends RuntimeException {

    private final BlobLocation location;

    public BlobNotFoundException(BlobLocation location) {
        super("Blob not found: " + location);
        this.location = location;
    }

    public BlobLocation location() {
        return location;
    }
}
