package com.libragraph.drive.core.storage;

/**
 * What the store returned for one uploaded part; passed back, in order, on completion.
 */
public record PartTag(int partNumber, String tag, long size) {}
