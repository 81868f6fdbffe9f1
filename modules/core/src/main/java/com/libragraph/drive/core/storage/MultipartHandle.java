package com.libragraph.drive.core.storage;

import com.libragraph.drive.util.BlobLocation;

/**
 * Opaque handle of an in-flight multipart upload and the object it will produce.
 */
public record MultipartHandle(String uploadId, BlobLocation target) {}
