package com.libragraph.drive.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure raised by engine operations. Carries an {@link ErrorKind} and a detail map
 * with enough context for the caller to decide whether to retry.
 */
public class DriveException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public DriveException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public DriveException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public static DriveException notFound(String entity, Object id) {
        return new DriveException(ErrorKind.NOT_FOUND, entity + " not found: " + id,
                Map.of("entity", entity, "id", String.valueOf(id)), null);
    }

    public static DriveException conflict(String message) {
        return new DriveException(ErrorKind.CONFLICT, message);
    }

    public static DriveException conflict(String message, Throwable cause) {
        return new DriveException(ErrorKind.CONFLICT, message, Map.of(), cause);
    }

    public static DriveException invalidState(String message) {
        return new DriveException(ErrorKind.INVALID_STATE, message);
    }

    public static DriveException invalidState(String message, Map<String, Object> details) {
        return new DriveException(ErrorKind.INVALID_STATE, message, details, null);
    }

    public static DriveException quotaExceeded(Object ownerId, long used, long reserved,
                                               long limit, long requested) {
        long available = Math.max(0, limit - used - reserved);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("ownerId", String.valueOf(ownerId));
        details.put("used", used);
        details.put("reserved", reserved);
        details.put("limit", limit);
        details.put("requested", requested);
        details.put("available", available);
        return new DriveException(ErrorKind.QUOTA_EXCEEDED,
                "Quota exceeded for " + ownerId + ": requested " + requested
                        + " bytes, " + available + " of " + limit + " available",
                details, null);
    }

    public static DriveException hashMismatch(String expectedHash, String actualHash) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedHash", expectedHash);
        details.put("actualHash", actualHash);
        return new DriveException(ErrorKind.INTEGRITY_FAILURE,
                "Content hash mismatch: expected " + expectedHash + ", got " + actualHash,
                details, null);
    }

    public static DriveException sizeMismatch(long expectedSize, long actualSize) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedSize", expectedSize);
        details.put("actualSize", actualSize);
        return new DriveException(ErrorKind.INTEGRITY_FAILURE,
                "Size mismatch: expected " + expectedSize + " bytes, got " + actualSize,
                details, null);
    }

    public static DriveException backendUnavailable(String message, Throwable cause) {
        return new DriveException(ErrorKind.BACKEND_UNAVAILABLE, message, Map.of(), cause);
    }
}
