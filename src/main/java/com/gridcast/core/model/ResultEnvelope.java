package com.gridcast.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform outcome of every capability invocation.
 * <p>
 * A successful envelope always carries data; a failed envelope always carries a
 * non-blank message and records its {@link ErrorKind} under {@link #ERROR_KIND_KEY}.
 * A failed envelope may still carry a partial payload, e.g. a forecast built from stale data.
 *
 * @param success  whether the capability achieved its purpose
 * @param data     payload, required when {@code success} is true
 * @param message  human-readable outcome description
 * @param metadata additional audit information (fallback attempts, timings, error kind)
 */
public record ResultEnvelope(
    boolean success,
    Object data,
    String message,
    Map<String, Object> metadata
) implements Serializable {

    public static final String ERROR_KIND_KEY = "errorKind";

    public ResultEnvelope {
        if (success && data == null) {
            throw new IllegalArgumentException("A successful result must carry data");
        }
        if (!success && (message == null || message.isBlank())) {
            throw new IllegalArgumentException("A failed result must carry a message");
        }
        message = message == null ? "" : message;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ResultEnvelope ok(Object data, String message) {
        return new ResultEnvelope(true, data, message, Map.of());
    }

    public static ResultEnvelope ok(Object data, String message, Map<String, Object> metadata) {
        return new ResultEnvelope(true, data, message, metadata);
    }

    public static ResultEnvelope failure(ErrorKind kind, String message) {
        return failure(kind, message, null, Map.of());
    }

    public static ResultEnvelope failure(ErrorKind kind, String message, Map<String, Object> metadata) {
        return failure(kind, message, null, metadata);
    }

    /**
     * Failed envelope that still carries a partial payload.
     */
    public static ResultEnvelope failure(ErrorKind kind, String message, Object partialData,
                                         Map<String, Object> metadata) {
        var meta = new LinkedHashMap<String, Object>(metadata == null ? Map.of() : metadata);
        meta.put(ERROR_KIND_KEY, kind.name());
        return new ResultEnvelope(false, partialData, message, meta);
    }

    /**
     * Returns the error kind of a failed envelope, or {@code null} for a successful one.
     * Failures without a recognised kind are reported as {@link ErrorKind#INTERNAL_CAPABILITY_ERROR}.
     */
    public ErrorKind errorKind() {
        if (success) {
            return null;
        }
        Object kind = metadata.get(ERROR_KIND_KEY);
        if (kind instanceof ErrorKind errorKind) {
            return errorKind;
        }
        if (kind != null) {
            try {
                return ErrorKind.valueOf(kind.toString());
            } catch (IllegalArgumentException e) {
                return ErrorKind.INTERNAL_CAPABILITY_ERROR;
            }
        }
        return ErrorKind.INTERNAL_CAPABILITY_ERROR;
    }

    /**
     * Returns this envelope with one more metadata entry.
     */
    public ResultEnvelope withMetadata(String key, Object value) {
        var meta = new LinkedHashMap<>(metadata);
        meta.put(key, value);
        return new ResultEnvelope(success, data, message, meta);
    }
}
