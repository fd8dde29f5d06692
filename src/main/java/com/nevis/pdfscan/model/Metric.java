package com.nevis.pdfscan.model;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record Metric(
    UUID id,
    String operation,
    double durationMs,
    OffsetDateTime timestamp,
    UUID documentId,
    Map<String, Object> metadata
) {

    public static final String UPLOAD = "upload";
    public static final String SCAN = "scan";

    public Metric {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timestamp, "timestamp");
        if (durationMs < 0.0 || Double.isNaN(durationMs)) {
            throw new IllegalArgumentException("durationMs must not be negative: " + durationMs);
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Metric create(String operation, double durationMs, UUID documentId, Map<String, Object> metadata) {
        return new Metric(
            UUID.randomUUID(),
            operation,
            durationMs,
            OffsetDateTime.now(ZoneOffset.UTC),
            documentId,
            metadata
        );
    }
}
