package com.nevis.pdfscan.model;

import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Conjunctive metric filter. A {@code null} component does not constrain the result;
 * time bounds are inclusive.
 */
@Builder
public record MetricQuery(
    String operation,
    UUID documentId,
    OffsetDateTime startTime,
    OffsetDateTime endTime
) {

    public static MetricQuery all() {
        return new MetricQuery(null, null, null, null);
    }

    public boolean matches(Metric metric) {
        return (operation == null || operation.equals(metric.operation()))
            && (documentId == null || documentId.equals(metric.documentId()))
            && (startTime == null || !metric.timestamp().isBefore(startTime))
            && (endTime == null || !metric.timestamp().isAfter(endTime));
    }
}
