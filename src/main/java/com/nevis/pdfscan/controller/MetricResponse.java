package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.pdfscan.model.Metric;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record MetricResponse(
    UUID id,

    String operation,

    @JsonProperty("duration_ms")
    double durationMs,

    OffsetDateTime timestamp,

    @JsonProperty("document_id")
    UUID documentId,

    Map<String, Object> metadata
) {

    public static MetricResponse from(Metric metric) {
        return new MetricResponse(
            metric.id(),
            metric.operation(),
            metric.durationMs(),
            metric.timestamp(),
            metric.documentId(),
            metric.metadata()
        );
    }
}
