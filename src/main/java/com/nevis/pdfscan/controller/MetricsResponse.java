package com.nevis.pdfscan.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record MetricsResponse(
    List<MetricResponse> metrics,

    @JsonProperty("average_duration_ms")
    Map<String, Double> averageDurationMs,

    PaginationResponse pagination
) {}
