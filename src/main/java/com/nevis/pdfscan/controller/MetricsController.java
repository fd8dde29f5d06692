package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.MetricQuery;
import com.nevis.pdfscan.service.MetricsService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.UUID;

@RestController
@RequestMapping("/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsService metricsService;

    @GetMapping
    public ResponseEntity<MetricsResponse> getMetrics(
        @RequestParam(required = false) String operation,
        @RequestParam(name = "document_id", required = false) UUID documentId,
        @RequestParam(name = "start_time", required = false)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime startTime,
        @RequestParam(name = "end_time", required = false)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime endTime,
        @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
        @RequestParam(defaultValue = "0") @Min(0) int offset) {

        MetricQuery query = MetricQuery.builder()
            .operation(operation)
            .documentId(documentId)
            .startTime(startTime)
            .endTime(endTime)
            .build();

        return ResponseEntity.ok(metricsService.query(query, limit, offset));
    }
}
