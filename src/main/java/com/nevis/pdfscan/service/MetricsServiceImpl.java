package com.nevis.pdfscan.service;

import com.nevis.pdfscan.config.Backends;
import com.nevis.pdfscan.controller.MetricResponse;
import com.nevis.pdfscan.controller.MetricsResponse;
import com.nevis.pdfscan.controller.PaginationResponse;
import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class MetricsServiceImpl implements MetricsService {

    private static final List<String> AVERAGED_OPERATIONS = List.of(Metric.UPLOAD, Metric.SCAN);

    private final Backends backends;

    @Override
    public MetricsResponse query(MetricQuery query, int limit, int offset) {
        List<MetricResponse> metrics = backends.metrics().findAll(query, limit, offset).stream()
            .map(MetricResponse::from)
            .toList();

        Map<String, Double> averages = new LinkedHashMap<>();
        for (String operation : AVERAGED_OPERATIONS) {
            averages.put(operation, backends.metrics().averageDuration(
                operation,
                Optional.ofNullable(query.startTime()),
                Optional.ofNullable(query.endTime())
            ));
        }

        return new MetricsResponse(metrics, averages, new PaginationResponse(limit, offset, null, metrics.size()));
    }
}
