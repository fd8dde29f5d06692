package com.nevis.pdfscan.service;

import com.nevis.pdfscan.controller.MetricsResponse;
import com.nevis.pdfscan.model.MetricQuery;

public interface MetricsService {

    /**
     * Lists matching metrics together with the average upload and scan durations over the query's time range.
     */
    MetricsResponse query(MetricQuery query, int limit, int offset);
}
