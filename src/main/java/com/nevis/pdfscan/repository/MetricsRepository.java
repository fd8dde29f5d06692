package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricQuery;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for operational metrics.
 */
public interface MetricsRepository {

    void save(Metric metric);

    /**
     * Returns the metrics matching every non-null component of the query, most recent first.
     */
    List<Metric> findAll(MetricQuery query, int limit, int offset);

    /**
     * Mean duration of the operation within the optional time range, or {@code 0.0} when nothing matches.
     */
    double averageDuration(String operation, Optional<OffsetDateTime> startTime, Optional<OffsetDateTime> endTime);
}
