package com.nevis.pdfscan.repository;

import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricQuery;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class InMemoryMetricsRepository implements MetricsRepository {

    private static final Comparator<Metric> NEWEST_FIRST =
        Comparator.comparing(Metric::timestamp).reversed();

    private final List<Metric> metrics = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public void save(Metric metric) {
        lock.lock();
        try {
            metrics.add(metric);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Metric> findAll(MetricQuery query, int limit, int offset) {
        List<Metric> matching = matching(query);
        matching.sort(NEWEST_FIRST);
        return Pages.slice(matching, limit, offset);
    }

    @Override
    public double averageDuration(String operation,
                                  Optional<OffsetDateTime> startTime,
                                  Optional<OffsetDateTime> endTime) {
        MetricQuery query = MetricQuery.builder()
            .operation(operation)
            .startTime(startTime.orElse(null))
            .endTime(endTime.orElse(null))
            .build();

        return matching(query).stream()
            .mapToDouble(Metric::durationMs)
            .average()
            .orElse(0.0);
    }

    private List<Metric> matching(MetricQuery query) {
        lock.lock();
        try {
            return new ArrayList<>(metrics.stream().filter(query::matches).toList());
        } finally {
            lock.unlock();
        }
    }
}
