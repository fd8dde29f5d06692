package com.nevis.pdfscan.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.exception.StorageException;
import com.nevis.pdfscan.model.Metric;
import com.nevis.pdfscan.model.MetricQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Metrics are append-only rows; metadata is stored as JSON text.
 */
@RequiredArgsConstructor
public class ClickHouseMetricsRepository implements MetricsRepository {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcClient jdbcClient;
    private final ObjectMapper objectMapper;

    private final RowMapper<Metric> metricRowMapper = (rs, rowNum) -> {
        String documentId = rs.getString("document_id");
        return new Metric(
            UUID.fromString(rs.getString("id")),
            rs.getString("operation"),
            rs.getDouble("duration_ms"),
            ClickHouseTime.fromMicros(rs.getLong("timestamp_us")),
            documentId == null ? null : UUID.fromString(documentId),
            readMetadata(rs.getString("metadata"))
        );
    };

    @Override
    public void save(Metric metric) {
        jdbcClient.sql("""
                INSERT INTO metrics (id, operation, duration_ms, timestamp, document_id, metadata)
                VALUES (toUUID(:id), :operation, :durationMs, fromUnixTimestamp64Micro(:timestamp, 'UTC'),
                        toUUIDOrNull(:documentId), :metadata)
                """)
            .param("id", metric.id().toString())
            .param("operation", metric.operation())
            .param("durationMs", metric.durationMs())
            .param("timestamp", ClickHouseTime.toMicros(metric.timestamp()))
            .param("documentId", metric.documentId() == null ? "" : metric.documentId().toString())
            .param("metadata", writeMetadata(metric.metadata()))
            .update();
    }

    @Override
    public List<Metric> findAll(MetricQuery query, int limit, int offset) {
        Map<String, Object> params = new HashMap<>();
        String where = whereClause(query, params);
        params.put("limit", limit);
        params.put("offset", offset);

        return jdbcClient.sql("""
                SELECT id, operation, duration_ms, toUnixTimestamp64Micro(timestamp) AS timestamp_us,
                       document_id, metadata
                FROM metrics
                WHERE %s
                ORDER BY timestamp DESC, id
                LIMIT :limit OFFSET :offset
                """.formatted(where))
            .params(params)
            .query(metricRowMapper)
            .list();
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

        Map<String, Object> params = new HashMap<>();
        String where = whereClause(query, params);

        // avg() over an empty set is NaN, count() guards it
        return jdbcClient.sql("""
                SELECT if(count() = 0, 0.0, avg(duration_ms)) AS avg_duration
                FROM metrics
                WHERE %s
                """.formatted(where))
            .params(params)
            .query(Double.class)
            .single();
    }

    private String whereClause(MetricQuery query, Map<String, Object> params) {
        List<String> clauses = new ArrayList<>();

        if (query.operation() != null) {
            clauses.add("operation = :operation");
            params.put("operation", query.operation());
        }
        if (query.documentId() != null) {
            clauses.add("document_id = toUUID(:documentId)");
            params.put("documentId", query.documentId().toString());
        }
        if (query.startTime() != null) {
            clauses.add("timestamp >= fromUnixTimestamp64Micro(:startTime, 'UTC')");
            params.put("startTime", ClickHouseTime.toMicros(query.startTime()));
        }
        if (query.endTime() != null) {
            clauses.add("timestamp <= fromUnixTimestamp64Micro(:endTime, 'UTC')");
            params.put("endTime", ClickHouseTime.toMicros(query.endTime()));
        }

        return clauses.isEmpty() ? "1 = 1" : String.join(" AND ", clauses);
    }

    private String writeMetadata(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to serialize metric metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to read metric metadata", e);
        }
    }
}
