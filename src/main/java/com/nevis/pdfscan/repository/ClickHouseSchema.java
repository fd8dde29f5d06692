package com.nevis.pdfscan.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Creates the tables used by the ClickHouse repositories when they do not exist yet.
 * <p>
 * Documents and findings live in {@code ReplacingMergeTree} tables keyed by id, which turns every
 * insert into an upsert once parts are merged; readers query them with {@code FINAL}.
 */
@Slf4j
@RequiredArgsConstructor
public class ClickHouseSchema {

    private final JdbcClient jdbcClient;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcClient.sql("""
            CREATE TABLE IF NOT EXISTS documents
            (
                id              UUID,
                filename        String,
                upload_time     DateTime64(6, 'UTC'),
                status          LowCardinality(String),
                file_size       UInt64,
                error_message   String DEFAULT '',
                version         UInt64
            )
            ENGINE = ReplacingMergeTree(version)
            PARTITION BY toYYYYMM(upload_time)
            ORDER BY id
            """).update();

        jdbcClient.sql("""
            CREATE TABLE IF NOT EXISTS findings
            (
                id              UUID,
                document_id     UUID,
                finding_type    LowCardinality(String),
                location        String,
                confidence      Float64,
                created_at      DateTime64(6, 'UTC') DEFAULT now64(6)
            )
            ENGINE = ReplacingMergeTree(created_at)
            ORDER BY id
            """).update();

        jdbcClient.sql("""
            CREATE TABLE IF NOT EXISTS metrics
            (
                id              UUID,
                operation       LowCardinality(String),
                duration_ms     Float64,
                timestamp       DateTime64(6, 'UTC'),
                document_id     Nullable(UUID),
                metadata        String
            )
            ENGINE = MergeTree()
            PARTITION BY toYYYYMM(timestamp)
            ORDER BY (operation, timestamp)
            TTL toDateTime(timestamp) + INTERVAL 90 DAY
            """).update();

        log.info("ClickHouse schema ready.");
    }
}
