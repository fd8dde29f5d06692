package com.nevis.pdfscan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.repository.ClickHouseDocumentRepository;
import com.nevis.pdfscan.repository.ClickHouseFindingRepository;
import com.nevis.pdfscan.repository.ClickHouseMetricsRepository;
import com.nevis.pdfscan.repository.ClickHouseSchema;
import com.nevis.pdfscan.repository.InMemoryDocumentRepository;
import com.nevis.pdfscan.repository.InMemoryFindingRepository;
import com.nevis.pdfscan.repository.InMemoryMetricsRepository;
import com.nevis.pdfscan.scanner.PdfScanner;
import org.springframework.jdbc.core.simple.JdbcClient;

public final class BackendFactory {

    private BackendFactory() {
    }

    public static Backends inMemory(PdfScanner scanner) {
        return new Backends(
            new InMemoryDocumentRepository(),
            new InMemoryFindingRepository(),
            new InMemoryMetricsRepository(),
            scanner
        );
    }

    /**
     * Creates the ClickHouse tables if needed and binds repositories to the given client.
     */
    public static Backends clickHouse(JdbcClient jdbcClient, ObjectMapper objectMapper, PdfScanner scanner) {
        new ClickHouseSchema(jdbcClient).ensureSchema();

        return new Backends(
            new ClickHouseDocumentRepository(jdbcClient),
            new ClickHouseFindingRepository(jdbcClient),
            new ClickHouseMetricsRepository(jdbcClient, objectMapper),
            scanner
        );
    }
}
