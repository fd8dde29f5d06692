package com.nevis.pdfscan.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.backend")
public record BackendProperties(
    @NotNull @DefaultValue("in-memory") BackendType type,
    @Valid @DefaultValue ClickHouse clickhouse
) {

    public record ClickHouse(
        @NotBlank @DefaultValue("localhost") String host,
        @Min(1) @DefaultValue("8123") int port,
        @NotBlank @DefaultValue("default") String username,
        @DefaultValue("") String password,
        @NotBlank @DefaultValue("pdf_scan") String database,
        @Min(1) @DefaultValue("10") int maxPoolSize,
        @Min(0) @DefaultValue("1") int minIdle
    ) {

        public String jdbcUrl() {
            return "jdbc:clickhouse://" + host + ":" + port + "/" + database;
        }
    }
}
