package com.nevis.pdfscan.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

import javax.sql.DataSource;

/**
 * Connection pool for the ClickHouse backend. Only active when {@code app.backend.type=clickhouse}.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.backend", name = "type", havingValue = "clickhouse")
public class ClickHouseConfig {

    static final String DRIVER_CLASS = "com.clickhouse.jdbc.ClickHouseDriver";

    @Bean(destroyMethod = "close")
    public HikariDataSource clickHouseDataSource(BackendProperties properties) {
        BackendProperties.ClickHouse clickhouse = properties.clickhouse();

        HikariConfig config = new HikariConfig();
        config.setPoolName("clickhouse");
        config.setDriverClassName(DRIVER_CLASS);
        config.setJdbcUrl(clickhouse.jdbcUrl());
        config.setUsername(clickhouse.username());
        config.setPassword(clickhouse.password());
        config.setMaximumPoolSize(clickhouse.maxPoolSize());
        config.setMinimumIdle(clickhouse.minIdle());
        return new HikariDataSource(config);
    }

    @Bean
    public JdbcClient clickHouseJdbcClient(DataSource clickHouseDataSource) {
        return JdbcClient.create(clickHouseDataSource);
    }
}
