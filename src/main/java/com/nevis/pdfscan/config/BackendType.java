package com.nevis.pdfscan.config;

public enum BackendType {
    IN_MEMORY,
    CLICKHOUSE
}
