package com.nevis.pdfscan.repository;

class InMemoryMetricsRepositoryTest extends MetricsRepositoryContract {

    @Override
    protected MetricsRepository createRepository() {
        return new InMemoryMetricsRepository();
    }
}
