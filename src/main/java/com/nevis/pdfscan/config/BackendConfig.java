package com.nevis.pdfscan.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.pdfscan.scanner.PdfScanner;
import com.nevis.pdfscan.scanner.RegexPdfScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    public PdfScanner pdfScanner() {
        return new RegexPdfScanner();
    }

    @Bean
    public Backends backends(
        BackendProperties properties,
        PdfScanner pdfScanner,
        ObjectProvider<JdbcClient> clickHouseJdbcClient,
        ObjectMapper objectMapper
    ) {
        Backends backends = switch (properties.type()) {
            case IN_MEMORY -> BackendFactory.inMemory(pdfScanner);
            case CLICKHOUSE -> BackendFactory.clickHouse(clickHouseJdbcClient.getObject(), objectMapper, pdfScanner);
        };
        log.info("Using {}", backends);
        return backends;
    }
}
