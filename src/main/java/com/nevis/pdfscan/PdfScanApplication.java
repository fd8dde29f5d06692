package com.nevis.pdfscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// the ClickHouse pool is created by ClickHouseConfig only when that backend is selected
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class PdfScanApplication {

	public static void main(String[] args) {
		SpringApplication.run(PdfScanApplication.class, args);
	}
}
