package com.gradeledger.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application entry point for the grade ledger.
 * The data source is built only when the JDBC store is selected.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
@EnableScheduling
public class GradeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GradeLedgerApplication.class, args);
    }
}
