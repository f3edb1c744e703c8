package com.metascan.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Metascan Explorer API Application
 * Read-only query layer over the indexed chain data
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ExplorerApiApplication {

    private static final Logger logger = LoggerFactory.getLogger(ExplorerApiApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Metascan Explorer API...");
        SpringApplication.run(ExplorerApiApplication.class, args);
        logger.info("Metascan Explorer API started successfully!");
    }
}
