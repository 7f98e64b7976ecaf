package com.dcruver.marginnote;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the MarginNote importer.
 *
 * Reads a .marginpkg package, decodes the notes database inside it and
 * reduces the notes to one record per annotation. Each package brings its
 * own database, so no application-wide DataSource is configured.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
@Slf4j
public class MarginNoteImporterApplication {

    public static void main(String[] args) {
        log.info("Starting MarginNote importer...");
        SpringApplication.run(MarginNoteImporterApplication.class, args);
    }
}
