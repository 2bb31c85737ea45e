package com.skein.store.jdbc;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Runs the idempotent schema script ({@code CREATE TABLE IF NOT EXISTS ...}) at startup.
 */
@Slf4j
public class SchemaInitializer {

    private final DataSource dataSource;
    private final String resource;

    public SchemaInitializer(DataSource dataSource, String resource) {
        this.dataSource = dataSource;
        this.resource = resource;
    }

    public void initialize() {
        if (resource == null || resource.isBlank()) {
            log.info("No schema resource configured, skipping schema initialisation");
            return;
        }
        log.info("Applying schema from classpath:{}", resource);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(resource));
        populator.setContinueOnError(false);
        populator.execute(dataSource);
    }
}
