package com.skein.store.jdbc;

import com.skein.config.PostgresConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the pooled PostgreSQL data source shared by the relational index, the cursor
 * store and the dead-letter store.
 */
@Slf4j
public final class DataSourceFactory {

    private DataSourceFactory() { /* utility */ }

    public static HikariDataSource create(PostgresConfig config) {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IllegalArgumentException("skein.postgres.url is required");
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("skein-postgres");
        hikari.setJdbcUrl(config.getUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
        log.info("Creating PostgreSQL pool url={} maxPoolSize={}", config.getUrl(), config.getMaximumPoolSize());
        return new HikariDataSource(hikari);
    }
}
