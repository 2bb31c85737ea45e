package com.skein.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relational index connection configuration.
 */
@Data
@NoArgsConstructor
public class PostgresConfig {

    private String url;
    private String username;
    private String password;
    private int maximumPoolSize = 10;
    private long connectionTimeoutMs = 10_000;
    /** Classpath SQL script applied at startup; blank to skip. */
    private String schemaResource;
}
