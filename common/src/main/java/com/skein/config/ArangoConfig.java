package com.skein.config;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Graph store connection configuration.
 */
@Data
@NoArgsConstructor
public class ArangoConfig {

    private String host = "localhost";
    private int port = 8529;
    private String user = "root";
    private String password = "";
    private String database = "skein";
    private int timeoutMs = 10_000;
}
