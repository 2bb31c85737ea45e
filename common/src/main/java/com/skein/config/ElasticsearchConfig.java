package com.skein.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Elasticsearch cluster connection configuration.
 */
@Data
@NoArgsConstructor
public class ElasticsearchConfig {

    private List<String> hosts = new ArrayList<>();
    private String index = "records";
    private String username;
    private String password;
    private int connectTimeoutMs = 5000;
    private int socketTimeoutMs = 30000;
}
