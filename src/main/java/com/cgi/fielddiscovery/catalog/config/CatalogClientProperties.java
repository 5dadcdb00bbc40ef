package com.cgi.fielddiscovery.catalog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the catalog/asset service client.
 * Maps to properties with the prefix "fielddiscovery.catalog" in the application properties.
 */
@Component
@ConfigurationProperties(prefix = "fielddiscovery.catalog")
@Getter
@Setter
public class CatalogClientProperties {
    /**
     * Base URL of the catalog service (API gateway).
     */
    private String baseUrl = "http://localhost:8000";

    /**
     * Connect timeout shared by all catalog calls.
     */
    private int connectTimeoutMs = 5000;

    /**
     * Read timeout for the table asset listing.
     */
    private int listTimeoutMs = 10000;

    /**
     * Read timeout for a single table detail (columns) fetch.
     */
    private int detailTimeoutMs = 5000;

    /**
     * Maximum number of table assets requested per discovery run.
     */
    private int assetLimit = 1000;

    /**
     * Optional bearer token sent as the Authorization header.
     */
    private String bearerToken;
}
