package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml. Every section falls back to defaults when absent.
 */
public class CatalogConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("cache")
    private CacheConfig cache = new CacheConfig();

    @JsonProperty("server")
    private ServerConfig server = new ServerConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public ServerConfig getServer() {
        return server;
    }
}
