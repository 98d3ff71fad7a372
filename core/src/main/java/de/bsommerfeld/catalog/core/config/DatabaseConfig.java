package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relational store settings, the {@code [database]} section of config.toml.
 */
public class DatabaseConfig {

    @JsonProperty("path")
    private String path = "catalog.db";

    @JsonProperty("enable-alpha")
    private boolean enableAlpha = false;

    @JsonProperty("batch-mode")
    private BatchMode batchMode = BatchMode.PERMISSIVE;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public boolean isEnableAlpha() {
        return enableAlpha;
    }

    public void setEnableAlpha(boolean enableAlpha) {
        this.enableAlpha = enableAlpha;
    }

    public BatchMode getBatchMode() {
        return batchMode;
    }

    public void setBatchMode(BatchMode batchMode) {
        this.batchMode = batchMode;
    }
}
