package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cache settings, the {@code [cache]} section of config.toml.
 */
public class CacheConfig {

    /** Backend choice; AUTO inspects the cache directory. */
    public enum Backend {
        AUTO,
        COMPACT,
        PLAIN
    }

    @JsonProperty("dir")
    private String dir = "cache";

    @JsonProperty("source")
    private String source = "catalog";

    @JsonProperty("backend")
    private Backend backend = Backend.AUTO;

    @JsonProperty("workers")
    private int workers = 0;

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    /** Configured build parallelism; 0 means one worker per available processor. */
    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }
}
