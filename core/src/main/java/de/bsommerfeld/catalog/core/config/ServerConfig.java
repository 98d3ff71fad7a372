package de.bsommerfeld.catalog.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RPC server settings, the {@code [server]} section of config.toml.
 */
public class ServerConfig {

    /** Store the server answers queries from. */
    public enum Source {
        CACHE,
        DATABASE
    }

    @JsonProperty("host")
    private String host = "0.0.0.0";

    @JsonProperty("port")
    private int port = 50051;

    @JsonProperty("source")
    private Source source = Source.CACHE;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }
}
