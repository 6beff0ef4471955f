package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record McpConfig(
    boolean enabled,
    String host,
    int port
) {

    public static McpConfig defaults() {
        return new McpConfig(true, "127.0.0.1", 8791);
    }
}
