package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RestApiConfig(
    boolean enabled,
    String host,
    int port,
    @JsonAlias({"cors_enabled"}) boolean corsEnabled
) {

    public static RestApiConfig defaults() {
        return new RestApiConfig(true, "127.0.0.1", 3002, true);
    }
}
