package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DatabaseConfig(
    String path,
    @JsonAlias({"busy_timeout_millis"}) int busyTimeoutMillis
) {

    public static DatabaseConfig defaults() {
        return new DatabaseConfig("~/.mycelic/memory.db", 5000);
    }
}
