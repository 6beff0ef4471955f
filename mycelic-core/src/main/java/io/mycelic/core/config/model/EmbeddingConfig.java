package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code provider} is one of {@code ollama}, {@code hashing} or {@code none}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    @JsonAlias({"base_url"}) String baseUrl,
    String model,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    int dimensions
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("ollama", "http://localhost:11434", "nomic-embed-text", 30, 256);
    }

    public static EmbeddingConfig disabled() {
        return new EmbeddingConfig("none", "", "", 0, 0);
    }
}
