package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Content longer than {@code minChunkSize} characters is also stored as overlapping child chunks
 * of at most {@code maxChunkSize} characters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkingConfig(
    boolean enabled,
    @JsonAlias({"min_chunk_size"}) int minChunkSize,
    @JsonAlias({"max_chunk_size"}) int maxChunkSize,
    @JsonAlias({"overlap_size"}) int overlapSize
) {

    public static ChunkingConfig defaults() {
        return new ChunkingConfig(true, 1500, 1000, 100);
    }

    public static ChunkingConfig disabled() {
        return new ChunkingConfig(false, 1500, 1000, 100);
    }
}
