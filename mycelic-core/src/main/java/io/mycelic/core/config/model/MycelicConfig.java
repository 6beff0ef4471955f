package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MycelicConfig(
    DatabaseConfig database,
    EmbeddingConfig embedding,
    SearchConfig search,
    ChunkingConfig chunking,
    RestApiConfig restApi,
    McpConfig mcp,
    @JsonAlias({"rate_limit"}) RateLimitConfig rateLimit,
    SessionConfig session
) {

    public static MycelicConfig defaults() {
        return new MycelicConfig(
            DatabaseConfig.defaults(),
            EmbeddingConfig.defaults(),
            SearchConfig.defaults(),
            ChunkingConfig.defaults(),
            RestApiConfig.defaults(),
            McpConfig.defaults(),
            RateLimitConfig.defaults(),
            SessionConfig.defaults()
        );
    }

    public MycelicConfig withDatabasePath(String path) {
        return new MycelicConfig(new DatabaseConfig(path, database.busyTimeoutMillis()), embedding, search, chunking,
            restApi, mcp, rateLimit, session);
    }

    public MycelicConfig withEmbedding(EmbeddingConfig replacement) {
        return new MycelicConfig(database, replacement, search, chunking, restApi, mcp, rateLimit, session);
    }

    public MycelicConfig withChunking(ChunkingConfig replacement) {
        return new MycelicConfig(database, embedding, search, replacement, restApi, mcp, rateLimit, session);
    }

    public MycelicConfig withRateLimit(RateLimitConfig replacement) {
        return new MycelicConfig(database, embedding, search, chunking, restApi, mcp, replacement, session);
    }
}
