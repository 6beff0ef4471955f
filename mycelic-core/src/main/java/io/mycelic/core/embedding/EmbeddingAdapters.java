package io.mycelic.core.embedding;

import io.mycelic.core.config.model.EmbeddingConfig;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EmbeddingAdapters {
    private static final Logger LOG = LoggerFactory.getLogger(EmbeddingAdapters.class);

    private EmbeddingAdapters() {
    }

    public static EmbeddingAdapter fromConfig(EmbeddingConfig config) {
        String provider = config == null || config.provider() == null ? "none" : config.provider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "ollama" -> new OllamaEmbeddingAdapter(
                config.baseUrl(),
                config.model(),
                Duration.ofSeconds(Math.max(1, config.timeoutSeconds()))
            );
            case "hashing" -> new HashingEmbeddingAdapter(config.dimensions() > 0 ? config.dimensions() : 256);
            case "none", "" -> new UnavailableEmbeddingAdapter();
            default -> {
                LOG.warn("Unknown embedding provider '{}', semantic features are disabled", provider);
                yield new UnavailableEmbeddingAdapter();
            }
        };
    }
}
