package io.mycelic.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mycelic.core.error.DependencyUnavailableException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeddings from an Ollama server ({@code POST /api/embeddings}). Availability is checked with
 * {@code GET /api/tags} and the answer is cached for {@link #AVAILABILITY_TTL}.
 */
public final class OllamaEmbeddingAdapter implements EmbeddingAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(OllamaEmbeddingAdapter.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final Duration AVAILABILITY_TTL = Duration.ofSeconds(30);

    private final HttpUrl baseUrl;
    private final String model;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final AtomicReference<AvailabilityCheck> lastCheck = new AtomicReference<>();

    public OllamaEmbeddingAdapter(String baseUrl, String model, Duration timeout) {
        this(baseUrl, model, new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(timeout)
            .callTimeout(timeout)
            .build(), Clock.systemUTC());
    }

    OllamaEmbeddingAdapter(String baseUrl, String model, OkHttpClient client, Clock clock) {
        this.baseUrl = HttpUrl.get(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.client = client;
        this.clock = clock;
        this.mapper = new ObjectMapper();
    }

    @Override
    public boolean isAvailable() {
        Instant now = clock.instant();
        AvailabilityCheck cached = lastCheck.get();
        if (cached != null && now.isBefore(cached.checkedAt().plus(AVAILABILITY_TTL))) {
            return cached.available();
        }
        boolean available = checkAvailability();
        lastCheck.set(new AvailabilityCheck(available, now));
        return available;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public float[] embed(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text == null ? "" : text));
            Request request = new Request.Builder()
                .url(baseUrl.newBuilder().addPathSegment("api").addPathSegment("embeddings").build())
                .post(RequestBody.create(payload, JSON))
                .header("Accept", "application/json")
                .build();
            try (Response response = client.newCall(request).execute()) {
                ResponseBody body = response.body();
                String raw = body == null ? "" : body.string();
                if (!response.isSuccessful()) {
                    markUnavailable();
                    throw new DependencyUnavailableException("Embedding request failed: HTTP " + response.code() + " " + raw);
                }
                return parseEmbedding(raw);
            }
        } catch (IOException e) {
            markUnavailable();
            throw new DependencyUnavailableException("Embedding server unreachable at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private float[] parseEmbedding(String raw) throws IOException {
        JsonNode vector = mapper.readTree(raw).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new DependencyUnavailableException("Embedding response did not contain a vector");
        }
        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) vector.get(i).asDouble();
        }
        return out;
    }

    private boolean checkAvailability() {
        Request request = new Request.Builder()
            .url(baseUrl.newBuilder().addPathSegment("api").addPathSegment("tags").build())
            .get()
            .build();
        try (Response response = client.newCall(request).execute()) {
            return response.isSuccessful();
        } catch (IOException e) {
            LOG.debug("Embedding server availability check failed: {}", e.getMessage());
            return false;
        }
    }

    private void markUnavailable() {
        lastCheck.set(new AvailabilityCheck(false, clock.instant()));
    }

    private record AvailabilityCheck(boolean available, Instant checkedAt) {
    }
}
