package io.mycelic.core.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.error.DependencyUnavailableException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OllamaEmbeddingAdapterTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private OllamaEmbeddingAdapter adapter(Clock clock) {
        return new OllamaEmbeddingAdapter(server.url("/").toString(), "nomic-embed-text",
            new OkHttpClient.Builder().callTimeout(Duration.ofSeconds(5)).build(), clock);
    }

    @Test
    void shouldRequestEmbeddingForPrompt() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"embedding\": [0.25, -0.5, 1.0]}"));

        float[] vector = new OllamaEmbeddingAdapter(server.url("/").toString(), "nomic-embed-text", Duration.ofSeconds(5))
            .embed("deploy notes");

        assertThat(vector).containsExactly(0.25f, -0.5f, 1.0f);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/embeddings");
        assertThat(request.getBody().readUtf8())
            .contains("\"model\":\"nomic-embed-text\"")
            .contains("\"prompt\":\"deploy notes\"");
    }

    @Test
    void shouldCacheAvailabilityCheck() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        server.enqueue(new MockResponse().setBody("{\"models\": []}"));
        server.enqueue(new MockResponse().setResponseCode(500));
        OllamaEmbeddingAdapter adapter = adapter(clock);

        assertThat(adapter.isAvailable()).isTrue();
        assertThat(adapter.isAvailable()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/tags");

        clock.advance(OllamaEmbeddingAdapter.AVAILABILITY_TTL.plusSeconds(1));
        assertThat(adapter.isAvailable()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldMarkUnavailableWhenEmbeddingFails() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("model loading"));
        OllamaEmbeddingAdapter adapter = adapter(clock);
        assertThat(adapter.isAvailable()).isTrue();

        assertThatThrownBy(() -> adapter.embed("anything"))
            .isInstanceOf(DependencyUnavailableException.class)
            .hasMessageContaining("503");
        assertThat(adapter.isAvailable()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldRejectResponseWithoutVector() {
        server.enqueue(new MockResponse().setBody("{\"embedding\": []}"));

        assertThatThrownBy(() -> adapter(Clock.systemUTC()).embed("anything"))
            .isInstanceOf(DependencyUnavailableException.class);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
