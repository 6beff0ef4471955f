package io.mycelic.mcp.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.embedding.HashingEmbeddingAdapter;
import io.mycelic.core.json.Json;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class McpHttpServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private MemoryEngine engine;
    private McpHttpServer server;

    @BeforeEach
    void setUp() {
        engine = MemoryEngine.open(tempDir.resolve("memory.db"), new HashingEmbeddingAdapter(64));
        server = new McpHttpServer("127.0.0.1", 0, McpServerApplication.router(engine), Json.wireMapper(), "test");
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        engine.close();
    }

    private JsonNode rpc(String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/mcp"))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(200);
        return mapper.readTree(response.body());
    }

    private JsonNode call(int id, String tool, String arguments) throws Exception {
        return rpc("{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"tools/call\",\"params\":{\"name\":\""
            + tool + "\",\"arguments\":" + arguments + "}}");
    }

    private JsonNode payload(JsonNode response) throws Exception {
        return mapper.readTree(response.path("result").path("content").get(0).path("text").asText());
    }

    @Test
    void shouldAnswerHealthCheck() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + "/healthz")).GET().build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("ok");
    }

    @Test
    void shouldInitializeAndListTools() throws Exception {
        JsonNode init = rpc("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}");
        assertThat(init.path("id").asInt()).isEqualTo(1);
        assertThat(init.path("result").path("protocolVersion").asText()).isEqualTo(McpHttpServer.PROTOCOL_VERSION);
        assertThat(init.path("result").path("serverInfo").path("name").asText()).isEqualTo("mycelic-memory");

        JsonNode list = rpc("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}");
        List<String> names = new ArrayList<>();
        list.path("result").path("tools").forEach(tool -> names.add(tool.path("name").asText()));
        assertThat(names).containsExactly(
            "categories", "delete_memory", "domains", "get_memory_by_id", "relationships",
            "search", "sessions", "stats", "store_memory", "update_memory");
        assertThat(list.path("result").path("tools").get(0).path("inputSchema").path("type").asText()).isEqualTo("object");
    }

    @Test
    void shouldStoreAndSearchThroughTools() throws Exception {
        JsonNode stored = call(1, "store_memory", "{\"content\":\"kubernetes rollout plan\",\"session_id\":\"s-1\",\"tags\":[\"ops\"]}");
        assertThat(stored.path("result").path("isError").asBoolean()).isFalse();
        String id = payload(stored).path("id").asText();

        JsonNode found = call(2, "get_memory_by_id", "{\"id\":\"" + id + "\"}");
        assertThat(payload(found).path("content").asText()).isEqualTo("kubernetes rollout plan");

        JsonNode results = call(3, "search", "{\"query\":\"kubernetes\",\"mode\":\"hybrid\"}");
        assertThat(payload(results)).hasSize(1);
        assertThat(payload(results).get(0).path("memory").path("id").asText()).isEqualTo(id);
    }

    @Test
    void shouldReportEngineErrorsAsToolErrors() throws Exception {
        JsonNode missing = call(1, "get_memory_by_id", "{\"id\":\"nope\"}");

        assertThat(missing.path("result").path("isError").asBoolean()).isTrue();
        assertThat(payload(missing).path("kind").asText()).isEqualTo("not_found");

        JsonNode invalid = call(2, "store_memory", "{\"content\":\"x\",\"importance\":99}");
        assertThat(payload(invalid).path("kind").asText()).isEqualTo("validation");

        JsonNode badAction = call(3, "relationships", "{\"action\":\"teleport\"}");
        assertThat(badAction.path("result").path("isError").asBoolean()).isTrue();
    }

    @Test
    void shouldRejectUnknownMethodsAndMalformedJson() throws Exception {
        JsonNode unknown = rpc("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"resources/list\"}");
        assertThat(unknown.path("error").path("code").asInt()).isEqualTo(McpHttpServer.METHOD_NOT_FOUND);
        assertThat(unknown.path("id").asInt()).isEqualTo(7);

        JsonNode malformed = rpc("{\"jsonrpc\":");
        assertThat(malformed.path("error").path("code").asInt()).isEqualTo(McpHttpServer.PARSE_ERROR);
    }
}
