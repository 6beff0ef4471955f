package io.mycelic.mcp.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over HTTP: JSON-RPC 2.0 requests on {@code POST /mcp} ({@code initialize},
 * {@code tools/list}, {@code tools/call}) and a liveness check on {@code GET /healthz}.
 */
public final class McpHttpServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(McpHttpServer.class);
    static final String PROTOCOL_VERSION = "2024-11-05";
    static final int PARSE_ERROR = -32700;
    static final int INVALID_REQUEST = -32600;
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;

    private final Undertow undertow;
    private final ToolRouter router;
    private final ObjectMapper mapper;
    private final String serverVersion;

    public McpHttpServer(String host, int port, ToolRouter router, ObjectMapper mapper, String serverVersion) {
        this.router = router;
        this.mapper = mapper;
        this.serverVersion = serverVersion;
        HttpHandler handler = exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(this::route);
                return;
            }
            route(exchange);
        };
        this.undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(handler)
            .build();
    }

    public void start() {
        undertow.start();
        LOG.info("MCP server listening on port {}", port());
    }

    public void stop() {
        undertow.stop();
    }

    @Override
    public void close() {
        stop();
    }

    public int port() {
        Object address = undertow.getListenerInfo().get(0).getAddress();
        return address instanceof InetSocketAddress socketAddress ? socketAddress.getPort() : -1;
    }

    private void route(HttpServerExchange exchange) throws IOException {
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (exchange.getRequestMethod().equalToString("GET") && exchange.getRequestPath().equals("/healthz")) {
            writeJson(exchange, Map.of("status", "ok"));
            return;
        }

        if (exchange.getRequestMethod().equalToString("POST") && exchange.getRequestPath().equals("/mcp")) {
            exchange.startBlocking();
            byte[] body = exchange.getInputStream().readAllBytes();
            JsonNode request;
            try {
                request = mapper.readTree(body);
            } catch (JsonProcessingException e) {
                writeJson(exchange, error(null, PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
                return;
            }
            ObjectNode response = handle(request);
            if (response == null) {
                exchange.setStatusCode(202);
                exchange.endExchange();
                return;
            }
            writeJson(exchange, response);
            return;
        }

        exchange.setStatusCode(404);
        writeJson(exchange, Map.of("error", "Not found"));
    }

    /**
     * Answers one JSON-RPC message; returns null for notifications, which get no response.
     */
    ObjectNode handle(JsonNode request) {
        if (request == null || !request.isObject() || !"2.0".equals(request.path("jsonrpc").asText())) {
            return error(null, INVALID_REQUEST, "Invalid JSON-RPC 2.0 request");
        }
        JsonNode id = request.get("id");
        String method = request.path("method").asText("");
        if (id == null) {
            LOG.debug("Notification {}", method);
            return null;
        }
        JsonNode params = request.path("params");
        return switch (method) {
            case "initialize" -> result(id, initializeResult());
            case "ping" -> result(id, mapper.createObjectNode());
            case "tools/list" -> result(id, toolsList());
            case "tools/call" -> toolsCall(id, params);
            default -> error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools").put("listChanged", false);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", "mycelic-memory");
        info.put("version", serverVersion);
        return result;
    }

    private ObjectNode toolsList() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        for (ToolDefinition definition : router.listTools()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", definition.name());
            tool.put("description", definition.description());
            tool.set("inputSchema", mapper.valueToTree(definition.inputSchema()));
        }
        return result;
    }

    private ObjectNode toolsCall(JsonNode id, JsonNode params) {
        String name = params.path("name").asText("");
        if (name.isBlank()) {
            return error(id, INVALID_PARAMS, "tools/call needs a tool name");
        }
        ToolCallResponse response = router.callTool(name, params.get("arguments"));

        ObjectNode result = mapper.createObjectNode();
        ObjectNode content = result.putArray("content").addObject();
        content.put("type", "text");
        if (response.ok()) {
            content.put("text", toText(response.data()));
            result.put("isError", false);
        } else {
            Map<String, Object> failure = new LinkedHashMap<>();
            failure.put("kind", response.errorKind());
            failure.put("message", response.message());
            content.put("text", toText(failure));
            result.put("isError", true);
            LOG.debug("Tool {} returned {}: {}", name, response.errorKind(), response.message());
        }
        return result(id, result);
    }

    private String toText(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool result", e);
        }
    }

    private ObjectNode result(JsonNode id, JsonNode result) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id == null ? mapper.nullNode() : id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }

    private void writeJson(HttpServerExchange exchange, Object payload) throws IOException {
        exchange.getResponseSender().send(mapper.writeValueAsString(payload));
    }
}
