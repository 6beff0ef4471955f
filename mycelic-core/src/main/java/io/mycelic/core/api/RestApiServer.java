package io.mycelic.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.category.CategoryQuery;
import io.mycelic.core.error.MemoryEngineException;
import io.mycelic.core.error.RateLimitedException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.json.Json;
import io.mycelic.core.ratelimit.ToolRateLimiter;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON REST front end under {@code /api/v1}. Every handler is a thin call into {@link MemoryEngine};
 * engine errors become an error envelope with the matching HTTP status.
 */
public final class RestApiServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RestApiServer.class);
    private static final String PREFIX = "/api/v1";
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");
    private static final HttpString RETRY_AFTER = new HttpString("Retry-After");

    private final MemoryEngine engine;
    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final boolean corsEnabled;
    private final String defaultSessionId;
    private final ToolRateLimiter rateLimiter;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private Undertow server;
    private int actualPort;

    public RestApiServer(MemoryEngine engine, String host, int port, boolean corsEnabled) {
        this(engine, host, port, corsEnabled, new ToolRateLimiter(engine.config().rateLimit()));
    }

    public RestApiServer(MemoryEngine engine, String host, int port, boolean corsEnabled, ToolRateLimiter rateLimiter) {
        this.engine = engine;
        this.rateLimiter = rateLimiter;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.corsEnabled = corsEnabled;
        this.defaultSessionId = engine.config().session().defaultSessionId();
        this.mapper = Json.wireMapper();
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        RoutingHandler routes = Handlers.routing()
            .get(PREFIX + "/health", blocking(this::health))
            .post(PREFIX + "/memories", blocking(this::createMemory))
            .get(PREFIX + "/memories", blocking(this::listMemories))
            .get(PREFIX + "/memories/{id}", blocking(this::getMemory))
            .put(PREFIX + "/memories/{id}", blocking(this::updateMemory))
            .delete(PREFIX + "/memories/{id}", blocking(this::deleteMemory))
            .get(PREFIX + "/memories/{id}/chunks", blocking(this::memoryChunks))
            .get(PREFIX + "/memories/{id}/related", blocking(this::relatedMemories))
            .get(PREFIX + "/memories/{id}/relationships", blocking(this::memoryRelationships))
            .get(PREFIX + "/memories/{id}/graph", blocking(this::memoryGraph))
            .post(PREFIX + "/memories/{id}/categorize", blocking(this::categorizeMemory))
            .get(PREFIX + "/memories/{id}/categories", blocking(this::memoryCategories))
            .post(PREFIX + "/search", blocking(this::search))
            .post(PREFIX + "/relationships", blocking(this::createRelationship))
            .post(PREFIX + "/relationships/discover", blocking(this::discoverRelationships))
            .post(PREFIX + "/categories", blocking(this::createCategory))
            .get(PREFIX + "/categories", blocking(this::listCategories))
            .delete(PREFIX + "/categories/{id}", blocking(this::deleteCategory))
            .get(PREFIX + "/categories/{id}/memories", blocking(this::categoryMemories))
            .post(PREFIX + "/domains", blocking(this::createDomain))
            .get(PREFIX + "/domains", blocking(this::listDomains))
            .get(PREFIX + "/domains/{name}/stats", blocking(this::domainStats))
            .get(PREFIX + "/sessions", blocking(this::listSessions))
            .get(PREFIX + "/stats", blocking(this::stats))
            .setFallbackHandler(exchange -> send(exchange, 404, ApiResponse.failure("not_found", "No route for "
                + exchange.getRequestMethod() + " " + exchange.getRequestPath())))
            .setInvalidMethodHandler(exchange -> send(exchange, 405, ApiResponse.failure("method_not_allowed",
                "Method " + exchange.getRequestMethod() + " not allowed on " + exchange.getRequestPath())));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("REST API listening on http://{}:{}{}", host, actualPort, PREFIX);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (running.getAndSet(false) && server != null) {
            server.stop();
            LOG.info("REST API stopped");
        }
    }

    private Object health(HttpServerExchange exchange) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", "ok");
        payload.put("memories", engine.memories().count());
        payload.put("embeddings_available", engine.embeddings().isAvailable());
        return payload;
    }

    private Object createMemory(HttpServerExchange exchange) throws IOException {
        exchange.setStatusCode(201);
        return engine.memories().create(RequestReader.memoryDraft(readJsonBody(exchange), defaultSessionId));
    }

    private Object listMemories(HttpServerExchange exchange) {
        return engine.memories().list(RequestReader.memoryQuery(queryParams(exchange)));
    }

    private Object getMemory(HttpServerExchange exchange) {
        return engine.memories().get(pathParam(exchange, "id"));
    }

    private Object updateMemory(HttpServerExchange exchange) throws IOException {
        return engine.memories().update(pathParam(exchange, "id"), RequestReader.memoryUpdate(readJsonBody(exchange)));
    }

    private Object deleteMemory(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        engine.memories().delete(id);
        return Map.of("deleted", id);
    }

    private Object memoryChunks(HttpServerExchange exchange) {
        return engine.memories().chunks(pathParam(exchange, "id"));
    }

    private Object relatedMemories(HttpServerExchange exchange) {
        JsonNode params = queryParams(exchange);
        return engine.relationships().findRelated(
            pathParam(exchange, "id"),
            RequestReader.decimal(params, "min_strength"),
            RequestReader.relationshipTypeOrNull(params, "type", "relationship_type"),
            RequestReader.integer(params, "limit")
        );
    }

    private Object memoryRelationships(HttpServerExchange exchange) {
        return engine.relationships().listForMemory(pathParam(exchange, "id"));
    }

    private Object memoryGraph(HttpServerExchange exchange) {
        return engine.relationships().mapGraph(RequestReader.graphQuery(pathParam(exchange, "id"), queryParams(exchange)));
    }

    private Object categorizeMemory(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        Double confidence = RequestReader.decimal(body, "confidence");
        return engine.categories().categorize(
            pathParam(exchange, "id"),
            RequestReader.requireText(body, "category_id", "categoryId"),
            confidence == null ? 1.0 : confidence,
            RequestReader.text(body, "reasoning")
        );
    }

    private Object memoryCategories(HttpServerExchange exchange) {
        return engine.categories().categoriesOf(pathParam(exchange, "id"));
    }

    private Object search(HttpServerExchange exchange) throws IOException {
        return engine.search().search(RequestReader.searchRequest(readJsonBody(exchange)));
    }

    private Object createRelationship(HttpServerExchange exchange) throws IOException {
        exchange.setStatusCode(201);
        return engine.relationships().create(RequestReader.relationshipDraft(readJsonBody(exchange)));
    }

    private Object discoverRelationships(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        return engine.relationships().discover(
            RequestReader.integer(body, "limit"),
            RequestReader.decimal(body, "min_strength", "minStrength"),
            RequestReader.timeout(body)
        );
    }

    private Object createCategory(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        exchange.setStatusCode(201);
        return engine.categories().create(
            RequestReader.text(body, "name"),
            RequestReader.text(body, "description"),
            RequestReader.text(body, "parent_category_id", "parent_id"),
            RequestReader.decimal(body, "confidence_threshold")
        );
    }

    private Object listCategories(HttpServerExchange exchange) {
        JsonNode params = queryParams(exchange);
        String parent = RequestReader.text(params, "parent_id");
        boolean roots = "true".equalsIgnoreCase(RequestReader.text(params, "roots"));
        return engine.categories().list(new CategoryQuery(parent, roots));
    }

    private Object deleteCategory(HttpServerExchange exchange) {
        String id = pathParam(exchange, "id");
        engine.categories().delete(id);
        return Map.of("deleted", id);
    }

    private Object categoryMemories(HttpServerExchange exchange) {
        return engine.categories().memoriesIn(pathParam(exchange, "id"));
    }

    private Object createDomain(HttpServerExchange exchange) throws IOException {
        JsonNode body = readJsonBody(exchange);
        return engine.domains().create(RequestReader.text(body, "name"), RequestReader.text(body, "description"));
    }

    private Object listDomains(HttpServerExchange exchange) {
        return engine.domains().list();
    }

    private Object domainStats(HttpServerExchange exchange) {
        return engine.domains().stats(pathParam(exchange, "name"));
    }

    private Object listSessions(HttpServerExchange exchange) {
        return engine.sessions().stats();
    }

    private Object stats(HttpServerExchange exchange) {
        return engine.stats().summary();
    }

    private HttpHandler blocking(Route route) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> respond(route, exchange));
                return;
            }
            respond(route, exchange);
        };
    }

    private void respond(Route route, HttpServerExchange exchange) {
        try {
            Object data = route.handle(exchange);
            send(exchange, exchange.getStatusCode(), ApiResponse.ok(data));
        } catch (MemoryEngineException e) {
            LOG.debug("{} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(), e.getMessage());
            sendQuietly(exchange, ErrorStatus.httpStatus(e.kind()), ApiResponse.failure(e.kind(), e.getMessage()));
        } catch (JsonProcessingException e) {
            sendQuietly(exchange, 400, ApiResponse.failure("validation", "Malformed JSON body: " + e.getOriginalMessage()));
        } catch (Exception e) {
            LOG.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendQuietly(exchange, 500, ApiResponse.failure("internal", e.getMessage() == null ? "internal_error" : e.getMessage()));
        }
    }

    private void handleWithCors(RoutingHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        String path = exchange.getRequestPath();
        if (!path.equals(PREFIX + "/health")) {
            try {
                rateLimiter.acquire(rateLimitedTool(exchange.getRequestMethod().toString(), path));
            } catch (RateLimitedException e) {
                exchange.getResponseHeaders().put(RETRY_AFTER, String.valueOf(e.retryAfter().toSeconds()));
                send(exchange, ErrorStatus.httpStatus(e.kind()), ApiResponse.failure(e.kind(), e.getMessage()));
                return;
            }
        }
        routes.handleRequest(exchange);
    }

    static String rateLimitedTool(String method, String path) {
        if (path.contains("/search") || path.contains("/related") || path.contains("/graph")) {
            return "search";
        }
        if ("POST".equalsIgnoreCase(method) && path.endsWith("/memories")) {
            return "store_memory";
        }
        if (path.contains("/relationships") || path.contains("/discover")) {
            return "relationships";
        }
        return ToolRateLimiter.DEFAULT_TOOL;
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        if (!corsEnabled) {
            return;
        }
        String origin = exchange.getRequestHeaders().getFirst("Origin");
        if (origin == null || origin.isBlank() || !isLocalOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,PUT,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private static boolean isLocalOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            String hostName = uri.getHost();
            return uri.getScheme() != null && hostName != null
                && ("localhost".equalsIgnoreCase(hostName) || "127.0.0.1".equals(hostName));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private void send(HttpServerExchange exchange, int status, ApiResponse payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendQuietly(HttpServerExchange exchange, int status, ApiResponse payload) {
        try {
            send(exchange, status, payload);
        } catch (IOException e) {
            LOG.warn("Failed to write error response: {}", e.getMessage());
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        JsonNode body = mapper.readTree(bytes);
        if (!body.isObject()) {
            throw new ValidationException("Request body must be a JSON object");
        }
        return body;
    }

    private JsonNode queryParams(HttpServerExchange exchange) {
        ObjectNode params = mapper.createObjectNode();
        for (Map.Entry<String, Deque<String>> entry : exchange.getQueryParameters().entrySet()) {
            if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                params.put(entry.getKey(), entry.getValue().peekFirst());
            }
        }
        return params;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            throw new ValidationException(name + " is required");
        }
        return values.peekFirst();
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException e) {
            LOG.debug("Could not resolve bound port: {}", e.getMessage());
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface Route {
        Object handle(HttpServerExchange exchange) throws Exception;
    }
}
