package io.mycelic.mcp.server;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.json.Json;
import io.mycelic.core.ratelimit.ToolRateLimiter;
import io.mycelic.mcp.server.config.McpServerConfig;
import io.mycelic.mcp.server.provider.MemoryToolProvider;
import io.mycelic.mcp.server.provider.OrganizationToolProvider;
import io.mycelic.mcp.server.provider.RelationshipToolProvider;
import io.mycelic.mcp.server.provider.SearchToolProvider;
import io.mycelic.mcp.server.provider.ToolProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the memory tools onto an {@link McpHttpServer}.
 */
public final class McpServerApplication {
    private static final Logger LOG = LoggerFactory.getLogger(McpServerApplication.class);
    public static final String VERSION = "0.1.0";

    private McpServerApplication() {
    }

    public static ToolRouter router(MemoryEngine engine) {
        List<ToolProvider> providers = List.of(
            new MemoryToolProvider(engine),
            new SearchToolProvider(engine),
            new RelationshipToolProvider(engine),
            new OrganizationToolProvider(engine)
        );
        for (ToolProvider provider : providers) {
            LOG.debug("Tool provider {} exposes {} tools", provider.name(), provider.tools().size());
        }
        return new ToolRouter(providers, new ToolRateLimiter(engine.config().rateLimit()));
    }

    public static McpHttpServer start(MemoryEngine engine, McpServerConfig config) {
        McpHttpServer server = new McpHttpServer(config.host(), config.port(), router(engine), Json.wireMapper(), VERSION);
        server.start();
        return server;
    }
}
