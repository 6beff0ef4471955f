package io.mycelic.mcp.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.mycelic.core.error.MemoryEngineException;
import io.mycelic.core.ratelimit.ToolRateLimiter;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import io.mycelic.mcp.server.provider.ToolProvider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ToolRouter {
    private static final Logger LOG = LoggerFactory.getLogger(ToolRouter.class);

    private final Map<String, ToolProvider> providerByTool;
    private final Map<String, ToolDefinition> definitions;
    private final ToolRateLimiter rateLimiter;

    public ToolRouter(List<ToolProvider> providers) {
        this(providers, ToolRateLimiter.unlimited());
    }

    public ToolRouter(List<ToolProvider> providers, ToolRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
        this.providerByTool = new LinkedHashMap<>();
        this.definitions = new LinkedHashMap<>();
        for (ToolProvider provider : providers) {
            for (ToolDefinition definition : provider.tools()) {
                providerByTool.put(definition.name(), provider);
                definitions.put(definition.name(), definition);
            }
        }
    }

    public List<ToolDefinition> listTools() {
        List<ToolDefinition> all = new ArrayList<>(definitions.values());
        all.sort(Comparator.comparing(ToolDefinition::name));
        return all;
    }

    public ToolCallResponse callTool(String toolName, JsonNode arguments) {
        ToolProvider provider = providerByTool.get(toolName);
        if (provider == null) {
            return ToolCallResponse.error("validation", "Unknown tool: " + toolName);
        }
        JsonNode args = arguments == null || arguments.isNull() ? JsonNodeFactory.instance.objectNode() : arguments;
        if (!args.isObject()) {
            return ToolCallResponse.error("validation", "Tool arguments must be a JSON object");
        }
        try {
            rateLimiter.acquire(toolName);
            return provider.execute(toolName, args);
        } catch (MemoryEngineException e) {
            LOG.debug("Tool {} failed ({}): {}", toolName, e.kind(), e.getMessage());
            return ToolCallResponse.error(e.kind(), e.getMessage());
        }
    }
}
