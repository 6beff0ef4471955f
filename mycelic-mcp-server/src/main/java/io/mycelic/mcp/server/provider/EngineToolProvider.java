package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import io.mycelic.core.error.ValidationException;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for providers whose tools are thin calls into a {@link MemoryEngine}.
 */
public abstract class EngineToolProvider implements ToolProvider {
    protected final MemoryEngine engine;
    private final List<ToolDefinition> tools;

    protected EngineToolProvider(MemoryEngine engine) {
        this.engine = engine;
        this.tools = List.copyOf(defineTools());
    }

    protected abstract List<ToolDefinition> defineTools();

    protected abstract ToolCallResponse handle(String toolName, JsonNode arguments);

    @Override
    public List<ToolDefinition> tools() {
        return tools;
    }

    @Override
    public ToolCallResponse execute(String toolName, JsonNode arguments) {
        if (!supports(toolName)) {
            return ToolCallResponse.error("validation", "Unsupported tool for provider " + name() + ": " + toolName);
        }
        return handle(toolName, arguments);
    }

    protected ToolDefinition tool(String toolName, String description, Map<String, Object> schema, boolean mutating) {
        return new ToolDefinition(toolName, description, schema, name(), mutating);
    }

    protected static String action(JsonNode arguments, String fallback) {
        String raw = RequestReader.text(arguments, "action");
        return raw == null ? fallback : raw.toLowerCase(Locale.ROOT);
    }

    protected static ValidationException unknownAction(String toolName, String action) {
        return new ValidationException("Unknown action for " + toolName + ": " + action);
    }
}
