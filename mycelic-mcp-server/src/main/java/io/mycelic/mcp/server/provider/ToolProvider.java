package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.List;

public interface ToolProvider {
    String name();

    List<ToolDefinition> tools();

    /**
     * Runs one tool. Engine failures are thrown, not folded into the response; the router turns
     * them into error results.
     */
    ToolCallResponse execute(String toolName, JsonNode arguments);

    default boolean supports(String toolName) {
        return tools().stream().anyMatch(tool -> tool.name().equals(toolName));
    }
}
