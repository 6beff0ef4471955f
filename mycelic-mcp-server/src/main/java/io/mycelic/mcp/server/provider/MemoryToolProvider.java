package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import io.mycelic.core.memory.Memory;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.List;
import java.util.Map;

public final class MemoryToolProvider extends EngineToolProvider {
    private final String defaultSessionId;

    public MemoryToolProvider(MemoryEngine engine) {
        super(engine);
        this.defaultSessionId = engine.config().session().defaultSessionId();
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    protected List<ToolDefinition> defineTools() {
        return List.of(
            tool("store_memory", "Store a new memory", Schemas.object("content")
                .string("content", "Text to remember")
                .integer("importance", "1 (trivial) to 10 (critical), default 5")
                .strings("tags", "Free-form labels")
                .string("domain", "Knowledge domain, created on first use")
                .string("source", "Where the memory came from")
                .string("session_id", "Session writing the memory")
                .enumeration("agent_type", "Kind of agent", List.of("desktop-agent", "code-agent", "api-caller", "unknown"))
                .string("agent_context", "Free-form agent context")
                .enumeration("access_scope", "Visibility", List.of("session", "shared", "global"))
                .string("slug", "Unique human-readable key")
                .build(), true),
            tool("get_memory_by_id", "Fetch one memory by id", Schemas.object("id")
                .string("id", "Memory id")
                .build(), false),
            tool("update_memory", "Change content, importance, tags, source or domain of a memory", Schemas.object("id")
                .string("id", "Memory id")
                .string("content", "Replacement content")
                .integer("importance", "1 to 10")
                .strings("tags", "Replacement tags")
                .string("source", "Replacement source, empty to clear")
                .string("domain", "Replacement domain, empty to clear")
                .build(), true),
            tool("delete_memory", "Delete a memory and its relationships", Schemas.object("id")
                .string("id", "Memory id")
                .build(), true)
        );
    }

    @Override
    protected ToolCallResponse handle(String toolName, JsonNode arguments) {
        return switch (toolName) {
            case "store_memory" -> {
                Memory stored = engine.memories().create(RequestReader.memoryDraft(arguments, defaultSessionId));
                yield ToolCallResponse.ok("Stored memory " + stored.id(), stored);
            }
            case "get_memory_by_id" -> ToolCallResponse.ok("Memory found", engine.memories().get(memoryId(arguments)));
            case "update_memory" -> {
                String id = memoryId(arguments);
                yield ToolCallResponse.ok("Updated memory " + id,
                    engine.memories().update(id, RequestReader.memoryUpdate(arguments)));
            }
            case "delete_memory" -> {
                String id = memoryId(arguments);
                engine.memories().delete(id);
                yield ToolCallResponse.ok("Deleted memory " + id, Map.of("deleted", id));
            }
            default -> throw new IllegalStateException("Unhandled tool " + toolName);
        };
    }

    private static String memoryId(JsonNode arguments) {
        return RequestReader.requireText(arguments, "id", "memory_id", "memoryId");
    }
}
