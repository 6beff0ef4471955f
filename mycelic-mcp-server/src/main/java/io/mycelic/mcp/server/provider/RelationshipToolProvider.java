package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import io.mycelic.core.graph.MemoryGraph;
import io.mycelic.core.graph.Relationship;
import io.mycelic.core.graph.RelationshipType;
import io.mycelic.core.memory.Memory;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class RelationshipToolProvider extends EngineToolProvider {

    public RelationshipToolProvider(MemoryEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "relationships";
    }

    @Override
    protected List<ToolDefinition> defineTools() {
        return List.of(tool("relationships", "Create, follow, map and discover relationships between memories",
            Schemas.object("action")
                .enumeration("action", "Operation to run", List.of("create", "find_related", "map_graph", "discover"))
                .string("source_id", "create: source memory id")
                .string("target_id", "create: target memory id")
                .enumeration("relationship_type", "create: edge type. " + typeGuide(),
                    Arrays.stream(RelationshipType.values()).map(RelationshipType::wire).toList())
                .number("strength", "create: 0 to 1, default 0.5")
                .string("context", "create: why the memories are related")
                .string("memory_id", "find_related and map_graph: starting memory")
                .integer("depth", "map_graph: hops from the start, default 2, at most 5")
                .strings("types", "map_graph: edge types to follow")
                .number("min_strength", "Ignore weaker edges; discover default 0.7")
                .integer("limit", "find_related and discover: maximum results")
                .integer("timeout_seconds", "map_graph and discover: stop early after this long")
                .build(), true));
    }

    static String typeGuide() {
        return Arrays.stream(RelationshipType.values())
            .map(type -> type.wire() + ": " + type.describe())
            .collect(Collectors.joining("; "));
    }

    @Override
    protected ToolCallResponse handle(String toolName, JsonNode arguments) {
        String action = action(arguments, "");
        switch (action) {
            case "create": {
                Relationship created = engine.relationships().create(RequestReader.relationshipDraft(arguments));
                return ToolCallResponse.ok("Created relationship " + created.id(), created);
            }
            case "find_related": {
                List<Memory> related = engine.relationships().findRelated(
                    RequestReader.requireText(arguments, "memory_id", "memoryId", "id"),
                    RequestReader.decimal(arguments, "min_strength", "minStrength"),
                    RequestReader.relationshipTypeOrNull(arguments, "relationship_type", "type"),
                    RequestReader.integer(arguments, "limit")
                );
                return ToolCallResponse.ok(related.size() + " related memories", related);
            }
            case "map_graph": {
                String root = RequestReader.requireText(arguments, "memory_id", "memoryId", "id");
                MemoryGraph graph = engine.relationships().mapGraph(RequestReader.graphQuery(root, arguments));
                String message = graph.nodes().size() + " nodes, " + graph.edges().size() + " edges"
                    + (graph.truncated() ? " (truncated)" : "");
                return ToolCallResponse.ok(message, graph);
            }
            case "discover": {
                List<Relationship> discovered = engine.relationships().discover(
                    RequestReader.integer(arguments, "limit"),
                    RequestReader.decimal(arguments, "min_strength", "minStrength"),
                    RequestReader.timeout(arguments)
                );
                return ToolCallResponse.ok("Discovered " + discovered.size() + " relationships", discovered);
            }
            default:
                throw unknownAction(toolName, action);
        }
    }
}
