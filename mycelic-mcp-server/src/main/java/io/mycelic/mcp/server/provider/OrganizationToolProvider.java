package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import io.mycelic.core.category.Category;
import io.mycelic.core.category.CategoryQuery;
import io.mycelic.core.domain.Domain;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.List;
import java.util.Map;

/**
 * Categories, domains, sessions and corpus statistics.
 */
public final class OrganizationToolProvider extends EngineToolProvider {

    public OrganizationToolProvider(MemoryEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "organization";
    }

    @Override
    protected List<ToolDefinition> defineTools() {
        return List.of(
            tool("categories", "Create, list, assign and delete categories", Schemas.object()
                .enumeration("action", "Operation, default list", List.of("create", "list", "categorize", "memories", "delete"))
                .string("name", "create: category name")
                .string("description", "create: description")
                .string("parent_id", "create: parent category id; list: only its children")
                .number("confidence_threshold", "create: 0 to 1, default 0.7")
                .string("category_id", "categorize, memories, delete: category id")
                .string("memory_id", "categorize: memory id")
                .number("confidence", "categorize: 0 to 1, default 1")
                .string("reasoning", "categorize: why the memory belongs")
                .build(), true),
            tool("domains", "Create and list knowledge domains", Schemas.object()
                .enumeration("action", "Operation, default list", List.of("create", "list", "stats"))
                .string("name", "create and stats: domain name")
                .string("description", "create: description")
                .build(), true),
            tool("sessions", "List agent sessions with memory counts", Schemas.object()
                .enumeration("action", "Operation, default list", List.of("list", "get", "deactivate"))
                .string("session_id", "get and deactivate: session id")
                .build(), true),
            tool("stats", "Corpus statistics", Schemas.object().build(), false)
        );
    }

    @Override
    protected ToolCallResponse handle(String toolName, JsonNode arguments) {
        return switch (toolName) {
            case "categories" -> categories(arguments);
            case "domains" -> domains(arguments);
            case "sessions" -> sessions(arguments);
            case "stats" -> ToolCallResponse.ok("Memory statistics", engine.stats().summary());
            default -> throw new IllegalStateException("Unhandled tool " + toolName);
        };
    }

    private ToolCallResponse categories(JsonNode arguments) {
        String action = action(arguments, "list");
        switch (action) {
            case "create": {
                Category created = engine.categories().create(
                    RequestReader.text(arguments, "name"),
                    RequestReader.text(arguments, "description"),
                    RequestReader.text(arguments, "parent_id", "parent_category_id"),
                    RequestReader.decimal(arguments, "confidence_threshold")
                );
                return ToolCallResponse.ok("Created category " + created.name(), created);
            }
            case "list": {
                List<Category> categories = engine.categories()
                    .list(new CategoryQuery(RequestReader.text(arguments, "parent_id"), false));
                return ToolCallResponse.ok(categories.size() + " categories", categories);
            }
            case "categorize": {
                Double confidence = RequestReader.decimal(arguments, "confidence");
                return ToolCallResponse.ok("Categorized memory", engine.categories().categorize(
                    RequestReader.requireText(arguments, "memory_id", "memoryId"),
                    RequestReader.requireText(arguments, "category_id", "categoryId"),
                    confidence == null ? 1.0 : confidence,
                    RequestReader.text(arguments, "reasoning")
                ));
            }
            case "memories": {
                String id = RequestReader.requireText(arguments, "category_id", "categoryId");
                return ToolCallResponse.ok("Category members", engine.categories().memoriesIn(id));
            }
            case "delete": {
                String id = RequestReader.requireText(arguments, "category_id", "categoryId");
                engine.categories().delete(id);
                return ToolCallResponse.ok("Deleted category " + id, Map.of("deleted", id));
            }
            default:
                throw unknownAction("categories", action);
        }
    }

    private ToolCallResponse domains(JsonNode arguments) {
        String action = action(arguments, "list");
        switch (action) {
            case "create": {
                Domain domain = engine.domains().create(
                    RequestReader.text(arguments, "name"),
                    RequestReader.text(arguments, "description")
                );
                return ToolCallResponse.ok("Domain " + domain.name(), domain);
            }
            case "list":
                return ToolCallResponse.ok("Domains", engine.domains().list());
            case "stats":
                return ToolCallResponse.ok("Domain statistics",
                    engine.domains().stats(RequestReader.requireText(arguments, "name")));
            default:
                throw unknownAction("domains", action);
        }
    }

    private ToolCallResponse sessions(JsonNode arguments) {
        String action = action(arguments, "list");
        switch (action) {
            case "list":
                return ToolCallResponse.ok("Sessions", engine.sessions().stats());
            case "get":
                return ToolCallResponse.ok("Session",
                    engine.sessions().get(RequestReader.requireText(arguments, "session_id", "sessionId")));
            case "deactivate": {
                String id = RequestReader.requireText(arguments, "session_id", "sessionId");
                engine.sessions().deactivate(id);
                return ToolCallResponse.ok("Deactivated session " + id, Map.of("deactivated", id));
            }
            default:
                throw unknownAction("sessions", action);
        }
    }
}
