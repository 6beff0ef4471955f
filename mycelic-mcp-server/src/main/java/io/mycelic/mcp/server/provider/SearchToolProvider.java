package io.mycelic.mcp.server.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.api.RequestReader;
import io.mycelic.core.search.ScoredResult;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.util.List;

public final class SearchToolProvider extends EngineToolProvider {

    public SearchToolProvider(MemoryEngine engine) {
        super(engine);
    }

    @Override
    public String name() {
        return "search";
    }

    @Override
    protected List<ToolDefinition> defineTools() {
        return List.of(tool("search", "Search memories by keyword, tag, date range, meaning or a hybrid of both",
            Schemas.object()
                .string("query", "Search text for keyword, semantic and hybrid modes")
                .enumeration("mode", "Search mode, default keyword",
                    List.of("keyword", "tag", "date_range", "semantic", "hybrid"))
                .strings("tags", "Tags for tag mode")
                .enumeration("tag_operator", "Tag matching, default OR", List.of("AND", "OR"))
                .string("start", "Inclusive lower bound for date_range, ISO-8601 instant or date")
                .string("end", "Inclusive upper bound for date_range, ISO-8601 instant or date")
                .string("domain", "Only memories in this domain")
                .string("session_id", "Session to filter by")
                .enumeration("session_filter_mode", "How session_id restricts results",
                    List.of("all", "session_only", "session_and_shared"))
                .enumeration("access_scope", "Only memories with this scope", List.of("session", "shared", "global"))
                .integer("limit", "Maximum results")
                .number("min_relevance", "Drop results scoring below this, 0 to 1")
                .build(), false));
    }

    @Override
    protected ToolCallResponse handle(String toolName, JsonNode arguments) {
        List<ScoredResult> results = engine.search().search(RequestReader.searchRequest(arguments));
        return ToolCallResponse.ok(results.size() + " results", results);
    }
}
