package io.mycelic.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.graph.CancellationSignal;
import io.mycelic.core.graph.GraphQuery;
import io.mycelic.core.graph.RelationshipDraft;
import io.mycelic.core.graph.RelationshipType;
import io.mycelic.core.memory.AccessScope;
import io.mycelic.core.memory.AgentType;
import io.mycelic.core.memory.MemoryDraft;
import io.mycelic.core.memory.MemoryQuery;
import io.mycelic.core.memory.MemoryUpdate;
import io.mycelic.core.search.SearchFilters;
import io.mycelic.core.search.SearchMode;
import io.mycelic.core.search.SearchRequest;
import io.mycelic.core.search.SessionFilterMode;
import io.mycelic.core.search.TagOperator;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns JSON request bodies (REST) and tool arguments (MCP) into engine inputs. Field names are
 * snake_case; the camelCase spelling is accepted as well.
 */
public final class RequestReader {

    private RequestReader() {
    }

    public static MemoryDraft memoryDraft(JsonNode body, String defaultSessionId) {
        String sessionId = text(body, "session_id", "sessionId");
        return MemoryDraft.builder(text(body, "content"), sessionId == null ? defaultSessionId : sessionId)
            .importance(integer(body, "importance"))
            .tags(stringList(body, "tags"))
            .domain(text(body, "domain"))
            .source(text(body, "source"))
            .agentType(AgentType.parse(text(body, "agent_type", "agentType")))
            .agentContext(text(body, "agent_context", "agentContext"))
            .accessScope(AccessScope.parse(text(body, "access_scope", "accessScope")))
            .slug(text(body, "slug"))
            .build();
    }

    public static MemoryUpdate memoryUpdate(JsonNode body) {
        return new MemoryUpdate(
            rawText(body, "content"),
            integer(body, "importance"),
            body.has("tags") ? stringList(body, "tags") : null,
            rawText(body, "source"),
            rawText(body, "domain")
        );
    }

    public static MemoryQuery memoryQuery(JsonNode params) {
        return new MemoryQuery(
            text(params, "domain"),
            text(params, "session_id", "sessionId"),
            integer(params, "min_importance", "minImportance"),
            integer(params, "max_importance", "maxImportance"),
            integer(params, "limit"),
            integer(params, "offset")
        );
    }

    public static SearchRequest searchRequest(JsonNode body) {
        SearchFilters filters = new SearchFilters(
            text(body, "domain"),
            text(body, "session_id", "sessionId"),
            scopeOrNull(text(body, "access_scope", "accessScope")),
            SessionFilterMode.parse(text(body, "session_filter_mode", "sessionFilterMode"))
        );
        return new SearchRequest(
            text(body, "query"),
            SearchMode.parse(text(body, "mode", "search_type")),
            stringList(body, "tags"),
            TagOperator.parse(text(body, "tag_operator", "tagOperator")),
            instant(body, "start", "start_date"),
            endInstant(body, "end", "end_date"),
            filters,
            integer(body, "limit"),
            decimal(body, "min_relevance", "minRelevance")
        );
    }

    public static RelationshipDraft relationshipDraft(JsonNode body) {
        return new RelationshipDraft(
            text(body, "source_id", "source_memory_id", "sourceId"),
            text(body, "target_id", "target_memory_id", "targetId"),
            text(body, "relationship_type", "type"),
            decimal(body, "strength"),
            text(body, "context")
        );
    }

    public static GraphQuery graphQuery(String rootId, JsonNode params) {
        Integer depth = integer(params, "depth", "max_depth");
        Set<RelationshipType> types = EnumSet.noneOf(RelationshipType.class);
        for (String type : stringList(params, "types")) {
            types.add(RelationshipType.parse(type));
        }
        return new GraphQuery(
            rootId,
            depth == null ? 0 : depth,
            types,
            decimal(params, "min_strength", "minStrength"),
            timeout(params)
        );
    }

    public static CancellationSignal timeout(JsonNode params) {
        Integer seconds = integer(params, "timeout_seconds", "timeoutSeconds");
        if (seconds == null || seconds <= 0) {
            return CancellationSignal.none();
        }
        return CancellationSignal.deadline(Duration.ofSeconds(seconds));
    }

    public static RelationshipType relationshipTypeOrNull(JsonNode params, String... fields) {
        String raw = text(params, fields);
        return raw == null ? null : RelationshipType.parse(raw);
    }

    public static String text(JsonNode body, String... fields) {
        String raw = rawText(body, fields);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    public static String requireText(JsonNode body, String... fields) {
        String value = text(body, fields);
        if (value == null) {
            throw new ValidationException(fields[0] + " is required");
        }
        return value;
    }

    /**
     * Like {@link #text} but keeps an explicitly empty string, which update requests use to clear a field.
     */
    public static String rawText(JsonNode body, String... fields) {
        JsonNode node = field(body, fields);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    public static Integer integer(JsonNode body, String... fields) {
        JsonNode node = field(body, fields);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToInt()) {
                throw new ValidationException(fields[0] + " is out of range");
            }
            return node.intValue();
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(fields[0] + " must be an integer, got '" + raw + "'");
        }
    }

    public static Double decimal(JsonNode body, String... fields) {
        JsonNode node = field(body, fields);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(fields[0] + " must be a number, got '" + raw + "'");
        }
    }

    /**
     * Accepts a JSON array or a comma separated string.
     */
    public static List<String> stringList(JsonNode body, String... fields) {
        JsonNode node = field(body, fields);
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText("");
                if (!value.isBlank()) {
                    values.add(value.trim());
                }
            }
            return values;
        }
        for (String value : node.asText("").split(",")) {
            if (!value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    /**
     * ISO-8601 instants, or plain dates ({@code 2024-05-01}) read as midnight UTC.
     */
    public static Instant instant(JsonNode body, String... fields) {
        String raw = text(body, fields);
        if (raw == null) {
            return null;
        }
        try {
            if (raw.length() == 10) {
                return LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ValidationException(fields[0] + " is not an ISO-8601 date or instant: " + raw);
        }
    }

    /**
     * Same as {@link #instant} except that a plain date covers the whole day.
     */
    public static Instant endInstant(JsonNode body, String... fields) {
        String raw = text(body, fields);
        Instant parsed = instant(body, fields);
        if (raw != null && raw.length() == 10) {
            return parsed.plus(Duration.ofDays(1)).minusNanos(1000);
        }
        return parsed;
    }

    private static AccessScope scopeOrNull(String raw) {
        return raw == null ? null : AccessScope.parse(raw);
    }

    private static JsonNode field(JsonNode body, String... fields) {
        if (body == null) {
            return null;
        }
        for (String name : fields) {
            JsonNode node = body.get(name);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return null;
    }
}
