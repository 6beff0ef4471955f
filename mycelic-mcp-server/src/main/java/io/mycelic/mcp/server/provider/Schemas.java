package io.mycelic.mcp.server.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builder for the JSON schemas advertised in {@code tools/list}.
 */
final class Schemas {
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> required;

    private Schemas(List<String> required) {
        this.required = required;
    }

    static Schemas object(String... required) {
        return new Schemas(List.of(required));
    }

    Schemas string(String name, String description) {
        properties.put(name, Map.of("type", "string", "description", description));
        return this;
    }

    Schemas enumeration(String name, String description, List<String> values) {
        properties.put(name, Map.of("type", "string", "description", description, "enum", values));
        return this;
    }

    Schemas integer(String name, String description) {
        properties.put(name, Map.of("type", "integer", "description", description));
        return this;
    }

    Schemas number(String name, String description) {
        properties.put(name, Map.of("type", "number", "description", description));
        return this;
    }

    Schemas strings(String name, String description) {
        properties.put(name, Map.of("type", "array", "items", Map.of("type", "string"), "description", description));
        return this;
    }

    Map<String, Object> build() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.copyOf(properties));
        if (!required.isEmpty()) {
            schema.put("required", required);
        }
        return schema;
    }
}
