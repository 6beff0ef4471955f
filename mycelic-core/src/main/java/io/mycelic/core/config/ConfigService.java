package io.mycelic.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.config.model.MycelicConfig;
import io.mycelic.core.json.Json;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads {@code config.json} on top of {@link MycelicConfig#defaults()}: keys missing from the
 * file keep their default, nested sections are merged key by key.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        this.mapper = Json.mapper();
    }

    public MycelicConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MycelicConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MycelicConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(defaultsNode, existingNode), MycelicConfig.class);
    }

    public void save(Path configPath, MycelicConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    /**
     * Writes the defaults when no file exists yet.
     *
     * @return true when a file was created
     */
    public boolean init(Path configPath, boolean overwrite) throws IOException {
        boolean exists = Files.exists(configPath);
        if (exists && !overwrite) {
            return false;
        }
        save(configPath, MycelicConfig.defaults());
        return true;
    }

    public String toPrettyJson(MycelicConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
