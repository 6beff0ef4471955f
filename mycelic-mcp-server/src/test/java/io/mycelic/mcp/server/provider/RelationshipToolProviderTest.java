package io.mycelic.mcp.server.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mycelic.core.MemoryEngine;
import io.mycelic.core.embedding.HashingEmbeddingAdapter;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.graph.MemoryGraph;
import io.mycelic.core.graph.Relationship;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryDraft;
import io.mycelic.mcp.server.model.ToolCallResponse;
import io.mycelic.mcp.server.model.ToolDefinition;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RelationshipToolProviderTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private MemoryEngine engine;
    private RelationshipToolProvider provider;

    @BeforeEach
    void setUp() {
        engine = MemoryEngine.open(tempDir.resolve("memory.db"), new HashingEmbeddingAdapter(64));
        provider = new RelationshipToolProvider(engine);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldCreateAndMapRelationships() {
        Memory a = engine.memories().create(MemoryDraft.builder("design doc", "s-1").build());
        Memory b = engine.memories().create(MemoryDraft.builder("implementation notes", "s-1").build());

        ObjectNode create = mapper.createObjectNode()
            .put("action", "create")
            .put("source_id", a.id())
            .put("target_id", b.id())
            .put("relationship_type", "expands");
        ToolCallResponse created = provider.execute("relationships", create);
        assertThat(created.ok()).isTrue();
        assertThat(((Relationship) created.data()).strength()).isEqualTo(0.5);

        ObjectNode map = mapper.createObjectNode().put("action", "map_graph").put("memory_id", a.id()).put("depth", 1);
        MemoryGraph graph = (MemoryGraph) provider.execute("relationships", map).data();
        assertThat(graph.nodes()).hasSize(2);

        ObjectNode related = mapper.createObjectNode().put("action", "find_related").put("memory_id", b.id());
        @SuppressWarnings("unchecked")
        List<Memory> neighbours = (List<Memory>) provider.execute("relationships", related).data();
        assertThat(neighbours).extracting(Memory::id).containsExactly(a.id());
    }

    @Test
    void shouldDiscoverSimilarMemories() {
        engine.memories().create(MemoryDraft.builder("postgres vacuum tuning guide", "s-1").build());
        engine.memories().create(MemoryDraft.builder("postgres vacuum tuning guide", "s-2").build());

        ToolCallResponse response = provider.execute("relationships",
            mapper.createObjectNode().put("action", "discover").put("min_strength", 0.9));

        assertThat(response.ok()).isTrue();
        assertThat(response.message()).isEqualTo("Discovered 1 relationships");
    }

    @Test
    void shouldRejectUnknownAction() {
        assertThatThrownBy(() -> provider.execute("relationships", mapper.createObjectNode().put("action", "merge")))
            .isInstanceOf(ValidationException.class);
        assertThat(provider.execute("search", mapper.createObjectNode()).ok()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldDescribeEveryRelationshipTypeInSchema() {
        ToolDefinition tool = provider.tools().get(0);
        Map<String, Object> properties = (Map<String, Object>) tool.inputSchema().get("properties");
        Map<String, Object> type = (Map<String, Object>) properties.get("relationship_type");

        assertThat((List<String>) type.get("enum"))
            .containsExactly("references", "contradicts", "expands", "similar", "sequential", "causes", "enables");
        assertThat((String) type.get("description"))
            .contains("contradicts: The memories state conflicting information")
            .contains("enables: One memory makes the other possible");
    }
}
