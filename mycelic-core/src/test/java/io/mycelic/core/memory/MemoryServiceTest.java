package io.mycelic.core.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.domain.Domain;
import io.mycelic.core.error.ConstraintException;
import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.graph.RelationshipDraft;
import io.mycelic.core.search.SearchRequest;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MemoryServiceTest {

    @TempDir
    Path tempDir;

    private StubEmbeddingAdapter embeddings;
    private MemoryEngine engine;
    private MemoryService memories;

    @BeforeEach
    void setUp() {
        embeddings = new StubEmbeddingAdapter();
        engine = MemoryEngine.open(tempDir.resolve("memory.db"), embeddings);
        memories = engine.memories();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldStoreMemoryWithDefaultsAndServerTimestamps() {
        Memory stored = memories.create(MemoryDraft.builder("  Prefers dark mode  ", "s-1").build());

        assertThat(stored.id()).isNotBlank();
        assertThat(stored.content()).isEqualTo("Prefers dark mode");
        assertThat(stored.importance()).isEqualTo(5);
        assertThat(stored.agentType()).isEqualTo(AgentType.UNKNOWN);
        assertThat(stored.accessScope()).isEqualTo(AccessScope.SESSION);
        assertThat(stored.embedded()).isTrue();
        assertThat(stored.createdAt()).isEqualTo(stored.updatedAt());

        Memory loaded = memories.get(stored.id());
        assertThat(loaded).isEqualTo(stored);
    }

    @Test
    void shouldNormalizeTags() {
        Memory stored = memories.create(MemoryDraft.builder("tagged", "s-1").tags(" Go ", "rust", "GO", "").build());

        assertThat(stored.tags()).containsExactly("go", "rust");
        assertThat(memories.get(stored.id()).tags()).containsExactly("go", "rust");
    }

    @Test
    void shouldRejectImportanceOutsideRangeInsteadOfClamping() {
        assertThatThrownBy(() -> memories.create(MemoryDraft.builder("x", "s-1").importance(11).build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("importance");
        assertThatThrownBy(() -> memories.create(MemoryDraft.builder("x", "s-1").importance(0).build()))
            .isInstanceOf(ValidationException.class);
        assertThat(memories.count()).isZero();
    }

    @Test
    void shouldRejectBlankContentAndMissingSession() {
        assertThatThrownBy(() -> memories.create(MemoryDraft.builder("   ", "s-1").build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> memories.create(MemoryDraft.builder("content", " ").build()))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("sessionId");
    }

    @Test
    void shouldRejectDuplicateSlug() {
        memories.create(MemoryDraft.builder("first", "s-1").slug("deploy-notes").build());

        assertThatThrownBy(() -> memories.create(MemoryDraft.builder("second", "s-1").slug("deploy-notes").build()))
            .isInstanceOf(ConstraintException.class);
        assertThat(memories.getBySlug("deploy-notes").content()).isEqualTo("first");
    }

    @Test
    void shouldStoreWithoutVectorWhenEmbeddingFails() {
        embeddings.setFailing(true);

        Memory stored = memories.create(MemoryDraft.builder("written while the model was down", "s-1").build());

        assertThat(stored.embedded()).isFalse();
        assertThat(engine.stats().summary().embeddedMemories()).isZero();
    }

    @Test
    void shouldEmbedMissingVectorsOnReindex() {
        embeddings.setAvailable(false);
        Memory offline = memories.create(MemoryDraft.builder("offline memory", "s-1").build());
        assertThat(offline.embedded()).isFalse();

        embeddings.setAvailable(true);
        int indexed = memories.reindexMissingEmbeddings(10);

        assertThat(indexed).isEqualTo(1);
        assertThat(memories.get(offline.id()).embedded()).isTrue();
        assertThat(memories.reindexMissingEmbeddings(10)).isZero();
    }

    @Test
    void shouldRequireAdapterForReindex() {
        embeddings.setAvailable(false);

        assertThatThrownBy(() -> memories.reindexMissingEmbeddings(10))
            .isInstanceOf(DependencyUnavailableException.class);
    }

    @Test
    void shouldAutoCreateDomainAndUpsertSession() {
        memories.create(MemoryDraft.builder("one", "s-9").domain("Work").agentType(AgentType.CODE_AGENT).build());
        Memory second = memories.create(MemoryDraft.builder("two", "s-9").domain("work").build());

        assertThat(second.domain()).isEqualTo("Work");
        assertThat(engine.domains().list()).extracting(d -> d.name()).containsExactly("Work");
        assertThat(engine.sessions().get("s-9").agentType()).isEqualTo(AgentType.CODE_AGENT);
        assertThat(engine.sessions().get("s-9").lastAccessed()).isAfter(engine.sessions().get("s-9").createdAt());
    }

    @Test
    void shouldUpdateFieldsAndReindexFullText() {
        Memory stored = memories.create(MemoryDraft.builder("the deploy uses blue green", "s-1").importance(4).build());

        Memory updated = memories.update(stored.id(), new MemoryUpdate("the deploy uses canary releases", 8,
            List.of("Ops"), null, null));

        assertThat(updated.content()).isEqualTo("the deploy uses canary releases");
        assertThat(updated.importance()).isEqualTo(8);
        assertThat(updated.tags()).containsExactly("ops");
        assertThat(updated.updatedAt()).isAfter(stored.updatedAt());
        assertThat(updated.createdAt()).isEqualTo(stored.createdAt());
        assertThat(engine.search().search(SearchRequest.keyword("canary"))).hasSize(1);
        assertThat(engine.search().search(SearchRequest.keyword("green"))).isEmpty();
    }

    @Test
    void shouldValidateUpdates() {
        Memory stored = memories.create(MemoryDraft.builder("content", "s-1").build());

        assertThatThrownBy(() -> memories.update(stored.id(), MemoryUpdate.importance(42)))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> memories.update("missing", MemoryUpdate.content("x")))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> memories.update(stored.id(), new MemoryUpdate(null, null, null, null, null)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldDropStaleVectorWhenReembedFails() {
        Memory stored = memories.create(MemoryDraft.builder("original", "s-1").build());
        embeddings.setFailing(true);

        Memory updated = memories.update(stored.id(), MemoryUpdate.content("rewritten"));

        assertThat(updated.embedded()).isFalse();
        assertThat(memories.get(stored.id()).embedded()).isFalse();
    }

    @Test
    void shouldCascadeDeleteToRelationshipsAndIndex() {
        Memory a = memories.create(MemoryDraft.builder("alpha kubernetes", "s-1").build());
        Memory b = memories.create(MemoryDraft.builder("beta kubernetes", "s-1").build());
        engine.relationships().create(new RelationshipDraft(a.id(), b.id(), "references", 0.9, null));

        memories.delete(a.id());

        assertThatThrownBy(() -> memories.get(a.id())).isInstanceOf(NotFoundException.class);
        assertThat(engine.relationships().count()).isZero();
        assertThat(engine.search().search(SearchRequest.keyword("alpha"))).isEmpty();
        assertThatThrownBy(() -> memories.delete(a.id())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldListNewestFirstWithFilters() {
        Memory first = memories.create(MemoryDraft.builder("first", "s-1").importance(2).build());
        Memory second = memories.create(MemoryDraft.builder("second", "s-2").importance(9).domain("home").build());
        Memory third = memories.create(MemoryDraft.builder("third", "s-1").importance(7).build());

        assertThat(memories.list(MemoryQuery.all())).extracting(Memory::id)
            .containsExactly(third.id(), second.id(), first.id());
        assertThat(memories.list(MemoryQuery.bySession("s-1"))).extracting(Memory::id)
            .containsExactly(third.id(), first.id());
        assertThat(memories.list(MemoryQuery.byDomain("HOME"))).extracting(Memory::id)
            .containsExactly(second.id());
        assertThat(memories.list(new MemoryQuery(null, null, 5, null, null, null))).extracting(Memory::id)
            .containsExactly(third.id(), second.id());
        assertThat(memories.list(new MemoryQuery(null, null, null, null, 1, 1))).extracting(Memory::id)
            .containsExactly(second.id());
    }

    @Test
    void shouldRejectNegativeOffset() {
        assertThatThrownBy(() -> memories.list(new MemoryQuery(null, null, null, null, 10, -1)))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldBumpDomainOnMemoryWrites() {
        Domain created = engine.domains().create("Work", "day job");

        Memory stored = memories.create(MemoryDraft.builder("standup at ten", "s-1").domain("work").build());
        Domain afterCreate = engine.domains().get("Work");
        memories.update(stored.id(), MemoryUpdate.importance(8));
        Domain afterUpdate = engine.domains().get("Work");

        assertThat(afterCreate.updatedAt()).isAfter(created.updatedAt());
        assertThat(afterUpdate.updatedAt()).isAfter(afterCreate.updatedAt());
        assertThat(afterUpdate.createdAt()).isEqualTo(created.createdAt());
    }

    @Test
    void shouldStoreLongContentWithLinkedChunks() {
        String content = longContent("alpha", "beta", "gamma", "delta");

        Memory parent = memories.create(MemoryDraft.builder(content, "s-1").importance(7).tags("notes")
            .domain("research").build());
        List<Memory> chunks = memories.chunks(parent.id());

        assertThat(parent.content()).isEqualTo(content);
        assertThat(parent.parentMemoryId()).isNull();
        assertThat(parent.chunkLevel()).isZero();
        assertThat(chunks).hasSize(4);
        assertThat(chunks).extracting(Memory::chunkIndex).containsExactly(0, 1, 2, 3);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.parentMemoryId()).isEqualTo(parent.id());
            assertThat(chunk.chunkLevel()).isEqualTo(1);
            assertThat(chunk.importance()).isEqualTo(7);
            assertThat(chunk.tags()).containsExactly("notes");
            assertThat(chunk.domain()).isEqualTo("research");
            assertThat(chunk.sessionId()).isEqualTo("s-1");
            assertThat(chunk.slug()).isNull();
            assertThat(chunk.embedded()).isTrue();
            assertThat(chunk.content().length()).isLessThanOrEqualTo(1000);
        });
        assertThat(chunks.get(3).content()).contains("delta");
        assertThat(memories.count()).isEqualTo(5);
    }

    @Test
    void shouldKeepShortContentWhole() {
        Memory stored = memories.create(MemoryDraft.builder("short note", "s-1").build());

        assertThat(memories.chunks(stored.id())).isEmpty();
        assertThatThrownBy(() -> memories.chunks("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void shouldDeleteChunksWithParent() {
        Memory parent = memories.create(MemoryDraft.builder(longContent("alpha", "beta", "gamma"), "s-1").build());
        assertThat(memories.count()).isGreaterThan(1);

        memories.delete(parent.id());

        assertThat(memories.count()).isZero();
        assertThat(engine.search().search(SearchRequest.keyword("gamma"))).isEmpty();
    }

    @Test
    void shouldReplaceChunksWhenContentChanges() {
        Memory parent = memories.create(MemoryDraft.builder(longContent("alpha", "beta", "gamma"), "s-1").build());
        List<String> before = memories.chunks(parent.id()).stream().map(Memory::id).toList();

        memories.update(parent.id(), MemoryUpdate.content(longContent("kappa", "lambda", "sigma", "omega")));
        List<Memory> after = memories.chunks(parent.id());

        assertThat(after).hasSize(4);
        assertThat(after).extracting(Memory::id).doesNotContainAnyElementsOf(before);
        assertThat(engine.search().search(SearchRequest.keyword("beta"))).isEmpty();

        memories.update(parent.id(), MemoryUpdate.content("now short"));
        assertThat(memories.chunks(parent.id())).isEmpty();
        assertThat(memories.count()).isEqualTo(1);
    }

    @Test
    void shouldCopyMetadataChangesOntoChunks() {
        Memory parent = memories.create(MemoryDraft.builder(longContent("alpha", "beta", "gamma"), "s-1").build());

        memories.update(parent.id(), new MemoryUpdate(null, 9, List.of("Archive"), "wiki", "ops"));

        assertThat(memories.chunks(parent.id())).isNotEmpty().allSatisfy(chunk -> {
            assertThat(chunk.importance()).isEqualTo(9);
            assertThat(chunk.tags()).containsExactly("archive");
            assertThat(chunk.source()).isEqualTo("wiki");
            assertThat(chunk.domain()).isEqualTo("ops");
        });
    }

    private static String longContent(String... words) {
        StringBuilder out = new StringBuilder();
        for (String word : words) {
            if (out.length() > 0) {
                out.append("\n\n");
            }
            out.append((word + " lorem ipsum dolor. ").repeat(30).trim());
        }
        return out.toString();
    }
}
