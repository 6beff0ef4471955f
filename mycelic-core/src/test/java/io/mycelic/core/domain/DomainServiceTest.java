package io.mycelic.core.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.embedding.UnavailableEmbeddingAdapter;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryDraft;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DomainServiceTest {

    @TempDir
    Path tempDir;

    private MemoryEngine engine;
    private DomainService domains;

    @BeforeEach
    void setUp() {
        engine = MemoryEngine.open(tempDir.resolve("memory.db"), new UnavailableEmbeddingAdapter());
        domains = engine.domains();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldCreateDomainsIdempotently() {
        Domain created = domains.create("Personal", "home and family");
        Domain again = domains.create("personal", "ignored");

        assertThat(again.id()).isEqualTo(created.id());
        assertThat(again.description()).isEqualTo("home and family");
        assertThat(domains.list()).hasSize(1);
        assertThat(domains.get("PERSONAL").name()).isEqualTo("Personal");
    }

    @Test
    void shouldReportDomainStats() {
        engine.memories().create(MemoryDraft.builder("one", "s-1").domain("work").importance(4).build());
        Memory last = engine.memories().create(MemoryDraft.builder("two", "s-1").domain("Work").importance(8).build());

        DomainStats stats = domains.stats("work");

        assertThat(stats.memoryCount()).isEqualTo(2);
        assertThat(stats.averageImportance()).isEqualTo(6.0);
        assertThat(stats.lastMemoryAt()).isEqualTo(last.createdAt());
    }

    @Test
    void shouldReportEmptyDomain() {
        domains.create("empty", null);

        DomainStats stats = domains.stats("empty");

        assertThat(stats.memoryCount()).isZero();
        assertThat(stats.lastMemoryAt()).isNull();
    }

    @Test
    void shouldRejectUnknownOrBlankDomain() {
        assertThatThrownBy(() -> domains.get("nowhere")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> domains.create("  ", null)).isInstanceOf(ValidationException.class);
    }
}
