package io.mycelic.core.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mycelic.core.MemoryEngine;
import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.AccessScope;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryDraft;
import io.mycelic.core.memory.StubEmbeddingAdapter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SearchDispatcherTest {

    @TempDir
    Path tempDir;

    private StubEmbeddingAdapter embeddings;
    private MemoryEngine engine;

    @BeforeEach
    void setUp() {
        embeddings = new StubEmbeddingAdapter();
        engine = MemoryEngine.open(tempDir.resolve("memory.db"), embeddings);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private Memory remember(String content, String sessionId, String... tags) {
        return engine.memories().create(MemoryDraft.builder(content, sessionId).tags(tags).build());
    }

    @Test
    void shouldRankKeywordMatchesWithNormalizedRelevance() {
        Memory strong = remember("kubernetes kubernetes kubernetes cluster", "s-1");
        Memory weak = remember("a long note that mentions kubernetes once among many other unrelated words", "s-1");
        remember("nothing relevant here", "s-1");
        remember("lunch order for friday", "s-1");
        remember("the printer on floor two is jammed", "s-1");
        remember("quarterly budget review", "s-1");

        List<ScoredResult> results = engine.search().search(SearchRequest.keyword("kubernetes"));

        assertThat(results).extracting(result -> result.memory().id()).containsExactly(strong.id(), weak.id());
        assertThat(results).allSatisfy(result -> assertThat(result.matchType()).isEqualTo(MatchType.KEYWORD));
        assertThat(results.get(0).relevance()).isEqualTo(1.0);
        assertThat(results.get(1).relevance()).isGreaterThan(0.0).isLessThan(1.0);
    }

    @Test
    void shouldKeepTopKeywordHitAboveRelevanceFloorInSmallCorpus() {
        Memory match = remember("Go routines enable concurrent programming", "s-1");
        remember("Rust ownership prevents data races", "s-1");

        List<ScoredResult> results = engine.search().search(SearchRequest.keyword("concurrent").withMinRelevance(0.5));

        assertThat(results).extracting(result -> result.memory().id()).containsExactly(match.id());
        assertThat(results.get(0).relevance()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNotANumberRelevanceFloor() {
        remember("kubernetes upgrade notes", "s-1");

        assertThatThrownBy(() -> engine.search().search(SearchRequest.keyword("kubernetes").withMinRelevance(Double.NaN)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("minRelevance");
    }

    @Test
    void shouldRetryMalformedKeywordQueryAsQuotedTerms() {
        Memory stored = remember("kubernetes upgrade notes", "s-1");

        List<ScoredResult> results = engine.search().search(SearchRequest.keyword("kubernetes\""));

        assertThat(results).extracting(result -> result.memory().id()).containsExactly(stored.id());
    }

    @Test
    void shouldRejectBlankKeywordQuery() {
        assertThatThrownBy(() -> engine.search().search(SearchRequest.keyword("  ")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldMatchTagsWithOrAndAnd() {
        Memory both = remember("both tags", "s-1", "go", "rust");
        Memory one = remember("one tag", "s-1", "go");
        remember("no tags", "s-1");

        List<ScoredResult> any = engine.search().search(SearchRequest.byTags(List.of("Go", "rust"), TagOperator.OR));
        assertThat(any).extracting(result -> result.memory().id()).containsExactly(both.id(), one.id());
        assertThat(any).extracting(ScoredResult::relevance).containsExactly(1.0, 0.5);

        List<ScoredResult> all = engine.search().search(SearchRequest.byTags(List.of("go", "rust"), TagOperator.AND));
        assertThat(all).extracting(result -> result.memory().id()).containsExactly(both.id());

        List<ScoredResult> strict = engine.search().search(
            SearchRequest.byTags(List.of("go", "rust"), TagOperator.OR).withMinRelevance(0.75));
        assertThat(strict).extracting(result -> result.memory().id()).containsExactly(both.id());
    }

    @Test
    void shouldTreatDateRangeBoundsAsInclusive() {
        Memory first = remember("first", "s-1");
        Memory second = remember("second", "s-1");
        Memory third = remember("third", "s-1");

        List<ScoredResult> exact = engine.search().search(SearchRequest.dateRange(second.createdAt(), second.createdAt()));
        assertThat(exact).extracting(result -> result.memory().id()).containsExactly(second.id());

        List<ScoredResult> open = engine.search().search(SearchRequest.dateRange(second.createdAt(), null));
        assertThat(open).extracting(result -> result.memory().id()).containsExactly(third.id(), second.id());

        assertThatThrownBy(() -> engine.search().search(SearchRequest.dateRange(third.createdAt(), first.createdAt())))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldFindSemanticNeighbours() {
        Memory related = remember("kubernetes cluster upgrade", "s-1");
        remember("banana bread recipe", "s-1");

        List<ScoredResult> results = engine.search().search(SearchRequest.semantic("kubernetes cluster"));

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).memory().id()).isEqualTo(related.id());
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.SEMANTIC);
        assertThat(results).allSatisfy(result -> assertThat(result.relevance()).isBetween(0.0, 1.0));
    }

    @Test
    void shouldFailSemanticSearchWithoutAdapter() {
        remember("kubernetes cluster upgrade", "s-1");
        embeddings.setAvailable(false);

        assertThatThrownBy(() -> engine.search().search(SearchRequest.semantic("kubernetes")))
            .isInstanceOf(DependencyUnavailableException.class);
    }

    @Test
    void shouldBoostMemoriesFoundByBothHalvesOfHybridSearch() {
        Memory stored = remember("kubernetes cluster upgrade", "s-1");

        List<ScoredResult> results = engine.search().search(SearchRequest.hybrid("kubernetes cluster"));

        assertThat(results).isNotEmpty();
        assertThat(results.get(0).memory().id()).isEqualTo(stored.id());
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.HYBRID);
        assertThat(results.get(0).relevance()).isLessThanOrEqualTo(1.0);
    }

    @Test
    void shouldDegradeHybridSearchToKeywordWithoutAdapter() {
        Memory stored = remember("kubernetes cluster upgrade", "s-1");
        embeddings.setAvailable(false);

        List<ScoredResult> results = engine.search().search(SearchRequest.hybrid("kubernetes"));

        assertThat(results).extracting(result -> result.memory().id()).containsExactly(stored.id());
        assertThat(results.get(0).matchType()).isEqualTo(MatchType.KEYWORD);
    }

    @Test
    void shouldApplySessionFilterModes() {
        Memory own = remember("rollout plan", "s-1");
        Memory shared = engine.memories().create(MemoryDraft.builder("rollout checklist", "s-2")
            .accessScope(AccessScope.SHARED).build());
        Memory foreign = remember("rollout retro", "s-2");

        SearchRequest base = SearchRequest.keyword("rollout");

        assertThat(engine.search().search(base.withFilters(new SearchFilters(null, "s-1", null, null))))
            .extracting(result -> result.memory().id()).containsExactly(own.id());
        assertThat(engine.search().search(base.withFilters(
                new SearchFilters(null, "s-1", null, SessionFilterMode.SESSION_AND_SHARED))))
            .extracting(result -> result.memory().id()).containsExactlyInAnyOrder(own.id(), shared.id());
        assertThat(engine.search().search(base.withFilters(new SearchFilters(null, "s-1", null, SessionFilterMode.ALL))))
            .extracting(result -> result.memory().id()).containsExactlyInAnyOrder(own.id(), shared.id(), foreign.id());
        assertThatThrownBy(() -> engine.search().search(base.withFilters(
                new SearchFilters(null, null, null, SessionFilterMode.SESSION_ONLY))))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldFilterByDomainAndScope() {
        Memory work = engine.memories().create(MemoryDraft.builder("standup notes", "s-1").domain("work").build());
        engine.memories().create(MemoryDraft.builder("standup at the gym", "s-1").domain("health")
            .accessScope(AccessScope.GLOBAL).build());

        assertThat(engine.search().search(SearchRequest.keyword("standup")
                .withFilters(new SearchFilters("WORK", null, null, null))))
            .extracting(result -> result.memory().id()).containsExactly(work.id());
        assertThat(engine.search().search(SearchRequest.keyword("standup")
                .withFilters(new SearchFilters(null, null, AccessScope.GLOBAL, null))))
            .extracting(result -> result.memory().domain()).containsExactly("health");
    }

    @Test
    void shouldApplyLimitAndClampToMaximum() {
        for (int i = 0; i < 5; i++) {
            remember("deploy note " + i, "s-1");
        }

        assertThat(engine.search().search(SearchRequest.keyword("deploy").withLimit(2))).hasSize(2);
        assertThat(engine.search().effectiveLimit(10_000)).isEqualTo(100);
        assertThat(engine.search().effectiveLimit(null)).isEqualTo(10);
    }

    @Test
    void shouldRejectRelevanceFloorOutsideUnitRange() {
        assertThatThrownBy(() -> engine.search().search(SearchRequest.keyword("deploy").withMinRelevance(1.5)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("minRelevance");
    }
}
