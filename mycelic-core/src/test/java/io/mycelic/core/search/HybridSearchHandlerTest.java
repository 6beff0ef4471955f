package io.mycelic.core.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import io.mycelic.core.memory.AccessScope;
import io.mycelic.core.memory.AgentType;
import io.mycelic.core.memory.Memory;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class HybridSearchHandlerTest {

    private final HybridSearchHandler handler = new HybridSearchHandler(null, null, HybridWeights.defaults(), null);

    private static Memory memory(String id) {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        return new Memory(id, "content " + id, 5, List.of(), null, null, "s-1", AgentType.UNKNOWN, null,
            AccessScope.SESSION, null, null, 0, 0, true, at, at);
    }

    @Test
    void shouldWeightAndBoostOverlappingResults() {
        Memory both = memory("both");
        Memory keywordOnly = memory("keyword");
        Memory semanticOnly = memory("semantic");

        List<ScoredResult> fused = handler.fuse(
            List.of(new ScoredResult(both, 0.5, MatchType.KEYWORD), new ScoredResult(keywordOnly, 0.9, MatchType.KEYWORD)),
            List.of(new ScoredResult(both, 0.5, MatchType.SEMANTIC), new ScoredResult(semanticOnly, 0.8, MatchType.SEMANTIC))
        );

        assertThat(fused).extracting(result -> result.memory().id()).containsExactly("both", "semantic", "keyword");
        assertThat(fused.get(0).relevance()).isCloseTo(0.4 * 0.5 + 0.6 * 0.5 + 0.1, offset(1e-9));
        assertThat(fused.get(0).matchType()).isEqualTo(MatchType.HYBRID);
        assertThat(fused.get(1).relevance()).isCloseTo(0.48, offset(1e-9));
        assertThat(fused.get(2).matchType()).isEqualTo(MatchType.KEYWORD);
    }

    @Test
    void shouldCapFusedScoreAtOne() {
        Memory both = memory("both");

        List<ScoredResult> fused = handler.fuse(
            List.of(new ScoredResult(both, 1.0, MatchType.KEYWORD)),
            List.of(new ScoredResult(both, 1.0, MatchType.SEMANTIC))
        );

        assertThat(fused.get(0).relevance()).isEqualTo(1.0);
    }
}
