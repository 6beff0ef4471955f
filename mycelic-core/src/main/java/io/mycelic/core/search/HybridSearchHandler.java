package io.mycelic.core.search;

import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.MemoryEngineException;
import io.mycelic.core.error.StorageException;
import io.mycelic.core.memory.Memory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs keyword and semantic search in parallel and fuses their scores. Falls back to plain
 * keyword results when no embedding adapter is reachable.
 */
public final class HybridSearchHandler implements SearchHandler {
    private static final Logger LOG = LoggerFactory.getLogger(HybridSearchHandler.class);

    private final KeywordSearchHandler keyword;
    private final SemanticSearchHandler semantic;
    private final HybridWeights weights;
    private final ExecutorService executor;

    public HybridSearchHandler(
        KeywordSearchHandler keyword,
        SemanticSearchHandler semantic,
        HybridWeights weights,
        ExecutorService executor
    ) {
        this.keyword = keyword;
        this.semantic = semantic;
        this.weights = weights;
        this.executor = executor;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.HYBRID;
    }

    @Override
    public List<ScoredResult> candidates(SearchRequest request, int candidateLimit) {
        if (!semantic.isAvailable()) {
            LOG.info("Embedding adapter unavailable, hybrid search is answering with keyword results only");
            return keyword.candidates(request, candidateLimit);
        }

        Future<List<ScoredResult>> keywordFuture = executor.submit(() -> keyword.candidates(request, candidateLimit));
        Future<List<ScoredResult>> semanticFuture = executor.submit(() -> semantic.candidates(request, candidateLimit));

        List<ScoredResult> keywordResults = await(keywordFuture);
        List<ScoredResult> semanticResults;
        try {
            semanticResults = await(semanticFuture);
        } catch (DependencyUnavailableException e) {
            LOG.warn("Semantic half of hybrid search failed, using keyword results: {}", e.getMessage());
            return keywordResults;
        }
        return fuse(keywordResults, semanticResults);
    }

    List<ScoredResult> fuse(List<ScoredResult> keywordResults, List<ScoredResult> semanticResults) {
        Map<String, Memory> memories = new LinkedHashMap<>();
        Map<String, Double> keywordScores = new LinkedHashMap<>();
        Map<String, Double> semanticScores = new LinkedHashMap<>();
        for (ScoredResult result : keywordResults) {
            memories.putIfAbsent(result.memory().id(), result.memory());
            keywordScores.merge(result.memory().id(), result.relevance(), Math::max);
        }
        for (ScoredResult result : semanticResults) {
            memories.putIfAbsent(result.memory().id(), result.memory());
            semanticScores.merge(result.memory().id(), result.relevance(), Math::max);
        }

        List<ScoredResult> fused = new ArrayList<>();
        for (Map.Entry<String, Memory> entry : memories.entrySet()) {
            String id = entry.getKey();
            boolean inKeyword = keywordScores.containsKey(id);
            boolean inSemantic = semanticScores.containsKey(id);
            double score = weights.fuse(
                keywordScores.getOrDefault(id, 0.0),
                semanticScores.getOrDefault(id, 0.0),
                inKeyword && inSemantic
            );
            MatchType type = inKeyword && inSemantic ? MatchType.HYBRID : inKeyword ? MatchType.KEYWORD : MatchType.SEMANTIC;
            fused.add(new ScoredResult(entry.getValue(), score, type));
        }
        fused.sort(Comparator.comparingDouble(ScoredResult::relevance).reversed()
            .thenComparing(result -> result.memory().createdAt(), Comparator.reverseOrder()));
        return fused;
    }

    private static List<ScoredResult> await(Future<List<ScoredResult>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while searching", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MemoryEngineException engineException) {
                throw engineException;
            }
            throw new StorageException("Search failed", e.getCause());
        }
    }
}
