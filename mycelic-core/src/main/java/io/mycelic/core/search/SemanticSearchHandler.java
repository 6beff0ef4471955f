package io.mycelic.core.search;

import io.mycelic.core.db.Database;
import io.mycelic.core.embedding.EmbeddingAdapter;
import io.mycelic.core.embedding.Vectors;
import io.mycelic.core.error.DependencyUnavailableException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryRepository;
import io.mycelic.core.memory.MemoryVector;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cosine similarity between the query embedding and every stored vector.
 */
public final class SemanticSearchHandler implements SearchHandler {
    private final Database database;
    private final MemoryRepository memories;
    private final EmbeddingAdapter embeddings;

    public SemanticSearchHandler(Database database, MemoryRepository memories, EmbeddingAdapter embeddings) {
        this.database = database;
        this.memories = memories;
        this.embeddings = embeddings;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.SEMANTIC;
    }

    public boolean isAvailable() {
        return embeddings.isAvailable();
    }

    @Override
    public List<ScoredResult> candidates(SearchRequest request, int candidateLimit) {
        String query = request.query() == null ? "" : request.query().trim();
        if (query.isEmpty()) {
            throw new ValidationException("query must not be blank for semantic search");
        }
        if (!embeddings.isAvailable()) {
            throw new DependencyUnavailableException("Semantic search needs an embedding adapter");
        }
        float[] queryVector = embeddings.embed(query);

        return database.read("semantic search", connection -> {
            List<Map.Entry<String, Double>> scored = new ArrayList<>();
            for (MemoryVector stored : memories.vectors(connection, Integer.MAX_VALUE)) {
                double similarity = Vectors.cosine(queryVector, stored.vector());
                if (similarity > 0.0) {
                    scored.add(Map.entry(stored.memoryId(), similarity));
                }
            }
            scored.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
            List<Map.Entry<String, Double>> top = scored.subList(0, Math.min(candidateLimit, scored.size()));

            Map<String, Double> similarityById = new LinkedHashMap<>();
            top.forEach(entry -> similarityById.put(entry.getKey(), entry.getValue()));
            Map<String, Memory> byId = memories.findByIds(connection, similarityById.keySet());

            List<ScoredResult> results = new ArrayList<>();
            for (Map.Entry<String, Double> entry : similarityById.entrySet()) {
                Memory memory = byId.get(entry.getKey());
                if (memory != null) {
                    results.add(new ScoredResult(memory, entry.getValue(), MatchType.SEMANTIC));
                }
            }
            return results;
        });
    }
}
