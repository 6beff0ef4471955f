package io.mycelic.core.search;

import io.mycelic.core.db.Database;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.MemoryRepository;
import io.mycelic.core.memory.TagNormalizer;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exact tag matching. Relevance is the share of requested tags a memory carries.
 */
public final class TagSearchHandler implements SearchHandler {
    private final Database database;
    private final MemoryRepository memories;

    public TagSearchHandler(Database database, MemoryRepository memories) {
        this.database = database;
        this.memories = memories;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.TAG;
    }

    @Override
    public List<ScoredResult> candidates(SearchRequest request, int candidateLimit) {
        List<String> tags = TagNormalizer.normalize(request.tags());
        if (tags.isEmpty()) {
            throw new ValidationException("at least one tag is required for tag search");
        }
        int required = request.tagOperator() == TagOperator.AND ? tags.size() : 1;
        String placeholders = String.join(", ", Collections.nCopies(tags.size(), "?"));
        String sql = """
            SELECT * FROM (
                SELECT %s,
                       (SELECT COUNT(DISTINCT t.value) FROM json_each(m.tags) t WHERE t.value IN (%s)) AS matched
                FROM memories m
            )
            WHERE matched >= ?
            ORDER BY matched DESC, created_at DESC
            LIMIT ?
            """.formatted(MemoryRepository.COLUMNS, placeholders);

        return database.read("tag search", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = 1;
                for (String tag : tags) {
                    statement.setString(index++, tag);
                }
                statement.setInt(index++, required);
                statement.setInt(index, candidateLimit);
                try (ResultSet rs = statement.executeQuery()) {
                    List<ScoredResult> results = new ArrayList<>();
                    while (rs.next()) {
                        double relevance = (double) rs.getInt("matched") / tags.size();
                        results.add(new ScoredResult(memories.map(rs), relevance, MatchType.TAG));
                    }
                    return results;
                }
            }
        });
    }
}
