package io.mycelic.core.search;

import io.mycelic.core.db.Database;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.Memory;
import io.mycelic.core.memory.MemoryRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Full-text search through the FTS5 index. The query is passed to {@code MATCH} unchanged so
 * phrases and boolean operators work; if FTS5 rejects the syntax the query is retried once as a
 * conjunction of quoted terms.
 */
public final class KeywordSearchHandler implements SearchHandler {
    private static final Logger LOG = LoggerFactory.getLogger(KeywordSearchHandler.class);

    private static final String SQL = "SELECT " + MemoryRepository.COLUMNS + """
        , bm25(memories_fts) AS rank
        FROM memories_fts
        JOIN memories m ON m.rowid = memories_fts.rowid
        WHERE memories_fts MATCH ?
        ORDER BY rank
        LIMIT ?
        """;

    private final Database database;
    private final MemoryRepository memories;

    public KeywordSearchHandler(Database database, MemoryRepository memories) {
        this.database = database;
        this.memories = memories;
    }

    @Override
    public SearchMode mode() {
        return SearchMode.KEYWORD;
    }

    @Override
    public List<ScoredResult> candidates(SearchRequest request, int candidateLimit) {
        String query = request.query() == null ? "" : request.query().trim();
        if (query.isEmpty()) {
            throw new ValidationException("query must not be blank for keyword search");
        }
        return database.read("keyword search", connection -> {
            try {
                return match(connection, query, candidateLimit);
            } catch (SQLException e) {
                if (!isQuerySyntaxError(e)) {
                    throw e;
                }
                String quoted = quoteTerms(query);
                LOG.debug("FTS rejected '{}' ({}), retrying as {}", query, e.getMessage(), quoted);
                if (quoted.isEmpty()) {
                    return List.of();
                }
                return match(connection, quoted, candidateLimit);
            }
        });
    }

    private List<ScoredResult> match(Connection connection, String expression, int limit) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SQL)) {
            statement.setString(1, expression);
            statement.setInt(2, limit);
            try (ResultSet rs = statement.executeQuery()) {
                List<Memory> matched = new ArrayList<>();
                List<Double> ranks = new ArrayList<>();
                while (rs.next()) {
                    matched.add(memories.map(rs));
                    ranks.add(rs.getDouble("rank"));
                }
                double best = ranks.isEmpty() ? 0.0 : ranks.get(0);
                List<ScoredResult> results = new ArrayList<>(matched.size());
                for (int i = 0; i < matched.size(); i++) {
                    results.add(new ScoredResult(matched.get(i), normalize(ranks.get(i), best), MatchType.KEYWORD));
                }
                return results;
            }
        }
    }

    /**
     * Scores a bm25 rank (lower is better, usually negative) relative to the best rank among the
     * candidates: the best match scores 1.0 and order is preserved. Small corpora give ranks near
     * zero, so an absolute mapping would push every hit below any useful relevance floor.
     */
    static double normalize(double bm25, double bestBm25) {
        double best = Math.max(0.0, -bestBm25);
        if (best == 0.0) {
            return 1.0;
        }
        double score = Math.max(0.0, -bm25);
        return Math.min(1.0, score / best);
    }

    static String quoteTerms(String query) {
        List<String> terms = new ArrayList<>();
        for (String raw : query.split("\\s+")) {
            String term = raw.replace("\"", "").trim();
            if (!term.isEmpty()) {
                terms.add('"' + term + '"');
            }
        }
        return String.join(" ", terms);
    }

    private static boolean isQuerySyntaxError(SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("fts5") || message.contains("syntax error")
            || message.contains("no such column") || message.contains("unterminated string");
    }
}
