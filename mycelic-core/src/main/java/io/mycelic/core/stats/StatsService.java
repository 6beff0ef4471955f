package io.mycelic.core.stats;

import io.mycelic.core.category.CategoryRepository;
import io.mycelic.core.db.Database;
import io.mycelic.core.db.Timestamps;
import io.mycelic.core.domain.DomainRepository;
import io.mycelic.core.embedding.VectorMetadataRepository;
import io.mycelic.core.graph.RelationshipRepository;
import io.mycelic.core.session.SessionRepository;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates computed on demand from a single read snapshot.
 */
public final class StatsService {
    private final Database database;
    private final RelationshipRepository relationships;
    private final SessionRepository sessions;
    private final DomainRepository domains;
    private final CategoryRepository categories;
    private final VectorMetadataRepository vectors;

    public StatsService(
        Database database,
        RelationshipRepository relationships,
        SessionRepository sessions,
        DomainRepository domains,
        CategoryRepository categories,
        VectorMetadataRepository vectors
    ) {
        this.database = database;
        this.relationships = relationships;
        this.sessions = sessions;
        this.domains = domains;
        this.categories = categories;
        this.vectors = vectors;
    }

    public MemoryStats summary() {
        return database.read("compute stats", connection -> {
            long total;
            double averageImportance;
            String oldest;
            String newest;
            try (PreparedStatement statement = connection.prepareStatement("""
                SELECT COUNT(*), COALESCE(AVG(importance), 0), MIN(created_at), MAX(created_at) FROM memories
                """);
                 ResultSet rs = statement.executeQuery()) {
                rs.next();
                total = rs.getLong(1);
                averageImportance = rs.getDouble(2);
                oldest = rs.getString(3);
                newest = rs.getString(4);
            }
            return new MemoryStats(
                total,
                averageImportance,
                distinctTags(connection),
                Timestamps.parse(oldest),
                Timestamps.parse(newest),
                byDomain(connection),
                categories.memoryCounts(connection),
                relationships.count(connection),
                sessions.count(connection),
                domains.count(connection),
                categories.count(connection),
                vectors.count(connection)
            );
        });
    }

    private List<String> distinctTags(Connection connection) throws SQLException {
        List<String> tags = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT DISTINCT t.value FROM memories m, json_each(m.tags) t ORDER BY t.value
            """);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                tags.add(rs.getString(1));
            }
        }
        return tags;
    }

    private Map<String, Long> byDomain(Connection connection) throws SQLException {
        Map<String, Long> counts = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
            SELECT domain, COUNT(*) FROM memories WHERE domain IS NOT NULL GROUP BY domain ORDER BY domain
            """);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString(1), rs.getLong(2));
            }
        }
        return counts;
    }
}
