package io.mycelic.core.graph;

import io.mycelic.core.db.Timestamps;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RelationshipRepository {
    private static final String COLUMNS = """
        id, source_memory_id, target_memory_id, relationship_type, strength, context, auto_generated, created_at
        """;

    public void insert(Connection connection, Relationship relationship) throws SQLException {
        String sql = "INSERT INTO memory_relationships (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, relationship);
            statement.executeUpdate();
        }
    }

    /**
     * Inserts the edge unless the two memories are already joined in either direction, or one of
     * them no longer exists.
     *
     * @return true when a row was written
     */
    public boolean insertIfUnlinked(Connection connection, Relationship relationship) throws SQLException {
        String sql = "INSERT INTO memory_relationships (" + COLUMNS + """
            )
            SELECT ?, ?, ?, ?, ?, ?, ?, ?
            WHERE NOT EXISTS (
                SELECT 1 FROM memory_relationships r
                WHERE (r.source_memory_id = ? AND r.target_memory_id = ?)
                   OR (r.source_memory_id = ? AND r.target_memory_id = ?)
            )
            AND EXISTS (SELECT 1 FROM memories WHERE id = ?)
            AND EXISTS (SELECT 1 FROM memories WHERE id = ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, relationship);
            String source = relationship.sourceMemoryId();
            String target = relationship.targetMemoryId();
            statement.setString(9, source);
            statement.setString(10, target);
            statement.setString(11, target);
            statement.setString(12, source);
            statement.setString(13, source);
            statement.setString(14, target);
            return statement.executeUpdate() > 0;
        }
    }

    /**
     * Edges with {@code memoryId} at either end, strongest first.
     */
    public List<Relationship> touching(
        Connection connection,
        String memoryId,
        Collection<RelationshipType> types,
        Double minStrength
    ) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
            .append(" FROM memory_relationships WHERE (source_memory_id = ? OR target_memory_id = ?)");
        List<Object> params = new ArrayList<>(List.of(memoryId, memoryId));
        if (minStrength != null) {
            sql.append(" AND strength >= ?");
            params.add(minStrength);
        }
        if (types != null && !types.isEmpty()) {
            sql.append(" AND relationship_type IN (")
                .append(String.join(", ", Collections.nCopies(types.size(), "?")))
                .append(")");
            types.forEach(type -> params.add(type.wire()));
        }
        sql.append(" ORDER BY strength DESC, created_at ASC");
        return query(connection, sql.toString(), params);
    }

    /**
     * Neighbour ids with the strength of their strongest edge, strongest first.
     */
    public Map<String, Double> strongestNeighbours(
        Connection connection,
        String memoryId,
        double minStrength,
        RelationshipType type,
        int limit
    ) throws SQLException {
        StringBuilder sql = new StringBuilder("""
            SELECT CASE WHEN source_memory_id = ? THEN target_memory_id ELSE source_memory_id END AS neighbour,
                   MAX(strength) AS best
            FROM memory_relationships
            WHERE (source_memory_id = ? OR target_memory_id = ?) AND strength >= ?
            """);
        List<Object> params = new ArrayList<>(List.of(memoryId, memoryId, memoryId, minStrength));
        if (type != null) {
            sql.append(" AND relationship_type = ?");
            params.add(type.wire());
        }
        sql.append(" GROUP BY neighbour ORDER BY best DESC, neighbour ASC LIMIT ?");
        params.add(limit);

        Map<String, Double> neighbours = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    neighbours.put(rs.getString("neighbour"), rs.getDouble("best"));
                }
            }
        }
        return neighbours;
    }

    /**
     * Every linked pair as {@code "a|b"} with {@code a < b}, direction and type ignored.
     */
    public Set<String> linkedPairs(Connection connection) throws SQLException {
        Set<String> pairs = new HashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT source_memory_id, target_memory_id FROM memory_relationships");
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                pairs.add(pairKey(rs.getString(1), rs.getString(2)));
            }
        }
        return pairs;
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM memory_relationships");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }

    private List<Relationship> query(Connection connection, String sql, List<Object> params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                List<Relationship> relationships = new ArrayList<>();
                while (rs.next()) {
                    relationships.add(map(rs));
                }
                return relationships;
            }
        }
    }

    private void bind(PreparedStatement statement, Relationship relationship) throws SQLException {
        statement.setString(1, relationship.id());
        statement.setString(2, relationship.sourceMemoryId());
        statement.setString(3, relationship.targetMemoryId());
        statement.setString(4, relationship.type().wire());
        statement.setDouble(5, relationship.strength());
        statement.setString(6, relationship.context());
        statement.setInt(7, relationship.autoGenerated() ? 1 : 0);
        statement.setString(8, Timestamps.format(relationship.createdAt()));
    }

    private Relationship map(ResultSet rs) throws SQLException {
        return new Relationship(
            rs.getString("id"),
            rs.getString("source_memory_id"),
            rs.getString("target_memory_id"),
            RelationshipType.parse(rs.getString("relationship_type")),
            rs.getDouble("strength"),
            rs.getString("context"),
            rs.getInt("auto_generated") != 0,
            Timestamps.parse(rs.getString("created_at"))
        );
    }
}
