package io.mycelic.core.category;

import io.mycelic.core.db.Timestamps;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class CategoryRepository {
    private static final String COLUMNS =
        "id, name, description, parent_category_id, confidence_threshold, auto_generated, created_at";

    public void insert(Connection connection, Category category) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO categories (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            statement.setString(1, category.id());
            statement.setString(2, category.name());
            statement.setString(3, category.description());
            statement.setString(4, category.parentCategoryId());
            statement.setDouble(5, category.confidenceThreshold());
            statement.setInt(6, category.autoGenerated() ? 1 : 0);
            statement.setString(7, Timestamps.format(category.createdAt()));
            statement.executeUpdate();
        }
    }

    public Optional<Category> findById(Connection connection, String id) throws SQLException {
        List<Category> rows = query(connection, "SELECT " + COLUMNS + " FROM categories WHERE id = ?", List.of(id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public Optional<Category> findByName(Connection connection, String name) throws SQLException {
        List<Category> rows = query(connection, "SELECT " + COLUMNS + " FROM categories WHERE name = ?", List.of(name));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<Category> list(Connection connection, CategoryQuery query) throws SQLException {
        if (query.parentId() != null && !query.parentId().isBlank()) {
            return query(connection,
                "SELECT " + COLUMNS + " FROM categories WHERE parent_category_id = ? ORDER BY name COLLATE NOCASE",
                List.of(query.parentId().trim()));
        }
        String where = query.rootsOnly() ? " WHERE parent_category_id IS NULL" : "";
        return query(connection, "SELECT " + COLUMNS + " FROM categories" + where + " ORDER BY name COLLATE NOCASE", List.of());
    }

    public boolean delete(Connection connection, String id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM categories WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        }
    }

    /**
     * Re-categorizing the same pair replaces the earlier confidence and reasoning.
     */
    public void upsertCategorization(
        Connection connection,
        String memoryId,
        String categoryId,
        double confidence,
        String reasoning,
        Instant now
    ) throws SQLException {
        String sql = """
            INSERT INTO memory_categorizations (memory_id, category_id, confidence, reasoning, created_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(memory_id, category_id) DO UPDATE SET
                confidence = excluded.confidence,
                reasoning = excluded.reasoning,
                created_at = excluded.created_at
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, memoryId);
            statement.setString(2, categoryId);
            statement.setDouble(3, confidence);
            statement.setString(4, reasoning);
            statement.setString(5, Timestamps.format(now));
            statement.executeUpdate();
        }
    }

    public List<Categorization> categorizationsOf(Connection connection, String memoryId) throws SQLException {
        String sql = """
            SELECT mc.memory_id, mc.category_id, c.name, mc.confidence, mc.reasoning, mc.created_at
            FROM memory_categorizations mc
            JOIN categories c ON c.id = mc.category_id
            WHERE mc.memory_id = ?
            ORDER BY mc.confidence DESC, c.name COLLATE NOCASE
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                List<Categorization> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new Categorization(
                        rs.getString(1),
                        rs.getString(2),
                        rs.getString(3),
                        rs.getDouble(4),
                        rs.getString(5),
                        Timestamps.parse(rs.getString(6))
                    ));
                }
                return out;
            }
        }
    }

    public List<String> memoryIdsIn(Connection connection, String categoryId) throws SQLException {
        String sql = """
            SELECT mc.memory_id
            FROM memory_categorizations mc
            JOIN memories m ON m.id = mc.memory_id
            WHERE mc.category_id = ?
            ORDER BY mc.confidence DESC, m.created_at DESC
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, categoryId);
            try (ResultSet rs = statement.executeQuery()) {
                List<String> ids = new ArrayList<>();
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
                return ids;
            }
        }
    }

    /**
     * Category name to number of categorized memories, including empty categories.
     */
    public Map<String, Long> memoryCounts(Connection connection) throws SQLException {
        String sql = """
            SELECT c.name, COUNT(mc.memory_id)
            FROM categories c
            LEFT JOIN memory_categorizations mc ON mc.category_id = c.id
            GROUP BY c.id
            ORDER BY c.name COLLATE NOCASE
            """;
        Map<String, Long> counts = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString(1), rs.getLong(2));
            }
        }
        return counts;
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM categories");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private List<Category> query(Connection connection, String sql, List<String> params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setString(i + 1, params.get(i));
            }
            try (ResultSet rs = statement.executeQuery()) {
                List<Category> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(map(rs));
                }
                return out;
            }
        }
    }

    private Category map(ResultSet rs) throws SQLException {
        return new Category(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("parent_category_id"),
            rs.getDouble("confidence_threshold"),
            rs.getInt("auto_generated") != 0,
            Timestamps.parse(rs.getString("created_at"))
        );
    }
}
