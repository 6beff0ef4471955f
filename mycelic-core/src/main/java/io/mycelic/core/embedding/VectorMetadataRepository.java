package io.mycelic.core.embedding;

import io.mycelic.core.db.Timestamps;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Bookkeeping for stored vectors. A memory keeps its {@code vector_index} across re-embeddings;
 * new memories get the next free slot.
 */
public final class VectorMetadataRepository {

    public void upsert(Connection connection, String memoryId, String model, int dimension, Instant now) throws SQLException {
        String sql = """
            INSERT INTO vector_metadata (memory_id, vector_index, embedding_model, embedding_dimension, last_updated)
            VALUES (?, (SELECT COALESCE(MAX(vector_index), -1) + 1 FROM vector_metadata), ?, ?, ?)
            ON CONFLICT(memory_id) DO UPDATE SET
                embedding_model = excluded.embedding_model,
                embedding_dimension = excluded.embedding_dimension,
                last_updated = excluded.last_updated
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, memoryId);
            statement.setString(2, model);
            statement.setInt(3, dimension);
            statement.setString(4, Timestamps.format(now));
            statement.executeUpdate();
        }
    }

    public void delete(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM vector_metadata WHERE memory_id = ?")) {
            statement.setString(1, memoryId);
            statement.executeUpdate();
        }
    }

    public Integer vectorIndex(Connection connection, String memoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT vector_index FROM vector_metadata WHERE memory_id = ?")) {
            statement.setString(1, memoryId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getInt(1) : null;
            }
        }
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM vector_metadata");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }
}
