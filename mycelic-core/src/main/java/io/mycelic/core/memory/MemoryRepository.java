package io.mycelic.core.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mycelic.core.db.Timestamps;
import io.mycelic.core.embedding.Vectors;
import io.mycelic.core.error.StorageException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row mapping and SQL for the {@code memories} table. Every method runs on a connection owned by
 * the caller's transaction.
 */
public final class MemoryRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    public static final String COLUMNS = """
        m.id, m.content, m.importance, m.tags, m.domain, m.source, m.session_id, m.agent_type,
        m.agent_context, m.access_scope, m.slug, m.parent_memory_id, m.chunk_level, m.chunk_index,
        m.created_at, m.updated_at,
        (m.embedding IS NOT NULL) AS embedded
        """;

    private final ObjectMapper mapper;

    public MemoryRepository(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void insert(Connection connection, Memory memory, byte[] embedding) throws SQLException {
        String sql = """
            INSERT INTO memories (id, content, importance, tags, domain, source, session_id, embedding,
                                  agent_type, agent_context, access_scope, slug, parent_memory_id,
                                  chunk_level, chunk_index, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, memory.id());
            statement.setString(2, memory.content());
            statement.setInt(3, memory.importance());
            statement.setString(4, writeTags(memory.tags()));
            statement.setString(5, memory.domain());
            statement.setString(6, memory.source());
            statement.setString(7, memory.sessionId());
            setBlob(statement, 8, embedding);
            statement.setString(9, memory.agentType().wire());
            statement.setString(10, memory.agentContext());
            statement.setString(11, memory.accessScope().wire());
            statement.setString(12, memory.slug());
            statement.setString(13, memory.parentMemoryId());
            statement.setInt(14, memory.chunkLevel());
            statement.setInt(15, memory.chunkIndex());
            statement.setString(16, Timestamps.format(memory.createdAt()));
            statement.setString(17, Timestamps.format(memory.updatedAt()));
            statement.executeUpdate();
        }
    }

    public void update(Connection connection, Memory memory) throws SQLException {
        String sql = """
            UPDATE memories
            SET content = ?, importance = ?, tags = ?, domain = ?, source = ?, updated_at = ?
            WHERE id = ?
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, memory.content());
            statement.setInt(2, memory.importance());
            statement.setString(3, writeTags(memory.tags()));
            statement.setString(4, memory.domain());
            statement.setString(5, memory.source());
            statement.setString(6, Timestamps.format(memory.updatedAt()));
            statement.setString(7, memory.id());
            statement.executeUpdate();
        }
    }

    public void updateEmbedding(Connection connection, String id, byte[] embedding) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("UPDATE memories SET embedding = ? WHERE id = ?")) {
            setBlob(statement, 1, embedding);
            statement.setString(2, id);
            statement.executeUpdate();
        }
    }

    /**
     * Copies the parent's importance, tags, domain and source onto its chunks.
     */
    public void updateChunkMetadata(Connection connection, Memory parent) throws SQLException {
        String sql = """
            UPDATE memories
            SET importance = ?, tags = ?, domain = ?, source = ?, updated_at = ?
            WHERE parent_memory_id = ?
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, parent.importance());
            statement.setString(2, writeTags(parent.tags()));
            statement.setString(3, parent.domain());
            statement.setString(4, parent.source());
            statement.setString(5, Timestamps.format(parent.updatedAt()));
            statement.setString(6, parent.id());
            statement.executeUpdate();
        }
    }

    public int deleteChunks(Connection connection, String parentId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM memories WHERE parent_memory_id = ?")) {
            statement.setString(1, parentId);
            return statement.executeUpdate();
        }
    }

    public List<Memory> chunks(Connection connection, String parentId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM memories m WHERE m.parent_memory_id = ? ORDER BY m.chunk_index ASC";
        return query(connection, sql, List.of(parentId));
    }

    public boolean delete(Connection connection, String id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM memories WHERE id = ?")) {
            statement.setString(1, id);
            return statement.executeUpdate() > 0;
        }
    }

    public boolean exists(Connection connection, String id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT 1 FROM memories WHERE id = ?")) {
            statement.setString(1, id);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    public Optional<Memory> findById(Connection connection, String id) throws SQLException {
        return findOne(connection, "m.id = ?", id);
    }

    public Optional<Memory> findBySlug(Connection connection, String slug) throws SQLException {
        return findOne(connection, "m.slug = ?", slug);
    }

    /**
     * @return memories keyed by id, in the iteration order of {@code ids}; unknown ids are skipped
     */
    public Map<String, Memory> findByIds(Connection connection, Collection<String> ids) throws SQLException {
        Map<String, Memory> found = new LinkedHashMap<>();
        if (ids.isEmpty()) {
            return found;
        }
        Map<String, Memory> byId = new LinkedHashMap<>();
        List<String> batch = new ArrayList<>(ids);
        for (int start = 0; start < batch.size(); start += 500) {
            List<String> chunk = batch.subList(start, Math.min(batch.size(), start + 500));
            String placeholders = String.join(", ", Collections.nCopies(chunk.size(), "?"));
            String sql = "SELECT " + COLUMNS + " FROM memories m WHERE m.id IN (" + placeholders + ")";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) {
                    statement.setString(i + 1, chunk.get(i));
                }
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        Memory memory = map(rs);
                        byId.put(memory.id(), memory);
                    }
                }
            }
        }
        for (String id : ids) {
            Memory memory = byId.get(id);
            if (memory != null) {
                found.put(id, memory);
            }
        }
        return found;
    }

    public List<Memory> list(Connection connection, MemoryQuery query) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM memories m WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.domain() != null && !query.domain().isBlank()) {
            sql.append(" AND m.domain = ? COLLATE NOCASE");
            params.add(query.domain().trim());
        }
        if (query.sessionId() != null && !query.sessionId().isBlank()) {
            sql.append(" AND m.session_id = ?");
            params.add(query.sessionId().trim());
        }
        if (query.minImportance() != null) {
            sql.append(" AND m.importance >= ?");
            params.add(query.minImportance());
        }
        if (query.maxImportance() != null) {
            sql.append(" AND m.importance <= ?");
            params.add(query.maxImportance());
        }
        sql.append(" ORDER BY m.created_at DESC LIMIT ? OFFSET ?");
        params.add(query.effectiveLimit());
        params.add(query.effectiveOffset());
        return query(connection, sql.toString(), params);
    }

    public List<Memory> withoutEmbedding(Connection connection, int limit) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM memories m WHERE m.embedding IS NULL ORDER BY m.created_at ASC LIMIT ?";
        return query(connection, sql, List.of(limit));
    }

    public List<MemoryVector> vectors(Connection connection, int limit) throws SQLException {
        String sql = "SELECT id, embedding FROM memories WHERE embedding IS NOT NULL ORDER BY created_at DESC LIMIT ?";
        List<MemoryVector> vectors = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, limit);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    float[] vector = Vectors.decode(rs.getBytes("embedding"));
                    if (vector != null) {
                        vectors.add(new MemoryVector(rs.getString("id"), vector));
                    }
                }
            }
        }
        return vectors;
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM memories");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    public List<Memory> query(Connection connection, String sql, List<?> params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            try (ResultSet rs = statement.executeQuery()) {
                List<Memory> memories = new ArrayList<>();
                while (rs.next()) {
                    memories.add(map(rs));
                }
                return memories;
            }
        }
    }

    public Memory map(ResultSet rs) throws SQLException {
        return new Memory(
            rs.getString("id"),
            rs.getString("content"),
            rs.getInt("importance"),
            readTags(rs.getString("tags")),
            rs.getString("domain"),
            rs.getString("source"),
            rs.getString("session_id"),
            AgentType.parse(rs.getString("agent_type")),
            rs.getString("agent_context"),
            AccessScope.parse(rs.getString("access_scope")),
            rs.getString("slug"),
            rs.getString("parent_memory_id"),
            rs.getInt("chunk_level"),
            rs.getInt("chunk_index"),
            rs.getBoolean("embedded"),
            Timestamps.parse(rs.getString("created_at")),
            Timestamps.parse(rs.getString("updated_at"))
        );
    }

    public List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StorageException("Stored tags are not a JSON array: " + json, e);
        }
    }

    private String writeTags(List<String> tags) {
        try {
            return mapper.writeValueAsString(tags == null ? List.of() : tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tags", e);
        }
    }

    private Optional<Memory> findOne(Connection connection, String where, String value) throws SQLException {
        List<Memory> rows = query(connection, "SELECT " + COLUMNS + " FROM memories m WHERE " + where, List.of(value));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    static void bind(PreparedStatement statement, List<?> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            statement.setObject(i + 1, params.get(i));
        }
    }

    private static void setBlob(PreparedStatement statement, int index, byte[] value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.BLOB);
        } else {
            statement.setBytes(index, value);
        }
    }
}
