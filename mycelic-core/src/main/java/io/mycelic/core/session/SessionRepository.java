package io.mycelic.core.session;

import io.mycelic.core.db.Timestamps;
import io.mycelic.core.memory.AgentType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SessionRepository {

    /**
     * Inserts the session or refreshes {@code last_accessed}. A known agent type replaces
     * {@code unknown}, never the other way round.
     */
    public void touch(Connection connection, String sessionId, AgentType agentType, String agentContext, Instant now)
        throws SQLException {
        String sql = """
            INSERT INTO agent_sessions (session_id, agent_type, agent_context, created_at, last_accessed, is_active)
            VALUES (?, ?, ?, ?, ?, 1)
            ON CONFLICT(session_id) DO UPDATE SET
                last_accessed = excluded.last_accessed,
                is_active = 1,
                agent_type = CASE WHEN excluded.agent_type <> 'unknown'
                    THEN excluded.agent_type ELSE agent_sessions.agent_type END,
                agent_context = COALESCE(excluded.agent_context, agent_sessions.agent_context)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setString(2, (agentType == null ? AgentType.UNKNOWN : agentType).wire());
            statement.setString(3, agentContext);
            statement.setString(4, Timestamps.format(now));
            statement.setString(5, Timestamps.format(now));
            statement.executeUpdate();
        }
    }

    public boolean deactivate(Connection connection, String sessionId, Instant now) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "UPDATE agent_sessions SET is_active = 0, last_accessed = ? WHERE session_id = ?")) {
            statement.setString(1, Timestamps.format(now));
            statement.setString(2, sessionId);
            return statement.executeUpdate() > 0;
        }
    }

    public Optional<AgentSession> find(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT * FROM agent_sessions WHERE session_id = ?")) {
            statement.setString(1, sessionId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public List<AgentSession> list(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "SELECT * FROM agent_sessions ORDER BY last_accessed DESC");
             ResultSet rs = statement.executeQuery()) {
            List<AgentSession> sessions = new ArrayList<>();
            while (rs.next()) {
                sessions.add(map(rs));
            }
            return sessions;
        }
    }

    public long count(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM agent_sessions");
             ResultSet rs = statement.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    private AgentSession map(ResultSet rs) throws SQLException {
        return new AgentSession(
            rs.getString("session_id"),
            AgentType.parse(rs.getString("agent_type")),
            rs.getString("agent_context"),
            Timestamps.parse(rs.getString("created_at")),
            Timestamps.parse(rs.getString("last_accessed")),
            rs.getInt("is_active") != 0
        );
    }
}
