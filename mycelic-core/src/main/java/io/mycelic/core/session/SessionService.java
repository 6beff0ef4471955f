package io.mycelic.core.session;

import io.mycelic.core.db.Database;
import io.mycelic.core.db.TimestampSource;
import io.mycelic.core.db.Timestamps;
import io.mycelic.core.error.NotFoundException;
import io.mycelic.core.error.ValidationException;
import io.mycelic.core.memory.AgentType;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Session metadata. There is no process-wide current session; callers always name one.
 */
public final class SessionService {
    private final Database database;
    private final TimestampSource timestamps;
    private final SessionRepository sessions;

    public SessionService(Database database, TimestampSource timestamps, SessionRepository sessions) {
        this.database = database;
        this.timestamps = timestamps;
        this.sessions = sessions;
    }

    public AgentSession touch(String sessionId, AgentType agentType, String agentContext) {
        String id = requireId(sessionId);
        return database.write("touch session", connection -> {
            sessions.touch(connection, id, agentType, agentContext, timestamps.next());
            return sessions.find(connection, id).orElseThrow();
        });
    }

    public AgentSession get(String sessionId) {
        String id = requireId(sessionId);
        return database.read("load session", connection -> sessions.find(connection, id))
            .orElseThrow(() -> new NotFoundException("Session not found: " + id));
    }

    public List<AgentSession> list() {
        return database.read("list sessions", sessions::list);
    }

    public void deactivate(String sessionId) {
        String id = requireId(sessionId);
        boolean updated = database.write("deactivate session", connection -> sessions.deactivate(connection, id, timestamps.next()));
        if (!updated) {
            throw new NotFoundException("Session not found: " + id);
        }
    }

    /**
     * Memory counts per session, most recently used first.
     */
    public List<SessionStats> stats() {
        return database.read("session stats", connection -> {
            String sql = """
                SELECT s.session_id, s.agent_type, s.is_active, s.created_at, s.last_accessed, COUNT(m.id) AS memory_count
                FROM agent_sessions s
                LEFT JOIN memories m ON m.session_id = s.session_id
                GROUP BY s.session_id
                ORDER BY s.last_accessed DESC
                """;
            try (PreparedStatement statement = connection.prepareStatement(sql);
                 ResultSet rs = statement.executeQuery()) {
                List<SessionStats> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new SessionStats(
                        rs.getString("session_id"),
                        AgentType.parse(rs.getString("agent_type")),
                        rs.getInt("is_active") != 0,
                        rs.getLong("memory_count"),
                        Timestamps.parse(rs.getString("created_at")),
                        Timestamps.parse(rs.getString("last_accessed"))
                    ));
                }
                return out;
            }
        });
    }

    private static String requireId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId must not be blank");
        }
        return sessionId.trim();
    }
}
