package io.mycelic.core.session;

import io.mycelic.core.memory.AgentType;
import java.time.Instant;

public record AgentSession(
    String sessionId,
    AgentType agentType,
    String agentContext,
    Instant createdAt,
    Instant lastAccessed,
    boolean active
) {
}
