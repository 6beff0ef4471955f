package io.mycelic.core.session;

import io.mycelic.core.memory.AgentType;
import java.time.Instant;

public record SessionStats(
    String sessionId,
    AgentType agentType,
    boolean active,
    long memoryCount,
    Instant createdAt,
    Instant lastAccessed
) {
}
