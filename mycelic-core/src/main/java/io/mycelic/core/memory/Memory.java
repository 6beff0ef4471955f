package io.mycelic.core.memory;

import java.time.Instant;
import java.util.List;

public record Memory(
    String id,
    String content,
    int importance,
    List<String> tags,
    String domain,
    String source,
    String sessionId,
    AgentType agentType,
    String agentContext,
    AccessScope accessScope,
    String slug,
    String parentMemoryId,
    int chunkLevel,
    int chunkIndex,
    boolean embedded,
    Instant createdAt,
    Instant updatedAt
) {

    public Memory {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
