package io.mycelic.core.graph;

import java.time.Instant;

public record Relationship(
    String id,
    String sourceMemoryId,
    String targetMemoryId,
    RelationshipType type,
    double strength,
    String context,
    boolean autoGenerated,
    Instant createdAt
) {

    public String otherEnd(String memoryId) {
        return sourceMemoryId.equals(memoryId) ? targetMemoryId : sourceMemoryId;
    }
}
