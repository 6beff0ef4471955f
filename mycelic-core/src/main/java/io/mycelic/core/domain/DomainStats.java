package io.mycelic.core.domain;

import java.time.Instant;

public record DomainStats(
    String name,
    String description,
    long memoryCount,
    double averageImportance,
    Instant createdAt,
    Instant updatedAt,
    Instant lastMemoryAt
) {
}
