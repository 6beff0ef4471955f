package io.mycelic.core.category;

import java.time.Instant;

public record Category(
    String id,
    String name,
    String description,
    String parentCategoryId,
    double confidenceThreshold,
    boolean autoGenerated,
    Instant createdAt
) {
}
