package io.mycelic.core.category;

import java.time.Instant;

public record Categorization(
    String memoryId,
    String categoryId,
    String categoryName,
    double confidence,
    String reasoning,
    Instant createdAt
) {
}
