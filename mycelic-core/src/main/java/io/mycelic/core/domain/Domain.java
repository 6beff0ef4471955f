package io.mycelic.core.domain;

import java.time.Instant;

public record Domain(
    String id,
    String name,
    String description,
    Instant createdAt,
    Instant updatedAt
) {
}
