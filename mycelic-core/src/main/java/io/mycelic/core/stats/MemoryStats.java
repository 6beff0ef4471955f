package io.mycelic.core.stats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record MemoryStats(
    long totalMemories,
    double averageImportance,
    List<String> distinctTags,
    Instant oldestMemoryAt,
    Instant newestMemoryAt,
    Map<String, Long> memoriesByDomain,
    Map<String, Long> memoriesByCategory,
    long totalRelationships,
    long totalSessions,
    long totalDomains,
    long totalCategories,
    long embeddedMemories
) {
}
