package io.mycelic.core.memory;

public record MemoryQuery(
    String domain,
    String sessionId,
    Integer minImportance,
    Integer maxImportance,
    Integer limit,
    Integer offset
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 1000;

    public static MemoryQuery all() {
        return new MemoryQuery(null, null, null, null, null, null);
    }

    public static MemoryQuery bySession(String sessionId) {
        return new MemoryQuery(null, sessionId, null, null, null, null);
    }

    public static MemoryQuery byDomain(String domain) {
        return new MemoryQuery(domain, null, null, null, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public int effectiveOffset() {
        return offset == null ? 0 : offset;
    }
}
