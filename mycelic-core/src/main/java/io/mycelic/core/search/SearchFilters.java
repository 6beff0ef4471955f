package io.mycelic.core.search;

import io.mycelic.core.memory.AccessScope;
import io.mycelic.core.memory.Memory;

/**
 * Filters applied to every search mode after candidates have been scored. When
 * {@code sessionMode} is null it defaults to {@link SessionFilterMode#SESSION_ONLY} if a session
 * id is given and to {@link SessionFilterMode#ALL} otherwise.
 */
public record SearchFilters(
    String domain,
    String sessionId,
    AccessScope accessScope,
    SessionFilterMode sessionMode
) {

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null);
    }

    public SessionFilterMode effectiveSessionMode() {
        if (sessionMode != null) {
            return sessionMode;
        }
        return hasSession() ? SessionFilterMode.SESSION_ONLY : SessionFilterMode.ALL;
    }

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }

    public boolean accepts(Memory memory) {
        if (domain != null && !domain.isBlank() && !domain.trim().equalsIgnoreCase(memory.domain())) {
            return false;
        }
        if (accessScope != null && memory.accessScope() != accessScope) {
            return false;
        }
        return switch (effectiveSessionMode()) {
            case ALL -> true;
            case SESSION_ONLY -> sessionId.trim().equals(memory.sessionId());
            case SESSION_AND_SHARED -> sessionId.trim().equals(memory.sessionId())
                || memory.accessScope() == AccessScope.SHARED
                || memory.accessScope() == AccessScope.GLOBAL;
        };
    }
}
