package io.mycelic.core.memory;

import java.util.List;

/**
 * Client input for a new memory. Null optional fields take their defaults; ids and timestamps
 * are always assigned by the store.
 */
public record MemoryDraft(
    String content,
    Integer importance,
    List<String> tags,
    String domain,
    String source,
    String sessionId,
    AgentType agentType,
    String agentContext,
    AccessScope accessScope,
    String slug
) {

    public static Builder builder(String content, String sessionId) {
        return new Builder(content, sessionId);
    }

    public static final class Builder {
        private final String content;
        private final String sessionId;
        private Integer importance;
        private List<String> tags = List.of();
        private String domain;
        private String source;
        private AgentType agentType;
        private String agentContext;
        private AccessScope accessScope;
        private String slug;

        private Builder(String content, String sessionId) {
            this.content = content;
            this.sessionId = sessionId;
        }

        public Builder importance(Integer value) {
            this.importance = value;
            return this;
        }

        public Builder tags(List<String> value) {
            this.tags = value;
            return this;
        }

        public Builder tags(String... value) {
            this.tags = List.of(value);
            return this;
        }

        public Builder domain(String value) {
            this.domain = value;
            return this;
        }

        public Builder source(String value) {
            this.source = value;
            return this;
        }

        public Builder agentType(AgentType value) {
            this.agentType = value;
            return this;
        }

        public Builder agentContext(String value) {
            this.agentContext = value;
            return this;
        }

        public Builder accessScope(AccessScope value) {
            this.accessScope = value;
            return this;
        }

        public Builder slug(String value) {
            this.slug = value;
            return this;
        }

        public MemoryDraft build() {
            return new MemoryDraft(content, importance, tags, domain, source, sessionId, agentType, agentContext, accessScope, slug);
        }
    }
}
