package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchConfig(
    @JsonAlias({"default_limit"}) int defaultLimit,
    @JsonAlias({"max_limit"}) int maxLimit,
    @JsonAlias({"candidate_limit"}) int candidateLimit,
    @JsonAlias({"worker_threads"}) int workerThreads,
    HybridConfig hybrid
) {

    public static SearchConfig defaults() {
        return new SearchConfig(10, 100, 1000, 4, HybridConfig.defaults());
    }
}
