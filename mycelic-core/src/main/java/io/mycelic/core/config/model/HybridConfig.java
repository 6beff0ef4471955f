package io.mycelic.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HybridConfig(
    @JsonAlias({"keyword_weight"}) double keywordWeight,
    @JsonAlias({"semantic_weight"}) double semanticWeight,
    @JsonAlias({"overlap_boost"}) double overlapBoost
) {

    public static HybridConfig defaults() {
        return new HybridConfig(0.4, 0.6, 0.1);
    }
}
