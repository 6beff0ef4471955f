package io.mycelic.core.search;

import io.mycelic.core.config.model.HybridConfig;

public record HybridWeights(double keywordWeight, double semanticWeight, double overlapBoost) {

    public HybridWeights {
        if (keywordWeight < 0 || semanticWeight < 0 || overlapBoost < 0) {
            throw new IllegalArgumentException("hybrid weights must not be negative");
        }
    }

    public static HybridWeights defaults() {
        return from(HybridConfig.defaults());
    }

    public static HybridWeights from(HybridConfig config) {
        return new HybridWeights(config.keywordWeight(), config.semanticWeight(), config.overlapBoost());
    }

    public double fuse(double keyword, double semantic, boolean inBoth) {
        double score = keywordWeight * keyword + semanticWeight * semantic + (inBoth ? overlapBoost : 0.0);
        return Math.min(1.0, score);
    }
}
