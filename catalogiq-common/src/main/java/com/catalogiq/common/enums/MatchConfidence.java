package com.catalogiq.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence band of a duplicate match, from its strongest similarity signal.
 */
public enum MatchConfidence {
    DEFINITE(0.95),
    LIKELY(0.90),
    POSSIBLE(0.85),
    SIMILAR(Double.NEGATIVE_INFINITY);

    private final double lowerBound;

    MatchConfidence(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public static MatchConfidence of(double score) {
        for (MatchConfidence confidence : values()) {
            if (score >= confidence.lowerBound) {
                return confidence;
            }
        }
        return SIMILAR;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
