package com.catalogiq.engine.service;

import com.catalogiq.common.exception.EngineException;

import java.util.List;

/**
 * Fixed-dimension vector operations shared by search, duplicate detection and ranking.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]. A zero vector on either side yields exactly 0.
     *
     * @throws EngineException DIMENSION_MISMATCH when the lengths differ
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw EngineException.dimensionMismatch(a.length, b.length);
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push identical directions slightly past 1
        return Math.max(-1.0, Math.min(1.0, similarity));
    }

    public static double cosineDistance(double[] a, double[] b) {
        return 1.0 - cosineSimilarity(a, b);
    }

    /**
     * Weighted mean {@code Σ(score·weight) / Σ(weight)}. Weights need not sum to 1.
     *
     * @throws EngineException EMPTY_INPUT on an empty list, INVALID_PARAMETER on a negative
     *                         weight or when all weights are zero
     */
    public static double weightedCombine(List<WeightedScore> scores) {
        if (scores == null || scores.isEmpty()) {
            throw EngineException.emptyInput("scores");
        }

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (WeightedScore ws : scores) {
            if (ws.weight() < 0 || Double.isNaN(ws.weight())) {
                throw EngineException.invalidParameter("weight", ws.weight());
            }
            weightedSum += ws.score() * ws.weight();
            totalWeight += ws.weight();
        }

        if (totalWeight == 0.0) {
            throw EngineException.invalidParameter("weights", "all zero");
        }
        return weightedSum / totalWeight;
    }

    public record WeightedScore(double score, double weight) {}
}
