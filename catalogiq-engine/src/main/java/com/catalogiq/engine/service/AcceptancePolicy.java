package com.catalogiq.engine.service;

import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.MatchConfidence;
import com.catalogiq.common.exception.EngineException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Any-signal-fires acceptance rule for candidate duplicate pairs: a pair is accepted when
 * its combined score reaches the floor, or when any single aspect reaches its own override.
 * Both bounds are inclusive.
 */
public final class AcceptancePolicy {

    public static final String COMBINED = "combined";

    private final double combinedThreshold;
    private final Map<Aspect, Double> aspectOverrides;

    private AcceptancePolicy(double combinedThreshold, Map<Aspect, Double> aspectOverrides) {
        if (Double.isNaN(combinedThreshold) || combinedThreshold < -1.0 || combinedThreshold > 1.0) {
            throw EngineException.invalidParameter("threshold", combinedThreshold);
        }
        EnumMap<Aspect, Double> overrides = new EnumMap<>(Aspect.class);
        if (aspectOverrides != null) {
            aspectOverrides.forEach((aspect, bound) -> {
                if (bound == null || Double.isNaN(bound)) {
                    throw EngineException.invalidParameter("override." + aspect.toJson(), bound);
                }
                overrides.put(aspect, bound);
            });
        }
        this.combinedThreshold = combinedThreshold;
        this.aspectOverrides = Collections.unmodifiableMap(overrides);
    }

    public static AcceptancePolicy of(double combinedThreshold, Map<Aspect, Double> aspectOverrides) {
        return new AcceptancePolicy(combinedThreshold, aspectOverrides);
    }

    public static AcceptancePolicy combinedOnly(double combinedThreshold) {
        return new AcceptancePolicy(combinedThreshold, Map.of());
    }

    public double getCombinedThreshold() {
        return combinedThreshold;
    }

    public Map<Aspect, Double> getAspectOverrides() {
        return aspectOverrides;
    }

    public Decision evaluate(Map<Aspect, Double> aspectScores, double combinedScore) {
        List<String> triggeredBy = new ArrayList<>();
        double strongest = combinedScore;

        for (Map.Entry<Aspect, Double> override : aspectOverrides.entrySet()) {
            Double score = aspectScores.get(override.getKey());
            if (score != null && score >= override.getValue()) {
                triggeredBy.add(override.getKey().toJson());
                strongest = Math.max(strongest, score);
            }
        }
        if (combinedScore >= combinedThreshold) {
            triggeredBy.add(COMBINED);
        }

        boolean accepted = !triggeredBy.isEmpty();
        return new Decision(accepted, List.copyOf(triggeredBy), MatchConfidence.of(strongest));
    }

    @Override
    public String toString() {
        return "AcceptancePolicy{combined>=" + combinedThreshold + ", overrides=" + aspectOverrides + "}";
    }

    public record Decision(boolean accepted, List<String> triggeredBy, MatchConfidence confidence) {}
}
