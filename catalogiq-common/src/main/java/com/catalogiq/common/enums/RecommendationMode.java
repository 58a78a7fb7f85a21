package com.catalogiq.common.enums;

import com.catalogiq.common.exception.EngineException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of recommendation requested for a target item.
 */
public enum RecommendationMode {
    SUBSTITUTES,
    CROSS_SELL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase().replace('_', '-');
    }

    @JsonCreator
    public static RecommendationMode fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase().replace('-', '_');
            for (RecommendationMode mode : values()) {
                if (mode.name().equals(normalized)) {
                    return mode;
                }
            }
        }
        throw EngineException.invalidParameter("mode", name);
    }
}
