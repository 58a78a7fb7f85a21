package com.catalogiq.common.enums;

import com.catalogiq.common.exception.EngineException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named embedding channel of an item.
 * Every vector stored for one aspect has the same dimension across the catalog.
 */
public enum Aspect {
    TITLE,
    ATTRIBUTES,
    FULL,
    VISUAL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Aspect fromName(String name) {
        if (name == null || name.isBlank()) {
            throw EngineException.invalidParameter("aspect", name);
        }
        for (Aspect aspect : values()) {
            if (aspect.name().equalsIgnoreCase(name.trim())) {
                return aspect;
            }
        }
        throw EngineException.invalidParameter("aspect", name);
    }
}
