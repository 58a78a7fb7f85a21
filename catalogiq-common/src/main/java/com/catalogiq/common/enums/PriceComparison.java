package com.catalogiq.common.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * Price position of a substitute relative to the item it replaces.
 */
public enum PriceComparison {
    BETTER_VALUE,
    SAME_PRICE,
    PREMIUM_OPTION;

    public static PriceComparison compare(BigDecimal candidatePrice, BigDecimal targetPrice) {
        int cmp = candidatePrice.compareTo(targetPrice);
        if (cmp < 0) {
            return BETTER_VALUE;
        }
        return cmp == 0 ? SAME_PRICE : PREMIUM_OPTION;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
