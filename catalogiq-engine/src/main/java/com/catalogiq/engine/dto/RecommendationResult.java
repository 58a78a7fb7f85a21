package com.catalogiq.engine.dto;

import com.catalogiq.common.enums.PriceComparison;
import com.catalogiq.common.enums.RecommendationMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Ranked recommendation for one (target item, mode) pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendationResult {

    private String itemId;
    private String name;
    private String brand;
    private String category;
    private BigDecimal price;

    private RecommendationMode mode;

    /** Rank score: 0-10 rating for substitutes, similarity plus bonus for cross-sell */
    private double score;

    private double similarity;

    /** Best-effort rationale from the oracle */
    private String rationale;

    // Substitutes
    private PriceComparison priceComparison;
    private Double savingsPercent;

    // Cross-sell
    private BigDecimal bundlePrice;
    private BigDecimal bundleDiscountPrice;
}
