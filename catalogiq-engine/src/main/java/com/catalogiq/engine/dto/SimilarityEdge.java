package com.catalogiq.engine.dto;

import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.MatchConfidence;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Candidate duplicate pair. Always oriented so that {@code itemA < itemB}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimilarityEdge {

    private String itemA;
    private String itemB;

    /** Cosine similarity per aspect present on both items */
    private Map<Aspect, Double> aspectScores;

    /** Weighted combination of the aspect scores */
    private double combinedScore;

    /** Signals that accepted the pair: aspect names and/or "combined" */
    private List<String> triggeredBy;

    private MatchConfidence confidence;

    /** Absolute price difference between the two items */
    private BigDecimal priceGap;

    /** Oracle verdict; null when the oracle was not consulted or failed */
    private Boolean validated;
}
