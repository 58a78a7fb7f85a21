package com.catalogiq.engine.dto;

import com.catalogiq.common.enums.OracleFailurePolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Parameters of a duplicate detection run. Null fields fall back to configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRequest {

    @DecimalMin(value = "-1.0", message = "Threshold must be at least -1")
    @DecimalMax(value = "1.0", message = "Threshold must not exceed 1")
    private Double threshold;

    private Boolean sameCategoryOnly;

    /** Aspect name to weight */
    private Map<String, Double> aspectWeights;

    /** Aspect name to minimum score that accepts a pair on its own */
    private Map<String, Double> aspectOverrides;

    private Boolean validate;

    private OracleFailurePolicy failurePolicy;

    /** Include the accepted edges in the response */
    private Boolean includeEdges;
}
