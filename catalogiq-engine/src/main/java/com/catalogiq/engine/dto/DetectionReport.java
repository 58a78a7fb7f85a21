package com.catalogiq.engine.dto;

import java.math.BigDecimal;

/**
 * Summary of one duplicate detection run.
 */
public record DetectionReport(
        String runId,
        int totalItems,
        long pairsScored,
        int candidateEdges,
        int acceptedEdges,
        int oracleRejected,
        int oracleFailures,
        int groups,
        BigDecimal estimatedSavings,
        long durationMs
) {}
