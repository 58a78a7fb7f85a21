package com.catalogiq.engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One hit of a similarity search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {
    /** Item ID */
    private String itemId;

    /** Cosine similarity score (higher is more similar) */
    private double similarityScore;

    /** Cosine distance, 1 - similarity */
    private Double distance;

    /** Optional: why the item matches the query, best-effort */
    private String explanation;
}
