package com.catalogiq.engine.config;

import com.catalogiq.common.enums.OracleFailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the similarity engine.
 * Maps to catalogiq.engine.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalogiq.engine")
public class EngineConfig {

    private Search search = new Search();
    private Duplicates duplicates = new Duplicates();
    private Recommendations recommendations = new Recommendations();

    @Data
    public static class Search {
        /** Number of results when the caller does not ask for a count */
        private int defaultTopK = 10;
        /** Minimum cosine similarity (0-1) */
        private double minSimilarity = 0.7;
        /** Aspect searched when none is given */
        private String defaultAspect = "full";
    }

    @Data
    public static class Duplicates {
        /** Combined-score floor for a candidate edge (inclusive) */
        private double threshold = 0.85;
        /** Weight of each aspect in the combined score */
        private Map<String, Double> aspectWeights = new LinkedHashMap<>(Map.of(
                "full", 0.5,
                "title", 0.3,
                "attributes", 0.2));
        /** Per-aspect score that accepts a pair on its own */
        private Map<String, Double> aspectOverrides = new LinkedHashMap<>(Map.of(
                "title", 0.95,
                "attributes", 0.85));
        /** Only compare items of the same category */
        private boolean sameCategoryOnly = true;
        /** Ask the oracle to confirm each candidate */
        private boolean validationEnabled = true;
        /** Handling of oracle timeouts and errors */
        private OracleFailurePolicy failurePolicy = OracleFailurePolicy.DEGRADE;
        /** Items per scoring task, and candidates per oracle batch */
        private int batchSize = 500;
        /** Scoring threads */
        private int workerThreads = 4;
        /** Concurrent oracle calls */
        private int oracleConcurrency = 8;
        /** Per-call oracle timeout */
        private long oracleTimeoutMs = 10_000;
        /** Master record rule: highest-price, lowest-price or lowest-id */
        private String masterSelection = "highest-price";
        /** Redundancy cost rule: non-master-value, sum-minus-min or price-spread */
        private String costFunction = "non-master-value";
        /** Attach a best-effort merge recommendation to each group */
        private boolean mergeRecommendations = false;
    }

    @Data
    public static class Recommendations {
        /** Allowed relative price difference for substitutes */
        private double substitutePriceVariance = 0.3;
        /** Minimum aspect similarity for substitutes */
        private double substituteSimilarityFloor = 0.5;
        /** Minimum 0-10 suitability rating for substitutes */
        private double substituteScoreCutoff = 6.0;
        /** Lower bound of the cross-sell similarity band */
        private double crossSellMinSimilarity = 0.4;
        /** Upper bound of the cross-sell similarity band */
        private double crossSellMaxSimilarity = 0.8;
        /** Score added to cross-category complements */
        private double crossSellCategoryBonus = 0.2;
        /** Hard cap on cross-sell results */
        private int crossSellLimit = 5;
        /** Customer segment named in cross-sell prompts */
        private String customerSegment = "general";
        /** Attach best-effort rationale strings */
        private boolean explanationsEnabled = true;
    }
}
