package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.repository.EmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.SearchResult;
import com.catalogiq.engine.service.batch.CancellationToken;
import com.catalogiq.engine.spi.EmbeddingException;
import com.catalogiq.engine.spi.EmbeddingProvider;
import com.catalogiq.engine.spi.Oracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Callable;

/**
 * Ranked similarity search over one aspect of the catalog.
 * Full scan: every item holding the aspect is scored against the query vector.
 */
@Slf4j
@Service
public class SimilaritySearchService {

    static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::getSimilarityScore).reversed()
            .thenComparing(SearchResult::getItemId);

    private final EmbeddingStore embeddingStore;
    private final EngineConfig engineConfig;
    @Nullable
    private final EmbeddingProvider embeddingProvider;
    @Nullable
    private final Oracle oracle;

    public SimilaritySearchService(
            EmbeddingStore embeddingStore,
            EngineConfig engineConfig,
            @Autowired(required = false) @Nullable EmbeddingProvider embeddingProvider,
            @Autowired(required = false) @Nullable Oracle oracle) {
        this.embeddingStore = embeddingStore;
        this.engineConfig = engineConfig;
        this.embeddingProvider = embeddingProvider;
        this.oracle = oracle;

        if (embeddingProvider == null) {
            log.warn("No embedding provider configured - free-text search disabled");
        }
    }

    /**
     * Search with the configured minimum similarity.
     */
    public List<SearchResult> search(double[] queryVector, Aspect aspect, int topK) {
        return search(queryVector, aspect, topK, engineConfig.getSearch().getMinSimilarity());
    }

    /**
     * Items whose aspect vector has cosine similarity {@code >= minSimilarity} with the query,
     * highest first, ties by ascending item id, at most {@code topK}.
     *
     * @return empty list when nothing clears the threshold
     * @throws EngineException INVALID_TOP_K, EMPTY_INPUT or DIMENSION_MISMATCH
     */
    public List<SearchResult> search(double[] queryVector, Aspect aspect, int topK, double minSimilarity) {
        if (topK <= 0) {
            throw EngineException.invalidTopK(topK);
        }
        if (aspect == null) {
            throw EngineException.invalidParameter("aspect", null);
        }
        if (queryVector == null || queryVector.length == 0) {
            throw EngineException.emptyInput("query vector");
        }

        OptionalInt dimension = embeddingStore.dimension(aspect);
        if (dimension.isEmpty()) {
            log.debug("No item has a {} embedding", aspect.toJson());
            return List.of();
        }
        if (dimension.getAsInt() != queryVector.length) {
            throw EngineException.dimensionMismatch(aspect.toJson(), dimension.getAsInt(), queryVector.length);
        }

        long startTime = System.currentTimeMillis();
        List<SearchResult> matches = new ArrayList<>();
        int scanned = 0;

        for (Item item : embeddingStore.findAllItems()) {
            Optional<double[]> vector = embeddingStore.findEmbedding(item.getId(), aspect);
            if (vector.isEmpty()) {
                continue;
            }
            scanned++;
            double similarity = VectorMath.cosineSimilarity(queryVector, vector.get());
            if (similarity >= minSimilarity) {
                matches.add(SearchResult.builder()
                        .itemId(item.getId())
                        .similarityScore(similarity)
                        .distance(1.0 - similarity)
                        .build());
            }
        }

        List<SearchResult> results = matches.stream()
                .sorted(RANKING)
                .limit(topK)
                .toList();

        log.info("Similarity search ({}): {} scanned, {} passed threshold (>={}), returned {} in {}ms",
                aspect.toJson(), scanned, matches.size(), minSimilarity, results.size(),
                System.currentTimeMillis() - startTime);
        return results;
    }

    /**
     * Embed a free-text query and search with it. Embedding failures give an empty result.
     *
     * @param explain attach a best-effort oracle explanation to each hit
     */
    public List<SearchResult> searchText(String query, Aspect aspect, int topK, double minSimilarity, boolean explain) {
        if (query == null || query.isBlank()) {
            throw EngineException.emptyInput("query");
        }
        if (topK <= 0) {
            throw EngineException.invalidTopK(topK);
        }
        if (embeddingProvider == null || !embeddingProvider.isAvailable()) {
            log.warn("Embedding provider not available, returning no results");
            return List.of();
        }

        double[] queryVector;
        try {
            queryVector = embeddingProvider.embedText(query, aspect);
        } catch (EmbeddingException e) {
            log.warn("Failed to embed query '{}': {}", abbreviate(query), e.getMessage());
            return List.of();
        }
        if (queryVector == null || queryVector.length == 0) {
            log.warn("Embedding provider returned no vector for query '{}'", abbreviate(query));
            return List.of();
        }

        List<SearchResult> results = search(queryVector, aspect, topK, minSimilarity);
        if (explain && !results.isEmpty()) {
            attachExplanations(query, results);
        }
        return results;
    }

    private void attachExplanations(String query, List<SearchResult> results) {
        if (oracle == null || !oracle.isAvailable() || !engineConfig.getRecommendations().isExplanationsEnabled()) {
            return;
        }

        List<Callable<String>> calls = new ArrayList<>(results.size());
        for (SearchResult result : results) {
            Item item = embeddingStore.findItem(result.getItemId()).orElse(null);
            if (item == null) {
                calls.add(() -> null);
                continue;
            }
            String prompt = PromptTemplates.searchMatchExplanation(query, item);
            calls.add(() -> oracle.explain(prompt));
        }

        EngineConfig.Duplicates limits = engineConfig.getDuplicates();
        OracleExecutor executor = new OracleExecutor(
                limits.getOracleConcurrency(), limits.getOracleTimeoutMs(), limits.getBatchSize());
        List<OracleExecutor.Outcome<String>> outcomes = executor.invokeAll(calls, CancellationToken.NONE);

        int failures = 0;
        for (int i = 0; i < results.size(); i++) {
            OracleExecutor.Outcome<String> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                results.get(i).setExplanation(outcome.value());
            } else {
                failures++;
            }
        }
        if (failures > 0) {
            log.warn("Search explanations unavailable for {} of {} results", failures, results.size());
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
