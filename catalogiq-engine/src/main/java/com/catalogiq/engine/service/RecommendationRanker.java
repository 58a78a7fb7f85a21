package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.model.ItemEmbeddings;
import com.catalogiq.catalog.repository.EmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.OracleFailurePolicy;
import com.catalogiq.common.enums.PriceComparison;
import com.catalogiq.common.enums.RecommendationMode;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.RecommendationResult;
import com.catalogiq.engine.service.batch.CancellationToken;
import com.catalogiq.engine.spi.Oracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Substitute and cross-sell recommendations for a target item.
 *
 * Both modes filter candidates by embedding similarity and attributes, score them,
 * sort deterministically and truncate. Rationale strings are attached last and only
 * to the returned results; a failing explanation never changes which items are
 * returned or their order.
 */
@Slf4j
@Service
public class RecommendationRanker {

    private static final BigDecimal BUNDLE_DISCOUNT = new BigDecimal("0.9");
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final EmbeddingStore embeddingStore;
    private final EngineConfig engineConfig;
    @Nullable
    private final Oracle oracle;

    public RecommendationRanker(
            EmbeddingStore embeddingStore,
            EngineConfig engineConfig,
            @Autowired(required = false) @Nullable Oracle oracle) {
        this.embeddingStore = embeddingStore;
        this.engineConfig = engineConfig;
        this.oracle = oracle;
    }

    /**
     * Rank recommendations using configured parameters.
     *
     * @return empty list when no candidate passes the mode's filters
     * @throws EngineException UNKNOWN_ITEM or INVALID_TOP_K
     */
    public List<RecommendationResult> rank(String targetId, RecommendationMode mode, int topK) {
        if (mode == null) {
            throw EngineException.invalidParameter("mode", null);
        }
        EngineConfig.Recommendations config = engineConfig.getRecommendations();
        return switch (mode) {
            case SUBSTITUTES -> findSubstitutes(targetId, config.getSubstitutePriceVariance(), topK);
            case CROSS_SELL -> findCrossSell(targetId, config.getCustomerSegment(), topK);
        };
    }

    /**
     * Same-category items within {@code ±maxPriceVariance} of the target price and above the
     * similarity floor, rated 0-10 by the oracle and cut at the configured score.
     */
    public List<RecommendationResult> findSubstitutes(String targetId, double maxPriceVariance, int topK) {
        if (topK <= 0) {
            throw EngineException.invalidTopK(topK);
        }
        if (maxPriceVariance < 0 || Double.isNaN(maxPriceVariance)) {
            throw EngineException.invalidParameter("maxPriceVariance", maxPriceVariance);
        }
        Item target = requireItem(targetId);
        EngineConfig.Recommendations config = engineConfig.getRecommendations();
        ItemEmbeddings targetVectors = embeddingStore.findEmbeddings(target.getId());

        BigDecimal variance = BigDecimal.valueOf(maxPriceVariance);
        BigDecimal minPrice = target.getPrice().multiply(BigDecimal.ONE.subtract(variance));
        BigDecimal maxPrice = target.getPrice().multiply(BigDecimal.ONE.add(variance));

        List<Candidate> candidates = new ArrayList<>();
        for (Item item : embeddingStore.findAllItems()) {
            if (item.getId().equals(target.getId())
                    || target.getCategory() == null
                    || !target.getCategory().equals(item.getCategory())
                    || item.getPrice().compareTo(minPrice) < 0
                    || item.getPrice().compareTo(maxPrice) > 0) {
                continue;
            }
            ItemEmbeddings vectors = embeddingStore.findEmbeddings(item.getId());
            OptionalDouble floorSimilarity = similarity(targetVectors, vectors, Aspect.ATTRIBUTES, Aspect.FULL);
            if (floorSimilarity.isEmpty() || floorSimilarity.getAsDouble() < config.getSubstituteSimilarityFloor()) {
                continue;
            }
            double reported = similarity(targetVectors, vectors, Aspect.FULL, Aspect.ATTRIBUTES)
                    .orElse(floorSimilarity.getAsDouble());
            candidates.add(new Candidate(item, reported));
        }

        List<RecommendationResult> scored = scoreSubstitutes(target, candidates);
        List<RecommendationResult> results = scored.stream()
                .filter(result -> result.getScore() >= config.getSubstituteScoreCutoff())
                .sorted(Comparator.comparingDouble(RecommendationResult::getScore).reversed()
                        .thenComparing(Comparator.comparingDouble(RecommendationResult::getSimilarity).reversed())
                        .thenComparing(RecommendationResult::getItemId))
                .limit(topK)
                .toList();

        attachRationales(results, item -> PromptTemplates.substituteReason(target, item));
        log.info("Substitutes for {}: {} candidates, {} scored >= {}, returned {}",
                target.getId(), candidates.size(), scored.stream()
                        .filter(r -> r.getScore() >= config.getSubstituteScoreCutoff()).count(),
                config.getSubstituteScoreCutoff(), results.size());
        return results;
    }

    /**
     * Items in the moderate similarity band (complementary, neither near-duplicates nor
     * unrelated), confirmed by the oracle, with a bonus for a different category.
     */
    public List<RecommendationResult> findCrossSell(String targetId, String customerSegment, int topK) {
        if (topK <= 0) {
            throw EngineException.invalidTopK(topK);
        }
        Item target = requireItem(targetId);
        EngineConfig.Recommendations config = engineConfig.getRecommendations();
        ItemEmbeddings targetVectors = embeddingStore.findEmbeddings(target.getId());
        String segment = customerSegment == null || customerSegment.isBlank()
                ? config.getCustomerSegment() : customerSegment;

        List<Candidate> banded = new ArrayList<>();
        for (Item item : embeddingStore.findAllItems()) {
            if (item.getId().equals(target.getId())) {
                continue;
            }
            OptionalDouble similarity = similarity(
                    targetVectors, embeddingStore.findEmbeddings(item.getId()), Aspect.FULL, Aspect.ATTRIBUTES);
            if (similarity.isEmpty()) {
                continue;
            }
            double value = similarity.getAsDouble();
            if (value >= config.getCrossSellMinSimilarity() && value <= config.getCrossSellMaxSimilarity()) {
                banded.add(new Candidate(item, value));
            }
        }

        List<Candidate> confirmed = confirmCrossSell(target, banded, segment);
        int limit = Math.min(topK, Math.max(1, config.getCrossSellLimit()));

        List<RecommendationResult> results = confirmed.stream()
                .map(candidate -> toCrossSell(target, candidate, config.getCrossSellCategoryBonus()))
                .sorted(Comparator.comparingDouble(RecommendationResult::getScore).reversed()
                        .thenComparing(RecommendationResult::getPrice)
                        .thenComparing(RecommendationResult::getItemId))
                .limit(limit)
                .toList();

        attachRationales(results, item -> PromptTemplates.crossSellReason(target, item));
        log.info("Cross-sell for {} (segment={}): {} in band, {} confirmed, returned {}",
                target.getId(), segment, banded.size(), confirmed.size(), results.size());
        return results;
    }

    private List<RecommendationResult> scoreSubstitutes(Item target, List<Candidate> candidates) {
        List<Double> ratings = new ArrayList<>(candidates.size());
        OracleFailurePolicy policy = engineConfig.getDuplicates().getFailurePolicy();

        if (!oracleAvailable()) {
            candidates.forEach(candidate -> ratings.add(candidate.similarity() * 10.0));
        } else {
            List<Callable<Double>> calls = new ArrayList<>(candidates.size());
            for (Candidate candidate : candidates) {
                String prompt = PromptTemplates.substituteRating(target, candidate.item(), candidate.similarity());
                calls.add(() -> oracle.scoreScalar(prompt));
            }
            List<OracleExecutor.Outcome<Double>> outcomes = newExecutor().invokeAll(calls, CancellationToken.NONE);
            int failures = 0;
            for (int i = 0; i < candidates.size(); i++) {
                OracleExecutor.Outcome<Double> outcome = outcomes.get(i);
                if (outcome.isSuccess() && outcome.value() != null && !outcome.value().isNaN()) {
                    ratings.add(outcome.value());
                    continue;
                }
                failures++;
                ratings.add(policy == OracleFailurePolicy.STRICT ? null : candidates.get(i).similarity() * 10.0);
            }
            if (failures > 0) {
                log.warn("Substitute rating failed for {} of {} candidates (policy={})",
                        failures, candidates.size(), policy);
            }
        }

        List<RecommendationResult> results = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            Double rating = ratings.get(i);
            if (rating == null) {
                continue;
            }
            results.add(toSubstitute(target, candidates.get(i), clamp(rating, 0.0, 10.0)));
        }
        return results;
    }

    private List<Candidate> confirmCrossSell(Item target, List<Candidate> banded, String segment) {
        if (!oracleAvailable() || banded.isEmpty()) {
            return banded;
        }

        List<Callable<Boolean>> calls = new ArrayList<>(banded.size());
        for (Candidate candidate : banded) {
            String prompt = PromptTemplates.crossSellCheck(segment, target, candidate.item());
            calls.add(() -> oracle.validateBool(prompt));
        }
        List<OracleExecutor.Outcome<Boolean>> outcomes = newExecutor().invokeAll(calls, CancellationToken.NONE);
        OracleFailurePolicy policy = engineConfig.getDuplicates().getFailurePolicy();

        List<Candidate> confirmed = new ArrayList<>();
        int failures = 0;
        for (int i = 0; i < banded.size(); i++) {
            OracleExecutor.Outcome<Boolean> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                if (Boolean.TRUE.equals(outcome.value())) {
                    confirmed.add(banded.get(i));
                }
            } else {
                failures++;
                if (policy != OracleFailurePolicy.STRICT) {
                    confirmed.add(banded.get(i));
                }
            }
        }
        if (failures > 0) {
            log.warn("Cross-sell check failed for {} of {} candidates (policy={})", failures, banded.size(), policy);
        }
        return confirmed;
    }

    private RecommendationResult toSubstitute(Item target, Candidate candidate, double rating) {
        Item item = candidate.item();
        return RecommendationResult.builder()
                .itemId(item.getId())
                .name(item.getName())
                .brand(item.getBrand())
                .category(item.getCategory())
                .price(item.getPrice())
                .mode(RecommendationMode.SUBSTITUTES)
                .score(rating)
                .similarity(candidate.similarity())
                .priceComparison(PriceComparison.compare(item.getPrice(), target.getPrice()))
                .savingsPercent(savingsPercent(target.getPrice(), item.getPrice()))
                .build();
    }

    private RecommendationResult toCrossSell(Item target, Candidate candidate, double categoryBonus) {
        Item item = candidate.item();
        double bonus = Objects.equals(item.getCategory(), target.getCategory()) ? 0.0 : categoryBonus;
        BigDecimal bundlePrice = target.getPrice().add(item.getPrice());
        return RecommendationResult.builder()
                .itemId(item.getId())
                .name(item.getName())
                .brand(item.getBrand())
                .category(item.getCategory())
                .price(item.getPrice())
                .mode(RecommendationMode.CROSS_SELL)
                .score(candidate.similarity() + bonus)
                .similarity(candidate.similarity())
                .bundlePrice(bundlePrice)
                .bundleDiscountPrice(bundlePrice.multiply(BUNDLE_DISCOUNT).setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    private void attachRationales(List<RecommendationResult> results, Function<Item, String> prompt) {
        if (results.isEmpty() || !oracleAvailable() || !engineConfig.getRecommendations().isExplanationsEnabled()) {
            return;
        }
        List<Callable<String>> calls = new ArrayList<>(results.size());
        for (RecommendationResult result : results) {
            String text = embeddingStore.findItem(result.getItemId()).map(prompt).orElse(null);
            calls.add(() -> text == null ? null : oracle.explain(text));
        }
        List<OracleExecutor.Outcome<String>> outcomes = newExecutor().invokeAll(calls, CancellationToken.NONE);
        for (int i = 0; i < results.size(); i++) {
            OracleExecutor.Outcome<String> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                results.get(i).setRationale(outcome.value());
            } else {
                log.debug("No rationale for {}: {}", results.get(i).getItemId(), outcome.failureMessage());
            }
        }
    }

    /**
     * Cosine similarity on the first aspect both items hold, in preference order.
     */
    private static OptionalDouble similarity(ItemEmbeddings a, ItemEmbeddings b, Aspect... preference) {
        for (Aspect aspect : preference) {
            if (a.has(aspect) && b.has(aspect)) {
                try {
                    return OptionalDouble.of(VectorMath.cosineSimilarity(a.get(aspect).get(), b.get(aspect).get()));
                } catch (EngineException e) {
                    log.warn("Skipping {} similarity for {}-{}: {}",
                            aspect.toJson(), a.getItemId(), b.getItemId(), e.getMessage());
                    return OptionalDouble.empty();
                }
            }
        }
        return OptionalDouble.empty();
    }

    private static Double savingsPercent(BigDecimal targetPrice, BigDecimal price) {
        if (targetPrice.signum() == 0) {
            return 0.0;
        }
        return targetPrice.subtract(price)
                .multiply(HUNDRED)
                .divide(targetPrice, 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private Item requireItem(String itemId) {
        return embeddingStore.findItem(itemId).orElseThrow(() -> EngineException.unknownItem(itemId));
    }

    private boolean oracleAvailable() {
        return oracle != null && oracle.isAvailable();
    }

    private OracleExecutor newExecutor() {
        EngineConfig.Duplicates limits = engineConfig.getDuplicates();
        return new OracleExecutor(limits.getOracleConcurrency(), limits.getOracleTimeoutMs(), limits.getBatchSize());
    }

    private record Candidate(Item item, double similarity) {}
}
