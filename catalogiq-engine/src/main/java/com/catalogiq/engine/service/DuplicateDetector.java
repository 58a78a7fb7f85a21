package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.model.ItemEmbeddings;
import com.catalogiq.catalog.repository.EmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.OracleFailurePolicy;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.SimilarityEdge;
import com.catalogiq.engine.service.batch.CancellationToken;
import com.catalogiq.engine.spi.Oracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Pairwise duplicate candidate generation.
 *
 * Pairs {@code (i, j)} with {@code i.id < j.id} are scored per aspect, combined with
 * {@link VectorMath#weightedCombine}, gated by an {@link AcceptancePolicy} and optionally
 * confirmed by the oracle. Scoring is fanned out over row ranges to a worker pool and the
 * per-range edge lists are concatenated in range order.
 */
@Slf4j
@Service
public class DuplicateDetector {

    static final Comparator<SimilarityEdge> EDGE_ORDER = Comparator
            .comparingDouble(SimilarityEdge::getCombinedScore).reversed()
            .thenComparing(SimilarityEdge::getItemA)
            .thenComparing(SimilarityEdge::getItemB);

    private final EmbeddingStore embeddingStore;
    private final EngineConfig engineConfig;
    @Nullable
    private final Oracle oracle;

    public DuplicateDetector(
            EmbeddingStore embeddingStore,
            EngineConfig engineConfig,
            @Autowired(required = false) @Nullable Oracle oracle) {
        this.embeddingStore = embeddingStore;
        this.engineConfig = engineConfig;
        this.oracle = oracle;
    }

    /**
     * Candidate edges using the configured aspect overrides and oracle settings.
     */
    public List<SimilarityEdge> findDuplicates(
            List<Item> items, Map<Aspect, Double> aspectWeights, double threshold, boolean sameCategoryOnly) {
        EngineConfig.Duplicates config = engineConfig.getDuplicates();
        AcceptancePolicy policy = AcceptancePolicy.of(threshold, toAspectMap(config.getAspectOverrides()));
        return findDuplicates(items, aspectWeights, policy, sameCategoryOnly);
    }

    public List<SimilarityEdge> findDuplicates(
            List<Item> items, Map<Aspect, Double> aspectWeights, AcceptancePolicy policy, boolean sameCategoryOnly) {
        EngineConfig.Duplicates config = engineConfig.getDuplicates();
        Settings settings = new Settings(aspectWeights, policy, sameCategoryOnly,
                config.isValidationEnabled(), config.getFailurePolicy());
        return detect(items, settings, CancellationToken.NONE).edges();
    }

    /**
     * Full detection with run statistics and cooperative cancellation.
     *
     * @throws EngineException DETECTION_CANCELLED when the token fires before all batches ran
     */
    public Detection detect(List<Item> items, Settings settings, CancellationToken token) {
        validateWeights(settings.aspectWeights());
        if (items == null || items.isEmpty()) {
            return new Detection(List.of(), 0, 0, 0, 0);
        }

        long startTime = System.currentTimeMillis();
        List<Item> ordered = distinctById(items);
        Set<Aspect> scoredAspects = EnumSet.noneOf(Aspect.class);
        scoredAspects.addAll(settings.aspectWeights().keySet());
        scoredAspects.addAll(settings.policy().getAspectOverrides().keySet());

        List<Item> eligible = new ArrayList<>(ordered.size());
        List<Map<Aspect, double[]>> vectors = new ArrayList<>(ordered.size());
        for (Item item : ordered) {
            ItemEmbeddings found = embeddingStore.findEmbeddings(item.getId());
            if (found.aspects().stream().anyMatch(settings.aspectWeights()::containsKey)) {
                eligible.add(item);
                vectors.add(snapshot(found, scoredAspects));
            } else {
                log.debug("Item {} has no weighted aspect embeddings, skipped", item.getId());
            }
        }

        ScoreBatch scored = scoreAll(eligible, vectors, scoredAspects, settings, token);
        List<SimilarityEdge> candidates = scored.edges();
        log.info("Scored {} pairs over {} items ({} eligible): {} candidate edges, policy={}",
                scored.pairsScored(), ordered.size(), eligible.size(), candidates.size(), settings.policy());

        Detection detection = settings.validate()
                ? validate(candidates, eligible, settings.failurePolicy(), scored.pairsScored(), token)
                : new Detection(sorted(candidates), scored.pairsScored(), candidates.size(), 0, 0);

        log.info("Duplicate detection complete in {}ms: {} accepted of {} candidates ({} rejected, {} oracle failures)",
                System.currentTimeMillis() - startTime, detection.edges().size(), detection.candidateEdges(),
                detection.oracleRejected(), detection.oracleFailures());
        return detection;
    }

    private ScoreBatch scoreAll(List<Item> items, List<Map<Aspect, double[]>> vectors, Set<Aspect> scoredAspects,
                                Settings settings, CancellationToken token) {
        int rowsPerTask = Math.max(1, engineConfig.getDuplicates().getBatchSize());
        List<Callable<ScoreBatch>> tasks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += rowsPerTask) {
            int from = start;
            int to = Math.min(start + rowsPerTask, items.size());
            tasks.add(() -> token.isCancelled()
                    ? ScoreBatch.SKIPPED
                    : scoreRows(from, to, items, vectors, scoredAspects, settings));
        }

        int threads = Math.max(1, Math.min(engineConfig.getDuplicates().getWorkerThreads(), tasks.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<ScoreBatch>> futures = new ArrayList<>(tasks.size());
        try {
            for (Callable<ScoreBatch> task : tasks) {
                futures.add(executor.submit(task));
            }

            List<SimilarityEdge> edges = new ArrayList<>();
            long pairs = 0;
            boolean skipped = false;
            for (Future<ScoreBatch> future : futures) {
                ScoreBatch batch = future.get();
                if (batch.skipped()) {
                    skipped = true;
                    continue;
                }
                edges.addAll(batch.edges());
                pairs += batch.pairsScored();
            }

            if (skipped) {
                log.warn("Duplicate scoring cancelled after {} pairs", pairs);
                throw EngineException.detectionCancelled();
            }
            return new ScoreBatch(edges, pairs, false);

        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Duplicate scoring failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw EngineException.detectionCancelled();
        } finally {
            executor.shutdownNow();
        }
    }

    private ScoreBatch scoreRows(int from, int to, List<Item> items, List<Map<Aspect, double[]>> vectors,
                                 Set<Aspect> scoredAspects, Settings settings) {
        List<SimilarityEdge> edges = new ArrayList<>();
        long pairs = 0;
        for (int i = from; i < to; i++) {
            Item a = items.get(i);
            for (int j = i + 1; j < items.size(); j++) {
                Item b = items.get(j);
                if (settings.sameCategoryOnly() && !Objects.equals(a.getCategory(), b.getCategory())) {
                    continue;
                }
                pairs++;
                SimilarityEdge edge = scorePair(a, b, vectors.get(i), vectors.get(j), scoredAspects, settings);
                if (edge != null) {
                    edges.add(edge);
                }
            }
        }
        return new ScoreBatch(edges, pairs, false);
    }

    // One copy per item and aspect, read by every pair of the run.
    private static Map<Aspect, double[]> snapshot(ItemEmbeddings embeddings, Set<Aspect> aspects) {
        Map<Aspect, double[]> copy = new EnumMap<>(Aspect.class);
        for (Aspect aspect : aspects) {
            embeddings.get(aspect).ifPresent(vector -> copy.put(aspect, vector));
        }
        return copy;
    }

    private SimilarityEdge scorePair(Item a, Item b, Map<Aspect, double[]> ea, Map<Aspect, double[]> eb,
                                     Set<Aspect> scoredAspects, Settings settings) {
        Map<Aspect, Double> scores = new EnumMap<>(Aspect.class);
        for (Aspect aspect : scoredAspects) {
            if (!ea.containsKey(aspect) || !eb.containsKey(aspect)) {
                continue;
            }
            try {
                scores.put(aspect, VectorMath.cosineSimilarity(ea.get(aspect), eb.get(aspect)));
            } catch (EngineException e) {
                log.warn("Skipping pair {}-{} on {}: {}", a.getId(), b.getId(), aspect.toJson(), e.getMessage());
                return null;
            }
        }

        List<VectorMath.WeightedScore> weighted = new ArrayList<>();
        double totalWeight = 0.0;
        for (Map.Entry<Aspect, Double> weight : settings.aspectWeights().entrySet()) {
            Double score = scores.get(weight.getKey());
            if (score != null) {
                weighted.add(new VectorMath.WeightedScore(score, weight.getValue()));
                totalWeight += weight.getValue();
            }
        }
        if (weighted.isEmpty() || totalWeight == 0.0) {
            return null;
        }

        double combined = VectorMath.weightedCombine(weighted);
        AcceptancePolicy.Decision decision = settings.policy().evaluate(scores, combined);
        if (!decision.accepted()) {
            return null;
        }

        return SimilarityEdge.builder()
                .itemA(a.getId())
                .itemB(b.getId())
                .aspectScores(Collections.unmodifiableMap(scores))
                .combinedScore(combined)
                .triggeredBy(decision.triggeredBy())
                .confidence(decision.confidence())
                .priceGap(a.getPrice().subtract(b.getPrice()).abs())
                .build();
    }

    private Detection validate(List<SimilarityEdge> candidates, List<Item> items, OracleFailurePolicy failurePolicy,
                               long pairsScored, CancellationToken token) {
        if (oracle == null || !oracle.isAvailable()) {
            log.info("Oracle not available - accepting {} candidates on similarity alone", candidates.size());
            return new Detection(sorted(candidates), pairsScored, candidates.size(), 0, 0);
        }

        Map<String, Item> byId = new LinkedHashMap<>();
        items.forEach(item -> byId.put(item.getId(), item));

        List<Callable<Boolean>> calls = new ArrayList<>(candidates.size());
        for (SimilarityEdge edge : candidates) {
            String prompt = PromptTemplates.duplicateValidation(
                    byId.get(edge.getItemA()), byId.get(edge.getItemB()), edge.getAspectScores());
            calls.add(() -> oracle.validateBool(prompt));
        }

        EngineConfig.Duplicates config = engineConfig.getDuplicates();
        OracleExecutor executor = new OracleExecutor(
                config.getOracleConcurrency(), config.getOracleTimeoutMs(), config.getBatchSize());
        List<OracleExecutor.Outcome<Boolean>> outcomes = executor.invokeAll(calls, token);

        List<SimilarityEdge> accepted = new ArrayList<>();
        int rejected = 0;
        int failures = 0;
        for (int i = 0; i < candidates.size(); i++) {
            SimilarityEdge edge = candidates.get(i);
            OracleExecutor.Outcome<Boolean> outcome = outcomes.get(i);

            if (outcome.wasSkipped()) {
                log.warn("Duplicate validation cancelled after {} of {} candidates", i, candidates.size());
                throw EngineException.detectionCancelled();
            }
            if (outcome.isSuccess()) {
                if (Boolean.TRUE.equals(outcome.value())) {
                    edge.setValidated(true);
                    accepted.add(edge);
                } else {
                    rejected++;
                    log.debug("Oracle rejected pair {}-{}", edge.getItemA(), edge.getItemB());
                }
                continue;
            }

            failures++;
            if (failurePolicy == OracleFailurePolicy.STRICT) {
                log.warn("Dropping pair {}-{}: oracle unavailable ({})",
                        edge.getItemA(), edge.getItemB(), outcome.failureMessage());
            } else {
                log.debug("Keeping pair {}-{} on threshold alone: {}",
                        edge.getItemA(), edge.getItemB(), outcome.failureMessage());
                accepted.add(edge);
            }
        }

        if (failures > 0) {
            log.warn("Oracle failed for {} of {} candidates (policy={})", failures, candidates.size(), failurePolicy);
        }
        return new Detection(sorted(accepted), pairsScored, candidates.size(), rejected, failures);
    }

    private static List<SimilarityEdge> sorted(List<SimilarityEdge> edges) {
        List<SimilarityEdge> copy = new ArrayList<>(edges);
        copy.sort(EDGE_ORDER);
        return copy;
    }

    private static List<Item> distinctById(List<Item> items) {
        Map<String, Item> byId = new LinkedHashMap<>();
        for (Item item : items) {
            byId.putIfAbsent(item.getId(), item);
        }
        List<Item> ordered = new ArrayList<>(byId.values());
        ordered.sort(Comparator.comparing(Item::getId));
        return ordered;
    }

    private static void validateWeights(Map<Aspect, Double> aspectWeights) {
        if (aspectWeights == null || aspectWeights.isEmpty()) {
            throw EngineException.emptyInput("aspectWeights");
        }
        double total = 0.0;
        for (Map.Entry<Aspect, Double> entry : aspectWeights.entrySet()) {
            Double weight = entry.getValue();
            if (weight == null || weight < 0 || Double.isNaN(weight)) {
                throw EngineException.invalidParameter("aspectWeights." + entry.getKey().toJson(), weight);
            }
            total += weight;
        }
        if (total == 0.0) {
            throw EngineException.invalidParameter("aspectWeights", "all zero");
        }
    }

    /**
     * Resolve a map keyed by aspect name, as found in configuration and request bodies.
     */
    public static Map<Aspect, Double> toAspectMap(Map<String, Double> byName) {
        Map<Aspect, Double> resolved = new EnumMap<>(Aspect.class);
        if (byName != null) {
            byName.forEach((name, value) -> resolved.put(Aspect.fromName(name), value));
        }
        return resolved;
    }

    /**
     * Parameters of one detection run.
     */
    public record Settings(
            Map<Aspect, Double> aspectWeights,
            AcceptancePolicy policy,
            boolean sameCategoryOnly,
            boolean validate,
            OracleFailurePolicy failurePolicy
    ) {}

    /**
     * Accepted edges, sorted by descending combined score, plus run counters.
     */
    public record Detection(
            List<SimilarityEdge> edges,
            long pairsScored,
            int candidateEdges,
            int oracleRejected,
            int oracleFailures
    ) {}

    private record ScoreBatch(List<SimilarityEdge> edges, long pairsScored, boolean skipped) {
        static final ScoreBatch SKIPPED = new ScoreBatch(List.of(), 0, true);
    }
}
