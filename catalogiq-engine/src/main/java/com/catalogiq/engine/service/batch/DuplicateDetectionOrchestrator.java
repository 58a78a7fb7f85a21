package com.catalogiq.engine.service.batch;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.repository.EmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.OracleFailurePolicy;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.DetectionReport;
import com.catalogiq.engine.dto.DetectionRequest;
import com.catalogiq.engine.dto.DetectionResponse;
import com.catalogiq.engine.dto.DuplicateGroup;
import com.catalogiq.engine.service.AcceptancePolicy;
import com.catalogiq.engine.service.ClusterBuilder;
import com.catalogiq.engine.service.DuplicateDetector;
import com.catalogiq.engine.service.OracleExecutor;
import com.catalogiq.engine.service.PromptTemplates;
import com.catalogiq.engine.spi.Oracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs duplicate detection end to end: score pairs, validate, cluster, report.
 * Coordinates: DuplicateDetector -> ClusterBuilder -> optional merge recommendations.
 *
 * Groups are only built once every batch of the run has finished, so a cancelled run
 * yields no groups at all.
 */
@Slf4j
@Service
public class DuplicateDetectionOrchestrator {

    private final EmbeddingStore embeddingStore;
    private final DuplicateDetector duplicateDetector;
    private final ClusterBuilder clusterBuilder;
    private final EngineConfig engineConfig;
    @Nullable
    private final Oracle oracle;

    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    public DuplicateDetectionOrchestrator(
            EmbeddingStore embeddingStore,
            DuplicateDetector duplicateDetector,
            ClusterBuilder clusterBuilder,
            EngineConfig engineConfig,
            @Autowired(required = false) @Nullable Oracle oracle) {
        this.embeddingStore = embeddingStore;
        this.duplicateDetector = duplicateDetector;
        this.clusterBuilder = clusterBuilder;
        this.engineConfig = engineConfig;
        this.oracle = oracle;
    }

    /**
     * Run detection over the whole catalog held by the store.
     */
    public DetectionResponse run(DetectionRequest request) {
        return run(embeddingStore.findAllItems(), request, new CancellationToken());
    }

    /**
     * Run detection over the given items.
     *
     * @throws EngineException DETECTION_CANCELLED when the token fires before the run completes
     */
    public DetectionResponse run(List<Item> items, DetectionRequest request, CancellationToken cancellation) {
        DetectionRequest effective = request != null ? request : new DetectionRequest();
        DuplicateDetector.Settings settings = resolveSettings(effective);
        String runId = UUID.randomUUID().toString();
        long startTime = System.currentTimeMillis();
        int totalItems = items == null ? 0 : items.size();

        log.info("Starting duplicate detection run {}: {} items, policy={}, validate={}",
                runId, totalItems, settings.policy(), settings.validate());
        activeRuns.put(runId, cancellation);
        try {
            DuplicateDetector.Detection detection = duplicateDetector.detect(
                    items == null ? List.of() : items, settings, cancellation);
            if (cancellation.isCancelled()) {
                throw EngineException.detectionCancelled();
            }

            Map<String, Item> itemsById = items == null ? Map.of() : items.stream()
                    .collect(Collectors.toMap(Item::getId, Function.identity(), (first, second) -> first));
            List<DuplicateGroup> groups = clusterBuilder.buildGroups(detection.edges(), itemsById);
            if (engineConfig.getDuplicates().isMergeRecommendations()) {
                attachMergeRecommendations(groups, itemsById);
            }

            BigDecimal estimatedSavings = groups.stream()
                    .map(DuplicateGroup::getRedundancyCost)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            long duration = System.currentTimeMillis() - startTime;

            DetectionReport report = new DetectionReport(
                    runId, totalItems, detection.pairsScored(), detection.candidateEdges(),
                    detection.edges().size(), detection.oracleRejected(), detection.oracleFailures(),
                    groups.size(), estimatedSavings, duration);
            log.info("Duplicate detection run {} completed in {}ms: {} groups, estimated savings {}",
                    runId, duration, groups.size(), estimatedSavings);

            boolean includeEdges = Boolean.TRUE.equals(effective.getIncludeEdges());
            return new DetectionResponse(report, groups, includeEdges ? detection.edges() : null);
        } catch (EngineException e) {
            if ("DETECTION_CANCELLED".equals(e.getErrorCode())) {
                log.warn("Duplicate detection run {} cancelled after {}ms", runId, System.currentTimeMillis() - startTime);
            }
            throw e;
        } finally {
            activeRuns.remove(runId);
        }
    }

    /**
     * Request cancellation of an in-flight run. The run stops at the next batch boundary.
     *
     * @return false when no such run is active
     */
    public boolean cancel(String runId) {
        CancellationToken token = activeRuns.get(runId);
        if (token == null) {
            return false;
        }
        log.info("Cancellation requested for duplicate detection run {}", runId);
        token.cancel();
        return true;
    }

    public Set<String> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    DuplicateDetector.Settings resolveSettings(DetectionRequest request) {
        EngineConfig.Duplicates config = engineConfig.getDuplicates();

        double threshold = request.getThreshold() != null ? request.getThreshold() : config.getThreshold();
        Map<Aspect, Double> weights = DuplicateDetector.toAspectMap(
                request.getAspectWeights() != null ? request.getAspectWeights() : config.getAspectWeights());
        Map<Aspect, Double> overrides = DuplicateDetector.toAspectMap(
                request.getAspectOverrides() != null ? request.getAspectOverrides() : config.getAspectOverrides());
        boolean sameCategoryOnly = request.getSameCategoryOnly() != null
                ? request.getSameCategoryOnly() : config.isSameCategoryOnly();
        boolean validate = request.getValidate() != null ? request.getValidate() : config.isValidationEnabled();
        OracleFailurePolicy failurePolicy = request.getFailurePolicy() != null
                ? request.getFailurePolicy() : config.getFailurePolicy();

        return new DuplicateDetector.Settings(
                weights, AcceptancePolicy.of(threshold, overrides), sameCategoryOnly, validate, failurePolicy);
    }

    private void attachMergeRecommendations(List<DuplicateGroup> groups, Map<String, Item> itemsById) {
        if (groups.isEmpty() || oracle == null || !oracle.isAvailable()
                || !engineConfig.getRecommendations().isExplanationsEnabled()) {
            return;
        }

        List<Callable<String>> calls = new ArrayList<>(groups.size());
        for (DuplicateGroup group : groups) {
            List<Item> members = group.getMemberIds().stream().map(itemsById::get).toList();
            String prompt = PromptTemplates.mergeRecommendation(members);
            calls.add(() -> oracle.explain(prompt));
        }

        EngineConfig.Duplicates limits = engineConfig.getDuplicates();
        OracleExecutor executor = new OracleExecutor(
                limits.getOracleConcurrency(), limits.getOracleTimeoutMs(), limits.getBatchSize());
        List<OracleExecutor.Outcome<String>> outcomes = executor.invokeAll(calls, CancellationToken.NONE);

        Map<Integer, String> failures = new LinkedHashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            OracleExecutor.Outcome<String> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                groups.get(i).setRationale(outcome.value());
            } else {
                failures.put(groups.get(i).getGroupId(), outcome.failureMessage());
            }
        }
        if (!failures.isEmpty()) {
            log.warn("Merge recommendation unavailable for {} of {} groups: {}", failures.size(), groups.size(), failures);
        }
    }
}
