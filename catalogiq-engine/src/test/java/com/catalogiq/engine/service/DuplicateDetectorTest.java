package com.catalogiq.engine.service;

import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.repository.InMemoryEmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.enums.MatchConfidence;
import com.catalogiq.common.enums.OracleFailurePolicy;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.SimilarityEdge;
import com.catalogiq.engine.service.batch.CancellationToken;
import com.catalogiq.engine.spi.Oracle;
import com.catalogiq.engine.spi.OracleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DuplicateDetectorTest {

    private static final double SIN_97 = Math.sqrt(1 - 0.97 * 0.97);

    @Mock
    private Oracle oracle;

    private InMemoryEmbeddingStore store;
    private EngineConfig config;
    private Map<Aspect, Double> weights;

    private Item phoneA;
    private Item phoneB;
    private Item phoneC;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new InMemoryEmbeddingStore();
        config = new EngineConfig();

        weights = new EnumMap<>(Aspect.class);
        weights.put(Aspect.FULL, 0.5);
        weights.put(Aspect.TITLE, 0.3);
        weights.put(Aspect.ATTRIBUTES, 0.2);

        phoneA = save("item-a", "phones", "160", new double[]{1, 0}, new double[]{1, 0, 0}, new double[]{1, 0});
        phoneB = save("item-b", "phones", "160", new double[]{0.97, SIN_97}, new double[]{0.6, 0.8, 0}, new double[]{0.6, 0.8});
        phoneC = save("item-c", "phones", "190", new double[]{0.2, Math.sqrt(0.96)}, new double[]{0, 0, 1}, new double[]{0, 1});
    }

    private Item save(String id, String category, String price, double[] title, double[] full, double[] attributes) {
        Item item = Item.builder()
                .id(id)
                .name("Phone " + id)
                .brand("Acme")
                .category(category)
                .price(new BigDecimal(price))
                .build();
        store.save(item, Map.of(Aspect.TITLE, title, Aspect.FULL, full, Aspect.ATTRIBUTES, attributes));
        return item;
    }

    private DuplicateDetector detector(Oracle collaborator) {
        return new DuplicateDetector(store, config, collaborator);
    }

    private DuplicateDetector.Settings settings(boolean validate, OracleFailurePolicy failurePolicy) {
        AcceptancePolicy policy = AcceptancePolicy.of(0.85, Map.of(Aspect.TITLE, 0.95, Aspect.ATTRIBUTES, 0.85));
        return new DuplicateDetector.Settings(weights, policy, true, validate, failurePolicy);
    }

    @Test
    void testFindDuplicates_TitleOverrideAcceptsPairBelowCombined() {
        List<SimilarityEdge> edges = detector(null).findDuplicates(List.of(phoneA, phoneB, phoneC), weights, 0.85, true);

        assertEquals(1, edges.size());
        SimilarityEdge edge = edges.get(0);
        assertEquals("item-a", edge.getItemA());
        assertEquals("item-b", edge.getItemB());
        assertEquals(0.711, edge.getCombinedScore(), 1e-9);
        assertEquals(0.97, edge.getAspectScores().get(Aspect.TITLE), 1e-9);
        assertEquals(List.of("title"), edge.getTriggeredBy());
        assertEquals(MatchConfidence.DEFINITE, edge.getConfidence());
        assertEquals(0, BigDecimal.ZERO.compareTo(edge.getPriceGap()));
        assertNull(edge.getValidated());
    }

    @Test
    void testFindDuplicates_CombinedOnlyRejectsSameData() {
        AcceptancePolicy combinedOnly = AcceptancePolicy.combinedOnly(0.85);
        List<SimilarityEdge> edges = detector(null)
                .findDuplicates(List.of(phoneA, phoneB, phoneC), weights, combinedOnly, true);

        assertTrue(edges.isEmpty());
    }

    @Test
    void testFindDuplicates_InputOrderDoesNotMatter() {
        List<SimilarityEdge> forward = detector(null).findDuplicates(List.of(phoneA, phoneB, phoneC), weights, 0.85, true);
        List<SimilarityEdge> reversed = detector(null).findDuplicates(List.of(phoneC, phoneB, phoneA), weights, 0.85, true);

        assertEquals(forward, reversed);
    }

    @Test
    void testFindDuplicates_FewerThanTwoItems() {
        assertTrue(detector(null).findDuplicates(List.of(), weights, 0.85, true).isEmpty());
        assertTrue(detector(null).findDuplicates(List.of(phoneA), weights, 0.85, true).isEmpty());
    }

    @Test
    void testDetect_SameCategoryOnlySkipsCrossCategoryPairs() {
        Item caseItem = save("item-d", "cases", "20", new double[]{1, 0}, new double[]{1, 0, 0}, new double[]{1, 0});

        DuplicateDetector.Detection detection = detector(null).detect(
                List.of(phoneA, phoneB, phoneC, caseItem), settings(false, OracleFailurePolicy.DEGRADE),
                new CancellationToken());

        assertEquals(3, detection.pairsScored());
        assertTrue(detection.edges().stream().noneMatch(e -> e.getItemB().equals("item-d")));
    }

    @Test
    void testDetect_CrossCategoryWhenAllowed() {
        Item caseItem = save("item-d", "cases", "20", new double[]{1, 0}, new double[]{1, 0, 0}, new double[]{1, 0});
        DuplicateDetector.Settings base = settings(false, OracleFailurePolicy.DEGRADE);
        DuplicateDetector.Settings crossCategory = new DuplicateDetector.Settings(
                base.aspectWeights(), base.policy(), false, false, OracleFailurePolicy.DEGRADE);

        DuplicateDetector.Detection detection = detector(null).detect(
                List.of(phoneA, phoneB, phoneC, caseItem), crossCategory, new CancellationToken());

        assertEquals(6, detection.pairsScored());
        SimilarityEdge top = detection.edges().get(0);
        assertEquals("item-a", top.getItemA());
        assertEquals("item-d", top.getItemB());
        assertEquals(1.0, top.getCombinedScore(), 1e-9);
        assertEquals(0, new BigDecimal("140").compareTo(top.getPriceGap()));
    }

    @Test
    void testDetect_ItemsWithoutWeightedAspectsAreSkipped() {
        Item bare = Item.builder().id("item-0").category("phones").price(BigDecimal.ONE).build();
        store.save(bare, Map.of(Aspect.VISUAL, new double[]{1, 0}));

        DuplicateDetector.Detection detection = detector(null).detect(
                List.of(bare, phoneA, phoneB), settings(false, OracleFailurePolicy.DEGRADE), new CancellationToken());

        assertEquals(1, detection.pairsScored());
    }

    @Test
    void testDetect_OracleConfirmsAndRejects() {
        when(oracle.isAvailable()).thenReturn(true);
        when(oracle.validateBool(anyString())).thenReturn(true);

        DuplicateDetector.Detection confirmed = detector(oracle).detect(
                List.of(phoneA, phoneB, phoneC), settings(true, OracleFailurePolicy.DEGRADE), new CancellationToken());
        assertEquals(1, confirmed.edges().size());
        assertEquals(Boolean.TRUE, confirmed.edges().get(0).getValidated());

        when(oracle.validateBool(anyString())).thenReturn(false);
        DuplicateDetector.Detection rejected = detector(oracle).detect(
                List.of(phoneA, phoneB, phoneC), settings(true, OracleFailurePolicy.DEGRADE), new CancellationToken());
        assertTrue(rejected.edges().isEmpty());
        assertEquals(1, rejected.candidateEdges());
        assertEquals(1, rejected.oracleRejected());
    }

    @Test
    void testDetect_OracleFailureDegradeKeepsEdge() {
        when(oracle.isAvailable()).thenReturn(true);
        when(oracle.validateBool(anyString())).thenThrow(new OracleException("503"));

        DuplicateDetector.Detection detection = detector(oracle).detect(
                List.of(phoneA, phoneB, phoneC), settings(true, OracleFailurePolicy.DEGRADE), new CancellationToken());

        assertEquals(1, detection.edges().size());
        assertNull(detection.edges().get(0).getValidated());
        assertEquals(1, detection.oracleFailures());
    }

    @Test
    void testDetect_OracleFailureStrictDropsEdge() {
        when(oracle.isAvailable()).thenReturn(true);
        when(oracle.validateBool(anyString())).thenThrow(new OracleException("503"));

        DuplicateDetector.Detection detection = detector(oracle).detect(
                List.of(phoneA, phoneB, phoneC), settings(true, OracleFailurePolicy.STRICT), new CancellationToken());

        assertTrue(detection.edges().isEmpty());
        assertEquals(1, detection.oracleFailures());
    }

    @Test
    void testDetect_UnavailableOracleIsNotCalled() {
        when(oracle.isAvailable()).thenReturn(false);

        DuplicateDetector.Detection detection = detector(oracle).detect(
                List.of(phoneA, phoneB, phoneC), settings(true, OracleFailurePolicy.STRICT), new CancellationToken());

        assertEquals(1, detection.edges().size());
        verify(oracle, never()).validateBool(anyString());
    }

    @Test
    void testDetect_CancelledTokenThrows() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        EngineException ex = assertThrows(EngineException.class, () -> detector(null).detect(
                List.of(phoneA, phoneB, phoneC), settings(false, OracleFailurePolicy.DEGRADE), token));
        assertEquals("DETECTION_CANCELLED", ex.getErrorCode());
    }

    @Test
    void testDetect_SmallBatchesGiveSameEdges() {
        config.getDuplicates().setBatchSize(1);
        config.getDuplicates().setWorkerThreads(3);

        List<SimilarityEdge> edges = detector(null).findDuplicates(List.of(phoneA, phoneB, phoneC), weights, 0.85, true);

        assertEquals(1, edges.size());
        assertEquals("item-b", edges.get(0).getItemB());
    }

    @Test
    void testDetect_InvalidWeights() {
        Map<Aspect, Double> negative = Map.of(Aspect.FULL, -0.5);
        assertEquals("INVALID_PARAMETER", assertThrows(EngineException.class,
                () -> detector(null).findDuplicates(List.of(phoneA, phoneB), negative, 0.85, true)).getErrorCode());
        assertEquals("EMPTY_INPUT", assertThrows(EngineException.class,
                () -> detector(null).findDuplicates(List.of(phoneA, phoneB), Map.of(), 0.85, true)).getErrorCode());
    }

    @Test
    void testToAspectMap_ResolvesNames() {
        Map<Aspect, Double> resolved = DuplicateDetector.toAspectMap(Map.of("title", 0.3, "FULL", 0.7));
        assertEquals(0.3, resolved.get(Aspect.TITLE));
        assertEquals(0.7, resolved.get(Aspect.FULL));
        assertThrows(EngineException.class, () -> DuplicateDetector.toAspectMap(Map.of("colour", 1.0)));
    }
}
