package com.catalogiq.engine.controller;

import com.catalogiq.common.enums.RecommendationMode;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.RecommendationResult;
import com.catalogiq.engine.service.RecommendationRanker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationRanker recommendationRanker;
    private final EngineConfig engineConfig;

    /**
     * GET /api/recommendations/{itemId}?mode=substitutes|cross-sell&topK=5
     */
    @GetMapping("/{itemId}")
    public ResponseEntity<List<RecommendationResult>> recommend(
            @PathVariable String itemId,
            @RequestParam(defaultValue = "substitutes") String mode,
            @RequestParam(required = false) Integer topK) {
        int limit = topK != null ? topK : engineConfig.getSearch().getDefaultTopK();
        return ResponseEntity.ok(recommendationRanker.rank(itemId, RecommendationMode.fromName(mode), limit));
    }
}
