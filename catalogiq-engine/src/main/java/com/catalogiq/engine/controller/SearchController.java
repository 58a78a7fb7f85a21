package com.catalogiq.engine.controller;

import com.catalogiq.common.enums.Aspect;
import com.catalogiq.engine.config.EngineConfig;
import com.catalogiq.engine.dto.SearchResult;
import com.catalogiq.engine.service.SimilaritySearchService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final SimilaritySearchService searchService;
    private final EngineConfig engineConfig;

    /**
     * Free-text similarity search over one aspect.
     *
     * GET /api/search?q=wireless+earbuds&aspect=full&topK=10
     */
    @GetMapping
    public ResponseEntity<List<SearchResult>> search(
            @RequestParam String q,
            @RequestParam(required = false) String aspect,
            @RequestParam(required = false) Integer topK,
            @RequestParam(required = false) Double minSimilarity,
            @RequestParam(defaultValue = "false") boolean explain) {
        EngineConfig.Search defaults = engineConfig.getSearch();
        Aspect resolved = Aspect.fromName(aspect != null ? aspect : defaults.getDefaultAspect());
        return ResponseEntity.ok(searchService.searchText(
                q,
                resolved,
                topK != null ? topK : defaults.getDefaultTopK(),
                minSimilarity != null ? minSimilarity : defaults.getMinSimilarity(),
                explain));
    }
}
