package com.catalogiq.engine.controller;

import com.catalogiq.engine.dto.DetectionRequest;
import com.catalogiq.engine.dto.DetectionResponse;
import com.catalogiq.engine.service.batch.DuplicateDetectionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/duplicates")
@RequiredArgsConstructor
public class DuplicateController {

    private final DuplicateDetectionOrchestrator orchestrator;

    /**
     * Run duplicate detection over the loaded catalog. Long-running for large catalogs.
     *
     * POST /api/duplicates/detect
     */
    @PostMapping("/detect")
    public ResponseEntity<DetectionResponse> detect(@Valid @RequestBody(required = false) DetectionRequest request) {
        log.info("Received duplicate detection request: {}", request);
        return ResponseEntity.ok(orchestrator.run(request));
    }

    @GetMapping("/runs")
    public ResponseEntity<Set<String>> activeRuns() {
        return ResponseEntity.ok(orchestrator.activeRunIds());
    }

    /**
     * POST /api/duplicates/runs/{runId}/cancel
     */
    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String runId) {
        if (!orchestrator.cancel(runId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("runId", runId, "status", "CANCELLING"));
    }
}
