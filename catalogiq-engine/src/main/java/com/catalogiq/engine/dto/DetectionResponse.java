package com.catalogiq.engine.dto;

import java.util.List;

public record DetectionResponse(
        DetectionReport report,
        List<DuplicateGroup> groups,
        List<SimilarityEdge> edges
) {}
