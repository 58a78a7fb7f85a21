package com.catalogiq.catalog.service;

import com.catalogiq.catalog.dto.CatalogItemJson;
import com.catalogiq.catalog.model.Item;
import com.catalogiq.catalog.repository.InMemoryEmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.exception.EngineException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads items and their embeddings from a JSON-lines file into the in-memory store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogLoader {

    private static final int MAX_LOGGED_ERRORS = 3;

    private final InMemoryEmbeddingStore embeddingStore;
    private final ObjectMapper objectMapper;

    public LoadResult load(Path ldjsonPath) {
        log.info("Loading catalog from: {}", ldjsonPath);
        long startTime = System.currentTimeMillis();

        int loaded = 0;
        int skipped = 0;
        int errors = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(ldjsonPath, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }

                try {
                    CatalogItemJson json = objectMapper.readValue(line, CatalogItemJson.class);
                    if (!json.isValid()) {
                        skipped++;
                        continue;
                    }
                    embeddingStore.save(toItem(json), toVectors(json));
                    loaded++;
                } catch (IOException | EngineException e) {
                    errors++;
                    if (errors <= MAX_LOGGED_ERRORS) {
                        log.warn("Skipping catalog line {}: {}", lineNumber, e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            log.error("Failed to read catalog file {}: {}", ldjsonPath, e.getMessage(), e);
            throw new UncheckedIOException("Failed to load catalog from " + ldjsonPath, e);
        }

        long duration = System.currentTimeMillis() - startTime;
        log.info("Catalog load complete in {}ms: {} loaded, {} skipped, {} errors", duration, loaded, skipped, errors);
        return new LoadResult(loaded, skipped, errors);
    }

    private Item toItem(CatalogItemJson json) {
        return Item.builder()
                .id(json.getId())
                .sku(json.getSku())
                .name(json.getName())
                .description(json.getDescription())
                .brand(json.getBrand())
                .category(json.getCategory())
                .price(json.getPrice() != null ? json.getPrice() : BigDecimal.ZERO)
                .build();
    }

    private Map<Aspect, double[]> toVectors(CatalogItemJson json) {
        Map<Aspect, double[]> vectors = new EnumMap<>(Aspect.class);
        if (json.getEmbeddings() == null) {
            return vectors;
        }
        for (Map.Entry<String, List<Double>> entry : json.getEmbeddings().entrySet()) {
            List<Double> values = entry.getValue();
            if (values == null || values.isEmpty()) {
                continue;
            }
            double[] vector = new double[values.size()];
            for (int i = 0; i < vector.length; i++) {
                Double value = values.get(i);
                if (value == null) {
                    throw EngineException.invalidParameter("embeddings." + entry.getKey(), "null component at " + i);
                }
                vector[i] = value;
            }
            vectors.put(Aspect.fromName(entry.getKey()), vector);
        }
        return vectors;
    }

    public record LoadResult(int loaded, int skipped, int errors) {}
}
