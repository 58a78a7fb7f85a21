package com.catalogiq.ai.service;

import com.catalogiq.ai.config.AiConfig;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.spi.EmbeddingException;
import com.catalogiq.engine.spi.EmbeddingProvider;
import com.google.genai.Client;
import com.google.genai.types.ContentEmbedding;
import com.google.genai.types.EmbedContentResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Text embeddings from Vertex AI's embedding model, with optional Redis caching
 * under embedding:&lt;aspect&gt;:&lt;hash&gt;.
 */
@Slf4j
@Service
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    static final String EMBEDDING_CACHE_PREFIX = "embedding:";

    private final Client client;
    private final AiConfig aiConfig;
    @Nullable
    private final RedisTemplate<String, Object> redisTemplate;
    private final String embeddingModel;

    @Autowired
    public GeminiEmbeddingProvider(
            AiConfig aiConfig,
            @Autowired(required = false) @Nullable RedisTemplate<String, Object> redisTemplate,
            @Value("${vertex.ai.project-id:}") String projectId,
            @Value("${vertex.ai.location:us-central1}") String location,
            @Value("${vertex.ai.embedding-model:text-embedding-004}") String embeddingModel) {
        this(aiConfig, redisTemplate, createClient(projectId, location, embeddingModel), embeddingModel);
    }

    GeminiEmbeddingProvider(AiConfig aiConfig, @Nullable RedisTemplate<String, Object> redisTemplate,
                            @Nullable Client client, String embeddingModel) {
        this.aiConfig = aiConfig;
        this.redisTemplate = redisTemplate;
        this.client = client;
        this.embeddingModel = embeddingModel;

        if (redisTemplate == null) {
            log.info("Redis not configured - embedding caching disabled");
        } else {
            log.info("Redis available - embedding caching enabled");
        }
    }

    private static Client createClient(String projectId, String location, String embeddingModel) {
        if (projectId == null || projectId.isBlank()) {
            log.warn("Vertex AI not configured for embeddings - projectId is empty");
            return null;
        }
        try {
            Client client = Client.builder()
                    .project(projectId)
                    .location(location)
                    .vertexAI(true)
                    .build();
            log.info("Initialized embedding client for Vertex AI: project={}, location={}, model={}",
                    projectId, location, embeddingModel);
            return client;
        } catch (Exception e) {
            log.error("Failed to initialize embedding client: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public double[] embedText(String text, Aspect aspect) {
        if (text == null || text.isBlank()) {
            throw EngineException.emptyInput("text");
        }

        String cacheKey = cacheKey(text, aspect);
        double[] cached = readCache(cacheKey);
        if (cached != null) {
            log.debug("Cache hit for embedding: {}", cacheKey);
            return cached;
        }

        if (client == null) {
            throw new EmbeddingException("Embedding client not initialized");
        }

        List<Float> values;
        try {
            EmbedContentResponse response = client.models.embedContent(embeddingModel, text, null);
            Optional<List<ContentEmbedding>> embeddingsOpt = response.embeddings();
            values = embeddingsOpt.filter(list -> !list.isEmpty())
                    .flatMap(list -> list.get(0).values())
                    .orElse(List.of());
        } catch (Exception e) {
            throw new EmbeddingException("Error generating embedding: " + e.getMessage(), e);
        }

        if (values.isEmpty()) {
            throw new EmbeddingException("No embedding returned for text: "
                    + text.substring(0, Math.min(50, text.length())));
        }

        double[] vector = new double[values.size()];
        List<Double> cacheable = new ArrayList<>(values.size());
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i);
            cacheable.add(vector[i]);
        }
        writeCache(cacheKey, cacheable);
        return vector;
    }

    static String cacheKey(String text, Aspect aspect) {
        String hash = DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
        return EMBEDDING_CACHE_PREFIX + aspect.toJson() + ":" + hash;
    }

    private double[] readCache(String cacheKey) {
        if (redisTemplate == null) {
            return null;
        }
        try {
            Object cached = redisTemplate.opsForValue().get(cacheKey);
            if (cached instanceof List<?> list && !list.isEmpty()) {
                double[] vector = new double[list.size()];
                for (int i = 0; i < vector.length; i++) {
                    vector[i] = ((Number) list.get(i)).doubleValue();
                }
                return vector;
            }
        } catch (RuntimeException e) {
            log.warn("Embedding cache read failed for {}: {}", cacheKey, e.getMessage());
        }
        return null;
    }

    private void writeCache(String cacheKey, List<Double> vector) {
        if (redisTemplate == null) {
            return;
        }
        try {
            Duration ttl = parseDuration(aiConfig.getCache().getEmbeddingTtl());
            redisTemplate.opsForValue().set(cacheKey, vector, ttl);
            log.debug("Cached embedding for: {}", cacheKey);
        } catch (RuntimeException e) {
            log.warn("Embedding cache write failed for {}: {}", cacheKey, e.getMessage());
        }
    }

    /**
     * Parse duration strings like "24h", "30m", "7d". Falls back to 1h.
     */
    static Duration parseDuration(String durationStr) {
        if (durationStr == null || durationStr.isBlank()) {
            return Duration.ofHours(1);
        }

        try {
            if (durationStr.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            } else if (durationStr.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            } else if (durationStr.endsWith("d")) {
                return Duration.ofDays(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid duration format: {}, using default 1h", durationStr);
        }

        return Duration.ofHours(1);
    }
}
