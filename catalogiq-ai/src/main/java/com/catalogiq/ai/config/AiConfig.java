package com.catalogiq.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the Gemini-backed collaborators.
 * Maps to catalogiq.ai.* properties in application.properties.
 * Connection settings stay under vertex.ai.*.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "catalogiq.ai")
public class AiConfig {

    private Generation generation = new Generation();
    private Cache cache = new Cache();

    @Data
    public static class Generation {
        /** Low temperature keeps TRUE/FALSE and numeric answers stable */
        private float temperature = 0.1f;
        /** Cap for validation and scoring answers */
        private int maxOutputTokens = 100;
    }

    @Data
    public static class Cache {
        /** TTL for embeddings in Redis, e.g. 24h, 30m, 7d */
        private String embeddingTtl = "24h";
    }
}
