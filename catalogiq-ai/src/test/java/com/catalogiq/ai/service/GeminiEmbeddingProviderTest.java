package com.catalogiq.ai.service;

import com.catalogiq.ai.config.AiConfig;
import com.catalogiq.common.enums.Aspect;
import com.catalogiq.common.exception.EngineException;
import com.catalogiq.engine.spi.EmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GeminiEmbeddingProviderTest {

    @Mock
    private RedisTemplate<String, Object> redisTemplate;
    @Mock
    private ValueOperations<String, Object> valueOperations;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    void testCacheKey_NamespacedByAspect() {
        String title = GeminiEmbeddingProvider.cacheKey("usb-c charger", Aspect.TITLE);
        String full = GeminiEmbeddingProvider.cacheKey("usb-c charger", Aspect.FULL);

        assertTrue(title.startsWith("embedding:title:"));
        assertTrue(full.startsWith("embedding:full:"));
        assertEquals(title.substring("embedding:title:".length()), full.substring("embedding:full:".length()));
        assertNotEquals(title, GeminiEmbeddingProvider.cacheKey("usb-a charger", Aspect.TITLE));
    }

    @Test
    void testEmbedText_CacheHitSkipsClient() {
        String key = GeminiEmbeddingProvider.cacheKey("usb-c charger", Aspect.TITLE);
        when(valueOperations.get(key)).thenReturn(List.of(0.25, 0.5, 1));

        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(new AiConfig(), redisTemplate, null, "text-embedding-004");

        assertArrayEquals(new double[]{0.25, 0.5, 1.0}, provider.embedText("usb-c charger", Aspect.TITLE));
        assertFalse(provider.isAvailable());
    }

    @Test
    void testEmbedText_NoClientAndCacheMiss() {
        when(valueOperations.get(anyString())).thenReturn(null);
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(new AiConfig(), redisTemplate, null, "text-embedding-004");

        assertThrows(EmbeddingException.class, () -> provider.embedText("usb-c charger", Aspect.TITLE));
    }

    @Test
    void testEmbedText_RedisDownFallsThrough() {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(new AiConfig(), redisTemplate, null, "text-embedding-004");

        assertThrows(EmbeddingException.class, () -> provider.embedText("usb-c charger", Aspect.TITLE));
    }

    @Test
    void testEmbedText_BlankText() {
        GeminiEmbeddingProvider provider = new GeminiEmbeddingProvider(new AiConfig(), null, null, "text-embedding-004");

        assertEquals("EMPTY_INPUT", assertThrows(EngineException.class,
                () -> provider.embedText(" ", Aspect.FULL)).getErrorCode());
    }

    @Test
    void testParseDuration() {
        assertEquals(Duration.ofHours(24), GeminiEmbeddingProvider.parseDuration("24h"));
        assertEquals(Duration.ofMinutes(30), GeminiEmbeddingProvider.parseDuration("30m"));
        assertEquals(Duration.ofDays(7), GeminiEmbeddingProvider.parseDuration("7d"));
        assertEquals(Duration.ofHours(1), GeminiEmbeddingProvider.parseDuration("soon"));
        assertEquals(Duration.ofHours(1), GeminiEmbeddingProvider.parseDuration(null));
    }
}
