package com.catalogiq.catalog.service;

import com.catalogiq.catalog.repository.InMemoryEmbeddingStore;
import com.catalogiq.common.enums.Aspect;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CatalogLoaderTest {

    @TempDir
    Path tempDir;

    private InMemoryEmbeddingStore store;
    private CatalogLoader loader;

    @BeforeEach
    void setUp() {
        store = new InMemoryEmbeddingStore();
        loader = new CatalogLoader(store, new ObjectMapper());
    }

    @Test
    void testLoad_ValidLines() throws IOException {
        Path file = tempDir.resolve("catalog.jsonl");
        Files.writeString(file, String.join("\n",
                "{\"id\":\"p1\",\"name\":\"Buds\",\"brand\":\"Acme\",\"category\":\"audio\",\"price\":49.99,"
                        + "\"embeddings\":{\"title\":[1.0,0.0],\"full\":[0.5,0.5,0.0]}}",
                "",
                "{\"id\":\"p2\",\"name\":\"Case\",\"category\":\"accessories\",\"price\":9.5,\"rating\":4.1,"
                        + "\"embeddings\":{\"title\":[0.0,1.0]}}"
        ), StandardCharsets.UTF_8);

        CatalogLoader.LoadResult result = loader.load(file);

        assertEquals(2, result.loaded());
        assertEquals(0, result.skipped());
        assertEquals(0, result.errors());
        assertEquals(new BigDecimal("49.99"), store.findItem("p1").get().getPrice());
        assertEquals("Acme", store.findItem("p1").get().getBrand());
        assertTrue(store.findEmbeddings("p1").has(Aspect.FULL));
        assertFalse(store.findEmbeddings("p2").has(Aspect.FULL));
    }

    @Test
    void testLoad_SkipsInvalidAndCountsErrors() throws IOException {
        Path file = tempDir.resolve("catalog.jsonl");
        Files.writeString(file, String.join("\n",
                "{\"id\":\"p1\",\"price\":10,\"embeddings\":{\"title\":[1.0,0.0]}}",
                "{\"name\":\"no id\",\"price\":10}",
                "{\"id\":\"neg\",\"price\":-1}",
                "not json",
                "{\"id\":\"p2\",\"price\":10,\"embeddings\":{\"title\":[1.0,0.0,0.0]}}",
                "{\"id\":\"p3\",\"price\":10,\"embeddings\":{\"colour\":[1.0]}}",
                "{\"id\":\"p4\",\"price\":10,\"embeddings\":{\"title\":[1.0,null]}}"
        ), StandardCharsets.UTF_8);

        CatalogLoader.LoadResult result = loader.load(file);

        assertEquals(1, result.loaded());
        assertEquals(2, result.skipped());
        assertEquals(4, result.errors());
        assertEquals(1, store.size());
    }

    @Test
    void testLoad_UsesInjectedMapperSettings() throws IOException {
        Path file = tempDir.resolve("catalog.jsonl");
        Files.writeString(file, "{'id':'p1','price':10,'embeddings':{'title':[1.0,0.0]}}", StandardCharsets.UTF_8);

        assertEquals(1, loader.load(file).errors());

        ObjectMapper lenient = new ObjectMapper().configure(JsonParser.Feature.ALLOW_SINGLE_QUOTES, true);
        CatalogLoader.LoadResult result = new CatalogLoader(store, lenient).load(file);

        assertEquals(1, result.loaded());
        assertEquals(0, result.errors());
        assertTrue(store.findItem("p1").isPresent());
    }

    @Test
    void testLoad_MissingFileThrows() {
        assertThrows(UncheckedIOException.class, () -> loader.load(tempDir.resolve("missing.jsonl")));
    }
}
