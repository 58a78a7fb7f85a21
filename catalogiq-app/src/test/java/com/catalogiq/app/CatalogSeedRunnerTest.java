package com.catalogiq.app;

import com.catalogiq.catalog.service.CatalogLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CatalogSeedRunnerTest {

    @TempDir
    Path tempDir;

    @Mock
    private CatalogLoader catalogLoader;

    private CatalogSeedRunner runner;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        runner = new CatalogSeedRunner(catalogLoader);
    }

    @Test
    void testRun_NoSeedFileConfigured() {
        ReflectionTestUtils.setField(runner, "seedFile", "");

        runner.run(new DefaultApplicationArguments());

        verify(catalogLoader, never()).load(any());
    }

    @Test
    void testRun_MissingSeedFileIsSkipped() {
        ReflectionTestUtils.setField(runner, "seedFile", tempDir.resolve("missing.jsonl").toString());

        runner.run(new DefaultApplicationArguments());

        verify(catalogLoader, never()).load(any());
    }

    @Test
    void testRun_LoadsConfiguredFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("catalog.jsonl"), "{\"id\":\"p1\",\"price\":1}\n");
        when(catalogLoader.load(file)).thenReturn(new CatalogLoader.LoadResult(1, 0, 0));
        ReflectionTestUtils.setField(runner, "seedFile", file.toString());

        runner.run(new DefaultApplicationArguments());

        verify(catalogLoader).load(file);
    }
}
