package com.catalogiq.app;

import com.catalogiq.catalog.service.CatalogLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the catalog named by catalogiq.catalog.seed-file on startup.
 *
 * Usage:
 *   CATALOGIQ_CATALOG_SEED_FILE=/data/catalog.jsonl mvn spring-boot:run -pl catalogiq-app
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogSeedRunner implements ApplicationRunner {

    private final CatalogLoader catalogLoader;

    @Value("${catalogiq.catalog.seed-file:}")
    private String seedFile;

    @Override
    public void run(ApplicationArguments args) {
        if (seedFile == null || seedFile.isBlank()) {
            log.info("No catalog seed file configured - starting with an empty catalog");
            return;
        }

        Path path = Paths.get(seedFile);
        if (!Files.exists(path)) {
            log.error("Catalog seed file not found: {}", seedFile);
            return;
        }

        CatalogLoader.LoadResult result = catalogLoader.load(path);
        log.info("Catalog seeded from {}: {} items loaded, {} skipped, {} errors",
                seedFile, result.loaded(), result.skipped(), result.errors());
    }
}
