package com.admissionsrag.config;

import java.nio.file.Path;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.admissionsrag.model.Page;
import com.admissionsrag.service.ingest.IngestReport;
import com.admissionsrag.service.ingest.IngestionService;
import com.admissionsrag.service.ingest.PageSourceLoader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInitializer implements ApplicationRunner {

    private final AdmissionsRagProperties properties;
    private final PageSourceLoader pageSourceLoader;
    private final IngestionService ingestionService;

    @Override
    public void run(ApplicationArguments args) {
        if (!Boolean.TRUE.equals(properties.getIngestion().getOnStartup())) {
            log.info("Startup ingestion disabled");
            return;
        }

        log.info("\n{}", "=".repeat(70));
        log.info("INITIALIZING ADMISSIONS RAG STORE");
        log.info("{}\n", "=".repeat(70));

        try {
            IngestReport report = ingestSourceDirectory();

            log.info("\n{}", "=".repeat(70));
            log.info("SYSTEM READY ({} pages, {} chunks)", report.getPagesIngested(), report.getChunksWritten());
            log.info("{}\n", "=".repeat(70));

        } catch (RuntimeException e) {
            log.error("\n{}", "=".repeat(70));
            log.error("INITIALIZATION FAILED");
            log.error("{}\n", "=".repeat(70));
            log.error("Error: {}", e.getMessage(), e);
            log.warn("Application started but the store may be empty");
        }
    }

    private IngestReport ingestSourceDirectory() {
        Path directory = Path.of(properties.getIngestion().getSourceDir());
        log.info("Loading pages from {}", directory.toAbsolutePath());

        List<Page> pages = pageSourceLoader.loadDirectory(directory);
        return ingestionService.ingest(pages);
    }
}
