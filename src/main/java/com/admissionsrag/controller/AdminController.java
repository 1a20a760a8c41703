package com.admissionsrag.controller;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.exception.IngestionException;
import com.admissionsrag.model.Page;
import com.admissionsrag.service.ingest.IngestionService;
import com.admissionsrag.service.ingest.PageSourceLoader;
import com.admissionsrag.service.store.ChunkStore;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final IngestionService ingestionService;
    private final PageSourceLoader pageSourceLoader;
    private final ChunkStore chunkStore;
    private final AdmissionsRagProperties properties;

    @PostMapping("/ingest")
    public ResponseEntity<?> ingest(@RequestBody List<Page> pages,
                                    @RequestParam(required = false) Integer timeoutSeconds) {
        try {
            return ResponseEntity.ok(ingestionService.ingest(pages, budget(timeoutSeconds)));
        } catch (IngestionException e) {
            log.warn("Ingestion rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/ingest/directory")
    public ResponseEntity<?> ingestDirectory(@RequestParam(required = false) String path,
                                             @RequestParam(required = false) Integer timeoutSeconds) {
        Path directory = Path.of(path != null ? path : properties.getIngestion().getSourceDir());
        try {
            TimeBudget budget = budget(timeoutSeconds);
            List<Page> pages = pageSourceLoader.loadDirectory(directory);
            return ResponseEntity.ok(ingestionService.ingest(pages, budget));
        } catch (IngestionException e) {
            log.warn("Directory ingestion rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private TimeBudget budget(Integer timeoutSeconds) {
        if (timeoutSeconds != null && timeoutSeconds <= 0) {
            throw new IngestionException("timeoutSeconds must be positive");
        }
        return TimeBudget.ofSeconds(timeoutSeconds != null
                ? timeoutSeconds
                : properties.getIngestion().getTimeoutSeconds());
    }

    @DeleteMapping("/pages")
    public ResponseEntity<?> deletePage(@RequestParam String url) {
        int removed = ingestionService.deletePage(url);
        return ResponseEntity.ok(Map.of("url", url, "chunksRemoved", removed));
    }

    @GetMapping("/store/stats")
    public ResponseEntity<?> storeStats() {
        return ResponseEntity.ok(chunkStore.stats());
    }
}
