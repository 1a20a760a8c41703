package com.admissionsrag.controller;

import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.dto.request.QueryRequest;
import com.admissionsrag.dto.request.SearchRequest;
import com.admissionsrag.dto.response.RagResponse;
import com.admissionsrag.dto.response.SearchResponse;
import com.admissionsrag.model.PageType;
import com.admissionsrag.service.agent.AgentService;
import com.admissionsrag.service.monitoring.PerformanceMonitorService;
import com.admissionsrag.service.rag.RagAnswerService;
import com.admissionsrag.service.store.ChunkStore;
import com.admissionsrag.util.TimeBudget;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RagController {

    private final RagAnswerService ragAnswerService;
    private final AgentService agentService;
    private final PerformanceMonitorService performanceMonitor;
    private final ChunkStore chunkStore;
    private final AdmissionsRagProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");

        Map<String, Object> health = new HashMap<>();
        health.put("status", "healthy");
        health.put("timestamp", Instant.now().toString());
        health.put("service", "Admissions RAG API");

        Map<String, Boolean> features = new HashMap<>();
        features.put("rerank", properties.isRerankEnabled());
        features.put("multi_query", Boolean.TRUE.equals(properties.getExpansion().getEnabled()));
        features.put("agent", true);
        health.put("features", features);

        try {
            health.put("store", chunkStore.stats());
        } catch (RuntimeException e) {
            log.warn("Failed to read store stats: {}", e.getMessage());
            health.put("status", "degraded");
        }

        return ResponseEntity.ok(health);
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(@Valid @RequestBody QueryRequest request) {
        SearchFilters filters = filters(request.getSchoolId(), request.getPageType());
        TimeBudget budget = budget(request.getTimeoutSeconds());
        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        log.info("Query received ({}): {}", request.getMode(), request.getQuestion());

        try {
            if (AgentService.MODE_AGENT.equals(request.getMode())) {
                log.info("Processing with agent loop");
                RagResponse response = agentService.query(request.getQuestion(), request.getMaxSteps(), budget);
                return ResponseEntity.ok(response);
            }

            RagResponse response = ragAnswerService.query(
                    request.getQuestion(),
                    request.getMode(),
                    request.getTopK(),
                    filters,
                    budget,
                    Boolean.TRUE.equals(request.getEvaluate()));
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            log.error("Query processing failed for: {}", request.getQuestion(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                        "error", String.valueOf(e.getMessage()),
                        "requestId", requestId,
                        "question", request.getQuestion()
                    ));
        } finally {
            MDC.remove("requestId");
        }
    }

    @PostMapping("/search")
    public ResponseEntity<?> search(@Valid @RequestBody SearchRequest request) {
        SearchFilters filters = filters(request.getSchoolId(), request.getPageType());
        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        log.info("Search received: {}", request.getQuery());

        try {
            SearchResponse response = ragAnswerService.search(
                    request.getQuery(),
                    request.getTopK(),
                    filters,
                    Boolean.TRUE.equals(request.getExpand()),
                    budget(request.getTimeoutSeconds()));
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            log.error("Search failed for: {}", request.getQuery(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", String.valueOf(e.getMessage()), "requestId", requestId));
        } finally {
            MDC.remove("requestId");
        }
    }

    // ===== PERFORMANCE MONITORING =====

    @GetMapping("/performance/stats")
    public ResponseEntity<?> performanceStats() {
        log.debug("Performance stats requested");
        return ResponseEntity.ok(performanceMonitor.getStatistics());
    }

    @GetMapping("/performance/history")
    public ResponseEntity<?> performanceHistory() {
        var history = performanceMonitor.getQueryHistory();
        return ResponseEntity.ok(Map.of("totalQueries", history.size(), "history", history));
    }

    /**
     * @throws ResponseStatusException 400 for a page type that is not a known code
     */
    static SearchFilters filters(String schoolId, String pageType) {
        String school = schoolId == null || schoolId.isBlank() ? null : schoolId.trim().toLowerCase(Locale.ROOT);
        PageType type = null;
        if (pageType != null && !pageType.isBlank()) {
            type = PageType.lookup(pageType).orElseThrow(() -> new ResponseStatusException(
                    HttpStatus.BAD_REQUEST, "Unknown pageType '" + pageType + "'"));
        }
        return new SearchFilters(school, type);
    }

    /**
     * Caller deadline, or null so the service applies its configured timeout.
     */
    private static TimeBudget budget(Integer timeoutSeconds) {
        return timeoutSeconds != null ? TimeBudget.ofSeconds(timeoutSeconds) : null;
    }
}
