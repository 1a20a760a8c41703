package com.admissionsrag.service.embedding;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.exception.RerankException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cross-encoder relevance scoring. Request {@code {"query": ..., "texts": [...]}},
 * response {@code {"scores": [...]}} aligned with {@code texts}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossEncoderClient {

    private final AdmissionsRagProperties properties;
    private final WebClient modelServiceWebClient;

    record RerankResponse(List<Double> scores) {
    }

    @CircuitBreaker(name = "rerank", fallbackMethod = "fallbackScore")
    @Retry(name = "rerank")
    public List<Double> score(String query, List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        try {
            log.debug("Scoring {} pairs with cross-encoder", texts.size());

            RerankResponse response = modelServiceWebClient.post()
                    .uri("/rerank")
                    .bodyValue(Map.of("query", query, "texts", texts))
                    .retrieve()
                    .bodyToMono(RerankResponse.class)
                    .block(Duration.ofSeconds(properties.getModelService().getTimeoutSeconds()));

            if (response == null || response.scores() == null || response.scores().size() != texts.size()) {
                throw new RerankException("Cross-encoder returned "
                        + (response == null || response.scores() == null ? "no" : response.scores().size())
                        + " scores for " + texts.size() + " pairs");
            }
            if (response.scores().contains(null)) {
                throw new RerankException("Cross-encoder returned a null score");
            }
            return response.scores();

        } catch (RerankException e) {
            throw e;
        } catch (Exception e) {
            log.error("Cross-encoder call failed: {}", e.getMessage());
            throw new RerankException("Failed to score pairs", e);
        }
    }

    private List<Double> fallbackScore(String query, List<String> texts, Throwable ex) {
        log.warn("Cross-encoder unavailable: {}", ex.getMessage());
        if (ex instanceof RerankException rerankException) {
            throw rerankException;
        }
        throw new RerankException("Cross-encoder unavailable: " + ex.getMessage(), ex);
    }
}
