package com.admissionsrag.service.embedding;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.exception.EmbeddingException;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Client for the embedding model hosted by the Python model service.
 * Request {@code {"texts": [...]}}, response {@code {"embeddings": [[...]]}}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingService {

    private final AdmissionsRagProperties properties;
    private final WebClient modelServiceWebClient;

    record EmbedResponse(List<List<Double>> embeddings) {
    }

    /**
     * Embed a single query text.
     */
    @Cacheable(value = "query-embeddings", key = "#text")
    @CircuitBreaker(name = "embedding", fallbackMethod = "fallbackEmbedding")
    @Retry(name = "embedding")
    public float[] embed(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new EmbeddingException("Text is empty");
        }

        log.debug("Calling embedding service for query ({} chars)", text.length());
        return request(List.of(text)).get(0);
    }

    /**
     * Embed texts in batches. Output order matches input order.
     */
    @CircuitBreaker(name = "embedding", fallbackMethod = "fallbackBatchEmbeddings")
    @Retry(name = "embedding")
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int batchSize = properties.getModelService().getEmbedBatchSize();
        List<float[]> vectors = new ArrayList<>(texts.size());

        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            log.debug("Calling embedding service for {} texts", batch.size());
            vectors.addAll(request(batch));
        }
        return vectors;
    }

    private List<float[]> request(List<String> texts) {
        try {
            EmbedResponse response = modelServiceWebClient.post()
                    .uri("/embed")
                    .bodyValue(Map.of("texts", texts))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .block(Duration.ofSeconds(properties.getModelService().getTimeoutSeconds()));

            if (response == null || response.embeddings() == null) {
                throw new EmbeddingException("Invalid response from embedding service");
            }
            if (response.embeddings().size() != texts.size()) {
                throw new EmbeddingException(String.format(
                        "Embedding service returned %d vectors for %d texts",
                        response.embeddings().size(), texts.size()));
            }

            int dimension = properties.getStore().getDimension();
            List<float[]> vectors = new ArrayList<>(texts.size());
            for (List<Double> values : response.embeddings()) {
                if (values.size() != dimension) {
                    log.warn("Embedding dimension mismatch: expected {}, got {}", dimension, values.size());
                }
                vectors.add(toFloatArray(values));
            }
            return vectors;

        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            log.error("Embedding service failed: {}", e.getMessage());
            throw new EmbeddingException("Failed to generate embedding", e);
        }
    }

    static float[] toFloatArray(List<Double> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }

    /**
     * Circuit open or retries exhausted. Always rethrows.
     */
    private float[] fallbackEmbedding(String text, Throwable ex) {
        log.warn("Embedding unavailable for query '{}': {}",
                text != null && text.length() > 50 ? text.substring(0, 50) + "..." : text,
                ex.getMessage());
        throw asEmbeddingException(ex);
    }

    private List<float[]> fallbackBatchEmbeddings(List<String> texts, Throwable ex) {
        log.warn("Batch embedding unavailable for {} texts: {}",
                texts != null ? texts.size() : 0, ex.getMessage());
        throw asEmbeddingException(ex);
    }

    private static EmbeddingException asEmbeddingException(Throwable ex) {
        if (ex instanceof EmbeddingException embeddingException) {
            return embeddingException;
        }
        return new EmbeddingException("Embedding service unavailable: " + ex.getMessage(), ex);
    }
}
