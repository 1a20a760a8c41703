package com.admissionsrag.service.rag;

import java.util.List;

import org.springframework.stereotype.Service;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.RetrievalFailure;
import com.admissionsrag.dto.internal.RetrievalOutcome;
import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.model.ScoredChunk;
import com.admissionsrag.service.embedding.EmbeddingService;
import com.admissionsrag.service.store.ChunkStore;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-stage retrieval: an oversampled vector search followed by cross-encoder
 * reranking. Transport failures come back as a failed outcome, never as an
 * exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HybridRetriever {

    private final EmbeddingService embeddingService;
    private final ChunkStore chunkStore;
    private final RerankService rerankService;
    private final AdmissionsRagProperties properties;

    public RetrievalOutcome search(String query, int topK, SearchFilters filters) {
        return search(query, topK, filters, null);
    }

    public RetrievalOutcome search(String query, int topK, SearchFilters filters, TimeBudget budget) {
        boolean rerank = properties.isRerankEnabled();
        int poolSize = rerank ? topK * properties.getRetrieval().getOversampleFactor() : topK;

        RetrievalOutcome candidates = searchCandidates(query, poolSize, filters, budget);
        if (candidates.isFailed() || candidates.isEmpty()) {
            return candidates;
        }

        List<RetrievalResult> pool = candidates.results();
        if (!rerank || pool.size() <= topK) {
            return RetrievalOutcome.of(pool.stream().limit(topK).toList());
        }
        if (budget != null && budget.exhausted()) {
            log.warn("Deadline reached before rerank, keeping vector order");
            return RetrievalOutcome.of(pool.stream().limit(topK).toList());
        }

        List<RetrievalResult> ranked = rerankService.rerank(query, pool, topK);
        log.debug("Retrieved {} of {} candidates for '{}'", ranked.size(), pool.size(), abbreviate(query));
        return RetrievalOutcome.of(ranked);
    }

    /**
     * Stage 1 only: nearest chunks by vector similarity, best first.
     */
    public RetrievalOutcome searchCandidates(String query, int poolSize, SearchFilters filters, TimeBudget budget) {
        if (query == null || query.isBlank()) {
            return RetrievalOutcome.of(List.of());
        }
        if (budget != null && budget.exhausted()) {
            return RetrievalOutcome.failed(RetrievalFailure.Kind.TIMEOUT, "Deadline reached before embedding");
        }

        float[] vector;
        try {
            vector = embeddingService.embed(query);
        } catch (RuntimeException e) {
            log.error("Query embedding failed: {}", e.getMessage());
            return RetrievalOutcome.failed(RetrievalFailure.Kind.EMBEDDING, e.getMessage());
        }

        if (budget != null && budget.exhausted()) {
            return RetrievalOutcome.failed(RetrievalFailure.Kind.TIMEOUT, "Deadline reached before vector search");
        }

        List<ScoredChunk> hits;
        try {
            hits = chunkStore.search(vector, filters, poolSize);
        } catch (RuntimeException e) {
            log.error("Vector search failed: {}", e.getMessage());
            return RetrievalOutcome.failed(RetrievalFailure.Kind.STORAGE, e.getMessage());
        }

        List<RetrievalResult> results = hits.stream()
                .map(hit -> RetrievalResult.builder()
                        .chunk(hit.chunk())
                        .vectorScore(hit.score())
                        .build())
                .toList();

        log.debug("Vector search returned {} candidates (pool {}) for '{}'",
                results.size(), poolSize, abbreviate(query));
        return RetrievalOutcome.of(results);
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
