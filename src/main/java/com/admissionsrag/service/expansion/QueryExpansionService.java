package com.admissionsrag.service.expansion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.RetrievalFailure;
import com.admissionsrag.dto.internal.RetrievalOutcome;
import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.service.rag.HybridRetriever;
import com.admissionsrag.service.rag.RerankService;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Multi-query retrieval. Each paraphrase runs a vector search in parallel;
 * the pools are merged by exact text in first-seen order and reranked once
 * against the original question.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryExpansionService {

    private final ParaphraseService paraphraseService;
    private final HybridRetriever hybridRetriever;
    private final RerankService rerankService;
    private final AdmissionsRagProperties properties;
    @Qualifier("retrievalExecutor")
    private final Executor retrievalExecutor;

    public RetrievalOutcome searchExpanded(String query, int topK, SearchFilters filters, TimeBudget budget) {
        List<String> queries = paraphraseService.paraphrase(query, properties.getExpansion().getParaphraseCount());
        int poolSize = topK * properties.getRetrieval().getOversampleFactor();

        List<CompletableFuture<RetrievalOutcome>> searches = queries.stream()
                .map(q -> CompletableFuture.supplyAsync(
                        () -> hybridRetriever.searchCandidates(q, poolSize, filters, budget), retrievalExecutor))
                .toList();

        List<RetrievalOutcome> outcomes = new ArrayList<>(searches.size());
        for (int i = 0; i < searches.size(); i++) {
            outcomes.add(await(searches.get(i), queries.get(i), budget));
        }

        RetrievalFailure firstFailure = null;
        int failed = 0;
        Map<String, RetrievalResult> merged = new LinkedHashMap<>();
        for (RetrievalOutcome outcome : outcomes) {
            if (outcome.isFailed()) {
                failed++;
                if (firstFailure == null) {
                    firstFailure = outcome.failure();
                }
                continue;
            }
            for (RetrievalResult result : outcome.results()) {
                merged.putIfAbsent(result.getText(), result);
            }
        }

        if (failed == outcomes.size()) {
            log.error("All {} expanded searches failed", failed);
            return new RetrievalOutcome(List.of(), firstFailure);
        }
        if (failed > 0) {
            log.warn("{} of {} expanded searches failed and were skipped", failed, outcomes.size());
        }

        List<RetrievalResult> pool = new ArrayList<>(merged.values());
        log.info("Merged {} unique chunks from {} queries", pool.size(), queries.size());
        if (pool.isEmpty()) {
            return RetrievalOutcome.of(List.of());
        }

        if (properties.isRerankEnabled()) {
            return RetrievalOutcome.of(rerankService.rerank(query, pool, topK));
        }
        pool.sort(Comparator.comparingDouble(RetrievalResult::getVectorScore).reversed());
        return RetrievalOutcome.of(pool.stream().limit(topK).toList());
    }

    private RetrievalOutcome await(CompletableFuture<RetrievalOutcome> search, String query, TimeBudget budget) {
        try {
            if (budget == null) {
                return search.get();
            }
            return search.get(Math.max(1, budget.remainingMs()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            search.cancel(true);
            return RetrievalOutcome.failed(RetrievalFailure.Kind.TIMEOUT, "Search timed out for '" + query + "'");
        } catch (ExecutionException e) {
            log.error("Expanded search failed for '{}'", query, e.getCause());
            return RetrievalOutcome.failed(RetrievalFailure.Kind.STORAGE, String.valueOf(e.getCause().getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RetrievalOutcome.failed(RetrievalFailure.Kind.TIMEOUT, "Interrupted while searching");
        }
    }
}
