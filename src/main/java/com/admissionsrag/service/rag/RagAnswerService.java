package com.admissionsrag.service.rag;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.ContextItem;
import com.admissionsrag.dto.internal.RetrievalFailure;
import com.admissionsrag.dto.internal.RetrievalOutcome;
import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.dto.response.EvaluationResult;
import com.admissionsrag.dto.response.RagResponse;
import com.admissionsrag.dto.response.SearchResponse;
import com.admissionsrag.exception.RagException;
import com.admissionsrag.service.evaluation.TriadEvaluationService;
import com.admissionsrag.service.expansion.QueryExpansionService;
import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.service.monitoring.PerformanceMonitorService;
import com.admissionsrag.service.monitoring.QueryTimer;
import com.admissionsrag.service.sanity.SanityAuditor;
import com.admissionsrag.util.ContextAssembler;
import com.admissionsrag.util.PromptBuilder;
import com.admissionsrag.util.TimeBudget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-shot answering: retrieve (directly or with query expansion), audit,
 * assemble context, generate once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RagAnswerService {

    public static final String MODE_DIRECT = "direct";
    public static final String MODE_MULTI_QUERY = "multi_query";

    static final String NO_RESULTS_ANSWER = "No relevant information found.";
    static final String UNAVAILABLE_ANSWER = "Search is temporarily unavailable. Please try again later.";
    static final String TIMEOUT_ANSWER = "The request deadline was reached before an answer could be generated.";

    private final HybridRetriever hybridRetriever;
    private final QueryExpansionService queryExpansionService;
    private final SanityAuditor sanityAuditor;
    private final ContextAssembler contextAssembler;
    private final OllamaLlmService llmService;
    private final PerformanceMonitorService performanceMonitor;
    private final PromptBuilder promptBuilder;
    private final TriadEvaluationService triadEvaluationService;
    private final AdmissionsRagProperties properties;

    public RagResponse query(String question, String mode, Integer topK, SearchFilters filters) {
        return query(question, mode, topK, filters, null, false);
    }

    /**
     * @param budget   deadline for the whole request; the configured retrieval
     *                 timeout applies when null
     * @param evaluate score the answer with the LLM judge
     */
    public RagResponse query(String question, String mode, Integer topK, SearchFilters filters,
                             TimeBudget budget, boolean evaluate) {
        QueryTimer timer = new QueryTimer();
        timer.start();

        String resolvedMode = MODE_MULTI_QUERY.equals(mode) ? MODE_MULTI_QUERY : MODE_DIRECT;
        int k = topK != null ? topK : properties.getRetrieval().getTopK();
        TimeBudget deadline = budget != null ? budget : defaultBudget();

        try {
            RetrievalOutcome outcome = retrieve(question, resolvedMode, k, filters, deadline);
            timer.mark("Retrieval");

            if (outcome.isFailed()) {
                log.error("Retrieval failed ({}): {}", outcome.failure().kind(), outcome.failure().message());
                if (outcome.failure().kind() == RetrievalFailure.Kind.TIMEOUT) {
                    return finish(question, TIMEOUT_ANSWER, List.of(), resolvedMode, "timeout", timer, null);
                }
                return finish(question, UNAVAILABLE_ANSWER, List.of(), resolvedMode, "unavailable", timer, null);
            }
            if (outcome.isEmpty()) {
                return finish(question, NO_RESULTS_ANSWER, List.of(), resolvedMode, "no_results", timer, null);
            }

            List<RetrievalResult> annotated = sanityAuditor.annotate(outcome.results());
            timer.mark("Sanity Audit");

            if (deadline.exhausted()) {
                log.warn("Deadline reached before generation");
                return finish(question, TIMEOUT_ANSWER, annotated, resolvedMode, "timeout", timer, null);
            }

            String context = contextAssembler.assemble(annotated);
            timer.mark("Context Assembly");

            String answer = llmService.generate(
                    promptBuilder.buildAnswerSystemPrompt(),
                    promptBuilder.buildStandardPrompt(question, context));
            timer.mark("LLM Generation");

            EvaluationResult evaluation = null;
            if (evaluate && deadline.exhausted()) {
                log.warn("Deadline reached, skipping evaluation");
            } else if (evaluate) {
                evaluation = triadEvaluationService.evaluate(question, annotated, answer);
                timer.mark("Evaluation");
            }

            return finish(question, answer, annotated, resolvedMode, "answered", timer, evaluation);

        } catch (RagException e) {
            log.error("Query failed: {}", e.getMessage(), e);
            timer.end();
            performanceMonitor.record(question, resolvedMode, "error", timer);
            return RagResponse.builder()
                    .question(question)
                    .answer("Error: " + e.getMessage())
                    .context(List.of())
                    .timing(timer.toTimingInfo())
                    .requestId(MDC.get("requestId"))
                    .mode("error")
                    .outcome("error")
                    .build();
        }
    }

    /**
     * Retrieval only, with sanity annotations, for inspecting what the
     * answerer would see.
     */
    public SearchResponse search(String query, Integer topK, SearchFilters filters, boolean expand) {
        return search(query, topK, filters, expand, null);
    }

    public SearchResponse search(String query, Integer topK, SearchFilters filters, boolean expand,
                                 TimeBudget budget) {
        QueryTimer timer = new QueryTimer();
        timer.start();

        int k = topK != null ? topK : properties.getRetrieval().getTopK();
        RetrievalOutcome outcome = retrieve(query, expand ? MODE_MULTI_QUERY : MODE_DIRECT, k, filters,
                budget != null ? budget : defaultBudget());
        timer.mark("Retrieval");

        List<RetrievalResult> annotated = sanityAuditor.annotate(outcome.results());
        timer.mark("Sanity Audit");
        timer.end();

        return SearchResponse.builder()
                .query(query)
                .expanded(expand)
                .results(contextItems(annotated))
                .failure(outcome.failure())
                .timing(timer.toTimingInfo())
                .build();
    }

    private TimeBudget defaultBudget() {
        return TimeBudget.ofSeconds(properties.getRetrieval().getTimeoutSeconds());
    }

    private RetrievalOutcome retrieve(String question, String mode, int topK, SearchFilters filters,
                                      TimeBudget budget) {
        if (MODE_MULTI_QUERY.equals(mode) && Boolean.TRUE.equals(properties.getExpansion().getEnabled())) {
            return queryExpansionService.searchExpanded(question, topK, filters, budget);
        }
        return hybridRetriever.search(question, topK, filters, budget);
    }

    private RagResponse finish(String question, String answer, List<RetrievalResult> results,
                               String mode, String outcome, QueryTimer timer,
                               EvaluationResult evaluation) {
        timer.end();
        performanceMonitor.record(question, mode, outcome, timer);
        log.info("{} ({})\n{}", mode, outcome, timer.formatDisplay());

        return RagResponse.builder()
                .question(question)
                .answer(answer)
                .context(contextItems(results))
                .timing(timer.toTimingInfo())
                .requestId(MDC.get("requestId"))
                .mode(mode)
                .outcome(outcome)
                .evaluation(evaluation)
                .build();
    }

    static List<ContextItem> contextItems(List<RetrievalResult> results) {
        List<ContextItem> items = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            items.add(ContextItem.from(i + 1, results.get(i)));
        }
        return items;
    }
}
