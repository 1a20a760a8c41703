package com.admissionsrag.service.evaluation;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.response.EvaluationResult;
import com.admissionsrag.dto.response.MetricScore;
import com.admissionsrag.exception.RagException;
import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.util.PromptBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores an answer with the generative model as judge, on three axes:
 * context relevance (question vs retrieved context), faithfulness (answer vs
 * context) and answer relevance (answer vs question). A judge failure scores
 * that metric 0 and records the error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriadEvaluationService {

    public static final String CONTEXT_RELEVANCE = "Context Relevance";
    public static final String FAITHFULNESS = "Faithfulness";
    public static final String ANSWER_RELEVANCE = "Answer Relevance";

    private static final Pattern SCORE = Pattern.compile("score:\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    private final OllamaLlmService llmService;
    private final PromptBuilder promptBuilder;

    public EvaluationResult evaluate(String question, List<RetrievalResult> results, String answer) {
        List<String> contexts = results.stream().map(RetrievalResult::displayText).toList();

        List<MetricScore> metrics = List.of(
                judge(CONTEXT_RELEVANCE, () -> promptBuilder.buildContextRelevancePrompt(question, contexts)),
                judge(FAITHFULNESS, () -> promptBuilder.buildFaithfulnessPrompt(answer, contexts)),
                judge(ANSWER_RELEVANCE, () -> promptBuilder.buildAnswerRelevancePrompt(question, answer)));

        double average = metrics.stream().mapToDouble(MetricScore::getScore).sum() / metrics.size();

        log.info("=".repeat(50));
        log.info("RAG TRIAD EVALUATION");
        for (MetricScore metric : metrics) {
            log.info("  {} : {}/5{}", metric.getMetric(), metric.getScore(),
                    metric.getError() != null ? " (error: " + metric.getError() + ")" : "");
        }
        log.info("  Average : {}/5", String.format(Locale.ROOT, "%.2f", average));
        log.info("=".repeat(50));

        return EvaluationResult.builder()
                .metrics(metrics)
                .averageScore(average)
                .build();
    }

    private MetricScore judge(String metric, Supplier<String> prompt) {
        try {
            String verdict = llmService.generate(prompt.get());
            return MetricScore.builder()
                    .metric(metric)
                    .score(parseScore(verdict))
                    .reasoning(reasoning(verdict))
                    .build();
        } catch (RagException e) {
            log.warn("{} judge failed: {}", metric, e.getMessage());
            return MetricScore.builder()
                    .metric(metric)
                    .score(0)
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * First {@code Score: N} in the verdict, clamped to 1-5; 0 when there is none.
     */
    static double parseScore(String verdict) {
        if (verdict == null) {
            return 0;
        }
        Matcher matcher = SCORE.matcher(verdict);
        if (!matcher.find()) {
            return 0;
        }
        double score = Double.parseDouble(matcher.group(1));
        return Math.min(Math.max(score, 1.0), 5.0);
    }

    static String reasoning(String verdict) {
        if (verdict == null) {
            return "";
        }
        Matcher matcher = SCORE.matcher(verdict);
        String head = matcher.find() ? verdict.substring(0, matcher.start()) : verdict;
        return head.replaceFirst("(?i)^\\s*reasoning:", "").strip();
    }
}
