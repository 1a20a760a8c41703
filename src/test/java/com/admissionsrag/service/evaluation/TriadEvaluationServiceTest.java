package com.admissionsrag.service.evaluation;

import static com.admissionsrag.TestFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.admissionsrag.dto.response.EvaluationResult;
import com.admissionsrag.dto.response.MetricScore;
import com.admissionsrag.exception.GenerationException;
import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.util.PromptBuilder;

@ExtendWith(MockitoExtension.class)
class TriadEvaluationServiceTest {

    @Mock private OllamaLlmService llmService;

    private TriadEvaluationService service;

    @BeforeEach
    void setUp() {
        service = new TriadEvaluationService(llmService, new PromptBuilder());
    }

    @Test
    void scoresAllThreeMetricsAndAveragesThem() {
        when(llmService.generate(anyString())).thenReturn(
                "Reasoning: on topic.\nScore: 5",
                "Reasoning: one unsupported claim.\nScore: 3",
                "Reasoning: direct.\nScore: 4");

        EvaluationResult evaluation = service.evaluate("Minimum TOEFL at CMU?",
                List.of(result("a", "CMU requires a TOEFL of 100.", 0.9)), "CMU requires 100.");

        assertThat(evaluation.getMetrics()).extracting(MetricScore::getMetric)
                .containsExactly(TriadEvaluationService.CONTEXT_RELEVANCE,
                        TriadEvaluationService.FAITHFULNESS,
                        TriadEvaluationService.ANSWER_RELEVANCE);
        assertThat(evaluation.getMetrics()).extracting(MetricScore::getScore).containsExactly(5.0, 3.0, 4.0);
        assertThat(evaluation.getMetrics().get(1).getReasoning()).isEqualTo("one unsupported claim.");
        assertThat(evaluation.getAverageScore()).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void contextsAreNumberedInTheJudgePrompt() {
        when(llmService.generate(anyString())).thenReturn("Score: 4");

        service.evaluate("q", List.of(result("a", "first", 0.9), result("b", "second", 0.8)), "answer");

        verify(llmService).generate(argThat((String prompt) ->
                prompt.contains("Context 1: first") && prompt.contains("Context 2: second")
                        && prompt.contains("fact checker")));
    }

    @Test
    void judgeFailureScoresZeroAndKeepsTheOthers() {
        when(llmService.generate(anyString()))
                .thenReturn("Score: 5")
                .thenThrow(new GenerationException("ollama down"))
                .thenReturn("Score: 4");

        EvaluationResult evaluation = service.evaluate("q", List.of(result("a", "text", 0.9)), "answer");

        MetricScore faithfulness = evaluation.getMetrics().get(1);
        assertThat(faithfulness.getScore()).isZero();
        assertThat(faithfulness.getError()).isEqualTo("ollama down");
        assertThat(evaluation.getAverageScore()).isCloseTo(3.0, within(1e-9));
    }

    @Nested
    class ScoreParsing {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "Reasoning: fine. Score: 4      | 4.0",
                "score: 3.5                     | 3.5",
                "Score: 9                       | 5.0",
                "Score: 0                       | 1.0",
                "no score given                 | 0.0"
        })
        void parsesAndClamps(String verdict, double expected) {
            assertThat(TriadEvaluationService.parseScore(verdict)).isEqualTo(expected);
        }

        @Test
        void reasoningStopsAtTheScoreLine() {
            assertThat(TriadEvaluationService.reasoning("Reasoning: too long.\nScore: 2")).isEqualTo("too long.");
            assertThat(TriadEvaluationService.reasoning("just text")).isEqualTo("just text");
        }
    }
}
