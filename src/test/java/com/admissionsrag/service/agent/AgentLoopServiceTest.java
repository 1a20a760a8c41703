package com.admissionsrag.service.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import com.admissionsrag.TestFixtures;
import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.RetrievalFailure;
import com.admissionsrag.dto.internal.RetrievalOutcome;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.exception.StoreException;
import com.admissionsrag.service.ingest.SchoolDirectory;
import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.service.rag.HybridRetriever;
import com.admissionsrag.service.sanity.SanityAuditor;
import com.admissionsrag.util.ContextAssembler;
import com.admissionsrag.util.PromptBuilder;
import com.admissionsrag.util.TimeBudget;
import com.fasterxml.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class AgentLoopServiceTest {

    private static final String QUERY = "Compare the TOEFL minimums of CMU and Stanford";

    @Mock private OllamaLlmService llmService;
    @Mock private HybridRetriever hybridRetriever;

    private AgentLoopService agent;
    private final PromptBuilder promptBuilder = new PromptBuilder();

    @BeforeEach
    void setUp() {
        AdmissionsRagProperties properties = new AdmissionsRagProperties();
        SearchToolbox toolbox = new SearchToolbox(hybridRetriever, new SanityAuditor(),
                new ContextAssembler(1500, 12000), new ObjectMapper(), properties);
        agent = new AgentLoopService(llmService, toolbox, new SchoolDirectory(properties), promptBuilder,
                properties, Runnable::run);

        lenient().when(hybridRetriever.search(anyString(), anyInt(), any(SearchFilters.class), any()))
                .thenReturn(RetrievalOutcome.of(List.of(
                        TestFixtures.result("a", "International applicants need TOEFL 100.", 0.8))));
    }

    private static AssistantMessage toolCall(String id, String name, String arguments) {
        return new AssistantMessage("", Map.of(), List.of(new AssistantMessage.ToolCall(id, "function", name, arguments)));
    }

    private static AssistantMessage answer(String text) {
        return new AssistantMessage(text);
    }

    private static TimeBudget plenty() {
        return TimeBudget.ofSeconds(60);
    }

    @Nested
    @DisplayName("terminal states")
    class TerminalStates {

        @Test
        void finishesWhenModelStopsCallingTools() {
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", SearchToolbox.SEARCH_SCHOOL, "{\"query\": \"toefl\", \"school_id\": \"cmu\"}"),
                    toolCall("2", SearchToolbox.SEARCH_SCHOOL, "{\"query\": \"toefl\", \"school_id\": \"stanford\"}"),
                    answer("CMU requires 100; Stanford requires 100."));

            TimeBudget budget = plenty();
            AgentResult result = agent.run(QUERY, 3, budget);

            assertThat(result.getTerminalState()).isEqualTo(AgentState.DONE);
            assertThat(result.getAnswer()).isEqualTo("CMU requires 100; Stanford requires 100.");
            assertThat(result.getSteps()).isEqualTo(2);
            assertThat(result.getModelCalls()).isEqualTo(3);
            assertThat(result.getInvocations()).extracting(ToolInvocation::step).containsExactly(1, 2);
            verify(hybridRetriever).search("toefl", 4, SearchFilters.school("cmu"), budget);
            verify(hybridRetriever).search("toefl", 4, SearchFilters.school("stanford"), budget);
            verify(llmService, never()).generateWithHistory(anyList());
        }

        @Test
        void forcesFinalAnswerAtStepCap() {
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"toefl\"}"),
                    toolCall("2", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"toefl cmu\"}"));
            when(llmService.generateWithHistory(anyList())).thenReturn("Best effort answer.");

            AgentResult result = agent.run(QUERY, 2, plenty());

            assertThat(result.getTerminalState()).isEqualTo(AgentState.FORCED_STOP);
            assertThat(result.getAnswer()).isEqualTo("Best effort answer.");
            assertThat(result.getSteps()).isEqualTo(2);
            assertThat(result.getModelCalls()).isEqualTo(3);
            verify(llmService, times(2)).generateWithTools(anyList(), anyList());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
            verify(llmService).generateWithHistory(history.capture());
            Message last = history.getValue().get(history.getValue().size() - 1);
            assertThat(last).isInstanceOf(UserMessage.class);
            assertThat(last.getText()).isEqualTo(promptBuilder.buildForcedFinalInstruction());
        }

        @Test
        void exhaustedDeadlineSkipsPlanning() {
            when(llmService.generateWithHistory(anyList())).thenReturn("Out of time.");

            AgentResult result = agent.run(QUERY, 3, new TimeBudget(0));

            assertThat(result.getTerminalState()).isEqualTo(AgentState.FORCED_STOP);
            assertThat(result.getSteps()).isZero();
            verify(llmService, never()).generateWithTools(anyList(), anyList());
        }

        @Test
        void modelCallsNeverExceedStepsPlusOne() {
            when(llmService.generateWithTools(anyList(), anyList()))
                    .thenReturn(toolCall("1", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"gpa\"}"));
            when(llmService.generateWithHistory(anyList())).thenReturn("done");

            AgentResult result = agent.run(QUERY, 5, plenty());

            assertThat(result.getModelCalls()).isEqualTo(6);
            assertThat(result.getSteps()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("tool dispatch")
    class Dispatch {

        @Test
        void unknownToolIsReportedToTheModel() {
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", "search_web", "{\"query\": \"toefl\"}"),
                    answer("I could not search the web."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getTerminalState()).isEqualTo(AgentState.DONE);
            assertThat(result.getInvocations()).singleElement()
                    .satisfies(invocation -> assertThat(invocation.failed()).isTrue());
            ToolResponseMessage responses = toolResponses();
            assertThat(responses.getResponses().get(0).responseData())
                    .startsWith(AgentLoopService.TOOL_ERROR + "Unknown tool 'search_web'");
        }

        @Test
        void invalidArgumentsAndBackendErrorsDoNotEndTheLoop() {
            when(hybridRetriever.search(anyString(), anyInt(), any(SearchFilters.class), any()))
                    .thenThrow(new StoreException("boom"));
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    new AssistantMessage("", Map.of(), List.of(
                            new AssistantMessage.ToolCall("1", "function", SearchToolbox.SEARCH_SCHOOL, "{\"query\": \"gpa\"}"),
                            new AssistantMessage.ToolCall("2", "function", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"gpa\"}"))),
                    answer("Sorry, the search is unavailable."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getTerminalState()).isEqualTo(AgentState.DONE);
            assertThat(result.getSteps()).isEqualTo(1);
            assertThat(result.getInvocations()).extracting(ToolInvocation::failed).containsExactly(true, true);
            assertThat(toolResponses().getResponses()).extracting(ToolResponseMessage.ToolResponse::responseData)
                    .satisfiesExactly(
                            first -> assertThat(first).contains("Missing required argument 'school_id'"),
                            second -> assertThat(second).contains("boom"));
        }

        @Test
        void unavailableSearchBackendIsLoggedAsFailedDispatch() {
            when(hybridRetriever.search(anyString(), anyInt(), any(SearchFilters.class), any()))
                    .thenReturn(RetrievalOutcome.failed(RetrievalFailure.Kind.STORAGE, "connection refused"));
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"gpa\"}"),
                    answer("The search is unavailable right now."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getInvocations()).singleElement()
                    .satisfies(invocation -> assertThat(invocation.failed()).isTrue());
            assertThat(toolResponses().getResponses().get(0).responseData())
                    .startsWith(SearchToolCallback.SEARCH_FAILED);
        }

        @Test
        void emptySearchIsNotAFailedDispatch() {
            when(hybridRetriever.search(anyString(), anyInt(), any(SearchFilters.class), any()))
                    .thenReturn(RetrievalOutcome.of(List.of()));
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", SearchToolbox.SEARCH_GENERAL, "{\"query\": \"gpa\"}"),
                    answer("Nothing found."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getInvocations()).singleElement()
                    .satisfies(invocation -> assertThat(invocation.failed()).isFalse());
        }

        @Test
        void unknownPageTypeIsRejectedAsToolError() {
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    toolCall("1", SearchToolbox.SEARCH_PAGE_TYPE,
                            "{\"query\": \"fee\", \"school_id\": \"cmu\", \"page_type\": \"brochure\"}"),
                    answer("Could not search that page type."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getInvocations()).singleElement()
                    .satisfies(invocation -> assertThat(invocation.failed()).isTrue());
            assertThat(toolResponses().getResponses().get(0).responseData())
                    .startsWith(AgentLoopService.TOOL_ERROR)
                    .contains("brochure");
            verify(hybridRetriever, never()).search(anyString(), anyInt(), any(SearchFilters.class), any());
        }

        @Test
        void parallelCallsOfOneStepKeepCallOrder() {
            when(llmService.generateWithTools(anyList(), anyList())).thenReturn(
                    new AssistantMessage("", Map.of(), List.of(
                            new AssistantMessage.ToolCall("a", "function", SearchToolbox.SEARCH_SCHOOL,
                                    "{\"query\": \"toefl\", \"school_id\": \"cmu\"}"),
                            new AssistantMessage.ToolCall("b", "function", SearchToolbox.SEARCH_SCHOOL,
                                    "{\"query\": \"toefl\", \"school_id\": \"stanford\"}"))),
                    answer("Both require 100."));

            AgentResult result = agent.run(QUERY, 3, plenty());

            assertThat(result.getSteps()).isEqualTo(1);
            assertThat(result.getInvocations()).extracting(ToolInvocation::step).containsExactly(1, 1);
            assertThat(toolResponses().getResponses()).extracting(ToolResponseMessage.ToolResponse::id)
                    .containsExactly("a", "b");
        }

        /** The tool results message the model saw on its final planning call. */
        private ToolResponseMessage toolResponses() {
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<Message>> history = ArgumentCaptor.forClass(List.class);
            verify(llmService, times(2)).generateWithTools(history.capture(), anyList());
            return history.getAllValues().get(1).stream()
                    .filter(ToolResponseMessage.class::isInstance)
                    .map(ToolResponseMessage.class::cast)
                    .findFirst()
                    .orElseThrow();
        }
    }
}
