package com.admissionsrag.service.agent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.exception.ToolExecutionException;
import com.admissionsrag.service.ingest.SchoolDirectory;
import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.util.PromptBuilder;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded ReAct loop:
 * <pre>
 * PLANNING -> TOOL_DISPATCH -> MERGE -> PLANNING ... -> DONE | FORCED_STOP
 * </pre>
 * At most {@code maxSteps} tool dispatch steps run. When the cap or the
 * deadline is reached the model gets one last call with no tools offered.
 * Tool failures are returned to the model as text and never end the loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentLoopService {

    static final String TOOL_ERROR = "[tool error] ";

    private final OllamaLlmService llmService;
    private final SearchToolbox searchToolbox;
    private final SchoolDirectory schoolDirectory;
    private final PromptBuilder promptBuilder;
    private final AdmissionsRagProperties properties;
    @Qualifier("retrievalExecutor")
    private final Executor retrievalExecutor;

    public AgentResult run(String query, Integer maxStepsOverride) {
        return run(query, maxStepsOverride, null);
    }

    /**
     * @param budget deadline for the session; the configured agent timeout
     *               applies when null. Reaching it behaves like the step cap.
     */
    public AgentResult run(String query, Integer maxStepsOverride, TimeBudget budget) {
        int maxSteps = maxStepsOverride != null ? maxStepsOverride : properties.getAgent().getMaxSteps();
        TimeBudget deadline = budget != null ? budget : TimeBudget.ofSeconds(properties.getAgent().getTimeoutSeconds());
        return loop(query, maxSteps, deadline);
    }

    private AgentResult loop(String query, int maxSteps, TimeBudget budget) {
        AgentSession session = new AgentSession(
                promptBuilder.buildAgentSystemPrompt(schoolDirectory.knownIds()), query, maxSteps);
        List<ToolCallback> tools = searchToolbox.callbacks();

        log.info("Agent started (max {} steps): {}", maxSteps, abbreviate(query));

        while (session.hasStepsLeft()) {
            if (budget.exhausted()) {
                log.warn("Agent deadline reached at step {}", session.getStepCount());
                break;
            }

            /* =========================
               PLANNING
               ========================= */
            AssistantMessage reply = llmService.generateWithTools(session.getHistory(), tools);
            session.recordModelReply(reply);

            if (!reply.hasToolCalls()) {
                session.finish(AgentState.DONE, reply.getText());
                log.info("Agent DONE after {} tool steps", session.getStepCount());
                return session.toResult();
            }

            /* =========================
               TOOL DISPATCH
               ========================= */
            session.transition(AgentState.TOOL_DISPATCH);
            int step = session.getStepCount() + 1;
            List<AssistantMessage.ToolCall> calls = reply.getToolCalls();
            log.info("Step {}: dispatching {} tool call(s) {}", step, calls.size(),
                    calls.stream().map(AssistantMessage.ToolCall::name).toList());

            List<ToolResponseMessage.ToolResponse> responses = dispatch(calls, budget);

            /* =========================
               MERGE
               ========================= */
            session.transition(AgentState.MERGE);
            List<ToolInvocation> invocations = new ArrayList<>(calls.size());
            for (int i = 0; i < calls.size(); i++) {
                AssistantMessage.ToolCall call = calls.get(i);
                boolean failed = isFailure(responses.get(i).responseData());
                invocations.add(new ToolInvocation(step, call.name(), call.arguments(), failed));
            }
            session.recordToolResults(new ToolResponseMessage(responses), invocations);
            session.transition(AgentState.PLANNING);
        }

        /* =========================
           FORCED STOP
           ========================= */
        log.info("Agent forcing final answer after {} tool steps", session.getStepCount());
        session.addUserInstruction(promptBuilder.buildForcedFinalInstruction());
        String answer = llmService.generateWithHistory(session.getHistory());
        session.countModelCall();
        session.finish(AgentState.FORCED_STOP, answer);
        return session.toResult();
    }

    /**
     * Runs every call of one step concurrently and waits for all of them.
     * Responses keep the order of the calls.
     */
    List<ToolResponseMessage.ToolResponse> dispatch(List<AssistantMessage.ToolCall> calls, TimeBudget budget) {
        List<CompletableFuture<String>> pending = calls.stream()
                .map(call -> CompletableFuture.supplyAsync(() -> execute(call, budget), retrievalExecutor))
                .toList();

        List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            AssistantMessage.ToolCall call = calls.get(i);
            responses.add(new ToolResponseMessage.ToolResponse(call.id(), call.name(),
                    await(pending.get(i), call, budget)));
        }
        return responses;
    }

    String execute(AssistantMessage.ToolCall call, TimeBudget budget) {
        Optional<SearchToolCallback> tool = searchToolbox.find(call.name());
        if (tool.isEmpty()) {
            log.warn("Model requested unknown tool '{}'", call.name());
            return TOOL_ERROR + "Unknown tool '" + call.name() + "'. Available tools: "
                    + String.join(", ", searchToolbox.names());
        }

        try {
            return tool.get().call(call.arguments(), budget);
        } catch (ToolExecutionException e) {
            log.warn("Rejected tool call {}: {}", call.name(), e.getMessage());
            return TOOL_ERROR + e.getMessage();
        } catch (RuntimeException e) {
            log.error("Tool {} failed", call.name(), e);
            return TOOL_ERROR + call.name() + " failed: " + e.getMessage();
        }
    }

    private String await(CompletableFuture<String> pending, AssistantMessage.ToolCall call, TimeBudget budget) {
        try {
            return pending.get(Math.max(1, budget.remainingMs()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            log.warn("Tool {} timed out", call.name());
            return TOOL_ERROR + call.name() + " timed out";
        } catch (ExecutionException e) {
            log.error("Tool {} failed", call.name(), e.getCause());
            return TOOL_ERROR + call.name() + " failed: " + e.getCause().getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TOOL_ERROR + call.name() + " interrupted";
        }
    }

    static boolean isFailure(String toolResult) {
        return toolResult.startsWith(TOOL_ERROR) || toolResult.startsWith(SearchToolCallback.SEARCH_FAILED);
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
