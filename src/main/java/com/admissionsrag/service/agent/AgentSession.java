package com.admissionsrag.service.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * State of one agent run. Lives for a single query and is never shared
 * between threads; tool workers only return values that the loop merges.
 */
@Slf4j
@Getter
public class AgentSession {

    private final List<Message> history = new ArrayList<>();
    private final List<ToolInvocation> invocations = new ArrayList<>();
    private final int maxSteps;

    private AgentState state = AgentState.PLANNING;
    private int stepCount;
    private int modelCalls;
    private String answer;

    public AgentSession(String systemPrompt, String query, int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1: " + maxSteps);
        }
        this.maxSteps = maxSteps;
        history.add(new SystemMessage(systemPrompt));
        history.add(new UserMessage(query));
    }

    public List<Message> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public boolean hasStepsLeft() {
        return stepCount < maxSteps;
    }

    void transition(AgentState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Session already finished in " + state);
        }
        log.debug("Agent {} -> {} (step {}/{})", state, next, stepCount, maxSteps);
        state = next;
    }

    void recordModelReply(AssistantMessage reply) {
        modelCalls++;
        history.add(reply);
    }

    void recordToolResults(ToolResponseMessage results, List<ToolInvocation> calls) {
        history.add(results);
        invocations.addAll(calls);
        stepCount++;
    }

    void addUserInstruction(String instruction) {
        history.add(new UserMessage(instruction));
    }

    void finish(AgentState terminal, String finalAnswer) {
        transition(terminal);
        this.answer = finalAnswer != null ? finalAnswer : "";
    }

    void countModelCall() {
        modelCalls++;
    }

    AgentResult toResult() {
        return AgentResult.builder()
                .answer(answer)
                .terminalState(state)
                .steps(stepCount)
                .modelCalls(modelCalls)
                .invocations(List.copyOf(invocations))
                .build();
    }
}
