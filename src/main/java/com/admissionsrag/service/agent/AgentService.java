package com.admissionsrag.service.agent;

import java.util.List;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import com.admissionsrag.dto.response.RagResponse;
import com.admissionsrag.exception.RagException;
import com.admissionsrag.service.monitoring.PerformanceMonitorService;
import com.admissionsrag.service.monitoring.QueryTimer;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Request boundary of the agent mode: runs the loop, records timings and
 * turns a model failure into an error response.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentService {

    public static final String MODE_AGENT = "agent";

    private final AgentLoopService agentLoopService;
    private final PerformanceMonitorService performanceMonitor;

    public RagResponse query(String question, Integer maxSteps) {
        return query(question, maxSteps, null);
    }

    public RagResponse query(String question, Integer maxSteps, TimeBudget budget) {
        QueryTimer timer = new QueryTimer();
        timer.start();

        try {
            AgentResult result = agentLoopService.run(question, maxSteps, budget);
            timer.mark("Agent Loop");
            timer.end();

            String outcome = result.getTerminalState() == AgentState.DONE ? "answered" : "forced_stop";
            performanceMonitor.record(question, MODE_AGENT, outcome, timer);
            log.info("agent ({}, {} steps)\n{}", outcome, result.getSteps(), timer.formatDisplay());

            return RagResponse.builder()
                    .question(question)
                    .answer(result.getAnswer())
                    .context(List.of())
                    .timing(timer.toTimingInfo())
                    .requestId(MDC.get("requestId"))
                    .mode(MODE_AGENT)
                    .outcome(outcome)
                    .agentState(result.getTerminalState().name())
                    .agentSteps(result.getSteps())
                    .toolCalls(result.getInvocations())
                    .build();

        } catch (RagException e) {
            log.error("Agent run failed", e);
            timer.end();
            performanceMonitor.record(question, MODE_AGENT, "error", timer);
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
}
