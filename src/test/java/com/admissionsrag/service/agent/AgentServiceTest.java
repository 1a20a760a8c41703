package com.admissionsrag.service.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.response.RagResponse;
import com.admissionsrag.exception.GenerationException;
import com.admissionsrag.service.monitoring.PerformanceMonitorService;
import com.admissionsrag.util.TimeBudget;

@ExtendWith(MockitoExtension.class)
class AgentServiceTest {

    @Mock private AgentLoopService agentLoopService;

    private PerformanceMonitorService monitor;
    private AgentService agentService;

    @BeforeEach
    void setUp() {
        monitor = new PerformanceMonitorService(new AdmissionsRagProperties());
        agentService = new AgentService(agentLoopService, monitor);
    }

    @Test
    void forcedStopIsReportedAsSuch() {
        when(agentLoopService.run("q", 2, null)).thenReturn(AgentResult.builder()
                .answer("partial")
                .terminalState(AgentState.FORCED_STOP)
                .steps(2)
                .modelCalls(3)
                .invocations(List.of(new ToolInvocation(1, "search_general", "{}", false)))
                .build());

        RagResponse response = agentService.query("q", 2);

        assertThat(response.getMode()).isEqualTo("agent");
        assertThat(response.getOutcome()).isEqualTo("forced_stop");
        assertThat(response.getAgentState()).isEqualTo("FORCED_STOP");
        assertThat(response.getAgentSteps()).isEqualTo(2);
        assertThat(response.getToolCalls()).hasSize(1);
        assertThat(response.getTiming().getStepDurations()).containsKey("Agent Loop");
    }

    @Test
    void modelFailureBecomesErrorResponse() {
        when(agentLoopService.run("q", null, null)).thenThrow(new GenerationException("model not found"));

        RagResponse response = agentService.query("q", null);

        assertThat(response.getOutcome()).isEqualTo("error");
        assertThat(response.getAnswer()).contains("model not found");
        assertThat(monitor.getQueryHistory()).singleElement()
                .satisfies(record -> assertThat(record.mode()).isEqualTo("agent"));
    }

    @Test
    void callerBudgetIsHandedToTheLoop() {
        TimeBudget budget = new TimeBudget(5_000);
        when(agentLoopService.run("q", 3, budget)).thenReturn(AgentResult.builder()
                .answer("done")
                .terminalState(AgentState.DONE)
                .steps(1)
                .modelCalls(2)
                .invocations(List.of())
                .build());

        RagResponse response = agentService.query("q", 3, budget);

        assertThat(response.getOutcome()).isEqualTo("answered");
        assertThat(response.getAnswer()).isEqualTo("done");
    }
}
