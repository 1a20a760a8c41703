package com.admissionsrag.service.agent;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResult {

    private String answer;

    private AgentState terminalState;

    private int steps;

    private int modelCalls;

    private List<ToolInvocation> invocations;
}
