package com.admissionsrag.dto.response;

import com.admissionsrag.dto.internal.ContextItem;
import com.admissionsrag.dto.internal.TimingInfo;
import com.admissionsrag.service.agent.ToolInvocation;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagResponse {

    // ================= CORE RESPONSE =================
    private String question;

    private String answer;

    private List<ContextItem> context;

    private TimingInfo timing;

    private String requestId;

    // ================= EXECUTION MODE =================
    /**
     * direct, multi_query, agent, or error
     */
    private String mode;

    /**
     * answered, no_results, unavailable, timeout, or error
     */
    private String outcome;

    // ================= AGENT =================
    private String agentState;

    private Integer agentSteps;

    private List<ToolInvocation> toolCalls;

    // ================= EVALUATION =================
    private EvaluationResult evaluation;
}
