package com.admissionsrag.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.server.ResponseStatusException;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.dto.response.RagResponse;
import com.admissionsrag.model.PageType;
import com.admissionsrag.service.agent.AgentService;
import com.admissionsrag.service.monitoring.PerformanceMonitorService;
import com.admissionsrag.service.rag.RagAnswerService;
import com.admissionsrag.service.store.InMemoryChunkStore;

@ExtendWith(MockitoExtension.class)
class RagControllerTest {

    @Mock private RagAnswerService ragAnswerService;
    @Mock private AgentService agentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AdmissionsRagProperties properties = new AdmissionsRagProperties();
        RagController controller = new RagController(ragAnswerService, agentService,
                new PerformanceMonitorService(properties), new InMemoryChunkStore(3), properties);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void healthReportsStoreAndFeatures() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.features.rerank").value(true))
                .andExpect(jsonPath("$.store.backend").value("memory"));
    }

    @Test
    void directQueryPassesFilters() throws Exception {
        when(ragAnswerService.query(anyString(), any(), any(), any(), any(), anyBoolean()))
                .thenReturn(RagResponse.builder().answer("3.0").mode("direct").outcome("answered").build());

        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"Minimum GPA?\", \"schoolId\": \"CMU\", \"pageType\": \"faq\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("3.0"));

        verify(ragAnswerService).query(eq("Minimum GPA?"), isNull(), isNull(),
                eq(new SearchFilters("cmu", PageType.FAQ)), isNull(), eq(false));
        verifyNoInteractions(agentService);
    }

    @Test
    void agentModeRoutesToAgent() throws Exception {
        when(agentService.query("Compare CMU and MIT", 3, null))
                .thenReturn(RagResponse.builder().answer("...").mode("agent").agentSteps(2).build());

        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"Compare CMU and MIT\", \"mode\": \"agent\", \"maxSteps\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.agentSteps").value(2));

        verifyNoInteractions(ragAnswerService);
    }

    @Test
    void timeoutAndEvaluateReachTheAnswerService() throws Exception {
        when(ragAnswerService.query(anyString(), any(), any(), any(), any(), anyBoolean()))
                .thenReturn(RagResponse.builder().answer("3.0").mode("direct").outcome("answered").build());

        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"Minimum GPA?\", \"timeoutSeconds\": 5, \"evaluate\": true}"))
                .andExpect(status().isOk());

        verify(ragAnswerService).query(eq("Minimum GPA?"), isNull(), isNull(), any(),
                argThat(budget -> budget != null && budget.remainingMs() > 0 && budget.remainingMs() <= 5000),
                eq(true));
    }

    @Test
    void unknownPageTypeFilterIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"gpa\", \"pageType\": \"brochure\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"gpa\", \"pageType\": \"brochure\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ragAnswerService, agentService);
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \" \"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"gpa\", \"mode\": \"fast\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"gpa\", \"maxSteps\": 50}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"gpa\", \"timeoutSeconds\": 0}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ragAnswerService, agentService);
    }

    @Test
    void unexpectedFailureBecomesServerError() throws Exception {
        when(ragAnswerService.query(anyString(), any(), any(), any(), any(), anyBoolean())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"gpa\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    void filtersIgnoreBlankValues() {
        assertThat(RagController.filters(" ", null)).isEqualTo(new SearchFilters(null, null));
        assertThat(RagController.filters("mit", "requirements")).isEqualTo(new SearchFilters("mit", PageType.CHECKLIST));
        assertThat(RagController.filters(" Stanford ", "FAQ")).isEqualTo(new SearchFilters("stanford", PageType.FAQ));
        assertThatThrownBy(() -> RagController.filters("mit", "brochure"))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("brochure");
    }

    @Test
    void performanceStatsStartEmpty() throws Exception {
        mockMvc.perform(get("/api/performance/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
        mockMvc.perform(get("/api/performance/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalQueries").value(0))
                .andExpect(jsonPath("$.history").isEmpty());
    }
}
