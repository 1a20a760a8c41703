package com.admissionsrag.service.agent;

import java.util.List;
import java.util.function.Function;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

import com.admissionsrag.dto.internal.RetrievalOutcome;
import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.exception.ToolExecutionException;
import com.admissionsrag.service.rag.HybridRetriever;
import com.admissionsrag.service.sanity.SanityAuditor;
import com.admissionsrag.util.ContextAssembler;
import com.admissionsrag.util.TimeBudget;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * A search tool offered to the agent. Each variant is one hybrid search with
 * a different filter; results are audited and rendered as plain text.
 */
@Slf4j
public class SearchToolCallback implements ToolCallback {

    static final String NOT_FOUND = "No relevant information found.";
    static final String SEARCH_FAILED = "[search failed] ";

    private final ToolDefinition definition;
    private final List<String> requiredArguments;
    private final Function<JsonNode, SearchFilters> filterFactory;
    private final HybridRetriever hybridRetriever;
    private final SanityAuditor sanityAuditor;
    private final ContextAssembler contextAssembler;
    private final ObjectMapper objectMapper;
    private final int topK;

    public SearchToolCallback(ToolDefinition definition,
                              List<String> requiredArguments,
                              Function<JsonNode, SearchFilters> filterFactory,
                              HybridRetriever hybridRetriever,
                              SanityAuditor sanityAuditor,
                              ContextAssembler contextAssembler,
                              ObjectMapper objectMapper,
                              int topK) {
        this.definition = definition;
        this.requiredArguments = List.copyOf(requiredArguments);
        this.filterFactory = filterFactory;
        this.hybridRetriever = hybridRetriever;
        this.sanityAuditor = sanityAuditor;
        this.contextAssembler = contextAssembler;
        this.objectMapper = objectMapper;
        this.topK = topK;
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    public String name() {
        return definition.name();
    }

    @Override
    public String call(String toolInput) {
        return call(toolInput, (TimeBudget) null);
    }

    /**
     * @param budget deadline of the calling agent session, or null for none
     */
    public String call(String toolInput, TimeBudget budget) {
        JsonNode arguments = parseArguments(toolInput);
        String query = arguments.get("query").asText().strip();
        SearchFilters filters = filterFactory.apply(arguments);

        log.info("Tool {} query='{}' school={} pageType={}", name(), query,
                filters.schoolId(), filters.pageType() != null ? filters.pageType().code() : null);

        RetrievalOutcome outcome = hybridRetriever.search(query, topK, filters, budget);

        if (outcome.isFailed()) {
            return SEARCH_FAILED + outcome.failure().kind() + ": " + outcome.failure().message()
                    + ". The search backend is unavailable; answer from earlier results or say the "
                    + "information could not be retrieved.";
        }
        if (outcome.isEmpty()) {
            return "[search results] " + NOT_FOUND + " (query: '" + query + "'" + scope(filters) + ")";
        }

        List<RetrievalResult> annotated = sanityAuditor.annotate(outcome.results());
        return "[search results] " + annotated.size() + " result(s) for '" + query + "'" + scope(filters)
                + "\n\n" + contextAssembler.assemble(annotated);
    }

    JsonNode parseArguments(String toolInput) {
        JsonNode arguments;
        try {
            arguments = objectMapper.readTree(toolInput == null || toolInput.isBlank() ? "{}" : toolInput);
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException("Arguments for " + name() + " are not valid JSON: " + e.getOriginalMessage());
        }
        if (arguments == null || !arguments.isObject()) {
            throw new ToolExecutionException("Arguments for " + name() + " must be a JSON object");
        }
        for (String required : requiredArguments) {
            JsonNode value = arguments.get(required);
            if (value == null || value.isNull() || value.asText().isBlank()) {
                throw new ToolExecutionException("Missing required argument '" + required + "' for " + name());
            }
        }
        return arguments;
    }

    private static String scope(SearchFilters filters) {
        StringBuilder sb = new StringBuilder();
        if (filters.hasSchool()) {
            sb.append(", school ").append(filters.schoolId());
        }
        if (filters.hasPageType()) {
            sb.append(", page type ").append(filters.pageType().code());
        }
        return sb.toString();
    }
}
