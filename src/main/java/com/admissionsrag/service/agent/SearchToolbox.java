package com.admissionsrag.service.agent;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.exception.ToolExecutionException;
import com.admissionsrag.model.PageType;
import com.admissionsrag.service.rag.HybridRetriever;
import com.admissionsrag.service.sanity.SanityAuditor;
import com.admissionsrag.util.ContextAssembler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The three search tools the agent can call.
 */
@Component
public class SearchToolbox {

    public static final String SEARCH_GENERAL = "search_general";
    public static final String SEARCH_SCHOOL = "search_school";
    public static final String SEARCH_PAGE_TYPE = "search_page_type";

    private static final String PAGE_TYPES =
            "[\"faq\", \"checklist\", \"admissions\", \"apply\", \"accepting\", \"reddit\", \"general\"]";

    private final List<SearchToolCallback> tools;

    public SearchToolbox(HybridRetriever hybridRetriever,
                         SanityAuditor sanityAuditor,
                         ContextAssembler contextAssembler,
                         ObjectMapper objectMapper,
                         AdmissionsRagProperties properties) {
        int topK = properties.getAgent().getToolTopK();

        this.tools = List.of(
                new SearchToolCallback(
                        ToolDefinition.builder()
                                .name(SEARCH_GENERAL)
                                .description("Search admissions information across all schools. "
                                        + "Use for broad questions or when the school is unknown.")
                                .inputSchema("""
                                        {"type": "object",
                                         "properties": {
                                           "query": {"type": "string", "description": "What to search for"}
                                         },
                                         "required": ["query"]}
                                        """)
                                .build(),
                        List.of("query"),
                        arguments -> SearchFilters.none(),
                        hybridRetriever, sanityAuditor, contextAssembler, objectMapper, topK),
                new SearchToolCallback(
                        ToolDefinition.builder()
                                .name(SEARCH_SCHOOL)
                                .description("Search admissions information for one school.")
                                .inputSchema("""
                                        {"type": "object",
                                         "properties": {
                                           "query": {"type": "string", "description": "What to search for"},
                                           "school_id": {"type": "string", "description": "School id, e.g. cmu, stanford"}
                                         },
                                         "required": ["query", "school_id"]}
                                        """)
                                .build(),
                        List.of("query", "school_id"),
                        arguments -> SearchFilters.school(schoolId(arguments)),
                        hybridRetriever, sanityAuditor, contextAssembler, objectMapper, topK),
                new SearchToolCallback(
                        ToolDefinition.builder()
                                .name(SEARCH_PAGE_TYPE)
                                .description("Search one kind of page (FAQ, checklist, forum posts, ...) of one school.")
                                .inputSchema("""
                                        {"type": "object",
                                         "properties": {
                                           "query": {"type": "string", "description": "What to search for"},
                                           "school_id": {"type": "string", "description": "School id, e.g. cmu, stanford"},
                                           "page_type": {"type": "string", "enum": %s}
                                         },
                                         "required": ["query", "school_id", "page_type"]}
                                        """.formatted(PAGE_TYPES))
                                .build(),
                        List.of("query", "school_id", "page_type"),
                        arguments -> SearchFilters.schoolAndPageType(
                                schoolId(arguments), pageType(arguments)),
                        hybridRetriever, sanityAuditor, contextAssembler, objectMapper, topK)
        );
    }

    public List<ToolCallback> callbacks() {
        return List.copyOf(tools);
    }

    public Optional<SearchToolCallback> find(String name) {
        return tools.stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    public List<String> names() {
        return tools.stream().map(SearchToolCallback::name).toList();
    }

    private static PageType pageType(JsonNode arguments) {
        String code = arguments.get("page_type").asText();
        return PageType.lookup(code).orElseThrow(() -> new ToolExecutionException(
                "Unknown page_type '" + code + "'. Use one of " + PAGE_TYPES));
    }

    private static String schoolId(JsonNode arguments) {
        return arguments.get("school_id").asText().strip().toLowerCase(Locale.ROOT);
    }
}
