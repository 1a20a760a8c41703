package com.admissionsrag.service.expansion;

import com.admissionsrag.service.llm.OllamaLlmService;
import com.admissionsrag.util.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Asks the chat model for alternative phrasings of a question. The original
 * question always comes first in the returned list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParaphraseService {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]+|\\d+[.)]|\\(\\d+\\))\\s*");

    private final OllamaLlmService llmService;
    private final PromptBuilder promptBuilder;

    /**
     * @return the original query followed by at most {@code count} paraphrases;
     *         just the original when generation fails
     */
    public List<String> paraphrase(String query, int count) {
        List<String> queries = new ArrayList<>();
        queries.add(query);
        if (count <= 0) {
            return queries;
        }

        try {
            String response = llmService.generate(promptBuilder.buildParaphrasePrompt(query, count));
            for (String line : parseLines(response)) {
                if (queries.size() > count) {
                    break;
                }
                if (queries.stream().noneMatch(line::equalsIgnoreCase)) {
                    queries.add(line);
                }
            }
            log.info("Generated {} paraphrases for '{}'", queries.size() - 1, abbreviate(query));
        } catch (RuntimeException e) {
            log.warn("Paraphrase generation failed, searching with the original query only: {}", e.getMessage());
        }
        return queries;
    }

    static List<String> parseLines(String response) {
        if (response == null || response.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String raw : response.split("\\R")) {
            String line = LIST_MARKER.matcher(raw).replaceFirst("").strip();
            if (line.length() >= 2 && line.startsWith("\"") && line.endsWith("\"")) {
                line = line.substring(1, line.length() - 1).strip();
            }
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
