package com.admissionsrag.service.ingest;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.admissionsrag.model.PageType;

/**
 * Infers a page type from its URL. First matching rule wins.
 */
@Component
public class PageTypeClassifier {

    private record Rule(PageType type, List<String> keywords) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(PageType.REDDIT, List.of("reddit.com")),
            new Rule(PageType.FAQ, List.of("faq", "frequently-asked", "frequently_asked")),
            new Rule(PageType.CHECKLIST, List.of("checklist", "requirements")),
            new Rule(PageType.ADMISSIONS, List.of("admissions", "admission")),
            new Rule(PageType.APPLY, List.of("apply", "application")),
            new Rule(PageType.ACCEPTING, List.of("accepting", "acceptance"))
    );

    public PageType classify(String url) {
        if (url == null || url.isBlank()) {
            return PageType.GENERAL;
        }
        String normalized = url.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            for (String keyword : rule.keywords()) {
                if (normalized.contains(keyword)) {
                    return rule.type();
                }
            }
        }
        return PageType.GENERAL;
    }
}
