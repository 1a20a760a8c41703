package com.admissionsrag.service.sanity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

import org.springframework.stereotype.Service;

import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.dto.internal.SanityWarning;

import lombok.extern.slf4j.Slf4j;

/**
 * Flags admissions numbers outside their known valid ranges. Warnings are
 * attached to retrieval results; stored chunk text is never changed.
 */
@Slf4j
@Service
public class SanityAuditor {

    static final String OUT_OF_RANGE = "out_of_range";
    static final String ZERO = "zero";

    private static final int MAX_SNIPPET = 80;

    private final List<SanityRule> rules;

    public SanityAuditor() {
        this(SanityRuleTable.defaults());
    }

    public SanityAuditor(List<SanityRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<SanityWarning> audit(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<SanityWarning> warnings = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        for (SanityRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                Double value = parse(matcher.group(rule.valueGroup()));
                if (value == null) {
                    continue;
                }

                SanityWarning warning = null;
                if (value == 0.0 && rule.zeroImplausible()) {
                    warning = warning(rule, ZERO, matcher.group(), rule.zeroExplanation());
                } else if (!rule.inRange(value)) {
                    warning = warning(rule, OUT_OF_RANGE, matcher.group(),
                            "value " + matcher.group(rule.valueGroup()) + " outside " + rule.validRanges()
                                    + ": " + rule.rangeExplanation());
                }

                if (warning != null && seen.add(warning.code() + "|" + warning.getMatchedSnippet())) {
                    warnings.add(warning);
                }
            }
        }
        return warnings;
    }

    /**
     * Copies of the results with warnings attached and, where any fired, a
     * warning banner prepended to the annotated text.
     */
    public List<RetrievalResult> annotate(List<RetrievalResult> results) {
        List<RetrievalResult> annotated = new ArrayList<>(results.size());
        int flagged = 0;

        for (RetrievalResult result : results) {
            List<SanityWarning> warnings = audit(result.getText());
            String text = result.getText();
            if (!warnings.isEmpty()) {
                flagged++;
                text = banner(warnings) + "\n\n" + text;
            }
            annotated.add(result.toBuilder()
                    .sanityWarnings(List.copyOf(warnings))
                    .annotatedText(text)
                    .build());
        }

        if (flagged > 0) {
            log.info("Sanity audit flagged {} of {} results", flagged, results.size());
        }
        return annotated;
    }

    static String banner(List<SanityWarning> warnings) {
        StringBuilder sb = new StringBuilder("[DATA QUALITY WARNING] Some values in this source look implausible:");
        for (SanityWarning warning : warnings) {
            sb.append("\n- ").append(warning.code())
              .append(": \"").append(warning.getMatchedSnippet()).append("\" (")
              .append(warning.getExplanation()).append(")");
        }
        return sb.toString();
    }

    private static SanityWarning warning(SanityRule rule, String violation, String match, String explanation) {
        String snippet = match.strip().replaceAll("\\s+", " ");
        if (snippet.length() > MAX_SNIPPET) {
            snippet = snippet.substring(0, MAX_SNIPPET) + "...";
        }
        return SanityWarning.builder()
                .category(rule.category().code())
                .violation(violation)
                .matchedSnippet(snippet)
                .explanation(explanation)
                .build();
    }

    private static Double parse(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
