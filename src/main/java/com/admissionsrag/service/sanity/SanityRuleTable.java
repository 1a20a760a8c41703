package com.admissionsrag.service.sanity;

import java.util.List;
import java.util.regex.Pattern;

import com.admissionsrag.service.sanity.SanityRule.Range;

/**
 * Known valid ranges for admissions numbers. Patterns look at most 40
 * non-digit characters past the keyword so they stay linear on long chunks.
 */
public final class SanityRuleTable {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private SanityRuleTable() {
    }

    public static List<SanityRule> defaults() {
        return List.of(
                new SanityRule(
                        SanityCategory.GPA,
                        Pattern.compile("\\b(?:gpa|grade point average)\\b[^0-9\\n]{0,40}?(\\d{1,3}(?:\\.\\d{1,2})?)", FLAGS),
                        1,
                        List.of(new Range(0.0, 4.5)),
                        true,
                        "GPA above the 4.0/4.3/4.5 scales; likely a percentage or 10-point grade, or a parsing slip",
                        "a GPA of zero is not a real requirement; likely a placeholder or parsing slip"),
                new SanityRule(
                        SanityCategory.TOEFL,
                        Pattern.compile("\\btoefl\\b[^0-9\\n]{0,40}?(\\d{2,3})\\b", FLAGS),
                        1,
                        List.of(new Range(0, 120)),
                        false,
                        "TOEFL iBT tops out at 120; likely an outdated paper-based (PBT, 310-677) score",
                        null),
                new SanityRule(
                        SanityCategory.IELTS,
                        Pattern.compile("\\bielts\\b[^0-9\\n]{0,40}?(\\d{1,2}(?:\\.\\d)?)", FLAGS),
                        1,
                        List.of(new Range(0.0, 9.0)),
                        true,
                        "IELTS bands run from 0 to 9; likely a parsing slip",
                        "an IELTS band of zero is not a real requirement"),
                new SanityRule(
                        SanityCategory.GRE,
                        Pattern.compile("\\bgre\\b[^0-9\\n]{0,40}?(\\d{3})\\b", FLAGS),
                        1,
                        List.of(new Range(130, 170), new Range(260, 340)),
                        false,
                        "GRE sections score 130-170 and totals 260-340; likely the pre-2011 200-800 scale or a parsing artifact",
                        null),
                new SanityRule(
                        SanityCategory.COST,
                        Pattern.compile("\\$\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.\\d{2})?"),
                        1,
                        List.of(new Range(0, 100_000)),
                        false,
                        "over $100,000; likely a multi-year total or a parsing slip",
                        null)
        );
    }
}
