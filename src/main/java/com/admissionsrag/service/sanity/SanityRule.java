package com.admissionsrag.service.sanity;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One plausibility check: where to find the number, which values are
 * acceptable, and what a miss usually means.
 *
 * @param valueGroup      capture group holding the numeric value
 * @param validRanges     inclusive ranges; a value inside any of them passes
 * @param zeroImplausible whether an exact zero is flagged on its own
 */
public record SanityRule(
        SanityCategory category,
        Pattern pattern,
        int valueGroup,
        List<Range> validRanges,
        boolean zeroImplausible,
        String rangeExplanation,
        String zeroExplanation) {

    public record Range(double min, double max) {

        public boolean contains(double value) {
            return value >= min && value <= max;
        }

        @Override
        public String toString() {
            return format(min) + "-" + format(max);
        }

        private static String format(double value) {
            return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
        }
    }

    public boolean inRange(double value) {
        return validRanges.stream().anyMatch(range -> range.contains(value));
    }
}
