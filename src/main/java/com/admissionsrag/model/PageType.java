package com.admissionsrag.model;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse classification of a harvested page. Drives the chunking profile and
 * serves as an equality filter at search time.
 */
public enum PageType {

    FAQ("faq"),
    CHECKLIST("checklist"),
    ADMISSIONS("admissions"),
    APPLY("apply"),
    ACCEPTING("accepting"),
    REDDIT("reddit"),
    GENERAL("general");

    private final String code;

    PageType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a wire code. Unknown or blank codes map to {@link #GENERAL}.
     * Use {@link #lookup(String)} where an unknown code is an error.
     */
    @JsonCreator
    public static PageType fromCode(String code) {
        return lookup(code).orElse(GENERAL);
    }

    public static Optional<PageType> lookup(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (PageType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        // "requirements" pages share the checklist profile
        if (normalized.equals("requirements")) {
            return Optional.of(CHECKLIST);
        }
        return Optional.empty();
    }
}
