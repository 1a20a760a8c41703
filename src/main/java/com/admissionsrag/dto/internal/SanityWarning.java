package com.admissionsrag.dto.internal;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SanityWarning {

    private String category;

    private String violation;

    private String matchedSnippet;

    private String explanation;

    /**
     * Stable machine code, e.g. {@code gpa_out_of_range}.
     */
    @JsonProperty("code")
    public String code() {
        return category + "_" + violation;
    }
}
