package com.admissionsrag.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured facts attached to a chunk. Known keys are typed fields, anything
 * else lands in {@code extra} and is written back out unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChunkMetadata {

    private String sourceUrl;

    private Double minimumGpa;

    private Integer toeflMin;

    private Boolean toeflRequired;

    private Double ieltsMin;

    private Boolean ieltsRequired;

    private String greStatus;

    private String fallDeadline;

    private String springDeadline;

    private Integer recommendationLetters;

    private String interviewRequired;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        extra.put(key, value);
    }

    /**
     * True when at least one admissions fact is known.
     */
    @JsonIgnore
    public boolean hasStructuredFacts() {
        return minimumGpa != null || toeflMin != null || toeflRequired != null
                || ieltsMin != null || ieltsRequired != null || greStatus != null
                || fallDeadline != null || springDeadline != null
                || recommendationLetters != null || interviewRequired != null;
    }

    public static ChunkMetadata forSource(String sourceUrl) {
        return ChunkMetadata.builder().sourceUrl(sourceUrl).build();
    }
}
