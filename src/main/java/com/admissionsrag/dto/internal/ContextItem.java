package com.admissionsrag.dto.internal;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextItem {
    
    private Integer rank;
    
    private Double score;

    private Double vectorScore;
    
    private String chunkId;

    private String schoolId;

    private String pageType;

    private String sourceUrl;
    
    private String text;

    private List<String> warnings;

    public static ContextItem from(int rank, RetrievalResult result) {
        var chunk = result.getChunk();
        return ContextItem.builder()
                .rank(rank)
                .score(result.effectiveScore())
                .vectorScore(result.getVectorScore())
                .chunkId(chunk.getId())
                .schoolId(chunk.getSchoolId())
                .pageType(chunk.getPageType() != null ? chunk.getPageType().code() : null)
                .sourceUrl(chunk.sourceUrl())
                .text(chunk.getText())
                .warnings(result.getSanityWarnings().stream().map(SanityWarning::code).toList())
                .build();
    }
}
