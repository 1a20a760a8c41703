package com.admissionsrag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored chunk as returned by a search, without its embedding.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRef {

    private String id;

    private String schoolId;

    private String pageId;

    private Integer chunkIndex;

    private PageType pageType;

    private String text;

    private ChunkMetadata metadata;

    public String sourceUrl() {
        if (metadata != null && metadata.getSourceUrl() != null) {
            return metadata.getSourceUrl();
        }
        return pageId;
    }
}
