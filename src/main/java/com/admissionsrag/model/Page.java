package com.admissionsrag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A harvested page. The URL doubles as the page id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Page {

    private String url;

    private PageType pageType;

    private String schoolId;

    private String rawText;

    private ChunkMetadata metadata;

    public String pageId() {
        return url;
    }
}
