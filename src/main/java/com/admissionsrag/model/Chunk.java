package com.admissionsrag.model;

import lombok.Builder;
import lombok.Value;

/**
 * A chunk ready to be written: text and embedding always travel together.
 */
@Value
@Builder
public class Chunk {

    String schoolId;

    String pageId;

    int chunkIndex;

    String text;

    float[] embedding;

    PageType pageType;

    ChunkMetadata metadata;
}
