package com.admissionsrag.service.store;

import java.util.List;

import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.model.Chunk;
import com.admissionsrag.model.Page;
import com.admissionsrag.model.ScoredChunk;

/**
 * Persistent chunk index. Writes are page-atomic: a page's chunk set is
 * replaced as a whole or not at all.
 */
public interface ChunkStore {

    /**
     * Replace every stored chunk of the page with {@code chunks}.
     *
     * @return number of chunks written
     */
    int replacePage(Page page, List<Chunk> chunks);

    /**
     * @return number of chunks removed
     */
    int deletePage(String pageId);

    /**
     * Nearest chunks by cosine similarity, best first.
     */
    List<ScoredChunk> search(float[] queryEmbedding, SearchFilters filters, int limit);

    StoreStats stats();
}
