package com.admissionsrag.service.store;

import java.util.List;

import com.admissionsrag.exception.StoreException;
import com.admissionsrag.model.Chunk;
import com.admissionsrag.model.Page;

/**
 * Write-side checks shared by the store implementations. Any violation
 * rejects the whole page.
 */
final class ChunkBatchValidator {

    private ChunkBatchValidator() {
    }

    static void validate(Page page, List<Chunk> chunks, int dimension) {
        if (page == null || page.pageId() == null || page.pageId().isBlank()) {
            throw new StoreException("Page id is required");
        }
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            if (!page.pageId().equals(chunk.getPageId())) {
                throw new StoreException("Chunk " + i + " belongs to " + chunk.getPageId()
                        + ", not " + page.pageId());
            }
            if (chunk.getChunkIndex() != i) {
                throw new StoreException("Chunk indices must be contiguous from 0 for "
                        + page.pageId() + ": found " + chunk.getChunkIndex() + " at position " + i);
            }
            if (chunk.getText() == null || chunk.getText().isBlank()) {
                throw new StoreException("Chunk " + i + " of " + page.pageId() + " has no text");
            }
            if (chunk.getEmbedding() == null || chunk.getEmbedding().length != dimension) {
                throw new StoreException(String.format(
                        "Embedding dimension mismatch for chunk %d of %s: expected %d, got %s",
                        i, page.pageId(), dimension,
                        chunk.getEmbedding() == null ? "none" : chunk.getEmbedding().length));
            }
        }
    }
}
