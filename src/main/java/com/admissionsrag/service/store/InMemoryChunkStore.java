package com.admissionsrag.service.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.model.Chunk;
import com.admissionsrag.model.ChunkRef;
import com.admissionsrag.model.Page;
import com.admissionsrag.model.ScoredChunk;

import lombok.extern.slf4j.Slf4j;

/**
 * Brute-force cosine store for local runs and tests. Each page's chunk list is
 * swapped in with a single map write. For production use the pgvector store.
 */
@Slf4j
public class InMemoryChunkStore implements ChunkStore {

    private final Map<String, List<Chunk>> pages = new ConcurrentSkipListMap<>();
    private final int dimension;

    public InMemoryChunkStore(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public int replacePage(Page page, List<Chunk> chunks) {
        ChunkBatchValidator.validate(page, chunks, dimension);

        if (chunks.isEmpty()) {
            pages.remove(page.pageId());
        } else {
            pages.put(page.pageId(), List.copyOf(chunks));
        }
        log.debug("Stored {} chunks for {}", chunks.size(), page.pageId());
        return chunks.size();
    }

    @Override
    public int deletePage(String pageId) {
        List<Chunk> removed = pages.remove(pageId);
        return removed != null ? removed.size() : 0;
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, SearchFilters filters, int limit) {
        SearchFilters f = filters != null ? filters : SearchFilters.none();
        List<ScoredChunk> scored = new ArrayList<>();

        for (List<Chunk> chunks : pages.values()) {
            for (Chunk chunk : chunks) {
                if (f.hasSchool() && !f.schoolId().equals(chunk.getSchoolId())) {
                    continue;
                }
                if (f.hasPageType() && f.pageType() != chunk.getPageType()) {
                    continue;
                }
                scored.add(new ScoredChunk(toRef(chunk), cosine(queryEmbedding, chunk.getEmbedding())));
            }
        }

        scored.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        return scored.stream().limit(limit).toList();
    }

    @Override
    public StoreStats stats() {
        List<Chunk> all = pages.values().stream().flatMap(List::stream).toList();
        return StoreStats.builder()
                .backend("memory")
                .totalChunks(all.size())
                .totalPages(pages.size())
                .chunksBySchool(all.stream().collect(Collectors.groupingBy(
                        Chunk::getSchoolId, TreeMap::new, Collectors.counting())))
                .chunksByPageType(all.stream().collect(Collectors.groupingBy(
                        chunk -> chunk.getPageType().code(), TreeMap::new, Collectors.counting())))
                .build();
    }

    private static ChunkRef toRef(Chunk chunk) {
        return ChunkRef.builder()
                .id(chunk.getPageId() + "#" + chunk.getChunkIndex())
                .schoolId(chunk.getSchoolId())
                .pageId(chunk.getPageId())
                .chunkIndex(chunk.getChunkIndex())
                .pageType(chunk.getPageType())
                .text(chunk.getText())
                .metadata(chunk.getMetadata())
                .build();
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
