package com.admissionsrag.service.ingest;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.exception.IngestionException;
import com.admissionsrag.exception.RagException;
import com.admissionsrag.model.Chunk;
import com.admissionsrag.model.ChunkMetadata;
import com.admissionsrag.model.Page;
import com.admissionsrag.model.PageType;
import com.admissionsrag.service.embedding.EmbeddingService;
import com.admissionsrag.service.store.ChunkStore;
import com.admissionsrag.util.TimeBudget;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Chunks, embeds and stores pages one at a time. Each page is committed on
 * its own; a bad page is counted as skipped and the batch carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final PageChunker pageChunker;
    private final PageTypeClassifier pageTypeClassifier;
    private final SchoolDirectory schoolDirectory;
    private final EmbeddingService embeddingService;
    private final ChunkStore chunkStore;
    private final AdmissionsRagProperties properties;

    static final String DEADLINE_REASON = "deadline reached before this page";

    public IngestReport ingest(List<Page> pages) {
        return ingest(pages, TimeBudget.ofSeconds(properties.getIngestion().getTimeoutSeconds()));
    }

    /**
     * Ingests pages in order until the budget runs out. Pages not reached
     * before the deadline are reported as skipped; committed pages stay.
     */
    public IngestReport ingest(List<Page> pages, TimeBudget budget) {
        IngestReport report = new IngestReport();
        log.info("Ingesting {} pages", pages.size());

        for (int i = 0; i < pages.size(); i++) {
            Page page = pages.get(i);
            String url = page != null ? page.getUrl() : null;
            if (budget.exhausted()) {
                log.warn("Ingestion deadline reached, skipping {} remaining pages", pages.size() - i);
                report.skip(url, DEADLINE_REASON);
                continue;
            }
            try {
                int written = ingestPage(page);
                report.ingested(written);
                log.info("Ingested {} ({} chunks)", url, written);
            } catch (IngestionException e) {
                log.warn("Skipped {}: {}", url, e.getMessage());
                report.skip(url, e.getMessage());
            } catch (RagException e) {
                log.error("Failed to ingest {}: {}", url, e.getMessage());
                report.skip(url, e.getMessage());
            }
        }

        log.info("Ingestion finished: {} ingested, {} skipped, {} chunks written",
                report.getPagesIngested(), report.getSkipped(), report.getChunksWritten());
        return report;
    }

    /**
     * @return number of chunks written for the page
     */
    public int ingestPage(Page page) {
        Page resolved = resolve(page);

        List<String> texts = pageChunker.chunk(resolved.getRawText(), resolved.getPageType());
        if (texts.isEmpty()) {
            throw new IngestionException("no chunks above the noise floor");
        }

        List<float[]> embeddings = embeddingService.embedBatch(texts);
        if (embeddings.size() != texts.size()) {
            throw new IngestionException("got " + embeddings.size() + " embeddings for " + texts.size() + " chunks");
        }

        ChunkMetadata base = resolved.getMetadata() != null
                ? resolved.getMetadata().toBuilder().sourceUrl(resolved.getUrl()).build()
                : ChunkMetadata.forSource(resolved.getUrl());

        List<Chunk> chunks = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            chunks.add(Chunk.builder()
                    .schoolId(resolved.getSchoolId())
                    .pageId(resolved.pageId())
                    .chunkIndex(i)
                    .text(texts.get(i))
                    .embedding(embeddings.get(i))
                    .pageType(resolved.getPageType())
                    .metadata(base)
                    .build());
        }

        return chunkStore.replacePage(resolved, chunks);
    }

    public int deletePage(String url) {
        int removed = chunkStore.deletePage(url);
        log.info("Deleted {} chunks of {}", removed, url);
        return removed;
    }

    /**
     * Fills in page type and school from the URL when the page does not carry them.
     */
    Page resolve(Page page) {
        if (page == null) {
            throw new IngestionException("empty page entry");
        }
        if (page.getUrl() == null || page.getUrl().isBlank()) {
            throw new IngestionException("page has no url");
        }
        String text = page.getRawText();
        int minChars = properties.getIngestion().getMinPageChars();
        if (text == null || text.strip().length() < minChars) {
            throw new IngestionException("text shorter than " + minChars + " characters");
        }

        PageType pageType = page.getPageType() != null
                ? page.getPageType()
                : pageTypeClassifier.classify(page.getUrl());

        String schoolId = page.getSchoolId();
        if (schoolId == null || schoolId.isBlank()) {
            schoolId = schoolDirectory.resolveByDomain(page.getUrl())
                    .orElseThrow(() -> new IngestionException("unknown school for " + page.getUrl()));
        } else {
            String given = schoolId;
            schoolId = schoolDirectory.canonical(given)
                    .orElseThrow(() -> new IngestionException("unknown school '" + given + "'"));
        }

        return page.toBuilder().pageType(pageType).schoolId(schoolId).build();
    }
}
