package com.admissionsrag.service.ingest;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * Outcome of one ingestion batch. Skipped pages do not stop the batch.
 */
@Data
public class IngestReport {

    private int pagesSeen;

    private int pagesIngested;

    private int chunksWritten;

    private int skipped;

    private List<SkippedPage> skippedPages = new ArrayList<>();

    public record SkippedPage(String url, String reason) {
    }

    void ingested(int chunks) {
        pagesSeen++;
        pagesIngested++;
        chunksWritten += chunks;
    }

    void skip(String url, String reason) {
        pagesSeen++;
        skipped++;
        skippedPages.add(new SkippedPage(url, reason));
    }
}
