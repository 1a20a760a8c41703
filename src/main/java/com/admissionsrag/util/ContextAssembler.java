package com.admissionsrag.util;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.model.ChunkMetadata;
import com.admissionsrag.model.ChunkRef;

import lombok.extern.slf4j.Slf4j;

/**
 * Renders ranked results into the source block handed to the model. The
 * first block is always included; later blocks are added while the total
 * stays within budget.
 */
@Slf4j
@Component
public class ContextAssembler {

    private static final String BLOCK_SEPARATOR = "\n\n";

    private final int maxCharsPerChunk;
    private final int maxTotalChars;

    @Autowired
    public ContextAssembler(AdmissionsRagProperties properties) {
        this(properties.getContext().getMaxCharsPerChunk(), properties.getContext().getMaxTotalChars());
    }

    public ContextAssembler(int maxCharsPerChunk, int maxTotalChars) {
        this.maxCharsPerChunk = maxCharsPerChunk;
        this.maxTotalChars = maxTotalChars;
    }

    public String assemble(List<RetrievalResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }

        StringBuilder context = new StringBuilder();
        int included = 0;

        for (int i = 0; i < results.size(); i++) {
            String block = block(i + 1, results.get(i));
            int added = (included == 0 ? 0 : BLOCK_SEPARATOR.length()) + block.length();
            if (included > 0 && context.length() + added > maxTotalChars) {
                break;
            }
            if (included > 0) {
                context.append(BLOCK_SEPARATOR);
            }
            context.append(block);
            included++;
        }

        if (included < results.size()) {
            log.debug("Context budget reached: {} of {} sources included", included, results.size());
        }
        return context.toString();
    }

    String block(int rank, RetrievalResult result) {
        ChunkRef chunk = result.getChunk();
        StringBuilder sb = new StringBuilder();

        sb.append("--- Source ").append(rank).append(" (")
          .append(chunk.getSchoolId() != null ? chunk.getSchoolId() : "unknown")
          .append(" / ")
          .append(chunk.getPageType() != null ? chunk.getPageType().code() : "general")
          .append(") ---\n");

        String structured = structuredLine(chunk.getMetadata());
        if (!structured.isEmpty()) {
            sb.append("[Structured] ").append(structured).append('\n');
        }

        sb.append("[Text] ").append(truncate(result.displayText(), maxCharsPerChunk)).append('\n');
        sb.append("(source: ").append(chunk.sourceUrl()).append(')');
        return sb.toString();
    }

    static String structuredLine(ChunkMetadata metadata) {
        if (metadata == null || !metadata.hasStructuredFacts()) {
            return "";
        }

        List<String> parts = new ArrayList<>();
        if (metadata.getMinimumGpa() != null) {
            parts.add("minimum GPA " + metadata.getMinimumGpa());
        }
        if (metadata.getToeflMin() != null || metadata.getToeflRequired() != null) {
            parts.add(testPart("TOEFL", metadata.getToeflMin(), metadata.getToeflRequired()));
        }
        if (metadata.getIeltsMin() != null || metadata.getIeltsRequired() != null) {
            parts.add(testPart("IELTS", metadata.getIeltsMin(), metadata.getIeltsRequired()));
        }
        if (metadata.getGreStatus() != null) {
            parts.add("GRE " + metadata.getGreStatus());
        }
        if (metadata.getFallDeadline() != null) {
            parts.add("fall deadline " + metadata.getFallDeadline());
        }
        if (metadata.getSpringDeadline() != null) {
            parts.add("spring deadline " + metadata.getSpringDeadline());
        }
        if (metadata.getRecommendationLetters() != null) {
            parts.add(metadata.getRecommendationLetters() + " recommendation letters");
        }
        if (metadata.getInterviewRequired() != null) {
            parts.add("interview " + metadata.getInterviewRequired());
        }
        return String.join(" | ", parts);
    }

    private static String testPart(String test, Number minimum, Boolean required) {
        StringBuilder sb = new StringBuilder(test);
        if (minimum != null) {
            sb.append(" min ").append(minimum);
        }
        if (required != null) {
            sb.append(required ? " (required)" : " (not required)");
        }
        return sb.toString();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}
