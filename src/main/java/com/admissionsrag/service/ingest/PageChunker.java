package com.admissionsrag.service.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.config.AdmissionsRagProperties.Profile;
import com.admissionsrag.model.PageType;
import com.admissionsrag.util.TextChunker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Page-type aware chunking. FAQ pages are cut at question boundaries first;
 * every other type goes straight through the window splitter. Chunks shorter
 * than the noise floor are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PageChunker {

    /**
     * A question sentence starting at text start or right after a sentence
     * terminator or line break.
     */
    private static final Pattern QUESTION_START = Pattern.compile(
            "(?:^|(?<=[.!?\\n]))[ \\t]*"
                    + "((?:What|How|When|Where|Why|Who|Which|Can|Could|Do|Does|Did|Is|Are"
                    + "|Will|Would|Should|May|Must)\\b[^?\\n]{0,300}\\?)");

    private final TextChunker textChunker;
    private final AdmissionsRagProperties properties;

    public List<String> chunk(String text, PageType pageType) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        PageType type = pageType != null ? pageType : PageType.GENERAL;
        Profile profile = properties.profileFor(type);
        int targetSize = profile.getTargetSize();
        int overlap = overlapChars(profile);

        List<String> raw = type == PageType.FAQ
                ? splitFaq(text, targetSize, overlap)
                : textChunker.split(text, targetSize, overlap);

        int noiseFloor = properties.getChunking().getNoiseFloor();
        List<String> chunks = raw.stream()
                .map(String::strip)
                .filter(chunk -> chunk.length() >= noiseFloor)
                .toList();

        log.debug("Chunked {} chars of {} page into {} chunks ({} dropped as noise)",
                text.length(), type.code(), chunks.size(), raw.size() - chunks.size());
        return chunks;
    }

    public int overlapChars(Profile profile) {
        int proportional = (int) Math.floor(profile.getTargetSize() * profile.getOverlapFraction());
        return Math.max(properties.getChunking().getOverlapFloor(), proportional);
    }

    private List<String> splitFaq(String text, int targetSize, int overlap) {
        List<String> fragments = mergeShortFragments(questionFragments(text));

        List<String> chunks = new ArrayList<>();
        for (String fragment : fragments) {
            if (fragment.length() > targetSize) {
                chunks.addAll(textChunker.split(fragment, targetSize, overlap));
            } else {
                chunks.add(fragment);
            }
        }
        return chunks;
    }

    List<String> questionFragments(String text) {
        List<Integer> starts = new ArrayList<>();
        Matcher matcher = QUESTION_START.matcher(text);
        while (matcher.find()) {
            starts.add(matcher.start(1));
        }

        if (starts.isEmpty()) {
            return List.of(text);
        }
        if (starts.get(0) != 0) {
            starts.add(0, 0);
        }

        List<String> fragments = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            fragments.add(text.substring(starts.get(i), end));
        }
        return fragments;
    }

    /**
     * Short fragments join the preceding fragment, or the following one when
     * nothing precedes them.
     */
    private List<String> mergeShortFragments(List<String> fragments) {
        int minFragment = properties.getChunking().getFaqMinFragment();
        List<String> merged = new ArrayList<>();
        String pending = "";

        for (String fragment : fragments) {
            String candidate = pending + fragment;
            pending = "";
            if (candidate.strip().length() >= minFragment) {
                merged.add(candidate);
            } else if (!merged.isEmpty()) {
                int last = merged.size() - 1;
                merged.set(last, merged.get(last) + candidate);
            } else {
                pending = candidate;
            }
        }

        if (!pending.isEmpty()) {
            if (merged.isEmpty()) {
                merged.add(pending);
            } else {
                int last = merged.size() - 1;
                merged.set(last, merged.get(last) + pending);
            }
        }
        return merged;
    }
}
