package com.admissionsrag.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive character splitter. Text is cut on the coarsest separator that
 * yields pieces no longer than the window, falling back to finer separators
 * (paragraph, line, sentence, word, character). Separators stay attached to
 * the piece they end, so the pieces always concatenate back to the input.
 */
@Slf4j
@Component
public class TextChunker {

    private static final List<Pattern> SEPARATORS = List.of(
            Pattern.compile("\n\n"),
            Pattern.compile("\n"),
            Pattern.compile("[.!?]+\\s+|。"),
            Pattern.compile(" ")
    );

    /**
     * Split text into windows of at most {@code targetSize} characters plus an
     * overlap prefix of at most {@code overlapChars} taken from the end of the
     * previous window.
     */
    public List<String> split(String text, int targetSize, int overlapChars) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<List<String>> windows = packWindows(text, targetSize);
        List<String> chunks = new ArrayList<>(windows.size());

        for (int i = 0; i < windows.size(); i++) {
            String body = String.join("", windows.get(i));
            if (i == 0 || overlapChars <= 0) {
                chunks.add(body);
            } else {
                chunks.add(overlapTail(windows.get(i - 1), overlapChars) + body);
            }
        }

        log.debug("Split {} chars into {} chunks (target {}, overlap {})",
                text.length(), chunks.size(), targetSize, overlapChars);
        return chunks;
    }

    private List<List<String>> packWindows(String text, int targetSize) {
        if (targetSize <= 0) {
            throw new IllegalArgumentException("targetSize must be positive: " + targetSize);
        }

        List<String> pieces = new ArrayList<>();
        collectPieces(text, 0, targetSize, pieces);

        List<List<String>> windows = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentLength = 0;

        for (String piece : pieces) {
            if (currentLength + piece.length() > targetSize && !current.isEmpty()) {
                windows.add(current);
                current = new ArrayList<>();
                currentLength = 0;
            }
            current.add(piece);
            currentLength += piece.length();
        }
        if (!current.isEmpty()) {
            windows.add(current);
        }
        return windows;
    }

    private void collectPieces(String text, int level, int maxSize, List<String> out) {
        if (text.length() <= maxSize) {
            out.add(text);
            return;
        }
        if (level >= SEPARATORS.size()) {
            for (int start = 0; start < text.length(); start += maxSize) {
                out.add(text.substring(start, Math.min(text.length(), start + maxSize)));
            }
            return;
        }

        for (String piece : cutAfter(text, SEPARATORS.get(level))) {
            if (piece.length() <= maxSize) {
                out.add(piece);
            } else {
                collectPieces(piece, level + 1, maxSize, out);
            }
        }
    }

    private static List<String> cutAfter(String text, Pattern separator) {
        List<String> pieces = new ArrayList<>();
        Matcher matcher = separator.matcher(text);
        int start = 0;
        while (matcher.find()) {
            if (matcher.end() > start) {
                pieces.add(text.substring(start, matcher.end()));
                start = matcher.end();
            }
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    /**
     * Trailing whole pieces of the previous window that fit in the overlap.
     * When the last piece alone is too long, its last characters are used,
     * starting at a word boundary when there is one.
     */
    private static String overlapTail(List<String> previous, int overlapChars) {
        StringBuilder tail = new StringBuilder();
        for (int i = previous.size() - 1; i >= 0; i--) {
            String piece = previous.get(i);
            if (tail.length() + piece.length() > overlapChars) {
                break;
            }
            tail.insert(0, piece);
        }
        if (tail.length() > 0) {
            return tail.toString();
        }

        String last = previous.get(previous.size() - 1);
        String raw = last.substring(Math.max(0, last.length() - overlapChars));
        int space = raw.indexOf(' ');
        if (space >= 0 && space < raw.length() - 1) {
            return raw.substring(space + 1);
        }
        return raw;
    }
}
