package com.admissionsrag.service.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.springframework.stereotype.Service;

import com.admissionsrag.exception.IngestionException;
import com.admissionsrag.model.Page;
import com.admissionsrag.model.PageType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads harvested pages from a directory of JSON files.
 * <ul>
 *   <li>an object file maps page URL to raw page text</li>
 *   <li>an array file (e.g. {@code stanford_reddit.json}) holds forum posts with
 *       {@code title}, {@code content} and optional {@code url}</li>
 * </ul>
 * The file name is used as a school hint when a URL does not identify one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageSourceLoader {

    private final ObjectMapper objectMapper;
    private final SchoolDirectory schoolDirectory;
    private final PageTypeClassifier pageTypeClassifier;

    public List<Page> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IngestionException("Source directory not found: " + directory.toAbsolutePath());
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IngestionException("Cannot list " + directory, e);
        }

        List<Page> pages = new ArrayList<>();
        for (Path file : files) {
            try {
                List<Page> loaded = loadFile(file);
                pages.addAll(loaded);
                log.info("Loaded {} pages from {}", loaded.size(), file.getFileName());
            } catch (IngestionException e) {
                log.warn("Skipping source file {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return pages;
    }

    public List<Page> loadFile(Path file) {
        String hint = file.getFileName().toString().replaceFirst("\\.json$", "");
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IngestionException("Unreadable JSON in " + file.getFileName(), e);
        }

        if (root == null) {
            return List.of();
        }
        if (root.isArray()) {
            return forumPosts(root, hint);
        }
        if (root.isObject()) {
            return urlToTextPages(root, hint);
        }
        throw new IngestionException("Expected a JSON object or array in " + file.getFileName());
    }

    private List<Page> urlToTextPages(JsonNode root, String hint) {
        List<Page> pages = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String url = field.getKey();
            if (!field.getValue().isTextual()) {
                log.debug("Ignoring non-text entry for {}", url);
                continue;
            }
            pages.add(Page.builder()
                    .url(url)
                    .rawText(field.getValue().asText())
                    .pageType(pageTypeClassifier.classify(url))
                    .schoolId(schoolDirectory.resolve(url, hint).orElse(null))
                    .build());
        }
        return pages;
    }

    private List<Page> forumPosts(JsonNode root, String hint) {
        String schoolId = schoolDirectory.resolveByHint(hint).orElse(null);
        List<Page> pages = new ArrayList<>();
        int index = 0;
        for (JsonNode post : root) {
            String title = post.path("title").asText("");
            String content = post.hasNonNull("content") ? post.get("content").asText() : post.path("selftext").asText("");
            String url = post.hasNonNull("url") ? post.get("url").asText() : "reddit://" + hint + "/" + index;
            index++;

            if (title.isBlank() && content.isBlank()) {
                continue;
            }
            pages.add(Page.builder()
                    .url(url)
                    .rawText("Title: " + title + "\nContent: " + content)
                    .pageType(PageType.REDDIT)
                    .schoolId(schoolId)
                    .build());
        }
        return pages;
    }
}
