package com.admissionsrag.service.ingest;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.config.AdmissionsRagProperties.School;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps page URLs to school ids using the configured domain table, with the
 * source file name as a fallback hint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchoolDirectory {

    private final AdmissionsRagProperties properties;

    public Optional<String> resolve(String url, String filenameHint) {
        Optional<String> byDomain = resolveByDomain(url);
        if (byDomain.isPresent()) {
            return byDomain;
        }
        return resolveByHint(filenameHint);
    }

    public Optional<String> resolveByDomain(String url) {
        String host = hostOf(url);
        if (host == null) {
            return Optional.empty();
        }
        for (School school : properties.getSchools()) {
            for (String domain : school.getDomains()) {
                String d = domain.toLowerCase(Locale.ROOT);
                if (host.equals(d) || host.endsWith("." + d)) {
                    return Optional.of(school.getId());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Matches a file name such as {@code stanford_pages.json} or
     * {@code uiuc_reddit.json} against school ids and domain labels.
     */
    public Optional<String> resolveByHint(String filenameHint) {
        if (filenameHint == null || filenameHint.isBlank()) {
            return Optional.empty();
        }
        List<String> tokens = List.of(filenameHint.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"));
        for (School school : properties.getSchools()) {
            if (tokens.contains(school.getId().toLowerCase(Locale.ROOT))) {
                return Optional.of(school.getId());
            }
            for (String domain : school.getDomains()) {
                String label = domain.toLowerCase(Locale.ROOT).split("\\.")[0];
                if (tokens.contains(label)) {
                    return Optional.of(school.getId());
                }
            }
        }
        return Optional.empty();
    }

    public boolean isKnown(String schoolId) {
        return canonical(schoolId).isPresent();
    }

    /**
     * Configured id matching {@code schoolId} regardless of case, so that
     * stored chunks always carry the id the search filters use.
     */
    public Optional<String> canonical(String schoolId) {
        if (schoolId == null || schoolId.isBlank()) {
            return Optional.empty();
        }
        String wanted = schoolId.strip();
        return properties.getSchools().stream()
                .map(School::getId)
                .filter(id -> id.equalsIgnoreCase(wanted))
                .findFirst();
    }

    public List<String> knownIds() {
        return properties.getSchools().stream().map(School::getId).toList();
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable page URL '{}': {}", url, e.getMessage());
            return null;
        }
    }
}
