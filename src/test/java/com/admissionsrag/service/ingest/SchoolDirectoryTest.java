package com.admissionsrag.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.admissionsrag.config.AdmissionsRagProperties;

class SchoolDirectoryTest {

    private SchoolDirectory directory;

    static AdmissionsRagProperties.School school(String id, String... domains) {
        AdmissionsRagProperties.School school = new AdmissionsRagProperties.School();
        school.setId(id);
        school.setName(id);
        school.setDomains(List.of(domains));
        return school;
    }

    @BeforeEach
    void setUp() {
        AdmissionsRagProperties properties = new AdmissionsRagProperties();
        properties.setSchools(List.of(
                school("stanford", "stanford.edu"),
                school("uiuc", "illinois.edu"),
                school("cmu", "cmu.edu")));
        directory = new SchoolDirectory(properties);
    }

    @Test
    void resolvesSubdomainsOfSchoolDomain() {
        assertThat(directory.resolveByDomain("https://gradadmissions.stanford.edu/apply")).contains("stanford");
        assertThat(directory.resolveByDomain("https://cmu.edu")).contains("cmu");
    }

    @Test
    void doesNotMatchDomainSuffixWithoutDot() {
        assertThat(directory.resolveByDomain("https://notstanford.edu/faq")).isEmpty();
    }

    @Test
    void unparseableUrlResolvesToNothing() {
        assertThat(directory.resolveByDomain("not a url")).isEmpty();
        assertThat(directory.resolveByDomain(null)).isEmpty();
    }

    @Test
    void fileNameHintMatchesIdOrDomainLabel() {
        assertThat(directory.resolveByHint("uiuc_reddit")).contains("uiuc");
        assertThat(directory.resolveByHint("illinois_pages")).contains("uiuc");
        assertThat(directory.resolveByHint("misc")).isEmpty();
    }

    @Test
    void domainWinsOverHint() {
        assertThat(directory.resolve("https://www.cs.cmu.edu/", "stanford_pages")).contains("cmu");
        assertThat(directory.resolve("https://www.reddit.com/r/x", "stanford_reddit")).contains("stanford");
    }

    @Test
    void knownIdsFollowConfiguration() {
        assertThat(directory.knownIds()).containsExactly("stanford", "uiuc", "cmu");
        assertThat(directory.isKnown("UIUC")).isTrue();
        assertThat(directory.isKnown("mit")).isFalse();
    }

    @Test
    void canonicalReturnsConfiguredSpelling() {
        assertThat(directory.canonical(" UIUC ")).contains("uiuc");
        assertThat(directory.canonical("Cmu")).contains("cmu");
        assertThat(directory.canonical("mit")).isEmpty();
        assertThat(directory.canonical(null)).isEmpty();
    }
}
