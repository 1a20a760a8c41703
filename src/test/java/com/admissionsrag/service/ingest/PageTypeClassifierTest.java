package com.admissionsrag.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.admissionsrag.model.PageType;

class PageTypeClassifierTest {

    private final PageTypeClassifier classifier = new PageTypeClassifier();

    @ParameterizedTest
    @CsvSource({
            "https://www.reddit.com/r/gradadmissions/comments/abc, REDDIT",
            "https://gradadmissions.stanford.edu/faq, FAQ",
            "https://www.cs.cmu.edu/frequently-asked-questions, FAQ",
            "https://grad.illinois.edu/requirements, CHECKLIST",
            "https://www.cs.ucla.edu/graduate-admissions, ADMISSIONS",
            "https://gradapply.mit.edu/portal, APPLY",
            "https://cs.ucsd.edu/accepting-students, ACCEPTING",
            "https://www.caltech.edu/about, GENERAL"
    })
    void classifiesByFirstMatchingRule(String url, PageType expected) {
        assertThat(classifier.classify(url)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(value = {"''", "'   '"})
    void blankUrlIsGeneral(String url) {
        assertThat(classifier.classify(url)).isEqualTo(PageType.GENERAL);
    }
}
