package com.admissionsrag.service.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.admissionsrag.config.AdmissionsRagProperties;
import com.admissionsrag.config.AdmissionsRagProperties.Profile;
import com.admissionsrag.model.PageType;
import com.admissionsrag.util.TextChunker;

class PageChunkerTest {

    private AdmissionsRagProperties properties;
    private PageChunker chunker;

    @BeforeEach
    void setUp() {
        properties = new AdmissionsRagProperties();
        chunker = new PageChunker(new TextChunker(), properties);
    }

    @Nested
    @DisplayName("FAQ pages")
    class Faq {

        private static final String FAQ = """
                What is the minimum GPA for admission? There is no strict minimum GPA, but most admitted students have strong records.
                How many letters of recommendation are required? Three letters of recommendation are required for every applicant.
                Is the GRE required? The GRE is optional for the 2025 application cycle and will not be considered.""";

        @Test
        void oneChunkPerQuestion() {
            List<String> chunks = chunker.chunk(FAQ, PageType.FAQ);

            assertThat(chunks).hasSize(3);
            assertThat(chunks.get(0)).startsWith("What is the minimum GPA");
            assertThat(chunks.get(1)).startsWith("How many letters");
            assertThat(chunks.get(2)).startsWith("Is the GRE required?");
        }

        @Test
        void shortAnswerJoinsPreviousQuestion() {
            String text = """
                    What documents do I need to submit with my application? Transcripts, a statement of purpose and a resume.
                    Is there a fee? Yes.""";

            List<String> chunks = chunker.chunk(text, PageType.FAQ);

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0)).contains("Is there a fee? Yes.");
        }

        @Test
        void oversizedAnswerIsWindowedWithinTheFaqBound() {
            Profile faq = properties.profileFor(PageType.FAQ);
            int bound = faq.getTargetSize() + chunker.overlapChars(faq);
            String question = "What are the English proficiency requirements? ";
            String answer = "Applicants whose first language is not English must submit official test scores. ".repeat(20);
            String text = question + answer
                    + "Is the GRE required? The GRE is optional for the 2025 application cycle and will not be considered.";
            assertThat(question.length() + answer.length()).isGreaterThan(faq.getTargetSize());

            List<String> chunks = chunker.chunk(text, PageType.FAQ);

            assertThat(chunks).hasSizeGreaterThanOrEqualTo(3);
            assertThat(chunks.get(0)).startsWith("What are the English proficiency requirements?");
            assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(bound));
            assertThat(chunks.subList(0, chunks.size() - 1))
                    .allSatisfy(chunk -> assertThat(chunk).doesNotContain("GRE"));
            assertThat(chunks.get(chunks.size() - 1)).startsWith("Is the GRE required?");
        }

        @Test
        void pageWithoutQuestionsIsWindowed() {
            String text = "The graduate office is open on weekdays and answers email within two business days.";

            assertThat(chunker.chunk(text, PageType.FAQ)).containsExactly(text);
        }
    }

    @Nested
    @DisplayName("windowed pages")
    class Windowed {

        private String requirements() {
            StringBuilder sb = new StringBuilder();
            for (int i = 1; i <= 30; i++) {
                sb.append(String.format("Requirement %02d: ", i)).append("a".repeat(82)).append(". ");
            }
            return sb.toString();
        }

        @Test
        void threeThousandCharPageWithLargeProfileGivesTwoChunks() {
            properties.getChunking().getProfiles().put(PageType.ADMISSIONS, new Profile(1600, 0.2));
            String text = requirements();
            assertThat(text).hasSize(3000);

            List<String> chunks = chunker.chunk(text, PageType.ADMISSIONS);

            assertThat(chunks).hasSize(2);
            assertThat(chunks.get(0)).startsWith("Requirement 01:");
            // second window opens with the three trailing sentences of the first
            assertThat(chunks.get(1)).startsWith("Requirement 14:");
            assertThat(chunks.get(1)).endsWith("Requirement 30: " + "a".repeat(82) + ".");
        }

        @Test
        void overlapHasAFloor() {
            assertThat(chunker.overlapChars(new Profile(600, 0.05))).isEqualTo(50);
            assertThat(chunker.overlapChars(new Profile(1600, 0.2))).isEqualTo(320);
        }

        @Test
        void chunksBelowNoiseFloorAreDropped() {
            assertThat(chunker.chunk("Apply now.", PageType.GENERAL)).isEmpty();
        }

        @Test
        void blankTextGivesNoChunks() {
            assertThat(chunker.chunk("", PageType.CHECKLIST)).isEmpty();
            assertThat(chunker.chunk(null, PageType.CHECKLIST)).isEmpty();
        }

        @Test
        void sameInputGivesSameChunks() {
            String text = requirements();

            assertThat(chunker.chunk(text, PageType.CHECKLIST)).isEqualTo(chunker.chunk(text, PageType.CHECKLIST));
        }

        @Test
        void missingPageTypeUsesGeneralProfile() {
            String text = requirements();

            assertThat(chunker.chunk(text, null)).isEqualTo(chunker.chunk(text, PageType.GENERAL));
        }
    }
}
