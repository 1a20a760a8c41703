package com.admissionsrag.util;

import java.util.List;

import org.springframework.stereotype.Component;

@Component
public class PromptBuilder {

    /* =========================================================
     * ANSWER SYSTEM PROMPT
     * ========================================================= */
    public String buildAnswerSystemPrompt() {
        return """
                You are a graduate admissions assistant. You answer questions about
                application requirements, deadlines, test scores and costs for US
                graduate programs, using only the sources you are given.

                Rules:
                1. ACCURATE: only state facts found in the sources
                2. CITED: name the school and source URL for every fact
                3. HONEST: if the sources do not answer the question, say so
                4. CAREFUL: sources marked [DATA QUALITY WARNING] contain values that
                   look implausible; do not repeat such values as fact, mention that
                   the figure looks wrong and point the reader to the official page
                """;
    }

    /* =========================================================
     * STANDARD RAG PROMPT
     * ========================================================= */
    public String buildStandardPrompt(String question, String context) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("### TASK\n");
        prompt.append("Answer the admissions question using the sources below.\n\n");

        prompt.append("### SOURCES\n");
        prompt.append(context).append("\n\n");

        prompt.append("### QUESTION\n");
        prompt.append(question).append("\n\n");

        prompt.append("### ANSWER REQUIREMENTS\n");
        prompt.append("- Be concise and specific (numbers, dates, names)\n");
        prompt.append("- Cite the school and source URL\n");
        prompt.append("- When schools differ, compare them explicitly\n\n");

        prompt.append("### ANSWER");

        return prompt.toString();
    }

    /* =========================================================
     * AGENT
     * ========================================================= */
    public String buildAgentSystemPrompt(List<String> knownSchools) {
        return """
                You are a graduate admissions research agent. You answer by searching
                a knowledge base of university admissions pages and student forum posts.

                Tools:
                - search_general(query): search every school. Use for broad or comparative questions.
                - search_school(query, school_id): search one school's pages.
                - search_page_type(query, school_id, page_type): search one kind of page
                  (faq, checklist, admissions, apply, accepting, reddit, general) of one school.

                Known school ids: %s

                Strategy:
                1. Start with the narrowest tool that fits the question.
                2. If a search finds nothing, broaden it or rephrase the query.
                3. For comparisons, search each school separately.
                4. Stop searching as soon as you can answer, then answer without tools.

                Suspicious data:
                Search results may start with [DATA QUALITY WARNING]. Known valid ranges:
                GPA 0.0-4.5, TOEFL iBT 0-120, IELTS 0-9, GRE 130-170 per section or
                260-340 total. When a value is flagged:
                - do not present it as fact
                - look for a second source that confirms the correct figure
                - if none is found, tell the user the published figure looks wrong
                  and recommend checking the official page

                Always cite the school and source URL for every fact in your final answer.
                """.formatted(knownSchools.isEmpty() ? "(none configured)" : String.join(", ", knownSchools));
    }

    public String buildForcedFinalInstruction() {
        return """
                You have reached the search limit. Do not call any more tools.
                Write your final answer now using only the search results above.
                If they are not sufficient, say what is missing.
                """;
    }

    /* =========================================================
     * QUERY EXPANSION
     * ========================================================= */
    public String buildParaphrasePrompt(String query, int count) {
        return """
                Rewrite the following graduate admissions question in %d different ways
                to improve search recall. Vary the wording and use synonyms (for example
                "English proficiency" for "TOEFL", "deadline" for "due date").
                Keep school names and numbers unchanged.

                Question: "%s"

                Return exactly %d lines, one rewritten question per line, with no
                numbering and no other text.
                """.formatted(count, query, count);
    }

    /* =========================================================
     * EVALUATION (LLM AS JUDGE)
     * ========================================================= */
    public String buildContextRelevancePrompt(String question, List<String> contexts) {
        return """
                You are a strict quality auditor for a retrieval system. Judge whether the
                retrieved context is sufficient, on its own, to answer the question.

                Question: %s

                Retrieved context:
                %s

                Scoring (1-5):
                1: completely unrelated
                2: a few keywords match but nothing that answers the question
                3: contains the key facts but lacks the surrounding explanation
                4: fully answers the question but mixes in irrelevant passages
                5: every passage is relevant, no noise, enough depth for an expert answer

                Reply in this format:
                Reasoning: (your analysis)
                Score: (1-5)
                """.formatted(question, joinContexts(contexts));
    }

    public String buildFaithfulnessPrompt(String answer, List<String> contexts) {
        return """
                You are a fact checker. Judge whether the answer is based entirely and
                only on the reference material. Any statement without an explicit source
                in the material, including guesses or general knowledge, lowers the score.

                Reference material:
                %s

                Answer:
                %s

                Scoring (1-5):
                1: contradicts the material
                2: mostly matches but core figures or requirements look invented
                3: faithful wording but adds inferences or outside knowledge
                4: precise, with only minor subjective phrasing
                5: every claim and figure has an explicit written source in the material

                Reply in this format:
                Reasoning: (your checks)
                Score: (1-5)
                """.formatted(joinContexts(contexts), answer);
    }

    public String buildAnswerRelevancePrompt(String question, String answer) {
        return """
                You are a communication expert. Judge whether the answer resolves the
                question as directly and efficiently as possible.

                Question: %s

                Answer:
                %s

                Scoring (1-5):
                1: does not answer the question or is vague
                2: too long, full of background the user did not ask for
                3: correct but loosely structured, the core answer is buried
                4: clear and direct, could be tighter
                5: concise, precise and free of filler

                Reply in this format:
                Reasoning: (your analysis)
                Score: (1-5)
                """.formatted(question, answer);
    }

    private static String joinContexts(List<String> contexts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < contexts.size(); i++) {
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("Context ").append(i + 1).append(": ").append(contexts.get(i));
        }
        return sb.toString();
    }
}
