package com.admissionsrag.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * LLM-judged quality of one answer: context relevance, faithfulness and
 * answer relevance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResult {

    private List<MetricScore> metrics;

    private double averageScore;
}
