package com.admissionsrag.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricScore {

    private String metric;

    /**
     * 1-5, or 0 when the judge gave no readable score
     */
    private double score;

    private String reasoning;

    private String error;
}
