package com.admissionsrag.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueryRequest {

    @NotBlank
    private String question;

    /**
     * direct | multi_query | agent
     */
    @Pattern(regexp = "direct|multi_query|agent")
    private String mode;

    @Min(1)
    @Max(50)
    private Integer topK;

    private String schoolId;

    private String pageType;

    @Min(1)
    @Max(10)
    private Integer maxSteps;

    /**
     * Deadline for the whole request; the configured timeout when absent
     */
    @Min(1)
    @Max(600)
    private Integer timeoutSeconds;

    /**
     * Score the answer with the LLM judge (direct and multi_query modes)
     */
    private Boolean evaluate;
}
