package com.admissionsrag.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SearchRequest {

    @NotBlank
    private String query;

    @Min(1)
    @Max(50)
    private Integer topK;

    private String schoolId;

    private String pageType;

    private Boolean expand;

    @Min(1)
    @Max(600)
    private Integer timeoutSeconds;
}
