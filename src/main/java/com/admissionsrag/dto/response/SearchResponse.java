package com.admissionsrag.dto.response;

import java.util.List;

import com.admissionsrag.dto.internal.ContextItem;
import com.admissionsrag.dto.internal.RetrievalFailure;
import com.admissionsrag.dto.internal.TimingInfo;
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
public class SearchResponse {

    private String query;

    private Boolean expanded;

    private List<ContextItem> results;

    private RetrievalFailure failure;

    private TimingInfo timing;
}
