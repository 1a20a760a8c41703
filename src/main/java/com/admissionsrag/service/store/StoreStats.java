package com.admissionsrag.service.store;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreStats {

    private String backend;

    private long totalChunks;

    private long totalPages;

    private Map<String, Long> chunksBySchool;

    private Map<String, Long> chunksByPageType;
}
