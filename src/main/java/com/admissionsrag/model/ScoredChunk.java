package com.admissionsrag.model;

public record ScoredChunk(ChunkRef chunk, double score) {
}
