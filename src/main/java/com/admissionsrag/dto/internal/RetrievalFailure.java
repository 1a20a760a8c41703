package com.admissionsrag.dto.internal;

public record RetrievalFailure(Kind kind, String message) {

    public enum Kind {
        EMBEDDING,
        STORAGE,
        TIMEOUT
    }
}
