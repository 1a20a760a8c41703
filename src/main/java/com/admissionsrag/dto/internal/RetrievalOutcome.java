package com.admissionsrag.dto.internal;

import java.util.List;

/**
 * Result of a retrieval call. An empty result list with no failure means
 * nothing matched; a failure means the search itself could not run.
 */
public record RetrievalOutcome(List<RetrievalResult> results, RetrievalFailure failure) {

    public RetrievalOutcome {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static RetrievalOutcome of(List<RetrievalResult> results) {
        return new RetrievalOutcome(results, null);
    }

    public static RetrievalOutcome failed(RetrievalFailure.Kind kind, String message) {
        return new RetrievalOutcome(List.of(), new RetrievalFailure(kind, message));
    }

    public boolean isFailed() {
        return failure != null;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
