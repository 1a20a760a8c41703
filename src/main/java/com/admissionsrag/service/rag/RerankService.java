package com.admissionsrag.service.rag;

import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.exception.RagException;
import com.admissionsrag.service.embedding.CrossEncoderClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Second retrieval stage: cross-encoder scoring of (query, chunk) pairs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RerankService {

    private final CrossEncoderClient crossEncoderClient;

    /**
     * Score every candidate against the query and keep the best {@code topK}.
     * The sort is stable, so equal scores keep their stage-1 order. If the
     * cross-encoder is unavailable the candidates keep their vector order.
     */
    public List<RetrievalResult> rerank(String query, List<RetrievalResult> candidates, int topK) {
        log.debug("Reranking {} results to top {}", candidates.size(), topK);

        if (candidates.isEmpty()) {
            return List.of();
        }

        List<Double> scores;
        try {
            scores = crossEncoderClient.score(query, candidates.stream().map(RetrievalResult::getText).toList());
        } catch (RagException e) {
            log.warn("Cross-encoder unavailable, keeping vector order: {}", e.getMessage());
            return candidates.stream().limit(topK).toList();
        }

        List<RetrievalResult> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            reranked.add(candidates.get(i).toBuilder().rerankScore(scores.get(i)).build());
        }

        reranked.sort(Comparator.comparingDouble(RetrievalResult::getRerankScore).reversed());

        List<RetrievalResult> top = reranked.stream().limit(topK).toList();
        log.debug("Reranking complete: returned {} results", top.size());
        return top;
    }
}
