package com.admissionsrag.service.rag;

import static com.admissionsrag.TestFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.admissionsrag.dto.internal.RetrievalResult;
import com.admissionsrag.exception.RerankException;
import com.admissionsrag.service.embedding.CrossEncoderClient;

@ExtendWith(MockitoExtension.class)
class RerankServiceTest {

    @Mock private CrossEncoderClient crossEncoderClient;

    private RerankService rerankService;

    private final List<RetrievalResult> candidates = List.of(
            result("a", "alpha", 0.9),
            result("b", "beta", 0.8),
            result("c", "gamma", 0.7),
            result("d", "delta", 0.6));

    @BeforeEach
    void setUp() {
        rerankService = new RerankService(crossEncoderClient);
    }

    @Test
    void ordersByCrossEncoderScore() {
        when(crossEncoderClient.score(eq("q"), anyList())).thenReturn(List.of(0.1, 0.7, 0.9, 0.3));

        List<RetrievalResult> top = rerankService.rerank("q", candidates, 2);

        assertThat(top).extracting(RetrievalResult::getText).containsExactly("gamma", "beta");
        assertThat(top).extracting(RetrievalResult::getRerankScore).containsExactly(0.9, 0.7);
        assertThat(top.get(0).getVectorScore()).isEqualTo(0.7);
    }

    @Test
    void tiesKeepVectorOrder() {
        when(crossEncoderClient.score(eq("q"), anyList())).thenReturn(List.of(0.5, 0.5, 0.5, 0.9));

        List<RetrievalResult> top = rerankService.rerank("q", candidates, 4);

        assertThat(top).extracting(RetrievalResult::getText).containsExactly("delta", "alpha", "beta", "gamma");
    }

    @Test
    void unavailableCrossEncoderKeepsVectorOrder() {
        when(crossEncoderClient.score(eq("q"), anyList())).thenThrow(new RerankException("circuit open"));

        List<RetrievalResult> top = rerankService.rerank("q", candidates, 3);

        assertThat(top).extracting(RetrievalResult::getText).containsExactly("alpha", "beta", "gamma");
        assertThat(top).allSatisfy(r -> assertThat(r.getRerankScore()).isNull());
    }

    @Test
    void emptyCandidatesSkipTheModel() {
        assertThat(rerankService.rerank("q", List.of(), 5)).isEmpty();
        verifyNoInteractions(crossEncoderClient);
    }
}
