package com.admissionsrag.dto.internal;

import java.util.ArrayList;
import java.util.List;

import com.admissionsrag.model.ChunkRef;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetrievalResult {

    private ChunkRef chunk;

    private Double vectorScore;

    private Double rerankScore;

    @Builder.Default
    private List<SanityWarning> sanityWarnings = new ArrayList<>();

    private String annotatedText;

    public String getText() {
        return chunk != null ? chunk.getText() : null;
    }

    /**
     * Text to show a reader or a model: the annotated copy when present.
     */
    public String displayText() {
        return annotatedText != null ? annotatedText : getText();
    }

    /**
     * Cross-encoder score when the result was reranked, otherwise the vector score.
     */
    public double effectiveScore() {
        if (rerankScore != null) {
            return rerankScore;
        }
        return vectorScore != null ? vectorScore : 0.0;
    }

    public boolean hasWarnings() {
        return sanityWarnings != null && !sanityWarnings.isEmpty();
    }
}
