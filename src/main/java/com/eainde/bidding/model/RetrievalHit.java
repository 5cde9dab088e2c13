package com.eainde.bidding.model;

import java.util.Comparator;

/**
 * A chunk returned by a similarity query, with its relevance score.
 */
public record RetrievalHit(String chunkId, double score, String text, TextSpan span, String namespaceId,
                           Integer pageNumber) {

    /** Score descending, chunk id ascending on ties so orderings are reproducible. */
    public static final Comparator<RetrievalHit> BY_SCORE_DESC =
            Comparator.comparingDouble(RetrievalHit::score).reversed()
                    .thenComparing(RetrievalHit::chunkId);

    public RetrievalHit withScore(double newScore) {
        return new RetrievalHit(chunkId, newScore, text, span, namespaceId, pageNumber);
    }
}
