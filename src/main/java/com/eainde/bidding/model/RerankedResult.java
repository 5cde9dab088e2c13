package com.eainde.bidding.model;

/**
 * A retrieval hit after reranking. {@code rank} is 1-based.
 */
public record RerankedResult(RetrievalHit hit, double rerankScore, int rank) {
}
