package com.eainde.bidding.model;

public record IndexingSummary(String namespaceId, String documentId, int chunkCount, int embeddingBatches) {
}
