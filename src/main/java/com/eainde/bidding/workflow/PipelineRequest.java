package com.eainde.bidding.workflow;

import com.eainde.bidding.model.Document;

import java.util.Objects;

/**
 * One document to analyse within a session. Documents of the same session share a
 * retrieval namespace.
 */
public record PipelineRequest(String sessionId, Document document) {

    public PipelineRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(document, "document must not be null");
    }
}
