package com.eainde.bidding.error;

/**
 * Error codes carried by every {@link BiddingPipelineException}.
 */
public enum PipelineErrorCode {

    STORE_UNAVAILABLE("BID-001", "Vector store is unavailable"),
    EMPTY_DOCUMENT("BID-002", "Document contains no extractable text"),
    UNSUPPORTED_FORMAT("BID-003", "Document format is not supported"),
    PROVIDER_TRANSIENT("BID-010", "Provider call failed with a transient error"),
    PROVIDER_PERMANENT("BID-011", "Provider call failed permanently"),
    FIELD_EXTRACTION_FAILED("BID-020", "Field extraction failed"),
    AGENT_TOTAL_FAILURE("BID-021", "Every field of the agent failed"),
    WORKFLOW_TIMEOUT("BID-030", "Workflow did not finish within its timeout"),
    INDEXING_FAILED("BID-040", "Document indexing failed"),
    INTERNAL_ERROR("BID-099", "Unexpected pipeline error");

    private final String code;
    private final String message;

    PipelineErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
