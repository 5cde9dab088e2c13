package com.eainde.bidding.error;

/**
 * Extraction of a single field failed. The field is recorded as unavailable and the agent carries on.
 */
public class FieldExtractionException extends BiddingPipelineException {

    public FieldExtractionException(String message) {
        super(PipelineErrorCode.FIELD_EXTRACTION_FAILED, message);
    }

    public FieldExtractionException(String message, Throwable cause) {
        super(PipelineErrorCode.FIELD_EXTRACTION_FAILED, message, cause);
    }
}
