package com.eainde.bidding.error;

/**
 * Chunking, embedding or upserting a document failed.
 */
public class IndexingException extends BiddingPipelineException {

    public IndexingException(String message) {
        super(PipelineErrorCode.INDEXING_FAILED, message);
    }

    public IndexingException(String message, Throwable cause) {
        super(PipelineErrorCode.INDEXING_FAILED, message, cause);
    }
}
