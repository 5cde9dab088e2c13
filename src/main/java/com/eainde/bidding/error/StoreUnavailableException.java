package com.eainde.bidding.error;

/**
 * The vector store cannot be reached. Fatal for the run.
 */
public class StoreUnavailableException extends BiddingPipelineException {

    public StoreUnavailableException(String message) {
        super(PipelineErrorCode.STORE_UNAVAILABLE, message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(PipelineErrorCode.STORE_UNAVAILABLE, message, cause);
    }
}
