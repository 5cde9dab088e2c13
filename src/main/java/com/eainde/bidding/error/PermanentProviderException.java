package com.eainde.bidding.error;

/**
 * A provider call failed in a way retrying cannot fix (bad credentials, invalid request).
 */
public class PermanentProviderException extends BiddingPipelineException {

    public PermanentProviderException(String message) {
        super(PipelineErrorCode.PROVIDER_PERMANENT, message);
    }

    public PermanentProviderException(String message, Throwable cause) {
        super(PipelineErrorCode.PROVIDER_PERMANENT, message, cause);
    }
}
