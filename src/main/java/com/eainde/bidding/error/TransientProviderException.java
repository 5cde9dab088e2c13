package com.eainde.bidding.error;

/**
 * A provider call failed in a way that may succeed on retry (rate limit, timeout, malformed output).
 */
public class TransientProviderException extends BiddingPipelineException {

    public TransientProviderException(String message) {
        super(PipelineErrorCode.PROVIDER_TRANSIENT, message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(PipelineErrorCode.PROVIDER_TRANSIENT, message, cause);
    }
}
