package com.eainde.bidding.error;

/**
 * The document source cannot read the given file type.
 */
public class UnsupportedFormatException extends BiddingPipelineException {

    public UnsupportedFormatException(String message) {
        super(PipelineErrorCode.UNSUPPORTED_FORMAT, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(PipelineErrorCode.UNSUPPORTED_FORMAT, message, cause);
    }
}
