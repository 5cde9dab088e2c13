package com.eainde.bidding.error;

/**
 * The document has no text to index. Raised before any provider is called.
 */
public class EmptyDocumentException extends BiddingPipelineException {

    public EmptyDocumentException(String message) {
        super(PipelineErrorCode.EMPTY_DOCUMENT, message);
    }

    public EmptyDocumentException(String message, Throwable cause) {
        super(PipelineErrorCode.EMPTY_DOCUMENT, message, cause);
    }
}
