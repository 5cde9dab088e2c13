package com.eainde.bidding.error;

import lombok.Getter;

import java.util.Optional;

/**
 * Base class of every failure raised by the pipeline. Carries an error code so callers
 * can tell failure kinds apart without inspecting messages.
 */
@Getter
public abstract class BiddingPipelineException extends RuntimeException {

    private final PipelineErrorCode errorCode;

    protected BiddingPipelineException(PipelineErrorCode errorCode, String message, Throwable cause) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), cause);
        this.errorCode = errorCode;
    }

    protected BiddingPipelineException(PipelineErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }
}
