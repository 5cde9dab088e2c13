package com.eainde.bidding.workflow;

import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.PipelineErrorCode;

/**
 * Why a run ended in {@link PipelineState#FAILED}.
 */
public record PipelineFailure(PipelineErrorCode errorCode, String message) {

    public static PipelineFailure of(BiddingPipelineException e) {
        return new PipelineFailure(e.getErrorCode(), e.getMessage());
    }
}
