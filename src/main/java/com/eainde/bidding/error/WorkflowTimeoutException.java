package com.eainde.bidding.error;

/**
 * The extraction stage exceeded the workflow timeout.
 */
public class WorkflowTimeoutException extends BiddingPipelineException {

    public WorkflowTimeoutException(String message) {
        super(PipelineErrorCode.WORKFLOW_TIMEOUT, message);
    }

    public WorkflowTimeoutException(String message, Throwable cause) {
        super(PipelineErrorCode.WORKFLOW_TIMEOUT, message, cause);
    }
}
