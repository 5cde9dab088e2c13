package com.eainde.bidding.error;

import com.eainde.bidding.model.PartialExtractionResult;
import lombok.Getter;

/**
 * Every field of an agent ended up unavailable. Carries the agent's result so the
 * aggregator can still report the individual failure notes.
 */
@Getter
public class AgentTotalFailureException extends BiddingPipelineException {

    private final transient PartialExtractionResult result;

    public AgentTotalFailureException(String agentName, PartialExtractionResult result) {
        super(PipelineErrorCode.AGENT_TOTAL_FAILURE,
                "All " + result.fields().size() + " fields of agent '" + agentName + "' failed");
        this.result = result;
    }
}
