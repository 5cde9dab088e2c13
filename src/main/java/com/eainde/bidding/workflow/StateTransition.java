package com.eainde.bidding.workflow;

public record StateTransition(PipelineState from, PipelineState to, String reason) {
}
