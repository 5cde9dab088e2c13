package com.eainde.bidding.model;

/**
 * What the orchestrator collected from one agent.
 *
 * @param result the agent's fields, {@code null} when the agent produced none
 * @param error  failure description, {@code null} when the agent succeeded
 */
public record AgentOutcome(String agentName, AgentStatus status, PartialExtractionResult result, String error) {

    public static AgentOutcome completed(PartialExtractionResult result) {
        return new AgentOutcome(result.agentName(), result.status(), result, null);
    }

    public static AgentOutcome failed(String agentName, PartialExtractionResult result, String error) {
        return new AgentOutcome(agentName, AgentStatus.FAILED, result, error);
    }

    public static AgentOutcome timedOut(String agentName) {
        return new AgentOutcome(agentName, AgentStatus.TIMED_OUT, null, "extraction timed out");
    }
}
