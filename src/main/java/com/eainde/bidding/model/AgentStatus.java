package com.eainde.bidding.model;

/**
 * Outcome of one extraction agent, as reported in the report manifest.
 */
public enum AgentStatus {
    SUCCEEDED,
    /** Some, but not all, fields are unavailable. */
    PARTIAL,
    FAILED,
    TIMED_OUT,
    /** The agent produced no outcome at all. */
    MISSING
}
