package com.eainde.bidding.agent;

/**
 * Builds an executable agent from its specification.
 */
@FunctionalInterface
public interface AgentFactory {

    ExtractionAgent create(AgentSpec spec);
}
