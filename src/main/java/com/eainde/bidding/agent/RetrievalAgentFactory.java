package com.eainde.bidding.agent;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.retrieval.RetrievalPlanner;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Creates {@link RetrievalExtractionAgent}s sharing one planner and one LLM provider.
 * Agents keep no state between runs, so a fresh instance per spec is cheap.
 */
public class RetrievalAgentFactory implements AgentFactory {

    private final RetrievalPlanner planner;
    private final LlmProvider llm;
    private final RetryingCaller retryingCaller;
    private final ObjectMapper objectMapper;
    private final PipelineProperties props;

    public RetrievalAgentFactory(RetrievalPlanner planner, LlmProvider llm, RetryingCaller retryingCaller,
                                 ObjectMapper objectMapper, PipelineProperties props) {
        this.planner = planner;
        this.llm = llm;
        this.retryingCaller = retryingCaller;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public ExtractionAgent create(AgentSpec spec) {
        return new RetrievalExtractionAgent(spec, planner, llm, retryingCaller, objectMapper, props);
    }
}
