package com.eainde.bidding.provider;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;

/**
 * Structured completion: the model answers {@code prompt} with JSON conforming to {@code schema}.
 */
public interface LlmProvider {

    JsonNode complete(String prompt, JsonSchema schema);
}
