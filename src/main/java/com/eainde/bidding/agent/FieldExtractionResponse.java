package com.eainde.bidding.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured answer of the model for one field.
 *
 * @param evidenceId 1-based number of the evidence block the value was taken from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldExtractionResponse(
        @JsonProperty("found") boolean found,
        @JsonProperty("value") String value,
        @JsonProperty("evidence_id") Integer evidenceId,
        @JsonProperty("quote") String quote,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("notes") String notes) {
}
