package com.eainde.bidding.agent;

import com.eainde.bidding.model.Query;

import java.util.List;

/**
 * Declares one field an agent extracts.
 *
 * @param name        stable machine name, unique across all agents
 * @param label       human-readable label used in prompts and reports
 * @param query       primary retrieval query
 * @param alternates  keyword queries for later retrieval rounds
 * @param instruction what exactly to extract, in the model's terms
 */
public record FieldSpec(String name, String label, String query, List<String> alternates, String instruction) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
        label = label == null ? name : label;
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
        instruction = instruction == null ? "" : instruction;
    }

    public static FieldSpec of(String name, String label, String query, String instruction, String... alternates) {
        return new FieldSpec(name, label, query, List.of(alternates), instruction);
    }

    public Query toQuery() {
        return new Query(name, query, alternates);
    }
}
