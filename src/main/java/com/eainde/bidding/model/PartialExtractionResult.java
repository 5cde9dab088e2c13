package com.eainde.bidding.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The fields produced by a single agent, keyed by field name in the agent's declared order.
 */
public record PartialExtractionResult(String agentName, Map<String, ExtractionField> fields) {

    public PartialExtractionResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a result, rejecting any field outside {@code domain} and any duplicate.
     */
    public static PartialExtractionResult of(String agentName, Collection<String> domain,
                                             List<ExtractionField> extracted) {
        Set<String> allowed = Set.copyOf(domain);
        Map<String, ExtractionField> byName = new LinkedHashMap<>();
        for (ExtractionField field : extracted) {
            if (!allowed.contains(field.name())) {
                throw new IllegalArgumentException("Agent '" + agentName
                        + "' produced field '" + field.name() + "' outside its domain " + domain);
            }
            if (byName.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("Agent '" + agentName
                        + "' produced field '" + field.name() + "' twice");
            }
        }
        return new PartialExtractionResult(agentName, byName);
    }

    public long unavailableCount() {
        return fields.values().stream().filter(ExtractionField::isUnavailable).count();
    }

    public AgentStatus status() {
        long unavailable = unavailableCount();
        if (unavailable == 0) {
            return AgentStatus.SUCCEEDED;
        }
        return unavailable == fields.size() ? AgentStatus.FAILED : AgentStatus.PARTIAL;
    }
}
