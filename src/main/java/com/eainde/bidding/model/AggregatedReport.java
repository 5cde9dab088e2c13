package com.eainde.bidding.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final, immutable result of a pipeline run.
 *
 * <p>Holds one section per registered agent in registration order and a manifest of agent
 * statuses. The report carries no timestamps, so two runs over the same inputs with
 * deterministic providers produce equal reports.</p>
 */
public record AggregatedReport(String documentId, String documentName, List<ReportSection> sections,
                               Map<String, AgentStatus> manifest, List<String> processingNotes) {

    public AggregatedReport {
        sections = List.copyOf(sections);
        manifest = Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
        processingNotes = List.copyOf(processingNotes);
    }

    public Optional<ExtractionField> field(String name) {
        return sections.stream()
                .flatMap(s -> s.fields().stream())
                .filter(f -> f.name().equals(name))
                .findFirst();
    }

    public Optional<ReportSection> section(String agentName) {
        return sections.stream().filter(s -> s.agentName().equals(agentName)).findFirst();
    }

    public List<ExtractionField> allFields() {
        return sections.stream().flatMap(s -> s.fields().stream()).toList();
    }
}
