package com.eainde.bidding.model;

import java.util.List;
import java.util.Optional;

public record ReportSection(String agentName, String category, List<ExtractionField> fields) {

    public ReportSection {
        fields = List.copyOf(fields);
    }

    public Optional<ExtractionField> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }
}
