package com.eainde.bidding.aggregate;

import com.eainde.bidding.agent.AgentRegistry;
import com.eainde.bidding.agent.AgentSpec;
import com.eainde.bidding.agent.FieldSpec;
import com.eainde.bidding.model.AgentOutcome;
import com.eainde.bidding.model.AgentStatus;
import com.eainde.bidding.model.AggregatedReport;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.model.ExtractionField;
import com.eainde.bidding.model.ReportSection;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges per-agent outcomes into one {@link AggregatedReport}.
 *
 * <p>Deterministic and total: sections follow registration order, fields follow each
 * agent's declared order, and every registered field appears exactly once. Fields an agent
 * did not deliver are recorded as unavailable. Aggregation never throws for missing or
 * failed agents.</p>
 */
@Log4j2
public class ReportAggregator {

    static final String NOTE_FAILED = "extraction failed";
    static final String NOTE_TIMED_OUT = "extraction timed out";

    public AggregatedReport aggregate(Document document, AgentRegistry registry, Map<String, AgentOutcome> outcomes) {
        List<ReportSection> sections = new ArrayList<>();
        Map<String, AgentStatus> manifest = new LinkedHashMap<>();
        List<String> notes = new ArrayList<>();

        for (AgentSpec spec : registry.specs()) {
            AgentOutcome outcome = outcomes.get(spec.agentName());
            AgentStatus status = outcome == null ? AgentStatus.MISSING : outcome.status();
            String fallbackNote = status == AgentStatus.TIMED_OUT ? NOTE_TIMED_OUT : NOTE_FAILED;
            Map<String, ExtractionField> delivered = outcome == null || outcome.result() == null
                    ? Map.of() : outcome.result().fields();

            List<ExtractionField> fields = new ArrayList<>(spec.fields().size());
            for (FieldSpec field : spec.fields()) {
                ExtractionField value = delivered.get(field.name());
                fields.add(value != null ? value : ExtractionField.unavailable(field.name(), field.label(), fallbackNote));
            }

            sections.add(new ReportSection(spec.agentName(), spec.category(), fields));
            manifest.put(spec.agentName(), status);

            long unavailable = fields.stream().filter(ExtractionField::isUnavailable).count();
            if (unavailable > 0) {
                notes.add(spec.category() + "（" + spec.agentName() + "）: " + unavailable + "/" + fields.size()
                        + " fields unavailable, agent status " + status
                        + (outcome != null && outcome.error() != null ? " (" + outcome.error() + ")" : ""));
            }
        }

        for (String agentName : outcomes.keySet()) {
            if (registry.find(agentName).isEmpty()) {
                log.warn("Ignoring outcome of unregistered agent {}", agentName);
            }
        }

        AggregatedReport report = new AggregatedReport(document.documentId(), document.name(), sections, manifest, notes);
        log.info("Aggregated report for {}: {} sections, manifest {}", document.name(), sections.size(), manifest);
        return report;
    }
}
