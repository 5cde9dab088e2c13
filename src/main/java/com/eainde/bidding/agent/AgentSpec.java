package com.eainde.bidding.agent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative specification of an extraction agent: its identity, the report category it
 * fills and the ordered fields it owns.
 *
 * <pre>
 * AgentSpec.of("basic-info", "基础信息")
 *          .description("Project identity, budget, deadlines and parties")
 *          .field(FieldSpec.of("project_name", "项目名称", "项目名称 采购项目", "..."))
 *          .field(FieldSpec.of("budget_amount", "预算金额", "预算金额 采购预算", "..."))
 *          .fieldConcurrency(2)
 *          .build();
 * </pre>
 */
public class AgentSpec {

    private final String agentName;
    private final String category;
    private final String description;
    private final List<FieldSpec> fields;
    private final Integer fieldConcurrency;

    private AgentSpec(Builder builder) {
        this.agentName = builder.agentName;
        this.category = builder.category;
        this.description = builder.description;
        this.fields = List.copyOf(builder.fields);
        this.fieldConcurrency = builder.fieldConcurrency;
    }

    public static Builder of(String agentName, String category) {
        return new Builder(agentName, category);
    }

    public String agentName() { return agentName; }
    public String category() { return category; }
    public String description() { return description; }
    public List<FieldSpec> fields() { return fields; }

    /** Per-agent override of the configured field concurrency; {@code null} means use the default. */
    public Integer fieldConcurrency() { return fieldConcurrency; }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }

    @Override
    public String toString() {
        return "AgentSpec{" + agentName + ", fields=" + fieldNames() + "}";
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static class Builder {
        private final String agentName;
        private final String category;
        private String description = "";
        private final List<FieldSpec> fields = new ArrayList<>();
        private Integer fieldConcurrency;

        private Builder(String agentName, String category) {
            if (agentName == null || agentName.isBlank()) {
                throw new IllegalArgumentException("agentName must not be blank");
            }
            this.agentName = agentName;
            this.category = category == null ? agentName : category;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder field(FieldSpec field) {
            this.fields.add(field);
            return this;
        }

        public Builder fields(FieldSpec... fields) {
            this.fields.addAll(List.of(fields));
            return this;
        }

        public Builder fieldConcurrency(int fieldConcurrency) {
            if (fieldConcurrency < 1) throw new IllegalArgumentException("fieldConcurrency must be >= 1");
            this.fieldConcurrency = fieldConcurrency;
            return this;
        }

        public AgentSpec build() {
            if (fields.isEmpty()) {
                throw new IllegalStateException("Agent '" + agentName + "' declares no fields");
            }
            Set<String> names = new HashSet<>();
            for (FieldSpec field : fields) {
                if (!names.add(field.name())) {
                    throw new IllegalStateException("Agent '" + agentName
                            + "' declares field '" + field.name() + "' twice");
                }
            }
            return new AgentSpec(this);
        }
    }
}
