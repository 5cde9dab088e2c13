package com.eainde.bidding.agent;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    @Test
    void standardRegistryPartitionsFieldsAcrossThreeAgents() {
        AgentRegistry registry = TenderAgents.standardRegistry();

        assertThat(registry.specs()).extracting(AgentSpec::agentName)
                .containsExactly(AgentNames.BASIC_INFO, AgentNames.SCORING_CRITERIA, AgentNames.OTHER_TERMS);
        Set<String> seen = new HashSet<>();
        registry.specs().forEach(spec -> spec.fieldNames().forEach(f -> assertThat(seen.add(f)).isTrue()));
        assertThat(registry.ownerOf("budget_amount")).contains(AgentNames.BASIC_INFO);
        assertThat(registry.ownerOf("payment_terms")).contains(AgentNames.OTHER_TERMS);
        assertThat(registry.ownerOf("evaluation_method")).contains(AgentNames.SCORING_CRITERIA);
    }

    @Test
    void shouldRejectDuplicateAgentNames() {
        AgentRegistry registry = AgentRegistry.of(agent("a", "f1"));

        assertThatThrownBy(() -> registry.register(agent("a", "f2")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void shouldRejectFieldsOwnedByAnotherAgent() {
        AgentRegistry registry = AgentRegistry.of(agent("a", "shared"));

        assertThatThrownBy(() -> registry.register(agent("b", "own", "shared")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shared")
                .hasMessageContaining("'a'");
        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.ownerOf("own")).isEmpty();
    }

    @Test
    void findReturnsRegisteredSpecs() {
        AgentRegistry registry = AgentRegistry.of(agent("a", "f1"), agent("b", "f2"));

        assertThat(registry.find("b")).map(AgentSpec::fieldNames).contains(List.of("f2"));
        assertThat(registry.find("missing")).isEmpty();
    }

    private static AgentSpec agent(String name, String... fields) {
        AgentSpec.Builder builder = AgentSpec.of(name, name);
        for (String field : fields) {
            builder.field(FieldSpec.of(field, field, field + " query", ""));
        }
        return builder.build();
    }
}
