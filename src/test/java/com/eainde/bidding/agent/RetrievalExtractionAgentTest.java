package com.eainde.bidding.agent;

import com.eainde.bidding.error.AgentTotalFailureException;
import com.eainde.bidding.model.AgentStatus;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.model.ExtractionField;
import com.eainde.bidding.model.FieldStatus;
import com.eainde.bidding.model.IsolationMode;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.model.PartialExtractionResult;
import com.eainde.bidding.support.PipelineFixture;
import com.eainde.bidding.support.ScriptedLlmProvider;
import com.eainde.bidding.support.TenderFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrievalExtractionAgentTest {

    private static final AgentSpec SPEC = AgentSpec.of("basic-info", "基础信息")
            .fields(
                    FieldSpec.of("project_name", "项目名称", "项目名称", "项目的完整名称"),
                    FieldSpec.of("budget_amount", "预算金额", "项目预算金额 采购预算", "含币种和单位"),
                    FieldSpec.of("bid_bond", "投标保证金", "投标保证金金额", "保证金金额"))
            .fieldConcurrency(2)
            .build();

    private final Document tender = TenderFixtures.sampleTender();

    @Test
    void extract_shouldCiteTheQuotedTextInTheDocument() {
        PipelineFixture fixture = PipelineFixture.create(TenderFixtures.fastProperties().build(),
                ScriptedLlmProvider.forSampleTender());
        NamespaceHandle handle = indexed(fixture, "agent-found");

        PartialExtractionResult result = fixture.agentFactory().create(SPEC).extract(handle);

        assertThat(result.fields().keySet()).containsExactly("project_name", "budget_amount", "bid_bond");
        ExtractionField budget = result.fields().get("budget_amount");
        assertThat(budget.status()).isEqualTo(FieldStatus.FOUND);
        assertThat(budget.value()).contains("500万元");
        assertThat(budget.citation().quote()).isEqualTo(TenderFixtures.BUDGET_SENTENCE);
        assertThat(budget.citation().span().slice(tender.text())).isEqualTo(budget.citation().quote());

        ExtractionField bond = result.fields().get("bid_bond");
        assertThat(bond.status()).isEqualTo(FieldStatus.NOT_FOUND);
        assertThat(bond.value()).isEqualTo(ExtractionField.NOT_MENTIONED);
        assertThat(result.status()).isEqualTo(AgentStatus.SUCCEEDED);
    }

    @Test
    void extract_shouldSkipTheModelWhenNothingIsRetrieved() {
        ScriptedLlmProvider llm = ScriptedLlmProvider.forSampleTender();
        PipelineFixture fixture = PipelineFixture.create(
                TenderFixtures.fastProperties().similarityThreshold(1.0).build(), llm);
        NamespaceHandle handle = indexed(fixture, "agent-empty");

        PartialExtractionResult result = fixture.agentFactory().create(SPEC).extract(handle);

        assertThat(result.fields().values()).extracting(ExtractionField::status)
                .containsOnly(FieldStatus.NOT_FOUND);
        assertThat(llm.calls()).isZero();
    }

    @Test
    void extract_shouldIsolateAFailingField() {
        ScriptedLlmProvider llm = ScriptedLlmProvider.forSampleTender().failFor(List.of("budget_amount"));
        PipelineFixture fixture = PipelineFixture.create(TenderFixtures.fastProperties().build(), llm);
        NamespaceHandle handle = indexed(fixture, "agent-partial");

        PartialExtractionResult result = fixture.agentFactory().create(SPEC).extract(handle);

        ExtractionField budget = result.fields().get("budget_amount");
        assertThat(budget.status()).isEqualTo(FieldStatus.UNAVAILABLE);
        assertThat(budget.notes()).startsWith("extraction failed");
        assertThat(result.fields().get("project_name").status()).isEqualTo(FieldStatus.FOUND);
        assertThat(result.status()).isEqualTo(AgentStatus.PARTIAL);
    }

    @Test
    void extract_shouldThrowWhenEveryFieldFails() {
        ScriptedLlmProvider llm = ScriptedLlmProvider.forSampleTender().failFor(SPEC.fieldNames());
        PipelineFixture fixture = PipelineFixture.create(TenderFixtures.fastProperties().build(), llm);
        NamespaceHandle handle = indexed(fixture, "agent-down");

        assertThatThrownBy(() -> fixture.agentFactory().create(SPEC).extract(handle))
                .isInstanceOfSatisfying(AgentTotalFailureException.class, failure -> {
                    assertThat(failure.getResult().fields()).hasSize(3);
                    assertThat(failure.getResult().unavailableCount()).isEqualTo(3);
                });
    }

    private NamespaceHandle indexed(PipelineFixture fixture, String sessionId) {
        NamespaceHandle handle = fixture.namespaceManager.acquire(sessionId, IsolationMode.ISOLATED);
        fixture.indexer.index(handle, tender);
        return handle;
    }
}
