package com.eainde.bidding.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionFieldTest {

    private static final Citation CITATION = new Citation("chunk-1", TextSpan.of(10, 24), "预算金额：人民币500万元整", 1);

    @Test
    void foundFieldRequiresCitation() {
        assertThatThrownBy(() -> new ExtractionField("budget_amount", "预算金额", "500万元", null, 0.9,
                FieldStatus.FOUND, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("budget_amount");
    }

    @Test
    void notFoundFieldMustNotCarryCitation() {
        assertThatThrownBy(() -> new ExtractionField("budget_amount", "预算金额", null, CITATION, 0.0,
                FieldStatus.NOT_FOUND, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void notFoundUsesTheNotMentionedMarker() {
        ExtractionField field = ExtractionField.notFound("bid_bond", "投标保证金", "no evidence");

        assertThat(field.value()).isEqualTo(ExtractionField.NOT_MENTIONED);
        assertThat(field.status()).isEqualTo(FieldStatus.NOT_FOUND);
        assertThat(field.isUnavailable()).isFalse();
    }

    @Test
    void confidenceIsClamped() {
        assertThat(ExtractionField.found("a", "A", "v", CITATION, 3.5, null).confidence()).isEqualTo(1.0);
        assertThat(ExtractionField.found("a", "A", "v", CITATION, -1, null).confidence()).isEqualTo(0.0);
    }

    @Test
    void partialResultRejectsFieldsOutsideTheDomain() {
        List<ExtractionField> fields = List.of(ExtractionField.notFound("payment_terms", "付款方式", null));

        assertThatThrownBy(() -> PartialExtractionResult.of("basic-info", List.of("project_name"), fields))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("payment_terms");
    }

    @Test
    void partialResultRejectsDuplicates() {
        List<ExtractionField> fields = List.of(
                ExtractionField.notFound("project_name", "项目名称", null),
                ExtractionField.notFound("project_name", "项目名称", null));

        assertThatThrownBy(() -> PartialExtractionResult.of("basic-info", List.of("project_name"), fields))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void partialResultStatusFollowsUnavailableCount() {
        List<String> domain = List.of("a", "b");

        PartialExtractionResult ok = PartialExtractionResult.of("x", domain, List.of(
                ExtractionField.found("a", "A", "v", CITATION, 0.9, null),
                ExtractionField.notFound("b", "B", null)));
        PartialExtractionResult partial = PartialExtractionResult.of("x", domain, List.of(
                ExtractionField.found("a", "A", "v", CITATION, 0.9, null),
                ExtractionField.unavailable("b", "B", "extraction failed")));
        PartialExtractionResult failed = PartialExtractionResult.of("x", domain, List.of(
                ExtractionField.unavailable("a", "A", "extraction failed"),
                ExtractionField.unavailable("b", "B", "extraction failed")));

        assertThat(ok.status()).isEqualTo(AgentStatus.SUCCEEDED);
        assertThat(partial.status()).isEqualTo(AgentStatus.PARTIAL);
        assertThat(failed.status()).isEqualTo(AgentStatus.FAILED);
        assertThat(failed.unavailableCount()).isEqualTo(2);
    }
}
