package com.eainde.bidding.retrieval;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.error.TransientProviderException;
import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.QueryVariant;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RetryPolicy;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.support.ScriptedLlmProvider;
import com.eainde.bidding.support.TenderFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryExpanderTest {

    private static final Query BUDGET = Query.of("budget_amount", "预算金额");

    private final PipelineProperties enabled = TenderFixtures.fastProperties()
            .enableQueryExpansion(true)
            .maxExpansions(3)
            .build();

    private final RetryingCaller caller = new RetryingCaller(RetryPolicy.from(enabled));

    @Test
    void expand_shouldKeepOriginalFirstAndCapVariants() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider().expansions("项目预算", "采购预算", "最高限价", "控制价");

        List<QueryVariant> variants = new QueryExpander(llm, caller, enabled).expand(BUDGET);

        assertThat(variants).extracting(QueryVariant::text).containsExactly("预算金额", "项目预算", "采购预算");
        assertThat(variants.get(0).isOriginal()).isTrue();
        assertThat(variants).extracting(QueryVariant::index).containsExactly(0, 1, 2);
    }

    @Test
    void expand_shouldStripListMarkersAndDropDuplicates() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider().expansions("1. 预算金额", "- 项目预算", "项目预算", "   ");

        List<QueryVariant> variants = new QueryExpander(llm, caller, enabled).expand(BUDGET);

        assertThat(variants).extracting(QueryVariant::text).containsExactly("预算金额", "项目预算");
    }

    @Test
    void expand_shouldFallBackToOriginalWhenTheModelFails() {
        AtomicInteger attempts = new AtomicInteger();
        LlmProvider failing = (prompt, schema) -> {
            attempts.incrementAndGet();
            throw new TransientProviderException("503");
        };

        List<QueryVariant> variants = new QueryExpander(failing, caller, enabled).expand(BUDGET);

        assertThat(variants).extracting(QueryVariant::text).containsExactly("预算金额");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void expand_shouldPropagateCancellation() {
        LlmProvider cancelled = (prompt, schema) -> {
            throw new CancellationException("workflow timed out");
        };

        assertThatThrownBy(() -> new QueryExpander(cancelled, caller, enabled).expand(BUDGET))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void expand_shouldNotCallTheModelWhenDisabled() {
        ScriptedLlmProvider llm = new ScriptedLlmProvider().expansions("项目预算");
        PipelineProperties disabled = TenderFixtures.fastProperties().build();

        List<QueryVariant> variants = new QueryExpander(llm, caller, disabled).expand(BUDGET);

        assertThat(variants).extracting(QueryVariant::text).containsExactly("预算金额");
        assertThat(llm.calls()).isZero();
    }

    @Test
    void expand_shouldWorkWithoutAModel() {
        assertThat(new QueryExpander(null, caller, enabled).expand(BUDGET)).hasSize(1);
    }
}
