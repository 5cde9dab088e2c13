package com.eainde.bidding.service;

import com.eainde.bidding.error.PipelineErrorCode;
import com.eainde.bidding.model.IsolationMode;
import com.eainde.bidding.support.PipelineFixture;
import com.eainde.bidding.support.ScriptedLlmProvider;
import com.eainde.bidding.support.TenderFixtures;
import com.eainde.bidding.workflow.PipelineResult;
import com.eainde.bidding.workflow.PipelineState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BiddingAnalysisServiceTest {

    @TempDir
    Path dir;

    private BiddingAnalysisService service;

    @BeforeEach
    void setUp() {
        PipelineFixture fixture = PipelineFixture.create(
                TenderFixtures.fastProperties().isolationMode(IsolationMode.CUMULATIVE).build(),
                ScriptedLlmProvider.forSampleTender());
        service = new BiddingAnalysisService(new PlainTextDocumentSource(), fixture.orchestrator());
    }

    @Test
    void analyzeAll_shouldContinuePastFilesThatCannotBeLoaded() throws IOException {
        Path good = Files.writeString(dir.resolve("tender.txt"), TenderFixtures.sampleTender().text(),
                StandardCharsets.UTF_8);
        Path scanned = Files.write(dir.resolve("scan.pdf"), new byte[]{1, 2, 3});
        Path empty = Files.writeString(dir.resolve("empty.txt"), "   ", StandardCharsets.UTF_8);

        List<PipelineResult> results = service.analyzeAll("session-1", List.of(scanned, good, empty));

        assertThat(results).extracting(PipelineResult::state)
                .containsExactly(PipelineState.FAILED, PipelineState.DONE, PipelineState.FAILED);
        assertThat(results.get(0).failure().errorCode()).isEqualTo(PipelineErrorCode.UNSUPPORTED_FORMAT);
        assertThat(results.get(2).failure().errorCode()).isEqualTo(PipelineErrorCode.EMPTY_DOCUMENT);
        assertThat(results.get(1).report().field("budget_amount").orElseThrow().value()).contains("500万元");
        assertThat(results.get(1).report().documentName()).isEqualTo("tender.txt");
    }

    @Test
    void analyze_shouldRunAnInMemoryDocument() {
        PipelineResult result = service.analyze("session-2", TenderFixtures.otherTender());

        assertThat(result.isDone()).isTrue();
        assertThat(result.report().documentId()).isEqualTo("tender-002");
    }
}
