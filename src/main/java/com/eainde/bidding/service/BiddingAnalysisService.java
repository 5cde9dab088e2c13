package com.eainde.bidding.service;

import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.provider.DocumentSource;
import com.eainde.bidding.workflow.BiddingPipelineOrchestrator;
import com.eainde.bidding.workflow.PipelineRequest;
import com.eainde.bidding.workflow.PipelineResult;
import lombok.extern.log4j.Log4j2;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point: loads tender documents and runs each through the pipeline.
 *
 * <p>Files of one call share the session, so in cumulative mode later documents can draw
 * on chunks of earlier ones. A file that cannot be loaded yields a FAILED result and the
 * remaining files still run.</p>
 */
@Log4j2
public class BiddingAnalysisService {

    private final DocumentSource documentSource;
    private final BiddingPipelineOrchestrator orchestrator;

    public BiddingAnalysisService(DocumentSource documentSource, BiddingPipelineOrchestrator orchestrator) {
        this.documentSource = documentSource;
        this.orchestrator = orchestrator;
    }

    public PipelineResult analyze(String sessionId, Path file) {
        Document document;
        try {
            document = documentSource.loadText(file);
        } catch (BiddingPipelineException e) {
            log.warn("Rejected {} [{}]: {}", file.getFileName(), e.getErrorCode().code(), e.getMessage());
            return orchestrator.reject(e);
        }
        return analyze(sessionId, document);
    }

    public PipelineResult analyze(String sessionId, Document document) {
        return orchestrator.execute(new PipelineRequest(sessionId, document));
    }

    public List<PipelineResult> analyzeAll(String sessionId, List<Path> files) {
        log.info("Analysing {} documents for session {}", files.size(), sessionId);
        List<PipelineResult> results = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            log.info("Processing file {}/{}: {}", i + 1, files.size(), file.getFileName());
            results.add(analyze(sessionId, file));
        }
        long done = results.stream().filter(PipelineResult::isDone).count();
        log.info("Session {} complete. Processed: {}, Succeeded: {}, Failed: {}",
                sessionId, results.size(), done, results.size() - done);
        return results;
    }
}
