package com.eainde.bidding.agent;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.error.AgentTotalFailureException;
import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.FieldExtractionException;
import com.eainde.bidding.model.AgentStatus;
import com.eainde.bidding.model.Citation;
import com.eainde.bidding.model.ExtractionField;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.model.PartialExtractionResult;
import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.model.RetrievalHit;
import com.eainde.bidding.model.TextSpan;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.retrieval.RetrievalOutcome;
import com.eainde.bidding.retrieval.RetrievalPlanner;
import com.eainde.bidding.thread.MdcTaskDecorator;
import com.eainde.bidding.thread.NamedThreadFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Extraction agent that grounds every field in retrieved evidence.
 *
 * <h3>Per field:</h3>
 * <pre>
 * plan retrieval for the field query
 *   ├── no evidence  → NOT_FOUND (no LLM call)
 *   └── evidence     → one structured LLM call over numbered evidence blocks
 *                       → locate the quote inside the cited block → FOUND with citation
 * any failure        → UNAVAILABLE with a note; other fields continue
 * </pre>
 *
 * <p>Fields run concurrently on a pool private to the call, bounded by the agent's field
 * concurrency. Interrupting the calling thread cancels the pool.</p>
 */
@Log4j2
public class RetrievalExtractionAgent implements ExtractionAgent {

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final AgentSpec spec;
    private final RetrievalPlanner planner;
    private final LlmProvider llm;
    private final RetryingCaller retryingCaller;
    private final ObjectMapper objectMapper;
    private final int fieldConcurrency;

    public RetrievalExtractionAgent(AgentSpec spec,
                                    RetrievalPlanner planner,
                                    LlmProvider llm,
                                    RetryingCaller retryingCaller,
                                    ObjectMapper objectMapper,
                                    PipelineProperties props) {
        this.spec = spec;
        this.planner = planner;
        this.llm = llm;
        this.retryingCaller = retryingCaller;
        this.objectMapper = objectMapper;
        this.fieldConcurrency = spec.fieldConcurrency() != null ? spec.fieldConcurrency() : props.getFieldConcurrency();
    }

    @Override
    public AgentSpec spec() {
        return spec;
    }

    @Override
    public PartialExtractionResult extract(NamespaceHandle handle) {
        List<FieldSpec> fields = spec.fields();
        int threads = Math.min(fieldConcurrency, fields.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads,
                new NamedThreadFactory("agent-" + spec.agentName()));
        List<ExtractionField> extracted = new ArrayList<>(fields.size());
        try {
            List<Future<ExtractionField>> futures = new ArrayList<>(fields.size());
            for (FieldSpec field : fields) {
                futures.add(pool.submit(MdcTaskDecorator.decorate(() -> extractField(handle, field))));
            }
            for (int i = 0; i < fields.size(); i++) {
                extracted.add(await(fields.get(i), futures.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        PartialExtractionResult result = PartialExtractionResult.of(spec.agentName(), spec.fieldNames(), extracted);
        log.info("Agent {} finished: {} fields, {} unavailable", spec.agentName(),
                result.fields().size(), result.unavailableCount());
        if (result.status() == AgentStatus.FAILED) {
            throw new AgentTotalFailureException(spec.agentName(), result);
        }
        return result;
    }

    // =========================================================================
    //  Per-field extraction
    // =========================================================================

    private ExtractionField await(FieldSpec field, Future<ExtractionField> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Agent " + spec.agentName() + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CancellationException cancelled) {
                throw cancelled;
            }
            log.error("Field {} of agent {} crashed", field.name(), spec.agentName(), cause);
            return ExtractionField.unavailable(field.name(), field.label(), "extraction failed: " + cause);
        }
    }

    ExtractionField extractField(NamespaceHandle handle, FieldSpec field) {
        try {
            RetrievalOutcome outcome = planner.retrieve(handle, field.toQuery());
            if (outcome.isEmpty()) {
                log.debug("No evidence for field {}", field.name());
                return ExtractionField.notFound(field.name(), field.label(), "no relevant evidence retrieved");
            }
            List<RerankedResult> evidence = outcome.results();
            String prompt = ExtractionPrompts.fieldPrompt(spec, field, evidence);
            JsonNode json = retryingCaller.call("extract " + field.name(),
                    () -> llm.complete(prompt, ExtractionPrompts.FIELD_SCHEMA));
            return toField(field, parse(field, json), evidence);
        } catch (CancellationException e) {
            throw e;
        } catch (BiddingPipelineException e) {
            log.warn("Field {} of agent {} unavailable [{}]: {}", field.name(), spec.agentName(),
                    e.getErrorCode().code(), e.getMessage());
            return ExtractionField.unavailable(field.name(), field.label(), "extraction failed: " + e.getMessage());
        }
    }

    private FieldExtractionResponse parse(FieldSpec field, JsonNode json) {
        try {
            return objectMapper.treeToValue(json, FieldExtractionResponse.class);
        } catch (JsonProcessingException e) {
            throw new FieldExtractionException("Unreadable extraction response for field " + field.name(), e);
        }
    }

    private ExtractionField toField(FieldSpec field, FieldExtractionResponse response, List<RerankedResult> evidence) {
        if (!response.found() || response.value() == null || response.value().isBlank()) {
            return ExtractionField.notFound(field.name(), field.label(), response.notes());
        }
        String quote = response.quote() == null ? "" : response.quote().strip();
        RetrievalHit cited = citedHit(field, response.evidenceId(), quote, evidence);
        double confidence = response.confidence() != null ? response.confidence() : DEFAULT_CONFIDENCE;
        return ExtractionField.found(field.name(), field.label(), response.value().strip(),
                citationFor(cited, quote), confidence, response.notes());
    }

    /**
     * The block the model cited, or, when that id is unusable, the first block containing
     * the quote verbatim.
     */
    private RetrievalHit citedHit(FieldSpec field, Integer evidenceId, String quote, List<RerankedResult> evidence) {
        if (evidenceId != null && evidenceId >= 1 && evidenceId <= evidence.size()) {
            return evidence.get(evidenceId - 1).hit();
        }
        if (!quote.isEmpty()) {
            for (RerankedResult result : evidence) {
                if (result.hit().text().contains(quote)) {
                    return result.hit();
                }
            }
        }
        throw new FieldExtractionException("Field " + field.name() + " cites evidence " + evidenceId
                + " which is not among the " + evidence.size() + " retrieved chunks");
    }

    private static Citation citationFor(RetrievalHit hit, String quote) {
        int offset = quote.isEmpty() ? -1 : hit.text().indexOf(quote);
        if (offset < 0) {
            // Quote not verbatim in the chunk: cite the whole chunk.
            return new Citation(hit.chunkId(), hit.span(), hit.text(), hit.pageNumber());
        }
        int start = hit.span().start() + offset;
        return new Citation(hit.chunkId(), TextSpan.of(start, start + quote.length()), quote, hit.pageNumber());
    }
}
