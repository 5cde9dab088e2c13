package com.eainde.bidding.workflow;

import com.eainde.bidding.agent.AgentFactory;
import com.eainde.bidding.agent.AgentRegistry;
import com.eainde.bidding.agent.AgentSpec;
import com.eainde.bidding.agent.ExtractionAgent;
import com.eainde.bidding.aggregate.ReportAggregator;
import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.error.AgentTotalFailureException;
import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.EmptyDocumentException;
import com.eainde.bidding.error.IndexingException;
import com.eainde.bidding.error.PipelineErrorCode;
import com.eainde.bidding.error.WorkflowTimeoutException;
import com.eainde.bidding.index.DocumentIndexer;
import com.eainde.bidding.model.AgentOutcome;
import com.eainde.bidding.model.AggregatedReport;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.model.IndexingSummary;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.model.PartialExtractionResult;
import com.eainde.bidding.namespace.NamespaceManager;
import com.eainde.bidding.thread.MdcTaskDecorator;
import com.eainde.bidding.thread.NamedThreadFactory;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one document through the pipeline.
 *
 * <h3>Stages:</h3>
 * <pre>
 * INIT        acquire namespace (clear when isolated), chunk + embed + upsert;
 *               counts against workflowTimeout, a run still indexing at the
 *               deadline is interrupted and FAILS with WORKFLOW_TIMEOUT
 *   ↓
 * INDEXED     submit every registered agent to a pool of agentConcurrency threads
 *   ↓
 * EXTRACTING  join all agents, or stop at workflowTimeout:
 *               unfinished agents are interrupted and reported TIMED_OUT,
 *               the pool gets at most cancellationGrace to wind down
 *   ↓
 * AGGREGATED  merge outcomes into the report, release the namespace
 *   ↓
 * DONE
 * </pre>
 *
 * <p>Store, empty-document and indexing failures end the run in FAILED with no report.
 * Agent failures never do: they show up as unavailable fields and in the manifest.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * PipelineResult result = orchestrator.execute(new PipelineRequest(sessionId, document));
 * if (result.isDone()) {
 *     render(result.report());
 * }
 * </pre>
 */
@Log4j2
public class BiddingPipelineOrchestrator {

    private final NamespaceManager namespaceManager;
    private final DocumentIndexer indexer;
    private final AgentRegistry registry;
    private final AgentFactory agentFactory;
    private final ReportAggregator aggregator;
    private final PipelineProperties props;

    public BiddingPipelineOrchestrator(NamespaceManager namespaceManager,
                                       DocumentIndexer indexer,
                                       AgentRegistry registry,
                                       AgentFactory agentFactory,
                                       ReportAggregator aggregator,
                                       PipelineProperties props) {
        this.namespaceManager = namespaceManager;
        this.indexer = indexer;
        this.registry = registry;
        this.agentFactory = agentFactory;
        this.aggregator = aggregator;
        this.props = props;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public PipelineResult execute(PipelineRequest request) {
        String runId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + props.getWorkflowTimeout().toNanos();
        Document document = request.document();
        PipelineStateMachine fsm = new PipelineStateMachine();

        MDC.put("runId", runId);
        MDC.put("sessionId", request.sessionId());
        try {
            log.info("Starting run for document '{}' ({} chars, mode {})",
                    document.name(), document.text().length(), props.getIsolationMode());

            // ── INIT → INDEXED ──────────────────────────────────────────────
            NamespaceHandle handle;
            try {
                handle = prepareNamespace(runId, request, deadlineNanos);
            } catch (BiddingPipelineException e) {
                log.error("Run failed before extraction [{}]: {}", e.getErrorCode().code(), e.getMessage());
                fsm.fail(e.getErrorCode().name());
                return PipelineResult.failed(runId, fsm, PipelineFailure.of(e), elapsedSince(startNanos));
            }
            fsm.transitionTo(PipelineState.INDEXED);

            // ── INDEXED → EXTRACTING → AGGREGATED ───────────────────────────
            fsm.transitionTo(PipelineState.EXTRACTING, registry.size() + " agents");
            Map<String, AgentOutcome> outcomes = runAgents(runId, handle, deadlineNanos);
            fsm.transitionTo(PipelineState.AGGREGATED);

            // ── AGGREGATED → DONE ───────────────────────────────────────────
            AggregatedReport report;
            try {
                report = aggregator.aggregate(document, registry, outcomes);
            } catch (RuntimeException e) {
                log.error("Aggregation failed", e);
                fsm.fail(PipelineErrorCode.INTERNAL_ERROR.name());
                return PipelineResult.failed(runId, fsm,
                        new PipelineFailure(PipelineErrorCode.INTERNAL_ERROR, "Aggregation failed: " + e.getMessage()),
                        elapsedSince(startNanos));
            } finally {
                namespaceManager.release(handle);
            }
            fsm.transitionTo(PipelineState.DONE);

            Duration elapsed = elapsedSince(startNanos);
            log.info("Run complete in {} ms, manifest {}", elapsed.toMillis(), report.manifest());
            return PipelineResult.completed(runId, fsm, report, elapsed);
        } finally {
            MDC.remove("runId");
            MDC.remove("sessionId");
        }
    }

    /**
     * Result for a request that never reached the pipeline, e.g. because the document
     * could not be loaded.
     */
    public PipelineResult reject(BiddingPipelineException cause) {
        PipelineStateMachine fsm = new PipelineStateMachine();
        fsm.fail(cause.getErrorCode().name());
        return PipelineResult.failed(UUID.randomUUID().toString(), fsm, PipelineFailure.of(cause), Duration.ZERO);
    }

    // =========================================================================
    //  INIT → INDEXED
    // =========================================================================

    private NamespaceHandle prepareNamespace(String runId, PipelineRequest request, long deadlineNanos) {
        Document document = request.document();
        if (document.isBlank()) {
            // Checked before acquiring so an empty upload never touches the store.
            throw new EmptyDocumentException("Document '" + document.name() + "' contains no text");
        }

        ExecutorService indexPool = Executors.newSingleThreadExecutor(
                new NamedThreadFactory("index-" + runId.substring(0, 8)));
        Future<NamespaceHandle> future = indexPool.submit(MdcTaskDecorator.decorate(() -> acquireAndIndex(request)));
        try {
            long remaining = deadlineNanos - System.nanoTime();
            return future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WorkflowTimeoutException("Workflow timeout of " + props.getWorkflowTimeout().toMillis()
                    + " ms reached while indexing '" + document.name() + "'");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BiddingPipelineException) {
                throw (BiddingPipelineException) cause;
            }
            throw new IndexingException("Indexing failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new WorkflowTimeoutException("Interrupted while indexing '" + document.name() + "'", e);
        } finally {
            indexPool.shutdownNow();
            awaitWindDown(indexPool);
        }
    }

    private NamespaceHandle acquireAndIndex(PipelineRequest request) {
        NamespaceHandle handle = namespaceManager.acquire(request.sessionId(), props.getIsolationMode());
        try {
            IndexingSummary summary = indexer.index(handle, request.document());
            log.info("Indexed {} chunks into {}", summary.chunkCount(), summary.namespaceId());
            return handle;
        } catch (BiddingPipelineException e) {
            throw e;
        } catch (CancellationException e) {
            throw new IndexingException("Indexing interrupted", e);
        } catch (RuntimeException e) {
            throw new IndexingException("Indexing failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    //  EXTRACTING
    // =========================================================================

    private Map<String, AgentOutcome> runAgents(String runId, NamespaceHandle handle, long deadlineNanos) {
        List<AgentSpec> specs = registry.specs();
        Map<String, AgentOutcome> outcomes = new LinkedHashMap<>();
        if (specs.isEmpty()) {
            return outcomes;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(props.getAgentConcurrency(), specs.size()),
                new NamedThreadFactory("extract-" + runId.substring(0, 8)));
        Map<String, Future<AgentOutcome>> futures = new LinkedHashMap<>();
        try {
            for (AgentSpec spec : specs) {
                ExtractionAgent agent;
                try {
                    agent = agentFactory.create(spec);
                } catch (RuntimeException e) {
                    log.error("Could not create agent {}", spec.agentName(), e);
                    outcomes.put(spec.agentName(), AgentOutcome.failed(spec.agentName(), null, e.toString()));
                    continue;
                }
                futures.put(spec.agentName(), pool.submit(MdcTaskDecorator.decorate(() -> runAgent(agent, handle))));
            }

            try {
                awaitAll(futures, deadlineNanos, outcomes);
            } catch (WorkflowTimeoutException e) {
                log.warn("{} [{}]", e.getMessage(), e.getErrorCode().code());
                cancelRemaining(futures, outcomes);
            }
        } finally {
            pool.shutdownNow();
            awaitWindDown(pool);
        }

        // Keep registration order regardless of completion order.
        Map<String, AgentOutcome> ordered = new LinkedHashMap<>();
        for (AgentSpec spec : specs) {
            AgentOutcome outcome = outcomes.get(spec.agentName());
            if (outcome != null) {
                ordered.put(spec.agentName(), outcome);
            }
        }
        return ordered;
    }

    private AgentOutcome runAgent(ExtractionAgent agent, NamespaceHandle handle) {
        String agentName = agent.spec().agentName();
        MDC.put("agent", agentName);
        try {
            log.info("Agent {} started", agentName);
            PartialExtractionResult result = agent.extract(handle);
            return AgentOutcome.completed(result);
        } catch (AgentTotalFailureException e) {
            log.error("Agent {} failed [{}]: {}", agentName, e.getErrorCode().code(), e.getMessage());
            return AgentOutcome.failed(agentName, e.getResult(), e.getMessage());
        } catch (CancellationException e) {
            log.warn("Agent {} cancelled", agentName);
            return AgentOutcome.timedOut(agentName);
        } catch (RuntimeException e) {
            log.error("Agent {} crashed", agentName, e);
            return AgentOutcome.failed(agentName, null, e.toString());
        } finally {
            MDC.remove("agent");
        }
    }

    private void awaitAll(Map<String, Future<AgentOutcome>> futures, long deadlineNanos,
                          Map<String, AgentOutcome> outcomes) {
        for (Map.Entry<String, Future<AgentOutcome>> entry : futures.entrySet()) {
            String agentName = entry.getKey();
            long remaining = deadlineNanos - System.nanoTime();
            try {
                if (remaining <= 0 && !entry.getValue().isDone()) {
                    throw new TimeoutException();
                }
                outcomes.put(agentName, entry.getValue().get(Math.max(remaining, 0), TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                throw new WorkflowTimeoutException("Workflow timeout of " + props.getWorkflowTimeout().toMillis()
                        + " ms reached while waiting for agent " + agentName);
            } catch (ExecutionException e) {
                log.error("Agent {} terminated abnormally", agentName, e.getCause());
                outcomes.put(agentName, AgentOutcome.failed(agentName, null, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkflowTimeoutException("Interrupted while waiting for agent " + agentName);
            }
        }
    }

    private static void cancelRemaining(Map<String, Future<AgentOutcome>> futures, Map<String, AgentOutcome> outcomes) {
        futures.forEach((agentName, future) -> {
            if (outcomes.containsKey(agentName)) {
                return;
            }
            if (future.isDone() && !future.isCancelled()) {
                // Finished between the timeout and now: keep its real outcome.
                try {
                    outcomes.put(agentName, future.get());
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (ExecutionException e) {
                    log.error("Agent {} terminated abnormally", agentName, e.getCause());
                    outcomes.put(agentName, AgentOutcome.failed(agentName, null, String.valueOf(e.getCause())));
                    return;
                }
            }
            future.cancel(true);
            outcomes.put(agentName, AgentOutcome.timedOut(agentName));
        });
    }

    private void awaitWindDown(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(props.getCancellationGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker threads still running {} ms after cancellation; abandoning them",
                        props.getCancellationGrace().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
