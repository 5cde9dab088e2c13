package com.eainde.bidding.config;

import com.eainde.bidding.model.IsolationMode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Immutable pipeline settings, resolved once at startup and passed to every component
 * that needs them.
 *
 * <pre>
 * PipelineProperties props = PipelineProperties.builder()
 *         .chunkSize(800)
 *         .chunkOverlap(100)
 *         .isolationMode(IsolationMode.CUMULATIVE)
 *         .build();
 * </pre>
 *
 * <p>Every option has a default, so {@code PipelineProperties.defaults()} is a valid
 * configuration.</p>
 */
@Getter
@ToString
public final class PipelineProperties {

    // ── Chunking / indexing ─────────────────────────────────────────────
    private final int chunkSize;
    private final int chunkOverlap;
    private final int embeddingBatchSize;

    // ── Retrieval ───────────────────────────────────────────────────────
    private final int retrievalK;
    private final double similarityThreshold;
    private final boolean enableReranking;
    private final int rerankTopK;
    private final int rerankFinalK;
    private final boolean enableQueryExpansion;
    private final int maxExpansions;
    private final boolean enableMultiRoundRetrieval;
    private final int maxRetrievalRounds;
    private final double coverageScoreThreshold;
    private final int coverageMinHits;

    // ── Workflow ────────────────────────────────────────────────────────
    private final IsolationMode isolationMode;
    private final Duration workflowTimeout;
    private final Duration cancellationGrace;
    private final int agentConcurrency;
    private final int fieldConcurrency;

    // ── Provider calls ──────────────────────────────────────────────────
    private final int perCallMaxRetries;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;

    private PipelineProperties(Builder b) {
        this.chunkSize = b.chunkSize;
        this.chunkOverlap = b.chunkOverlap;
        this.embeddingBatchSize = b.embeddingBatchSize;
        this.retrievalK = b.retrievalK;
        this.similarityThreshold = b.similarityThreshold;
        this.enableReranking = b.enableReranking;
        this.rerankTopK = b.rerankTopK;
        this.rerankFinalK = b.rerankFinalK;
        this.enableQueryExpansion = b.enableQueryExpansion;
        this.maxExpansions = b.maxExpansions;
        this.enableMultiRoundRetrieval = b.enableMultiRoundRetrieval;
        this.maxRetrievalRounds = b.maxRetrievalRounds;
        this.coverageScoreThreshold = b.coverageScoreThreshold;
        this.coverageMinHits = b.coverageMinHits;
        this.isolationMode = b.isolationMode;
        this.workflowTimeout = b.workflowTimeout;
        this.cancellationGrace = b.cancellationGrace;
        this.agentConcurrency = b.agentConcurrency;
        this.fieldConcurrency = b.fieldConcurrency;
        this.perCallMaxRetries = b.perCallMaxRetries;
        this.retryBaseDelay = b.retryBaseDelay;
        this.retryMaxDelay = b.retryMaxDelay;
        validate();
    }

    public static PipelineProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        return new Builder()
                .chunkSize(chunkSize).chunkOverlap(chunkOverlap).embeddingBatchSize(embeddingBatchSize)
                .retrievalK(retrievalK).similarityThreshold(similarityThreshold)
                .enableReranking(enableReranking).rerankTopK(rerankTopK).rerankFinalK(rerankFinalK)
                .enableQueryExpansion(enableQueryExpansion).maxExpansions(maxExpansions)
                .enableMultiRoundRetrieval(enableMultiRoundRetrieval).maxRetrievalRounds(maxRetrievalRounds)
                .coverageScoreThreshold(coverageScoreThreshold).coverageMinHits(coverageMinHits)
                .isolationMode(isolationMode).workflowTimeout(workflowTimeout)
                .cancellationGrace(cancellationGrace).agentConcurrency(agentConcurrency)
                .fieldConcurrency(fieldConcurrency).perCallMaxRetries(perCallMaxRetries)
                .retryBaseDelay(retryBaseDelay).retryMaxDelay(retryMaxDelay);
    }

    /** Number of retrieval rounds the planner may run. */
    public int effectiveRetrievalRounds() {
        return enableMultiRoundRetrieval ? maxRetrievalRounds : 1;
    }

    /** Number of query variants the expander may produce, the original included. */
    public int effectiveExpansions() {
        return enableQueryExpansion ? maxExpansions : 1;
    }

    private void validate() {
        require(chunkSize > 0, "chunkSize must be > 0, got " + chunkSize);
        require(chunkOverlap >= 0 && chunkOverlap < chunkSize,
                "chunkOverlap (" + chunkOverlap + ") must be >= 0 and < chunkSize (" + chunkSize + ")");
        require(embeddingBatchSize > 0, "embeddingBatchSize must be > 0");
        require(retrievalK > 0, "retrievalK must be > 0");
        require(similarityThreshold >= 0.0 && similarityThreshold <= 1.0,
                "similarityThreshold must be within [0, 1], got " + similarityThreshold);
        require(rerankFinalK > 0, "rerankFinalK must be > 0");
        require(rerankTopK >= rerankFinalK,
                "rerankTopK (" + rerankTopK + ") must be >= rerankFinalK (" + rerankFinalK + ")");
        require(maxExpansions >= 1, "maxExpansions must be >= 1");
        require(maxRetrievalRounds >= 1, "maxRetrievalRounds must be >= 1");
        require(coverageMinHits >= 1, "coverageMinHits must be >= 1");
        require(isolationMode != null, "isolationMode must not be null");
        require(isPositive(workflowTimeout), "workflowTimeout must be positive");
        require(cancellationGrace != null && !cancellationGrace.isNegative(), "cancellationGrace must be >= 0");
        require(agentConcurrency > 0, "agentConcurrency must be > 0");
        require(fieldConcurrency > 0, "fieldConcurrency must be > 0");
        require(perCallMaxRetries >= 0, "perCallMaxRetries must be >= 0");
        require(retryBaseDelay != null && !retryBaseDelay.isNegative(), "retryBaseDelay must be >= 0");
        require(retryMaxDelay != null && retryMaxDelay.compareTo(retryBaseDelay) >= 0,
                "retryMaxDelay must be >= retryBaseDelay");
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static final class Builder {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private int embeddingBatchSize = 32;
        private int retrievalK = 5;
        private double similarityThreshold = 0.5;
        private boolean enableReranking = true;
        private int rerankTopK = 15;
        private int rerankFinalK = 8;
        private boolean enableQueryExpansion = false;
        private int maxExpansions = 3;
        private boolean enableMultiRoundRetrieval = true;
        private int maxRetrievalRounds = 2;
        private double coverageScoreThreshold = 0.75;
        private int coverageMinHits = 2;
        private IsolationMode isolationMode = IsolationMode.ISOLATED;
        private Duration workflowTimeout = Duration.ofMinutes(10);
        private Duration cancellationGrace = Duration.ofSeconds(5);
        private int agentConcurrency = 3;
        private int fieldConcurrency = 4;
        private int perCallMaxRetries = 3;
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofSeconds(30);

        private Builder() {
        }

        public Builder chunkSize(int chunkSize) { this.chunkSize = chunkSize; return this; }
        public Builder chunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; return this; }
        public Builder embeddingBatchSize(int size) { this.embeddingBatchSize = size; return this; }
        public Builder retrievalK(int retrievalK) { this.retrievalK = retrievalK; return this; }
        public Builder similarityThreshold(double threshold) { this.similarityThreshold = threshold; return this; }
        public Builder enableReranking(boolean enable) { this.enableReranking = enable; return this; }
        public Builder rerankTopK(int rerankTopK) { this.rerankTopK = rerankTopK; return this; }
        public Builder rerankFinalK(int rerankFinalK) { this.rerankFinalK = rerankFinalK; return this; }
        public Builder enableQueryExpansion(boolean enable) { this.enableQueryExpansion = enable; return this; }
        public Builder maxExpansions(int maxExpansions) { this.maxExpansions = maxExpansions; return this; }
        public Builder enableMultiRoundRetrieval(boolean enable) { this.enableMultiRoundRetrieval = enable; return this; }
        public Builder maxRetrievalRounds(int rounds) { this.maxRetrievalRounds = rounds; return this; }
        public Builder coverageScoreThreshold(double threshold) { this.coverageScoreThreshold = threshold; return this; }
        public Builder coverageMinHits(int minHits) { this.coverageMinHits = minHits; return this; }
        public Builder isolationMode(IsolationMode mode) { this.isolationMode = mode; return this; }
        public Builder workflowTimeout(Duration timeout) { this.workflowTimeout = timeout; return this; }
        public Builder cancellationGrace(Duration grace) { this.cancellationGrace = grace; return this; }
        public Builder agentConcurrency(int concurrency) { this.agentConcurrency = concurrency; return this; }
        public Builder fieldConcurrency(int concurrency) { this.fieldConcurrency = concurrency; return this; }
        public Builder perCallMaxRetries(int retries) { this.perCallMaxRetries = retries; return this; }
        public Builder retryBaseDelay(Duration delay) { this.retryBaseDelay = delay; return this; }
        public Builder retryMaxDelay(Duration delay) { this.retryMaxDelay = delay; return this; }

        public PipelineProperties build() {
            return new PipelineProperties(this);
        }
    }
}
