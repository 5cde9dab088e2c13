package com.eainde.bidding.config;

import com.eainde.bidding.agent.AgentFactory;
import com.eainde.bidding.agent.AgentRegistry;
import com.eainde.bidding.agent.RetrievalAgentFactory;
import com.eainde.bidding.agent.TenderAgents;
import com.eainde.bidding.aggregate.ReportAggregator;
import com.eainde.bidding.index.DocumentIndexer;
import com.eainde.bidding.model.IsolationMode;
import com.eainde.bidding.namespace.NamespaceManager;
import com.eainde.bidding.provider.DocumentSource;
import com.eainde.bidding.provider.EmbeddingProvider;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RerankerProvider;
import com.eainde.bidding.provider.RetryPolicy;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.provider.VectorStore;
import com.eainde.bidding.provider.langchain4j.ChatModelLlmProvider;
import com.eainde.bidding.provider.langchain4j.LangChain4jEmbeddingProvider;
import com.eainde.bidding.provider.langchain4j.LangChain4jVectorStore;
import com.eainde.bidding.provider.langchain4j.LlmReranker;
import com.eainde.bidding.provider.langchain4j.ScoringModelReranker;
import com.eainde.bidding.retrieval.CoveragePolicy;
import com.eainde.bidding.retrieval.QueryExpander;
import com.eainde.bidding.retrieval.RetrievalPlanner;
import com.eainde.bidding.retrieval.ThresholdCoveragePolicy;
import com.eainde.bidding.service.BiddingAnalysisService;
import com.eainde.bidding.service.PlainTextDocumentSource;
import com.eainde.bidding.workflow.BiddingPipelineOrchestrator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.time.Duration;
import java.util.Locale;

/**
 * Wires the pipeline.
 *
 * <p>The host application supplies the langchain4j models: a {@link ChatModel} and an
 * {@link EmbeddingModel} are required, a {@link ScoringModel} is optional. Settings come
 * from {@code bidding-pipeline.properties} (or any other property source) under the
 * {@code bidding.} prefix:</p>
 * <pre>
 * bidding.chunk-size=1000
 * bidding.chunk-overlap=200
 * bidding.retrieval-k=5
 * bidding.similarity-threshold=0.5
 * bidding.reranking.enabled=true
 * bidding.reranking.provider=scoring    # scoring | llm
 * bidding.isolation-mode=isolated       # isolated | cumulative
 * bidding.workflow-timeout-ms=600000
 * </pre>
 */
@Log4j2
@Configuration
@PropertySource(value = "classpath:bidding-pipeline.properties", ignoreResourceNotFound = true)
public class BiddingPipelineConfiguration {

    // ── Chunking / indexing ─────────────────────────────────────────────
    @Value("${bidding.chunk-size:1000}")
    private int chunkSize;

    @Value("${bidding.chunk-overlap:200}")
    private int chunkOverlap;

    @Value("${bidding.embedding-batch-size:32}")
    private int embeddingBatchSize;

    // ── Retrieval ───────────────────────────────────────────────────────
    @Value("${bidding.retrieval-k:5}")
    private int retrievalK;

    @Value("${bidding.similarity-threshold:0.5}")
    private double similarityThreshold;

    @Value("${bidding.reranking.enabled:true}")
    private boolean enableReranking;

    @Value("${bidding.reranking.provider:scoring}")
    private String rerankerProvider;

    @Value("${bidding.reranking.top-k:15}")
    private int rerankTopK;

    @Value("${bidding.reranking.final-k:8}")
    private int rerankFinalK;

    @Value("${bidding.query-expansion.enabled:false}")
    private boolean enableQueryExpansion;

    @Value("${bidding.query-expansion.max-expansions:3}")
    private int maxExpansions;

    @Value("${bidding.multi-round.enabled:true}")
    private boolean enableMultiRoundRetrieval;

    @Value("${bidding.multi-round.max-rounds:2}")
    private int maxRetrievalRounds;

    @Value("${bidding.coverage.score-threshold:0.75}")
    private double coverageScoreThreshold;

    @Value("${bidding.coverage.min-hits:2}")
    private int coverageMinHits;

    // ── Workflow ────────────────────────────────────────────────────────
    @Value("${bidding.isolation-mode:isolated}")
    private String isolationMode;

    @Value("${bidding.workflow-timeout-ms:600000}")
    private long workflowTimeoutMs;

    @Value("${bidding.cancellation-grace-ms:5000}")
    private long cancellationGraceMs;

    @Value("${bidding.agent-concurrency:3}")
    private int agentConcurrency;

    @Value("${bidding.field-concurrency:4}")
    private int fieldConcurrency;

    // ── Provider calls ──────────────────────────────────────────────────
    @Value("${bidding.retry.max-retries:3}")
    private int perCallMaxRetries;

    @Value("${bidding.retry.base-delay-ms:1000}")
    private long retryBaseDelayMs;

    @Value("${bidding.retry.max-delay-ms:30000}")
    private long retryMaxDelayMs;

    @Bean
    public static PropertySourcesPlaceholderConfigurer biddingPropertyPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public PipelineProperties pipelineProperties() {
        PipelineProperties props = PipelineProperties.builder()
                .chunkSize(chunkSize)
                .chunkOverlap(chunkOverlap)
                .embeddingBatchSize(embeddingBatchSize)
                .retrievalK(retrievalK)
                .similarityThreshold(similarityThreshold)
                .enableReranking(enableReranking)
                .rerankTopK(rerankTopK)
                .rerankFinalK(rerankFinalK)
                .enableQueryExpansion(enableQueryExpansion)
                .maxExpansions(maxExpansions)
                .enableMultiRoundRetrieval(enableMultiRoundRetrieval)
                .maxRetrievalRounds(maxRetrievalRounds)
                .coverageScoreThreshold(coverageScoreThreshold)
                .coverageMinHits(coverageMinHits)
                .isolationMode(IsolationMode.fromValue(isolationMode))
                .workflowTimeout(Duration.ofMillis(workflowTimeoutMs))
                .cancellationGrace(Duration.ofMillis(cancellationGraceMs))
                .agentConcurrency(agentConcurrency)
                .fieldConcurrency(fieldConcurrency)
                .perCallMaxRetries(perCallMaxRetries)
                .retryBaseDelay(Duration.ofMillis(retryBaseDelayMs))
                .retryMaxDelay(Duration.ofMillis(retryMaxDelayMs))
                .build();
        log.info("Bidding pipeline configuration: {}", props);
        return props;
    }

    @Bean
    public ObjectMapper biddingObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // =========================================================================
    //  Providers
    // =========================================================================

    @Bean
    public EmbeddingStore<TextSegment> biddingEmbeddingStore() {
        return new InMemoryEmbeddingStore<>();
    }

    @Bean
    public VectorStore vectorStore(EmbeddingStore<TextSegment> biddingEmbeddingStore) {
        return new LangChain4jVectorStore(biddingEmbeddingStore);
    }

    @Bean
    public EmbeddingProvider embeddingProvider(EmbeddingModel embeddingModel) {
        return new LangChain4jEmbeddingProvider(embeddingModel);
    }

    @Bean
    public LlmProvider llmProvider(ChatModel chatModel, ObjectMapper biddingObjectMapper) {
        return new ChatModelLlmProvider(chatModel, biddingObjectMapper);
    }

    @Bean
    public RetryingCaller retryingCaller(PipelineProperties pipelineProperties) {
        return new RetryingCaller(RetryPolicy.from(pipelineProperties));
    }

    @Bean
    public DocumentSource documentSource() {
        return new PlainTextDocumentSource();
    }

    // =========================================================================
    //  Pipeline components
    // =========================================================================

    @Bean
    public NamespaceManager namespaceManager(VectorStore vectorStore, RetryingCaller retryingCaller) {
        return new NamespaceManager(vectorStore, retryingCaller);
    }

    @Bean
    public DocumentIndexer documentIndexer(NamespaceManager namespaceManager, EmbeddingProvider embeddingProvider,
                                           VectorStore vectorStore, RetryingCaller retryingCaller,
                                           PipelineProperties pipelineProperties) {
        return new DocumentIndexer(namespaceManager, embeddingProvider, vectorStore, retryingCaller, pipelineProperties);
    }

    @Bean
    public QueryExpander queryExpander(LlmProvider llmProvider, RetryingCaller retryingCaller,
                                       PipelineProperties pipelineProperties) {
        return new QueryExpander(llmProvider, retryingCaller, pipelineProperties);
    }

    @Bean
    public CoveragePolicy coveragePolicy(PipelineProperties pipelineProperties) {
        return ThresholdCoveragePolicy.from(pipelineProperties);
    }

    @Bean
    public RetrievalPlanner retrievalPlanner(NamespaceManager namespaceManager, EmbeddingProvider embeddingProvider,
                                             VectorStore vectorStore, LlmProvider llmProvider,
                                             ObjectProvider<ScoringModel> scoringModel, QueryExpander queryExpander,
                                             CoveragePolicy coveragePolicy, RetryingCaller retryingCaller,
                                             PipelineProperties pipelineProperties) {
        RerankerProvider reranker = selectReranker(llmProvider, scoringModel.getIfAvailable());
        return new RetrievalPlanner(namespaceManager, embeddingProvider, vectorStore, reranker, queryExpander,
                coveragePolicy, retryingCaller, pipelineProperties);
    }

    @Bean
    public AgentRegistry agentRegistry() {
        return TenderAgents.standardRegistry();
    }

    @Bean
    public AgentFactory agentFactory(RetrievalPlanner retrievalPlanner, LlmProvider llmProvider,
                                     RetryingCaller retryingCaller, ObjectMapper biddingObjectMapper,
                                     PipelineProperties pipelineProperties) {
        return new RetrievalAgentFactory(retrievalPlanner, llmProvider, retryingCaller, biddingObjectMapper,
                pipelineProperties);
    }

    @Bean
    public ReportAggregator reportAggregator() {
        return new ReportAggregator();
    }

    @Bean
    public BiddingPipelineOrchestrator biddingPipelineOrchestrator(NamespaceManager namespaceManager,
                                                                   DocumentIndexer documentIndexer,
                                                                   AgentRegistry agentRegistry,
                                                                   AgentFactory agentFactory,
                                                                   ReportAggregator reportAggregator,
                                                                   PipelineProperties pipelineProperties) {
        return new BiddingPipelineOrchestrator(namespaceManager, documentIndexer, agentRegistry, agentFactory,
                reportAggregator, pipelineProperties);
    }

    @Bean
    public BiddingAnalysisService biddingAnalysisService(DocumentSource documentSource,
                                                         BiddingPipelineOrchestrator biddingPipelineOrchestrator) {
        return new BiddingAnalysisService(documentSource, biddingPipelineOrchestrator);
    }

    /**
     * {@code null} when reranking is disabled or the configured provider is not available;
     * retrieval then keeps similarity order.
     */
    RerankerProvider selectReranker(LlmProvider llmProvider, ScoringModel scoringModel) {
        if (!enableReranking) {
            return null;
        }
        String provider = rerankerProvider == null ? "scoring" : rerankerProvider.trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "llm":
                log.info("Reranking with the chat model");
                return new LlmReranker(llmProvider);
            case "scoring":
                if (scoringModel == null) {
                    log.warn("Reranking enabled but no ScoringModel bean is present; using similarity order");
                    return null;
                }
                log.info("Reranking with ScoringModel {}", scoringModel.getClass().getSimpleName());
                return new ScoringModelReranker(scoringModel);
            default:
                throw new IllegalArgumentException("Unknown reranker provider '" + rerankerProvider
                        + "', expected 'scoring' or 'llm'");
        }
    }
}
