package com.eainde.bidding.retrieval;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.QueryVariant;
import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.model.RetrievalHit;
import com.eainde.bidding.namespace.NamespaceManager;
import com.eainde.bidding.provider.EmbeddingProvider;
import com.eainde.bidding.provider.RerankerProvider;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.provider.VectorStore;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Turns a field query into a small, ranked evidence set.
 *
 * <h3>Flow per query:</h3>
 * <pre>
 * expand(query)                       → variants (original first)
 * for round r = 1..R:
 *     embed variants, search with k = retrievalK * r
 *     drop hits below similarityThreshold, merge by chunk id (max score)
 *     covered? → stop
 *     next variants = unused alternates, else same variants with wider k
 * pool  = top rerankTopK by score
 * final = rerank(pool) top rerankFinalK, or pool order when reranking is off or fails
 * </pre>
 *
 * <p>Embedding and store errors propagate after retries; reranker errors only downgrade
 * the ordering. An empty result means the document holds no evidence for the query.</p>
 */
@Log4j2
public class RetrievalPlanner {

    private final NamespaceManager namespaceManager;
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final RerankerProvider reranker;
    private final QueryExpander queryExpander;
    private final CoveragePolicy coveragePolicy;
    private final RetryingCaller retryingCaller;
    private final PipelineProperties props;

    /**
     * @param reranker may be {@code null}; candidates then keep their similarity order
     */
    public RetrievalPlanner(NamespaceManager namespaceManager,
                            EmbeddingProvider embeddingProvider,
                            VectorStore vectorStore,
                            RerankerProvider reranker,
                            QueryExpander queryExpander,
                            CoveragePolicy coveragePolicy,
                            RetryingCaller retryingCaller,
                            PipelineProperties props) {
        this.namespaceManager = namespaceManager;
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.reranker = reranker;
        this.queryExpander = queryExpander;
        this.coveragePolicy = coveragePolicy;
        this.retryingCaller = retryingCaller;
        this.props = props;
    }

    public List<RerankedResult> plan(NamespaceHandle handle, Query query) {
        return retrieve(handle, query).results();
    }

    public RetrievalOutcome retrieve(NamespaceHandle handle, Query query) {
        List<QueryVariant> variants = queryExpander.expand(query);
        int maxRounds = props.effectiveRetrievalRounds();

        Set<String> used = new HashSet<>();
        List<String> active = new ArrayList<>();
        for (QueryVariant variant : variants) {
            active.add(variant.text());
            used.add(variant.text());
        }

        Map<String, RetrievalHit> pool = new HashMap<>();
        int rounds = 0;
        for (int round = 1; round <= maxRounds; round++) {
            int k = props.getRetrievalK() * round;
            searchRound(handle, active, k, pool);
            rounds = round;

            if (coveragePolicy.isCovered(query, pool.values())) {
                log.debug("Field {} covered after round {} ({} hits)", query.fieldName(), round, pool.size());
                break;
            }
            if (round < maxRounds) {
                List<String> alternates = unusedAlternates(query, used);
                if (!alternates.isEmpty()) {
                    active = alternates;
                    used.addAll(alternates);
                }
            }
        }

        List<RetrievalHit> candidates = pool.values().stream()
                .sorted(RetrievalHit.BY_SCORE_DESC)
                .limit(props.getRerankTopK())
                .toList();

        boolean reranked = false;
        List<RerankedResult> results;
        if (candidates.isEmpty()) {
            results = List.of();
        } else if (props.isEnableReranking() && reranker != null) {
            List<RerankedResult> ordered = rerank(query, candidates);
            reranked = ordered != null;
            results = reranked ? ordered : similarityOrder(candidates);
        } else {
            results = similarityOrder(candidates);
        }

        log.debug("Retrieved {} evidence chunks for field {} ({} rounds, pool {}, reranked={})",
                results.size(), query.fieldName(), rounds, pool.size(), reranked);
        return new RetrievalOutcome(query, variants, rounds, pool.size(), reranked, results);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void searchRound(NamespaceHandle handle, List<String> texts, int k, Map<String, RetrievalHit> pool) {
        String namespaceId = handle.namespaceId();
        List<float[]> vectors = retryingCaller.call("embed queries", () -> embeddingProvider.embed(texts));
        for (float[] vector : vectors) {
            List<RetrievalHit> hits = namespaceManager.readAccess(handle,
                    () -> retryingCaller.call("query " + namespaceId, () -> vectorStore.query(namespaceId, vector, k)));
            for (RetrievalHit hit : hits) {
                if (hit.score() < props.getSimilarityThreshold()) {
                    continue;
                }
                pool.merge(hit.chunkId(), hit, (a, b) -> a.score() >= b.score() ? a : b);
            }
        }
    }

    private static List<String> unusedAlternates(Query query, Collection<String> used) {
        Set<String> fresh = new LinkedHashSet<>();
        for (String alternate : query.alternates()) {
            String text = alternate.trim();
            if (!text.isEmpty() && !used.contains(text)) {
                fresh.add(text);
            }
        }
        return new ArrayList<>(fresh);
    }

    /**
     * @return the reranked results restricted to the candidate pool, or {@code null} when the
     * reranker failed or returned nothing usable
     */
    private List<RerankedResult> rerank(Query query, List<RetrievalHit> candidates) {
        List<RerankedResult> raw;
        try {
            raw = retryingCaller.call("rerank " + query.fieldName(),
                    () -> reranker.rerank(query.text(), candidates, props.getRerankFinalK()));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Reranking failed for field {}, keeping similarity order: {}", query.fieldName(), e.getMessage());
            return null;
        }

        Map<String, RetrievalHit> byId = new HashMap<>();
        candidates.forEach(hit -> byId.put(hit.chunkId(), hit));
        Set<String> seen = new HashSet<>();
        List<RerankedResult> results = new ArrayList<>();
        for (RerankedResult result : raw) {
            if (results.size() >= props.getRerankFinalK()) {
                break;
            }
            String chunkId = result.hit().chunkId();
            if (!byId.containsKey(chunkId) || !seen.add(chunkId)) {
                continue;
            }
            results.add(new RerankedResult(byId.get(chunkId), result.rerankScore(), results.size() + 1));
        }
        if (results.isEmpty()) {
            log.warn("Reranker returned no candidates from the pool for field {}, keeping similarity order",
                    query.fieldName());
            return null;
        }
        return results;
    }

    private List<RerankedResult> similarityOrder(List<RetrievalHit> candidates) {
        List<RerankedResult> results = new ArrayList<>();
        for (RetrievalHit hit : candidates) {
            if (results.size() >= props.getRerankFinalK()) {
                break;
            }
            results.add(new RerankedResult(hit, hit.score(), results.size() + 1));
        }
        return results;
    }
}
