package com.eainde.bidding.retrieval;

import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.QueryVariant;
import com.eainde.bidding.model.RerankedResult;

import java.util.List;

/**
 * Evidence for one query plus how it was obtained.
 *
 * @param roundsExecuted   retrieval rounds actually run
 * @param candidatePoolSize distinct hits above the similarity threshold before reranking
 * @param reranked         whether the reranker ordered {@code results}
 */
public record RetrievalOutcome(Query query, List<QueryVariant> variants, int roundsExecuted,
                               int candidatePoolSize, boolean reranked, List<RerankedResult> results) {

    public RetrievalOutcome {
        variants = List.copyOf(variants);
        results = List.copyOf(results);
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
