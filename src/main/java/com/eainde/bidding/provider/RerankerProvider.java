package com.eainde.bidding.provider;

import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.model.RetrievalHit;

import java.util.List;

/**
 * Reorders retrieval candidates by relevance to a query.
 *
 * <p>Implementations return at most {@code topK} results, ranked from 1, drawn only from
 * {@code candidates}.</p>
 */
public interface RerankerProvider {

    List<RerankedResult> rerank(String query, List<RetrievalHit> candidates, int topK);
}
