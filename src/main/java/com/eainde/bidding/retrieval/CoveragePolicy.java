package com.eainde.bidding.retrieval;

import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.RetrievalHit;

import java.util.Collection;

/**
 * Decides after each retrieval round whether the evidence gathered so far is enough to stop.
 */
@FunctionalInterface
public interface CoveragePolicy {

    boolean isCovered(Query query, Collection<RetrievalHit> hits);
}
