package com.eainde.bidding.retrieval;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.RetrievalHit;

import java.util.Collection;

/**
 * Covered once at least {@code minHits} hits score at or above {@code scoreThreshold}.
 */
public class ThresholdCoveragePolicy implements CoveragePolicy {

    private final double scoreThreshold;
    private final int minHits;

    public ThresholdCoveragePolicy(double scoreThreshold, int minHits) {
        this.scoreThreshold = scoreThreshold;
        this.minHits = minHits;
    }

    public static ThresholdCoveragePolicy from(PipelineProperties props) {
        return new ThresholdCoveragePolicy(props.getCoverageScoreThreshold(), props.getCoverageMinHits());
    }

    @Override
    public boolean isCovered(Query query, Collection<RetrievalHit> hits) {
        long strong = hits.stream().filter(hit -> hit.score() >= scoreThreshold).count();
        return strong >= minHits;
    }
}
