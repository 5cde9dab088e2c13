package com.eainde.bidding.provider.langchain4j;

import com.eainde.bidding.error.TransientProviderException;
import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.model.RetrievalHit;
import com.eainde.bidding.provider.ProviderExceptions;
import com.eainde.bidding.provider.RerankerProvider;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link RerankerProvider} backed by a langchain4j {@link ScoringModel} (cross-encoder or
 * hosted rerank API).
 */
public class ScoringModelReranker implements RerankerProvider {

    private final ScoringModel scoringModel;

    public ScoringModelReranker(ScoringModel scoringModel) {
        this.scoringModel = scoringModel;
    }

    @Override
    public List<RerankedResult> rerank(String query, List<RetrievalHit> candidates, int topK) {
        if (candidates.isEmpty() || topK <= 0) {
            return List.of();
        }
        List<TextSegment> segments = candidates.stream().map(hit -> TextSegment.from(hit.text())).toList();
        Response<List<Double>> response;
        try {
            response = scoringModel.scoreAll(segments, query);
        } catch (RuntimeException e) {
            throw ProviderExceptions.translate("Scoring model", e);
        }
        List<Double> scores = response.content();
        if (scores == null || scores.size() != candidates.size()) {
            throw new TransientProviderException("Scoring model returned "
                    + (scores == null ? 0 : scores.size()) + " scores for " + candidates.size() + " candidates");
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> scores.get(i)).reversed());

        List<RerankedResult> results = new ArrayList<>();
        for (int i = 0; i < Math.min(topK, order.size()); i++) {
            int idx = order.get(i);
            results.add(new RerankedResult(candidates.get(idx), scores.get(idx), i + 1));
        }
        return results;
    }
}
