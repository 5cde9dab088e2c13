package com.eainde.bidding.provider.langchain4j;

import com.eainde.bidding.model.RerankedResult;
import com.eainde.bidding.model.RetrievalHit;
import com.eainde.bidding.provider.JsonSchemaConverter;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RerankerProvider;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reranks with a chat model: the model scores every candidate from 0 to 1 in one call.
 * Candidates the model does not score rank after every scored candidate, in their
 * original order.
 */
@Log4j2
public class LlmReranker implements RerankerProvider {

    private static final int DEFAULT_SNIPPET_LENGTH = 300;

    static final JsonSchema SCHEMA = JsonSchemaConverter.parse("rerank_scores", """
            {
              "type": "object",
              "properties": {
                "scores": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "properties": {
                      "id": { "type": "integer", "description": "候选片段编号" },
                      "score": { "type": "number", "description": "相关性分数，0 到 1" }
                    },
                    "required": ["id", "score"]
                  }
                }
              },
              "required": ["scores"]
            }
            """);

    private final LlmProvider llm;
    private final int snippetLength;

    public LlmReranker(LlmProvider llm) {
        this(llm, DEFAULT_SNIPPET_LENGTH);
    }

    public LlmReranker(LlmProvider llm, int snippetLength) {
        this.llm = llm;
        this.snippetLength = snippetLength;
    }

    @Override
    public List<RerankedResult> rerank(String query, List<RetrievalHit> candidates, int topK) {
        if (candidates.isEmpty() || topK <= 0) {
            return List.of();
        }
        JsonNode response = llm.complete(buildPrompt(query, candidates), SCHEMA);

        Map<Integer, Double> scores = new HashMap<>();
        for (JsonNode entry : response.path("scores")) {
            int id = entry.path("id").asInt(-1);
            if (id >= 1 && id <= candidates.size() && entry.path("score").isNumber()) {
                scores.put(id - 1, clamp(entry.path("score").asDouble()));
            }
        }
        if (scores.isEmpty()) {
            log.warn("LLM reranker returned no usable scores for query '{}'", query);
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> scores.getOrDefault(i, -1.0)).reversed());

        List<RerankedResult> results = new ArrayList<>();
        for (int i = 0; i < Math.min(topK, order.size()); i++) {
            int idx = order.get(i);
            results.add(new RerankedResult(candidates.get(idx), scores.getOrDefault(idx, 0.0), i + 1));
        }
        return results;
    }

    private String buildPrompt(String query, List<RetrievalHit> candidates) {
        StringBuilder sb = new StringBuilder();
        sb.append("你是检索结果重排序助手。请根据查询与候选片段的相关性打分，分数范围 0 到 1，越相关分数越高。\n");
        sb.append("查询：").append(query).append("\n\n候选片段：\n");
        for (int i = 0; i < candidates.size(); i++) {
            String text = candidates.get(i).text();
            String snippet = text.length() > snippetLength ? text.substring(0, snippetLength) : text;
            sb.append('[').append(i + 1).append("] ").append(snippet.replace('\n', ' ')).append('\n');
        }
        sb.append("\n请为每个候选片段输出编号与分数。");
        return sb.toString();
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
