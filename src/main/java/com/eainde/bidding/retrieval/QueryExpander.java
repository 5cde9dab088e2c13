package com.eainde.bidding.retrieval;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.model.Query;
import com.eainde.bidding.model.QueryVariant;
import com.eainde.bidding.provider.JsonSchemaConverter;
import com.eainde.bidding.provider.LlmProvider;
import com.eainde.bidding.provider.RetryingCaller;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.regex.Pattern;

/**
 * Rewrites a field query into alternative phrasings (synonyms, abbreviations, the terms
 * tender documents actually use) to raise recall.
 *
 * <p>The original query is always variant 0. Rewrites are trimmed, stripped of list
 * markers and deduplicated, and the total never exceeds {@code maxExpansions}. When
 * expansion is disabled, no LLM is configured, or the call fails, the result is just the
 * original query.</p>
 */
@Log4j2
public class QueryExpander {

    private static final Pattern LIST_MARKER = Pattern.compile("^[-*•\\d.、)）]+\\s*");

    static final JsonSchema SCHEMA = JsonSchemaConverter.parse("query_expansion", """
            {
              "type": "object",
              "properties": {
                "expanded_queries": {
                  "type": "array",
                  "items": { "type": "string" },
                  "description": "改写后的查询，不包含原查询"
                }
              },
              "required": ["expanded_queries"]
            }
            """);

    private final LlmProvider llm;
    private final RetryingCaller retryingCaller;
    private final int maxVariants;

    /**
     * @param llm may be {@code null}, in which case expansion is off
     */
    public QueryExpander(LlmProvider llm, RetryingCaller retryingCaller, PipelineProperties props) {
        this.llm = llm;
        this.retryingCaller = retryingCaller;
        this.maxVariants = props.effectiveExpansions();
    }

    public List<QueryVariant> expand(Query query) {
        String original = query.text().trim();
        if (maxVariants <= 1 || llm == null) {
            return List.of(new QueryVariant(0, original));
        }

        List<String> rewrites;
        try {
            JsonNode response = retryingCaller.call("expand query for " + query.fieldName(),
                    () -> llm.complete(buildPrompt(original, maxVariants - 1), SCHEMA));
            rewrites = new ArrayList<>();
            response.path("expanded_queries").forEach(node -> rewrites.add(node.asText()));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Query expansion failed for field {}, using original query only: {}",
                    query.fieldName(), e.getMessage());
            return List.of(new QueryVariant(0, original));
        }

        Set<String> texts = new LinkedHashSet<>();
        texts.add(original);
        for (String rewrite : rewrites) {
            if (texts.size() >= maxVariants) {
                break;
            }
            String cleaned = normalize(rewrite);
            if (!cleaned.isEmpty()) {
                texts.add(cleaned);
            }
        }

        List<QueryVariant> variants = new ArrayList<>(texts.size());
        int index = 0;
        for (String text : texts) {
            variants.add(new QueryVariant(index++, text));
        }
        log.debug("Expanded query for field {} into {} variants", query.fieldName(), variants.size());
        return variants;
    }

    private static String normalize(String rewrite) {
        if (rewrite == null) {
            return "";
        }
        return LIST_MARKER.matcher(rewrite.trim()).replaceFirst("").trim();
    }

    private static String buildPrompt(String original, int count) {
        return """
                你是招投标文件检索助手。请将下面的查询改写为 %d 个不同的检索查询，用于在招标文件中查找相关内容。
                要求：
                1. 使用招标文件中常见的同义词、近义词和专业术语；
                2. 保持原查询的核心含义，不要引入无关信息；
                3. 每个查询简洁，适合语义检索；
                4. 不要重复原查询。

                原查询：%s
                """.formatted(count, original);
    }
}
