package com.eainde.bidding.provider.langchain4j;

import com.eainde.bidding.error.TransientProviderException;
import com.eainde.bidding.provider.EmbeddingProvider;
import com.eainde.bidding.provider.ProviderExceptions;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.List;

/**
 * {@link EmbeddingProvider} backed by a langchain4j {@link EmbeddingModel}.
 */
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel model;

    public LangChain4jEmbeddingProvider(EmbeddingModel model) {
        this.model = model;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
        Response<List<Embedding>> response;
        try {
            response = model.embedAll(segments);
        } catch (RuntimeException e) {
            throw ProviderExceptions.translate("Embedding", e);
        }
        List<Embedding> embeddings = response.content();
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new TransientProviderException("Embedding model returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vectors for " + texts.size() + " texts");
        }
        return embeddings.stream().map(Embedding::vector).toList();
    }
}
