package com.eainde.bidding.provider.langchain4j;

import com.eainde.bidding.error.StoreUnavailableException;
import com.eainde.bidding.model.Chunk;
import com.eainde.bidding.model.RetrievalHit;
import com.eainde.bidding.model.TextSpan;
import com.eainde.bidding.provider.ProviderExceptions;
import com.eainde.bidding.provider.VectorStore;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.exception.UnsupportedFeatureException;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.filter.Filter;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * {@link VectorStore} over a langchain4j {@link EmbeddingStore}. Namespaces are kept apart
 * with a metadata filter on every query and clear.
 */
@Log4j2
public class LangChain4jVectorStore implements VectorStore {

    static final String NAMESPACE_KEY = "namespace_id";
    static final String SPAN_START_KEY = "span_start";
    static final String SPAN_END_KEY = "span_end";
    static final String PAGE_KEY = "page";

    private static final String PROBE_ID_PREFIX = "availability-probe-";

    private final EmbeddingStore<TextSegment> store;

    public LangChain4jVectorStore(EmbeddingStore<TextSegment> store) {
        this.store = store;
    }

    @Override
    public void upsert(String namespaceId, List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<String> ids = new ArrayList<>(chunks.size());
        List<Embedding> embeddings = new ArrayList<>(chunks.size());
        List<TextSegment> segments = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            if (!namespaceId.equals(chunk.namespaceId())) {
                throw new IllegalArgumentException("Chunk " + chunk.id() + " belongs to namespace "
                        + chunk.namespaceId() + ", not " + namespaceId);
            }
            ids.add(chunk.id());
            embeddings.add(Embedding.from(chunk.embedding()));
            segments.add(TextSegment.from(chunk.text(), metadataFor(chunk)));
        }
        try {
            // Replace by id so re-indexing the same document never duplicates chunks.
            store.removeAll(ids);
            store.addAll(ids, embeddings, segments);
        } catch (RuntimeException e) {
            throw ProviderExceptions.translate("Vector store upsert", e);
        }
        log.debug("Upserted {} chunks into namespace {}", chunks.size(), namespaceId);
    }

    @Override
    public List<RetrievalHit> query(String namespaceId, float[] vector, int k) {
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(Embedding.from(vector))
                .maxResults(k)
                .minScore(0.0)
                .filter(namespaceFilter(namespaceId))
                .build();
        List<EmbeddingMatch<TextSegment>> matches;
        try {
            matches = store.search(request).matches();
        } catch (RuntimeException e) {
            throw ProviderExceptions.translate("Vector store query", e);
        }
        return matches.stream()
                .map(match -> toHit(namespaceId, match))
                .toList();
    }

    @Override
    public void clear(String namespaceId) {
        try {
            store.removeAll(namespaceFilter(namespaceId));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Failed to clear namespace " + namespaceId, e);
        }
    }

    @Override
    public void checkAvailable(String namespaceId) {
        try {
            // Removing an id that never exists is a round trip with no effect on the data.
            store.removeAll(List.of(PROBE_ID_PREFIX + namespaceId));
        } catch (UnsupportedFeatureException e) {
            log.debug("Store does not support removal by id, skipping availability probe");
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Vector store unreachable for namespace " + namespaceId, e);
        }
    }

    private static Filter namespaceFilter(String namespaceId) {
        return metadataKey(NAMESPACE_KEY).isEqualTo(namespaceId);
    }

    private static Metadata metadataFor(Chunk chunk) {
        Metadata metadata = new Metadata()
                .put(NAMESPACE_KEY, chunk.namespaceId())
                .put(SPAN_START_KEY, chunk.span().start())
                .put(SPAN_END_KEY, chunk.span().end());
        if (chunk.pageNumber() != null) {
            metadata.put(PAGE_KEY, chunk.pageNumber());
        }
        return metadata;
    }

    private static RetrievalHit toHit(String namespaceId, EmbeddingMatch<TextSegment> match) {
        TextSegment segment = match.embedded();
        Metadata metadata = segment.metadata();
        TextSpan span = TextSpan.of(metadata.getInteger(SPAN_START_KEY), metadata.getInteger(SPAN_END_KEY));
        return new RetrievalHit(match.embeddingId(), match.score(), segment.text(), span,
                namespaceId, metadata.getInteger(PAGE_KEY));
    }
}
