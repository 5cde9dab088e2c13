package com.eainde.bidding.index;

import com.eainde.bidding.config.PipelineProperties;
import com.eainde.bidding.error.BiddingPipelineException;
import com.eainde.bidding.error.EmptyDocumentException;
import com.eainde.bidding.error.IndexingException;
import com.eainde.bidding.model.Chunk;
import com.eainde.bidding.model.Document;
import com.eainde.bidding.model.IndexingSummary;
import com.eainde.bidding.model.NamespaceHandle;
import com.eainde.bidding.namespace.NamespaceManager;
import com.eainde.bidding.provider.EmbeddingProvider;
import com.eainde.bidding.provider.RetryingCaller;
import com.eainde.bidding.provider.VectorStore;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

/**
 * Chunks a document, embeds the chunks in batches and writes them to the session namespace.
 *
 * <p>Chunk ids depend only on namespace, offset and text, so indexing the same document twice
 * leaves the store with the same chunk set as indexing it once.</p>
 */
@Log4j2
public class DocumentIndexer {

    private final NamespaceManager namespaceManager;
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final RetryingCaller retryingCaller;
    private final DocumentChunker chunker;
    private final int batchSize;

    public DocumentIndexer(NamespaceManager namespaceManager,
                           EmbeddingProvider embeddingProvider,
                           VectorStore vectorStore,
                           RetryingCaller retryingCaller,
                           PipelineProperties props) {
        this.namespaceManager = namespaceManager;
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.retryingCaller = retryingCaller;
        this.chunker = DocumentChunker.builder()
                .chunkSize(props.getChunkSize())
                .chunkOverlap(props.getChunkOverlap())
                .build();
        this.batchSize = props.getEmbeddingBatchSize();
    }

    /**
     * @throws EmptyDocumentException when the document has no text; no provider is called
     * @throws BiddingPipelineException when embedding or upserting fails after retries
     */
    public IndexingSummary index(NamespaceHandle handle, Document document) {
        if (document.isBlank()) {
            throw new EmptyDocumentException("Document '" + document.name() + "' contains no text");
        }
        List<TextSlice> slices = chunker.chunk(document.text());
        String namespaceId = handle.namespaceId();

        return namespaceManager.readAccess(handle, () -> {
            int batches = 0;
            for (int from = 0; from < slices.size(); from += batchSize) {
                List<TextSlice> batch = slices.subList(from, Math.min(from + batchSize, slices.size()));
                List<String> texts = batch.stream().map(TextSlice::text).toList();

                List<float[]> vectors = retryingCaller.call("embed chunks " + from + ".." + (from + batch.size()),
                        () -> embeddingProvider.embed(texts));
                if (vectors.size() != batch.size()) {
                    throw new IndexingException("Embedding provider returned " + vectors.size()
                            + " vectors for " + batch.size() + " chunks");
                }

                List<Chunk> chunks = new ArrayList<>(batch.size());
                for (int i = 0; i < batch.size(); i++) {
                    TextSlice slice = batch.get(i);
                    chunks.add(new Chunk(
                            Chunk.idFor(namespaceId, slice.span().start(), slice.text()),
                            namespaceId,
                            slice.text(),
                            slice.span(),
                            document.pageAt(slice.span().start()),
                            vectors.get(i)));
                }
                retryingCaller.run("upsert chunks into " + namespaceId, () -> vectorStore.upsert(namespaceId, chunks));
                batches++;
            }
            log.info("Indexed document '{}' into {}: {} chunks in {} embedding batches",
                    document.name(), namespaceId, slices.size(), batches);
            return new IndexingSummary(namespaceId, document.documentId(), slices.size(), batches);
        });
    }
}
