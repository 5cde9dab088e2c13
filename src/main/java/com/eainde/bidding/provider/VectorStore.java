package com.eainde.bidding.provider;

import com.eainde.bidding.model.Chunk;
import com.eainde.bidding.model.RetrievalHit;

import java.util.List;

/**
 * Namespaced similarity store.
 *
 * <p>Implementations must keep namespaces fully separate: a query never returns a chunk
 * of another namespace, and {@link #clear(String)} only removes chunks of the given one.</p>
 */
public interface VectorStore {

    /** Inserts or replaces chunks by id. */
    void upsert(String namespaceId, List<Chunk> chunks);

    /** Returns at most {@code k} hits, best first. */
    List<RetrievalHit> query(String namespaceId, float[] vector, int k);

    void clear(String namespaceId);

    /**
     * Verifies the store can serve requests for the namespace.
     * Throws when it cannot; the default assumes an embedded store that is always reachable.
     */
    default void checkAvailable(String namespaceId) {
    }
}
