package com.eainde.bidding.model;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * An indexed slice of a document, owned by exactly one namespace.
 *
 * @param pageNumber 1-based page of the chunk start, {@code null} when unknown
 */
public record Chunk(String id, String namespaceId, String text, TextSpan span, Integer pageNumber,
                    float[] embedding) {

    /**
     * Chunk ids are stable for the same namespace, offset and text, so indexing a document
     * twice overwrites its chunks instead of adding new ones.
     */
    public static String idFor(String namespaceId, int start, String text) {
        String key = namespaceId + ":" + start + ":" + text;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
