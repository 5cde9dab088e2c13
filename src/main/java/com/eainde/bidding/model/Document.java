package com.eainde.bidding.model;

import java.util.List;
import java.util.Objects;

/**
 * A source document as plain text.
 *
 * <p>{@code pageOffsets} holds the start offset of every page in ascending order. It may be
 * empty when the source format has no notion of pages, in which case {@link #pageAt(int)}
 * returns {@code null}.</p>
 */
public record Document(String documentId, String name, String text, List<Integer> pageOffsets) {

    public Document {
        Objects.requireNonNull(documentId, "documentId must not be null");
        text = text == null ? "" : text;
        name = name == null ? documentId : name;
        pageOffsets = pageOffsets == null ? List.of() : List.copyOf(pageOffsets);
    }

    public static Document of(String documentId, String name, String text) {
        return new Document(documentId, name, text, List.of());
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * @return the 1-based page containing {@code offset}, or {@code null} when pages are unknown
     */
    public Integer pageAt(int offset) {
        if (pageOffsets.isEmpty()) {
            return null;
        }
        int page = 0;
        for (int i = 0; i < pageOffsets.size(); i++) {
            if (pageOffsets.get(i) <= offset) {
                page = i;
            } else {
                break;
            }
        }
        return page + 1;
    }
}
