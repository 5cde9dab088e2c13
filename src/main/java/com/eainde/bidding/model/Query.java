package com.eainde.bidding.model;

import java.util.List;

/**
 * A retrieval query for one field.
 *
 * @param alternates keyword queries tried in later retrieval rounds when the first round
 *                   does not reach sufficient coverage
 */
public record Query(String fieldName, String text, List<String> alternates) {

    public Query {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank (field " + fieldName + ")");
        }
        alternates = alternates == null ? List.of() : List.copyOf(alternates);
    }

    public static Query of(String fieldName, String text) {
        return new Query(fieldName, text, List.of());
    }
}
