package com.eainde.bidding.model;

/**
 * One phrasing of a query. Index 0 is always the original text.
 */
public record QueryVariant(int index, String text) {

    public boolean isOriginal() {
        return index == 0;
    }
}
