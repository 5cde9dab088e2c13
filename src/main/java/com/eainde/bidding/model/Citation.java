package com.eainde.bidding.model;

/**
 * Points an extracted value back at the exact text it was taken from.
 */
public record Citation(String chunkId, TextSpan span, String quote, Integer pageNumber) {
}
