package com.eainde.bidding.provider;

import java.util.List;

/**
 * Turns text into dense vectors. The returned list has one vector per input, in input order.
 */
public interface EmbeddingProvider {

    List<float[]> embed(List<String> texts);

    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }
}
