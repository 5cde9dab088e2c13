package com.eainde.bidding.support;

import com.eainde.bidding.provider.EmbeddingProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic embeddings from hashed character bigrams: texts sharing wording end up close.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    public static final int DIMENSION = 256;

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public List<float[]> embed(List<String> texts) {
        calls.incrementAndGet();
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorFor(text));
        }
        return vectors;
    }

    public int calls() {
        return calls.get();
    }

    static float[] vectorFor(String text) {
        float[] vector = new float[DIMENSION];
        String compact = text.replaceAll("\\s+", "");
        if (compact.length() == 1) {
            vector[Math.floorMod(compact.hashCode(), DIMENSION)] += 1f;
        }
        for (int i = 0; i + 2 <= compact.length(); i++) {
            vector[Math.floorMod(compact.substring(i, i + 2).hashCode(), DIMENSION)] += 1f;
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            vector[0] = 1f;
            return vector;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
        return vector;
    }
}
