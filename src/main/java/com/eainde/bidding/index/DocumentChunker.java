package com.eainde.bidding.index;

import com.eainde.bidding.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits document text into overlapping character windows for embedding.
 *
 * <h3>Why overlap?</h3>
 * <p>Tender clauses often straddle a window boundary: "预算金额" at the end of one window and
 * the amount at the start of the next. With overlap both halves land in at least one chunk
 * together, so the clause stays retrievable.</p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * DocumentChunker chunker = DocumentChunker.builder()
 *         .chunkSize(1000)
 *         .chunkOverlap(200)
 *         .build();
 *
 * List&lt;TextSlice&gt; slices = chunker.chunk(document.text());
 * </pre>
 *
 * <p>Windows advance by {@code chunkSize - chunkOverlap} characters; the last window may be
 * shorter. Windows containing only whitespace are skipped. Every slice records its span in
 * the original text.</p>
 */
public class DocumentChunker {

    private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);

    private final int chunkSize;
    private final int chunkOverlap;

    private DocumentChunker(Builder builder) {
        this.chunkSize = builder.chunkSize;
        this.chunkOverlap = builder.chunkOverlap;

        if (chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "chunkOverlap (" + chunkOverlap + ") must be < chunkSize (" + chunkSize + ")");
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param text the full document text
     * @return slices in document order; empty for blank text
     */
    public List<TextSlice> chunk(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        int stride = chunkSize - chunkOverlap;
        List<TextSlice> slices = new ArrayList<>();
        int index = 0;
        for (int start = 0; start < text.length(); start += stride) {
            int end = Math.min(start + chunkSize, text.length());
            String window = text.substring(start, end);
            if (!window.isBlank()) {
                slices.add(new TextSlice(index++, TextSpan.of(start, end), window));
            }
            if (end >= text.length()) {
                break;
            }
        }

        log.info("Split {} characters into {} chunks (chunkSize={}, overlap={})",
                text.length(), slices.size(), chunkSize, chunkOverlap);
        return Collections.unmodifiableList(slices);
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int chunkOverlap() {
        return chunkOverlap;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a chunker with default settings (1000 characters, 200 overlap).
     */
    public static DocumentChunker withDefaults() {
        return builder().build();
    }

    public static class Builder {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;

        /** Window length in characters. Default: 1000. */
        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
            this.chunkSize = chunkSize;
            return this;
        }

        /** Characters shared by adjacent windows. Default: 200. Must be less than chunkSize. */
        public Builder chunkOverlap(int chunkOverlap) {
            if (chunkOverlap < 0) throw new IllegalArgumentException("chunkOverlap must be >= 0");
            this.chunkOverlap = chunkOverlap;
            return this;
        }

        public DocumentChunker build() {
            return new DocumentChunker(this);
        }
    }
}
