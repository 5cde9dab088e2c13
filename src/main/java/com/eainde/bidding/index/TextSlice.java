package com.eainde.bidding.index;

import com.eainde.bidding.model.TextSpan;

/**
 * One window produced by {@link DocumentChunker}, before it is embedded.
 *
 * @param index 0-based position of the window in the document
 */
public record TextSlice(int index, TextSpan span, String text) {
}
