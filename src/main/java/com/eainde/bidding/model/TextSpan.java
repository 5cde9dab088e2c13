package com.eainde.bidding.model;

/**
 * Half-open range {@code [start, end)} of character offsets into a document's text.
 */
public record TextSpan(int start, int end) {

    public TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static TextSpan of(int start, int end) {
        return new TextSpan(start, end);
    }

    public int length() {
        return end - start;
    }

    public boolean contains(TextSpan other) {
        return other.start >= start && other.end <= end;
    }

    /** Returns the slice of {@code text} this span covers. */
    public String slice(String text) {
        return text.substring(start, end);
    }
}
