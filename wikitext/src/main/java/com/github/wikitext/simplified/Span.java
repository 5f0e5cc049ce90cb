package com.github.wikitext.simplified;

/**
 * Half-open range {@code [start, end)} of UTF-16 {@code char} offsets into the source wikitext.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(String.format("Invalid span: %d-%d", start, end));
        }
    }
}
