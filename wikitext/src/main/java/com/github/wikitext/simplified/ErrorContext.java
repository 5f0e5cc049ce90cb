package com.github.wikitext.simplified;

/**
 * The offending slice of source text, with its offsets.
 */
public record ErrorContext(String content, int start, int end) {
    static ErrorContext of(String wikitext, int start, int end) {
        return new ErrorContext(wikitext.substring(start, end), start, end);
    }

    @Override
    public String toString() {
        return String.format("at position %d-%d: '%s'", start, end, content);
    }
}
