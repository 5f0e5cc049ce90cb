package com.github.wikitext.simplified;

import java.util.Objects;

public record Spanned<T>(T value, Span span) {
    public Spanned {
        Objects.requireNonNull(value);
        Objects.requireNonNull(span);
    }

    public static <T> Spanned<T> of(T value, int start, int end) {
        return new Spanned<>(value, new Span(start, end));
    }
}
