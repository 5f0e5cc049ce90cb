package com.github.wikitext.simplified;

import java.util.Objects;

/**
 * Named template argument. Positional arguments are named by their 1-based index.
 */
public record TemplateParameter(String name, String value) {
    public TemplateParameter {
        Objects.requireNonNull(name);
        Objects.requireNonNull(value);
    }
}
