package com.github.wikitext.template;

import java.util.Objects;

import com.github.wikitext.simplified.WikitextSimplifiedNode;

/**
 * What to instantiate: a template loaded by name, or an already simplified tree. Exactly one of
 * the components is set.
 */
public record TemplateTarget(String name, WikitextSimplifiedNode node) {
    public TemplateTarget {
        if ((name == null) == (node == null)) {
            throw new IllegalArgumentException("exactly one of name and node must be given");
        }
    }

    public static TemplateTarget ofName(String name) {
        return new TemplateTarget(Objects.requireNonNull(name), null);
    }

    public static TemplateTarget ofNode(WikitextSimplifiedNode node) {
        return new TemplateTarget(null, Objects.requireNonNull(node));
    }
}
