package com.github.wikitext.template;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.github.wikitext.parsing.Configuration;

/**
 * Supplies templates and magic variables to a {@link TemplateEvaluator}.
 */
public interface TemplateContext {
    /**
     * Tokenizer profile used to parse loaded templates and reparse expansions.
     */
    Configuration configuration();

    /**
     * Resolves a magic variable such as {@code subpagename}; empty if the name is unknown.
     */
    Optional<String> resolveMagicVariable(String name);

    /**
     * Loads the wikitext source of a template. The returned future completes exceptionally with a
     * {@link TemplateException} (possibly wrapped in a
     * {@link java.util.concurrent.CompletionException}) when the template cannot be provided.
     */
    CompletableFuture<String> loadTemplate(String name);
}
