package com.github.wikitext.simplified;

import java.util.List;
import java.util.Objects;

import com.github.wikitext.parsing.Configuration;
import com.github.wikitext.parsing.Parser;
import com.github.wikitext.parsing.ParsingException;

/**
 * Entry point: tokenizes wikitext and simplifies the resulting grammar tree.
 */
public final class WikitextSimplified {
    private WikitextSimplified() {}

    /**
     * @throws ParsingException if the tokenizer rejects the input
     * @throws SimplificationException if the grammar tree cannot be simplified
     */
    public static List<Spanned<WikitextSimplifiedNode>> parseAndSimplify(String wikitext, Configuration configuration) {
        Objects.requireNonNull(configuration);
        return parseAndSimplify(wikitext, configuration.parser());
    }

    public static List<Spanned<WikitextSimplifiedNode>> parseAndSimplify(String wikitext, Parser parser) {
        Objects.requireNonNull(wikitext);
        Objects.requireNonNull(parser);

        var output = parser.parse(wikitext);
        return Simplifier.simplifyNodes(wikitext, output.nodes());
    }

    public static List<Spanned<WikitextSimplifiedNode>> parseAndSimplify(String wikitext) {
        return parseAndSimplify(wikitext, Configuration.wikipedia());
    }
}
