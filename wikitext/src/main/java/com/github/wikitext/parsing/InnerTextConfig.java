package com.github.wikitext.parsing;

/**
 * Options for {@link Nodes#innerText(java.util.List, InnerTextConfig)}.
 *
 * @param stopAfterBr stop collecting text at the first {@code <br>} start tag
 */
public record InnerTextConfig(boolean stopAfterBr) {
    public static final InnerTextConfig DEFAULT = new InnerTextConfig(false);
}
