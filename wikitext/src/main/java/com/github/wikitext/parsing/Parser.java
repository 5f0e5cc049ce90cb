package com.github.wikitext.parsing;

import java.util.List;

/**
 * Turns wikitext into a flat-ish grammar tree. Implementations are expected to be safe to call
 * repeatedly; a failure on one input must not affect later calls.
 */
public interface Parser {
    Output parse(String wikitext);

    record Output(List<Node> nodes) {
        public Output {
            nodes = List.copyOf(nodes);
        }
    }
}
