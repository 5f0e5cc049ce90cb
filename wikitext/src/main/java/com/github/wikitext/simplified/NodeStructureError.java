package com.github.wikitext.simplified;

/**
 * Structural inconsistencies found while resolving formatting toggles and tags.
 */
public interface NodeStructureError {
    String describe();

    /**
     * A closing token arrived with nothing left to close.
     */
    record StackUnderflow() implements NodeStructureError {
        @Override
        public String describe() {
            return "stack underflow";
        }
    }

    /**
     * The innermost open layer cannot take children.
     */
    record NoChildren(String parentNodeType) implements NodeStructureError {
        @Override
        public String describe() {
            return String.format("node of type '%s' cannot have children", parentNodeType);
        }
    }

    /**
     * A bold-italic toggle closed an italic layer that was not nested in a bold one.
     */
    record MissingBoldLayer() implements NodeStructureError {
        @Override
        public String describe() {
            return "missing bold layer";
        }
    }

    record TagClosureMismatch(String expected, String actual) implements NodeStructureError {
        @Override
        public String describe() {
            return String.format("tag closure mismatch (expected '%s', found '%s')", expected, actual);
        }
    }
}
