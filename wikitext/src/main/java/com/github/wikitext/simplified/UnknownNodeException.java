package com.github.wikitext.simplified;

/**
 * Raised for grammar nodes the simplifier has no conversion for.
 */
public class UnknownNodeException extends SimplificationException {
    private static final long serialVersionUID = 4679532371582237705L;

    private final String nodeType;

    public UnknownNodeException(String nodeType, ErrorContext context) {
        super(String.format("Unknown node type '%s'", nodeType), context);
        this.nodeType = nodeType;
    }

    public String getNodeType() {
        return nodeType;
    }
}
