package com.github.wikitext.simplified;

public class InvalidNodeStructureException extends SimplificationException {
    private static final long serialVersionUID = -6023874920381154092L;

    private final NodeStructureError error;

    public InvalidNodeStructureException(NodeStructureError error, ErrorContext context) {
        super("Invalid node structure: " + error.describe(), context);
        this.error = error;
    }

    public NodeStructureError getError() {
        return error;
    }
}
