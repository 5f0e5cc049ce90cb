package com.github.wikitext.simplified;

import com.github.wikitext.parsing.ParsingException;

/**
 * Failure to turn a grammar tree into a simplified tree. Terminal for the call that raised it.
 */
public abstract class SimplificationException extends ParsingException {
    private static final long serialVersionUID = -2915170352906383917L;

    private final ErrorContext context;

    protected SimplificationException(String message, ErrorContext context) {
        super(message + " " + context);
        this.context = context;
    }

    public ErrorContext getContext() {
        return context;
    }
}
