package com.github.wikitext.template;

/**
 * Failure to provide or prepare a template for instantiation.
 */
public class TemplateException extends Exception {
    private static final long serialVersionUID = 1L;

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
