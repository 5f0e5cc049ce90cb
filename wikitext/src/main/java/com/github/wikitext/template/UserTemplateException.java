package com.github.wikitext.template;

import java.util.Objects;

/**
 * Wraps failures raised by custom {@link TemplateContext} implementations; the message is the
 * one of the wrapped exception.
 */
public class UserTemplateException extends TemplateException {
    private static final long serialVersionUID = 1L;

    public UserTemplateException(Throwable cause) {
        super(Objects.toString(cause.getMessage(), cause.toString()), cause);
    }
}
