package com.github.wikitext.template;

public class ParseFailedException extends TemplateException {
    private static final long serialVersionUID = 1L;

    private final String name;

    public ParseFailedException(String name, String message) {
        super(String.format("Failed to parse template '%s': %s", name, message));
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
