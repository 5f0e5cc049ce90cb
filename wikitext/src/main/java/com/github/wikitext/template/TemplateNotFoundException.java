package com.github.wikitext.template;

public class TemplateNotFoundException extends TemplateException {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String key;

    public TemplateNotFoundException(String name, String key) {
        super(String.format("Template not found: %s (key: %s)", name, key));
        this.name = name;
        this.key = key;
    }

    public String getName() {
        return name;
    }

    public String getKey() {
        return key;
    }
}
