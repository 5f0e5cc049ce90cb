package com.github.wikitext.template;

import java.io.IOException;

public class LoadFailedException extends TemplateException {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String path;

    public LoadFailedException(String name, String path, IOException cause) {
        super(String.format("Failed to load template '%s' from %s: %s", name, path, cause.getMessage()), cause);
        this.name = name;
        this.path = path;
    }

    public String getName() {
        return name;
    }

    public String getPath() {
        return path;
    }
}
