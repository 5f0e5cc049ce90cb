package com.github.wikitext.template;

import java.io.IOException;

public class DirectoryScanFailedException extends TemplateException {
    private static final long serialVersionUID = 1L;

    private final String path;

    public DirectoryScanFailedException(String path, IOException cause) {
        super(String.format("Failed to scan template directory %s: %s", path, cause.getMessage()), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
