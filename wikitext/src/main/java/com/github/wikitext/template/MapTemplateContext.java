package com.github.wikitext.template;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.github.wikitext.parsing.Configuration;

/**
 * In-memory templates and magic variables. Template names are matched by their normalized key.
 */
public class MapTemplateContext implements TemplateContext {
    private final Configuration configuration;
    private final Map<String, String> templates = new HashMap<>();
    private final Map<String, String> magicVariables = new HashMap<>();

    public MapTemplateContext(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration);
    }

    public MapTemplateContext template(String name, String source) {
        templates.put(TemplateKeys.normalize(name), Objects.requireNonNull(source));
        return this;
    }

    public MapTemplateContext magicVariable(String name, String value) {
        magicVariables.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
        return this;
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public Optional<String> resolveMagicVariable(String name) {
        return Optional.ofNullable(magicVariables.get(name));
    }

    @Override
    public CompletableFuture<String> loadTemplate(String name) {
        var key = TemplateKeys.normalize(name);
        var source = templates.get(key);

        if (source == null) {
            return CompletableFuture.failedFuture(new TemplateNotFoundException(name, key));
        }

        return CompletableFuture.completedFuture(source);
    }
}
