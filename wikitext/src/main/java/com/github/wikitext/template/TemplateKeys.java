package com.github.wikitext.template;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

public final class TemplateKeys {
    private TemplateKeys() {}

    /**
     * Cache and lookup key of a template name: lower-cased, spaces turned into underscores.
     */
    public static String normalize(String name) {
        return StringUtils.replaceChars(name.toLowerCase(Locale.ROOT), ' ', '_');
    }
}
