package com.github.wikitext.parsing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.MissingResourceException;

import org.apache.commons.io.IOUtils;

public final class Utils {
    private Utils() {}

    public static String loadResource(String filename, Class<?> caller) {
        try (var stream = caller.getResourceAsStream(filename)) {
            if (stream == null) {
                throw new MissingResourceException("Resource not found: " + filename, caller.getName(), filename);
            }

            return IOUtils.toString(stream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MissingResourceException("Error loading resource: " + filename, caller.getName(), filename);
        }
    }

    static boolean isLineStart(String text, int index) {
        return index == 0 || text.charAt(index - 1) == '\n';
    }

    static int lineEnd(String text, int index, int limit) {
        var pos = text.indexOf('\n', index);
        return pos == -1 || pos > limit ? limit : pos;
    }

    static boolean startsWithIgnoreCase(String text, int index, String prefix) {
        return text.regionMatches(true, index, prefix, 0, prefix.length());
    }
}
