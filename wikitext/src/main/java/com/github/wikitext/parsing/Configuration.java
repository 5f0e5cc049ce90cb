package com.github.wikitext.parsing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Site profile consumed by {@link WikitextParser}: which namespaces denote categories and files,
 * which tags are extension tags, which behaviour switches and URL protocols are recognized.
 * Instances are immutable; build them with {@link #builder()} or read them from JSON.
 */
public final class Configuration {
    private static final String WIKIPEDIA_PROFILE = "wikipedia.json";

    private static Configuration wikipedia;

    private final Set<String> categoryNamespaces;
    private final Set<String> extensionTags;
    private final Set<String> fileNamespaces;
    private final String linkTrail;
    private final Set<String> magicWords;
    private final List<String> protocols;
    private final Set<String> redirectMagicWords;

    private Configuration(Builder builder) {
        categoryNamespaces = Set.copyOf(builder.categoryNamespaces);
        extensionTags = Set.copyOf(builder.extensionTags);
        fileNamespaces = Set.copyOf(builder.fileNamespaces);
        linkTrail = builder.linkTrail;
        magicWords = Set.copyOf(builder.magicWords);
        redirectMagicWords = Set.copyOf(builder.redirectMagicWords);

        // longest protocol first, so that "https://" wins over "http" lookalikes
        protocols = builder.protocols.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The profile used by the English Wikipedia, loaded once from the bundled JSON resource.
     */
    public static synchronized Configuration wikipedia() {
        if (wikipedia == null) {
            wikipedia = fromJson(new JSONObject(Utils.loadResource(WIKIPEDIA_PROFILE, Configuration.class)));
        }

        return wikipedia;
    }

    public static Configuration fromJson(JSONObject json) {
        Objects.requireNonNull(json);

        return builder()
            .categoryNamespaces(readStrings(json, "categoryNamespaces"))
            .extensionTags(readStrings(json, "extensionTags"))
            .fileNamespaces(readStrings(json, "fileNamespaces"))
            .linkTrail(json.optString("linkTrail", ""))
            .magicWords(readStrings(json, "magicWords"))
            .protocols(readStrings(json, "protocols"))
            .redirectMagicWords(readStrings(json, "redirectMagicWords"))
            .build();
    }

    private static List<String> readStrings(JSONObject json, String key) {
        var list = new ArrayList<String>();
        var array = json.optJSONArray(key);

        if (array != null) {
            for (var i = 0; i < array.length(); i++) {
                list.add(array.getString(i));
            }
        }

        return list;
    }

    public JSONObject toJson() {
        return new JSONObject()
            .put("categoryNamespaces", new JSONArray(sorted(categoryNamespaces)))
            .put("extensionTags", new JSONArray(sorted(extensionTags)))
            .put("fileNamespaces", new JSONArray(sorted(fileNamespaces)))
            .put("linkTrail", linkTrail)
            .put("magicWords", new JSONArray(sorted(magicWords)))
            .put("protocols", new JSONArray(sorted(protocols)))
            .put("redirectMagicWords", new JSONArray(sorted(redirectMagicWords)));
    }

    private static List<String> sorted(Collection<String> values) {
        return values.stream().sorted().toList();
    }

    public Parser parser() {
        return new WikitextParser(this);
    }

    public boolean isCategoryNamespace(String namespace) {
        return categoryNamespaces.contains(namespace.toLowerCase(Locale.ROOT));
    }

    public boolean isFileNamespace(String namespace) {
        return fileNamespaces.contains(namespace.toLowerCase(Locale.ROOT));
    }

    public boolean isExtensionTag(String name) {
        return extensionTags.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isMagicWord(String name) {
        return magicWords.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isRedirectMagicWord(String word) {
        return redirectMagicWords.contains(word.toLowerCase(Locale.ROOT));
    }

    public boolean isLinkTrailCharacter(char ch) {
        return linkTrail.indexOf(ch) != -1;
    }

    public Set<String> getRedirectMagicWords() {
        return redirectMagicWords;
    }

    public List<String> getProtocols() {
        return protocols;
    }

    @Override
    public String toString() {
        return String.format("[extensionTags=%d, magicWords=%d, protocols=%d, linkTrail=%s]",
            extensionTags.size(), magicWords.size(), protocols.size(), linkTrail);
    }

    public static final class Builder {
        private final Set<String> categoryNamespaces = new LinkedHashSet<>();
        private final Set<String> extensionTags = new LinkedHashSet<>();
        private final Set<String> fileNamespaces = new LinkedHashSet<>();
        private String linkTrail = "";
        private final Set<String> magicWords = new LinkedHashSet<>();
        private final Set<String> protocols = new LinkedHashSet<>();
        private final Set<String> redirectMagicWords = new LinkedHashSet<>();

        private Builder() {}

        public Builder categoryNamespaces(String... namespaces) {
            return categoryNamespaces(Arrays.asList(namespaces));
        }

        public Builder categoryNamespaces(Collection<String> namespaces) {
            categoryNamespaces.addAll(normalize(namespaces, "category namespace"));
            return this;
        }

        public Builder extensionTags(String... tags) {
            return extensionTags(Arrays.asList(tags));
        }

        public Builder extensionTags(Collection<String> tags) {
            extensionTags.addAll(normalize(tags, "extension tag"));
            return this;
        }

        public Builder fileNamespaces(String... namespaces) {
            return fileNamespaces(Arrays.asList(namespaces));
        }

        public Builder fileNamespaces(Collection<String> namespaces) {
            fileNamespaces.addAll(normalize(namespaces, "file namespace"));
            return this;
        }

        public Builder linkTrail(String characters) {
            linkTrail = Objects.requireNonNull(characters);
            return this;
        }

        public Builder magicWords(String... words) {
            return magicWords(Arrays.asList(words));
        }

        public Builder magicWords(Collection<String> words) {
            magicWords.addAll(normalize(words, "magic word"));
            return this;
        }

        public Builder protocols(String... values) {
            return protocols(Arrays.asList(values));
        }

        public Builder protocols(Collection<String> values) {
            protocols.addAll(normalize(values, "protocol"));
            return this;
        }

        public Builder redirectMagicWords(String... words) {
            return redirectMagicWords(Arrays.asList(words));
        }

        public Builder redirectMagicWords(Collection<String> words) {
            redirectMagicWords.addAll(normalize(words, "redirect magic word"));
            return this;
        }

        public Configuration build() {
            return new Configuration(this);
        }

        private static Set<String> normalize(Collection<String> values, String what) {
            Objects.requireNonNull(values);

            for (var value : values) {
                Validate.isTrue(StringUtils.isNotBlank(value), "%s must be a non-empty string: '%s'", what, value);
            }

            return values.stream()
                .map(value -> value.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        }
    }
}
