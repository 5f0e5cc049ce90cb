package com.github.wikitext.parsing;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Text extraction helpers for grammar nodes.
 */
public final class Nodes {
    private Nodes() {}

    /**
     * Concatenates the raw source slices covered by the given nodes.
     */
    public static String wikitext(String source, List<Node> nodes) {
        Objects.requireNonNull(source);
        var sb = new StringBuilder();

        for (var node : nodes) {
            sb.append(source, node.start(), node.end());
        }

        return sb.toString();
    }

    public static String innerText(List<Node> nodes) {
        return innerText(nodes, InnerTextConfig.DEFAULT);
    }

    /**
     * Joins the plain text carried by the given nodes, ignoring formatting, and trims the result.
     */
    public static String innerText(List<Node> nodes, InnerTextConfig config) {
        var sb = new StringBuilder();

        for (var node : nodes) {
            if (config.stopAfterBr() && node instanceof Node.StartTag tag && (tag.name().equals("br") || tag.name().equals("br/"))) {
                break;
            }

            sb.append(innerText(node, config));
        }

        return sb.toString().strip();
    }

    public static String innerText(Node node, InnerTextConfig config) {
        if (node instanceof Node.CharacterEntity entity) {
            return entity.character();
        } else if (node instanceof Node.Text text) {
            return text.value();
        } else if (node instanceof Node.Heading heading) {
            return innerText(heading.nodes(), config);
        } else if (node instanceof Node.Image image) {
            return innerText(image.text(), config);
        } else if (node instanceof Node.Link link) {
            return innerText(link.text(), config);
        } else if (node instanceof Node.Preformatted preformatted) {
            return innerText(preformatted.nodes(), config);
        } else if (node instanceof Node.Template template) {
            return templateText(template, config);
        } else {
            return "";
        }
    }

    // a couple of inline language templates carry readable text in their arguments
    private static String templateText(Node.Template template, InnerTextConfig config) {
        var name = innerText(template.name(), config).toLowerCase(Locale.ROOT);
        var positional = template.parameters().stream()
            .filter(argument -> argument.name() == null)
            .toList();

        switch (name) {
            case "lang" -> {
                return template.parameters().stream()
                    .filter(argument -> argument.name() != null && innerText(argument.name(), config).equals("text"))
                    .findFirst()
                    .or(() -> positional.stream().skip(1).findFirst())
                    .map(argument -> innerText(argument.value(), config))
                    .orElse("");
            }
            case "transliteration", "tlit", "transl" -> {
                if (positional.size() >= 3) {
                    return innerText(positional.get(2).value(), config);
                } else if (positional.size() == 2) {
                    return innerText(positional.get(1).value(), config);
                } else {
                    return StringUtils.EMPTY;
                }
            }
            default -> {
                return "";
            }
        }
    }
}
