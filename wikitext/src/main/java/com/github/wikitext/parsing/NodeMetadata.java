package com.github.wikitext.parsing;

import java.util.List;

/**
 * Uniform view of a grammar node: its type, its span and, for container nodes, its immediate
 * children.
 */
public record NodeMetadata(Type type, int start, int end, List<Node> children) {
    public enum Type {
        BOLD("Bold"),
        BOLD_ITALIC("BoldItalic"),
        CATEGORY("Category"),
        CHARACTER_ENTITY("CharacterEntity"),
        COMMENT("Comment"),
        DEFINITION_LIST("DefinitionList"),
        END_TAG("EndTag"),
        EXTERNAL_LINK("ExternalLink"),
        HEADING("Heading"),
        HORIZONTAL_DIVIDER("HorizontalDivider"),
        IMAGE("Image"),
        ITALIC("Italic"),
        LINK("Link"),
        MAGIC_WORD("MagicWord"),
        ORDERED_LIST("OrderedList"),
        PARAGRAPH_BREAK("ParagraphBreak"),
        PARAMETER("Parameter"),
        PREFORMATTED("Preformatted"),
        REDIRECT("Redirect"),
        START_TAG("StartTag"),
        TABLE("Table"),
        TAG("Tag"),
        TEMPLATE("Template"),
        TEXT("Text"),
        UNORDERED_LIST("UnorderedList"),
        // a Node implementation from outside this package
        UNKNOWN("Unknown");

        private final String displayName;

        Type(String displayName) {
            this.displayName = displayName;
        }

        @Override
        public String toString() {
            return displayName;
        }
    }

    public static NodeMetadata of(Node node) {
        if (node instanceof Node.ExternalLink n) {
            return new NodeMetadata(Type.EXTERNAL_LINK, n.start(), n.end(), n.nodes());
        } else if (node instanceof Node.Heading n) {
            return new NodeMetadata(Type.HEADING, n.start(), n.end(), n.nodes());
        } else if (node instanceof Node.Image n) {
            return new NodeMetadata(Type.IMAGE, n.start(), n.end(), n.text());
        } else if (node instanceof Node.Link n) {
            return new NodeMetadata(Type.LINK, n.start(), n.end(), n.text());
        } else if (node instanceof Node.Preformatted n) {
            return new NodeMetadata(Type.PREFORMATTED, n.start(), n.end(), n.nodes());
        } else if (node instanceof Node.Tag n) {
            return new NodeMetadata(Type.TAG, n.start(), n.end(), n.nodes());
        } else {
            return new NodeMetadata(typeOf(node), node.start(), node.end(), null);
        }
    }

    private static Type typeOf(Node node) {
        if (node instanceof Node.Bold) {
            return Type.BOLD;
        } else if (node instanceof Node.BoldItalic) {
            return Type.BOLD_ITALIC;
        } else if (node instanceof Node.Category) {
            return Type.CATEGORY;
        } else if (node instanceof Node.CharacterEntity) {
            return Type.CHARACTER_ENTITY;
        } else if (node instanceof Node.Comment) {
            return Type.COMMENT;
        } else if (node instanceof Node.DefinitionList) {
            return Type.DEFINITION_LIST;
        } else if (node instanceof Node.EndTag) {
            return Type.END_TAG;
        } else if (node instanceof Node.HorizontalDivider) {
            return Type.HORIZONTAL_DIVIDER;
        } else if (node instanceof Node.Italic) {
            return Type.ITALIC;
        } else if (node instanceof Node.MagicWord) {
            return Type.MAGIC_WORD;
        } else if (node instanceof Node.OrderedList) {
            return Type.ORDERED_LIST;
        } else if (node instanceof Node.ParagraphBreak) {
            return Type.PARAGRAPH_BREAK;
        } else if (node instanceof Node.Parameter) {
            return Type.PARAMETER;
        } else if (node instanceof Node.Redirect) {
            return Type.REDIRECT;
        } else if (node instanceof Node.StartTag) {
            return Type.START_TAG;
        } else if (node instanceof Node.Table) {
            return Type.TABLE;
        } else if (node instanceof Node.Template) {
            return Type.TEMPLATE;
        } else if (node instanceof Node.Text) {
            return Type.TEXT;
        } else if (node instanceof Node.UnorderedList) {
            return Type.UNORDERED_LIST;
        } else {
            return Type.UNKNOWN;
        }
    }
}
