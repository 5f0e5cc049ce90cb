package com.github.wikitext.simplified;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Node of the simplified wikitext tree. Formatting toggles and start/end tags of the grammar
 * tree are resolved into proper containers; every child carries the span of source text it was
 * built from.
 */
public interface WikitextSimplifiedNode {
    /**
     * Kebab-case discriminant, as used in the JSON output.
     */
    String nodeType();

    /**
     * Immediate children of container nodes; {@code null} for leaves and for nodes whose content
     * lives in dedicated structures (tables, lists, template parameter defaults).
     */
    default List<Spanned<WikitextSimplifiedNode>> children() {
        return null;
    }

    /**
     * Block-type nodes must start on their own line when serialized.
     */
    default boolean isBlockType() {
        return false;
    }

    default String toWikitext() {
        return WikitextSerializer.toWikitext(this);
    }

    /**
     * Pre-order traversal over this node and all of its descendants.
     */
    default void visit(Consumer<WikitextSimplifiedNode> visitor) {
        NodeTraversal.visit(this, visitor);
    }

    /**
     * Bottom-up rewrite: descendants are replaced first, then the rebuilt node itself is passed to
     * the visitor. Spans of replaced children are preserved.
     */
    default WikitextSimplifiedNode visitAndReplace(UnaryOperator<WikitextSimplifiedNode> visitor) {
        return NodeTraversal.visitAndReplace(this, visitor);
    }

    record Fragment(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "fragment";
        }
    }

    record Template(String name, List<TemplateParameter> parameters) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "template";
        }
    }

    /**
     * {@code {{{name|default}}}}; {@code defaultValue} is {@code null} when no default is given.
     */
    record TemplateParameterUse(String name, List<Spanned<WikitextSimplifiedNode>> defaultValue) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "template-parameter-use";
        }
    }

    record Heading(int level, List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "heading";
        }

        @Override
        public boolean isBlockType() {
            return true;
        }
    }

    record Link(String text, String title) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "link";
        }
    }

    /**
     * {@code [link text]}; {@code text} is {@code null} for bare external links.
     */
    record ExtLink(String link, String text) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "ext-link";
        }
    }

    record Bold(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "bold";
        }
    }

    record Italic(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "italic";
        }
    }

    record Blockquote(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "blockquote";
        }
    }

    record Superscript(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "superscript";
        }
    }

    record Subscript(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "subscript";
        }
    }

    record Small(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "small";
        }
    }

    record Preformatted(List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "preformatted";
        }
    }

    /**
     * Generic tag; {@code attributes} is {@code null} when the opening tag has none.
     */
    record Tag(String name, String attributes, List<Spanned<WikitextSimplifiedNode>> children) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "tag";
        }
    }

    record Text(String text) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "text";
        }
    }

    record Table(List<Spanned<WikitextSimplifiedNode>> attributes, List<TableCaption> captions, List<TableRow> rows) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "table";
        }

        @Override
        public boolean isBlockType() {
            return true;
        }
    }

    record OrderedList(List<ListItem> items) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "ordered-list";
        }

        @Override
        public boolean isBlockType() {
            return true;
        }
    }

    record UnorderedList(List<ListItem> items) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "unordered-list";
        }

        @Override
        public boolean isBlockType() {
            return true;
        }
    }

    record DefinitionList(List<DefinitionListItem> items) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "definition-list";
        }

        @Override
        public boolean isBlockType() {
            return true;
        }
    }

    record Redirect(String target) implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "redirect";
        }
    }

    record HorizontalDivider() implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "horizontal-divider";
        }
    }

    record ParagraphBreak() implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "paragraph-break";
        }
    }

    record Newline() implements WikitextSimplifiedNode {
        @Override
        public String nodeType() {
            return "newline";
        }
    }
}
