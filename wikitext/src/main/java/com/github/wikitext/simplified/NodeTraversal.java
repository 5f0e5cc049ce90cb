package com.github.wikitext.simplified;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

import com.github.wikitext.simplified.WikitextSimplifiedNode.Blockquote;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Bold;
import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Heading;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Italic;
import com.github.wikitext.simplified.WikitextSimplifiedNode.OrderedList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Preformatted;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Small;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Subscript;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Superscript;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Tag;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.UnorderedList;

/**
 * Deep traversal and rebuilding of simplified trees.
 */
public final class NodeTraversal {
    private NodeTraversal() {}

    public static void visit(WikitextSimplifiedNode node, Consumer<WikitextSimplifiedNode> visitor) {
        visitor.accept(node);

        if (node.children() != null) {
            visitAll(node.children(), visitor);
        } else if (node instanceof TemplateParameterUse use && use.defaultValue() != null) {
            visitAll(use.defaultValue(), visitor);
        } else if (node instanceof Table table) {
            visitAll(table.attributes(), visitor);

            for (var caption : table.captions()) {
                visitAll(caption.attributes(), visitor);
                visitAll(caption.content(), visitor);
            }

            for (var row : table.rows()) {
                visitAll(row.attributes(), visitor);

                for (var cell : row.cells()) {
                    visitAll(cell.attributes(), visitor);
                    visitAll(cell.content(), visitor);
                }
            }
        } else if (node instanceof OrderedList list) {
            list.items().forEach(item -> visitAll(item.content(), visitor));
        } else if (node instanceof UnorderedList list) {
            list.items().forEach(item -> visitAll(item.content(), visitor));
        } else if (node instanceof DefinitionList list) {
            list.items().forEach(item -> visitAll(item.content(), visitor));
        }
    }

    private static void visitAll(List<Spanned<WikitextSimplifiedNode>> nodes, Consumer<WikitextSimplifiedNode> visitor) {
        if (nodes != null) {
            nodes.forEach(child -> visit(child.value(), visitor));
        }
    }

    public static WikitextSimplifiedNode visitAndReplace(WikitextSimplifiedNode node, UnaryOperator<WikitextSimplifiedNode> visitor) {
        return visitor.apply(rebuild(node, child -> visitAndReplace(child, visitor)));
    }

    /**
     * Returns a copy of the node whose direct and structural descendants have been passed
     * through the given function. Leaves are returned as they are.
     */
    public static WikitextSimplifiedNode rebuild(WikitextSimplifiedNode node, UnaryOperator<WikitextSimplifiedNode> mapper) {
        if (node.children() != null) {
            return withChildren(node, mapAll(node.children(), mapper));
        } else if (node instanceof TemplateParameterUse use) {
            return new TemplateParameterUse(use.name(), mapAll(use.defaultValue(), mapper));
        } else if (node instanceof Table table) {
            var captions = table.captions().stream()
                .map(caption -> new TableCaption(mapAll(caption.attributes(), mapper), mapAll(caption.content(), mapper)))
                .toList();

            var rows = table.rows().stream()
                .map(row -> new TableRow(mapAll(row.attributes(), mapper), row.cells().stream()
                    .map(cell -> new TableCell(cell.header(), mapAll(cell.attributes(), mapper), mapAll(cell.content(), mapper)))
                    .toList()))
                .toList();

            return new Table(mapAll(table.attributes(), mapper), captions, rows);
        } else if (node instanceof OrderedList list) {
            return new OrderedList(list.items().stream().map(item -> new ListItem(mapAll(item.content(), mapper))).toList());
        } else if (node instanceof UnorderedList list) {
            return new UnorderedList(list.items().stream().map(item -> new ListItem(mapAll(item.content(), mapper))).toList());
        } else if (node instanceof DefinitionList list) {
            return new DefinitionList(list.items().stream()
                .map(item -> new DefinitionListItem(item.type(), mapAll(item.content(), mapper)))
                .toList());
        } else {
            return node;
        }
    }

    private static List<Spanned<WikitextSimplifiedNode>> mapAll(List<Spanned<WikitextSimplifiedNode>> nodes, UnaryOperator<WikitextSimplifiedNode> mapper) {
        if (nodes == null) {
            return null;
        }

        var mapped = new ArrayList<Spanned<WikitextSimplifiedNode>>(nodes.size());

        for (var child : nodes) {
            mapped.add(new Spanned<>(mapper.apply(child.value()), child.span()));
        }

        return mapped;
    }

    /**
     * Copies a container node with a new list of children.
     *
     * @throws IllegalArgumentException if the node does not hold children
     */
    public static WikitextSimplifiedNode withChildren(WikitextSimplifiedNode node, List<Spanned<WikitextSimplifiedNode>> children) {
        if (node instanceof Fragment) {
            return new Fragment(children);
        } else if (node instanceof Heading heading) {
            return new Heading(heading.level(), children);
        } else if (node instanceof Bold) {
            return new Bold(children);
        } else if (node instanceof Italic) {
            return new Italic(children);
        } else if (node instanceof Blockquote) {
            return new Blockquote(children);
        } else if (node instanceof Superscript) {
            return new Superscript(children);
        } else if (node instanceof Subscript) {
            return new Subscript(children);
        } else if (node instanceof Small) {
            return new Small(children);
        } else if (node instanceof Preformatted) {
            return new Preformatted(children);
        } else if (node instanceof Tag tag) {
            return new Tag(tag.name(), tag.attributes(), children);
        } else {
            throw new IllegalArgumentException("Node does not hold children: " + node.nodeType());
        }
    }
}
