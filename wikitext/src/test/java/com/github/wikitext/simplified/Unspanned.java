package com.github.wikitext.simplified;

import java.util.List;

import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.OrderedList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.UnorderedList;

/**
 * Resets every span of a tree to 0-0, for comparisons that only care about structure.
 */
public final class Unspanned {
    private Unspanned() {}

    public static Spanned<WikitextSimplifiedNode> n(WikitextSimplifiedNode node) {
        return Spanned.of(node, 0, 0);
    }

    public static List<Spanned<WikitextSimplifiedNode>> nodes(WikitextSimplifiedNode... nodes) {
        return List.of(nodes).stream().map(Unspanned::n).toList();
    }

    public static List<Spanned<WikitextSimplifiedNode>> strip(List<Spanned<WikitextSimplifiedNode>> nodes) {
        if (nodes == null) {
            return null;
        }

        return nodes.stream().map(node -> n(strip(node.value()))).toList();
    }

    public static WikitextSimplifiedNode strip(WikitextSimplifiedNode node) {
        if (node.children() != null) {
            return NodeTraversal.withChildren(node, strip(node.children()));
        } else if (node instanceof TemplateParameterUse use) {
            return new TemplateParameterUse(use.name(), strip(use.defaultValue()));
        } else if (node instanceof Table table) {
            return new Table(strip(table.attributes()),
                table.captions().stream().map(c -> new TableCaption(strip(c.attributes()), strip(c.content()))).toList(),
                table.rows().stream().map(r -> new TableRow(strip(r.attributes()), r.cells().stream()
                    .map(c -> new TableCell(c.header(), strip(c.attributes()), strip(c.content())))
                    .toList())).toList());
        } else if (node instanceof OrderedList list) {
            return new OrderedList(list.items().stream().map(i -> new ListItem(strip(i.content()))).toList());
        } else if (node instanceof UnorderedList list) {
            return new UnorderedList(list.items().stream().map(i -> new ListItem(strip(i.content()))).toList());
        } else if (node instanceof DefinitionList list) {
            return new DefinitionList(list.items().stream().map(i -> new DefinitionListItem(i.type(), strip(i.content()))).toList());
        } else {
            return node;
        }
    }
}
