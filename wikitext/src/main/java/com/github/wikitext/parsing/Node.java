package com.github.wikitext.parsing;

import java.util.List;

/**
 * Grammar-level wikitext node as produced by a {@link Parser}. Offsets are indices into the
 * parsed source string, {@code start} inclusive and {@code end} exclusive.
 */
public interface Node {
    int start();

    int end();

    record Bold(int start, int end) implements Node {}

    record Italic(int start, int end) implements Node {}

    record BoldItalic(int start, int end) implements Node {}

    record StartTag(String name, int start, int end) implements Node {}

    record EndTag(String name, int start, int end) implements Node {}

    record Template(List<Node> name, List<TemplateArgument> parameters, int start, int end) implements Node {}

    record Parameter(List<Node> name, List<Node> defaultValue, int start, int end) implements Node {}

    record Link(String target, List<Node> text, int start, int end) implements Node {}

    record ExternalLink(List<Node> nodes, int start, int end) implements Node {}

    record Image(String target, List<Node> text, int start, int end) implements Node {}

    record Category(String target, String ordinal, int start, int end) implements Node {}

    record Text(String value, int start, int end) implements Node {}

    record CharacterEntity(String character, int start, int end) implements Node {}

    record Comment(int start, int end) implements Node {}

    record MagicWord(String name, int start, int end) implements Node {}

    record ParagraphBreak(int start, int end) implements Node {}

    record HorizontalDivider(int start, int end) implements Node {}

    record Redirect(String target, int start, int end) implements Node {}

    record Heading(int level, List<Node> nodes, int start, int end) implements Node {}

    record Preformatted(List<Node> nodes, int start, int end) implements Node {}

    record Tag(String name, List<Node> nodes, int start, int end) implements Node {}

    record Table(List<Node> attributes, List<TableCaption> captions, List<TableRow> rows, int start, int end) implements Node {}

    record OrderedList(List<ListItem> items, int start, int end) implements Node {}

    record UnorderedList(List<ListItem> items, int start, int end) implements Node {}

    record DefinitionList(List<DefinitionListItem> items, int start, int end) implements Node {}

    /**
     * Template argument; {@code name} is {@code null} for positional arguments.
     */
    record TemplateArgument(List<Node> name, List<Node> value, int start, int end) {}

    /**
     * Table caption; {@code attributes} is {@code null} when the caption has none.
     */
    record TableCaption(List<Node> attributes, List<Node> content, int start, int end) {}

    record TableRow(List<Node> attributes, List<TableCell> cells, int start, int end) {}

    /**
     * Table cell; {@code attributes} is {@code null} when the cell has none.
     */
    record TableCell(TableCellType type, List<Node> attributes, List<Node> content, int start, int end) {}

    enum TableCellType {
        ORDINARY,
        HEADING
    }

    record ListItem(List<Node> nodes, int start, int end) {}

    record DefinitionListItem(DefinitionListItemType type, List<Node> nodes, int start, int end) {}

    enum DefinitionListItemType {
        TERM,
        DETAILS
    }
}
