package com.github.wikitext.simplified;

import java.util.ArrayList;
import java.util.List;

import com.github.wikitext.simplified.WikitextSimplifiedNode.Blockquote;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Bold;
import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ExtLink;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Heading;
import com.github.wikitext.simplified.WikitextSimplifiedNode.HorizontalDivider;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Italic;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Link;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Newline;
import com.github.wikitext.simplified.WikitextSimplifiedNode.OrderedList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ParagraphBreak;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Preformatted;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Redirect;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Small;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Subscript;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Superscript;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Tag;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Template;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;
import com.github.wikitext.simplified.WikitextSimplifiedNode.UnorderedList;

/**
 * Turns simplified trees back into wikitext that parses into an equivalent tree.
 */
public final class WikitextSerializer {
    private WikitextSerializer() {}

    public static String toWikitext(WikitextSimplifiedNode node) {
        var sb = new StringBuilder();
        write(node, sb);
        return sb.toString();
    }

    public static String toWikitext(List<Spanned<WikitextSimplifiedNode>> nodes) {
        var sb = new StringBuilder();
        writeAll(nodes, sb);
        return sb.toString();
    }

    private static void writeAll(List<Spanned<WikitextSimplifiedNode>> nodes, StringBuilder sb) {
        for (var node : nodes) {
            // block constructs are only recognized at the start of a line
            if (node.value().isBlockType()) {
                sb.append('\n');
            }

            write(node.value(), sb);
        }
    }

    private static void write(WikitextSimplifiedNode node, StringBuilder sb) {
        if (node instanceof Fragment fragment) {
            writeAll(fragment.children(), sb);
        } else if (node instanceof Template template) {
            writeTemplate(template, sb);
        } else if (node instanceof TemplateParameterUse use) {
            sb.append("{{{").append(use.name());

            if (use.defaultValue() != null) {
                sb.append('|');
                writeAll(use.defaultValue(), sb);
            }

            sb.append("}}}");
        } else if (node instanceof Heading heading) {
            var equals = "=".repeat(heading.level());
            sb.append(equals).append(' ');
            writeAll(heading.children(), sb);
            sb.append(' ').append(equals);
        } else if (node instanceof Link link) {
            if (link.text().equals(link.title())) {
                sb.append("[[").append(link.title()).append("]]");
            } else {
                sb.append("[[").append(link.title()).append('|').append(link.text()).append("]]");
            }
        } else if (node instanceof ExtLink link) {
            sb.append('[').append(link.link());

            if (link.text() != null) {
                sb.append(' ').append(link.text());
            }

            sb.append(']');
        } else if (node instanceof Bold bold) {
            // an empty toggle pair would read back as a longer apostrophe run
            if (!bold.children().isEmpty()) {
                wrap("'''", bold.children(), "'''", sb);
            }
        } else if (node instanceof Italic italic) {
            if (!italic.children().isEmpty()) {
                wrap("''", italic.children(), "''", sb);
            }
        } else if (node instanceof Blockquote blockquote) {
            wrap("<blockquote>", blockquote.children(), "</blockquote>", sb);
        } else if (node instanceof Superscript superscript) {
            wrap("<sup>", superscript.children(), "</sup>", sb);
        } else if (node instanceof Subscript subscript) {
            wrap("<sub>", subscript.children(), "</sub>", sb);
        } else if (node instanceof Small small) {
            wrap("<small>", small.children(), "</small>", sb);
        } else if (node instanceof Preformatted preformatted) {
            wrap("<pre>", preformatted.children(), "</pre>", sb);
        } else if (node instanceof Tag tag) {
            var attributes = tag.attributes() == null || tag.attributes().isEmpty() ? "" : " " + tag.attributes();
            wrap("<" + tag.name() + attributes + ">", tag.children(), "</" + tag.name() + ">", sb);
        } else if (node instanceof Text text) {
            sb.append(text.text().replace("\u00a0", "&nbsp;"));
        } else if (node instanceof Table table) {
            writeTable(table, sb);
        } else if (node instanceof OrderedList || node instanceof UnorderedList || node instanceof DefinitionList) {
            writeList(node, "", sb);
        } else if (node instanceof Redirect redirect) {
            sb.append("#REDIRECT [[").append(redirect.target()).append("]]");
        } else if (node instanceof HorizontalDivider) {
            sb.append("----");
        } else if (node instanceof ParagraphBreak) {
            sb.append("<br/>");
        } else if (node instanceof Newline) {
            sb.append('\n');
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + node.nodeType());
        }
    }

    private static void wrap(String open, List<Spanned<WikitextSimplifiedNode>> children, String close, StringBuilder sb) {
        sb.append(open);
        writeAll(children, sb);
        sb.append(close);
    }

    private static void writeTemplate(Template template, StringBuilder sb) {
        sb.append("{{").append(template.name());
        var position = 1;

        for (var parameter : template.parameters()) {
            sb.append('|');

            // positional only while the numbering lines up and the value cannot be mistaken for a name
            if (position > 0 && parameter.name().equals(Integer.toString(position)) && !parameter.value().contains("=")) {
                sb.append(parameter.value());
                position++;
            } else {
                sb.append(parameter.name()).append('=').append(parameter.value());
                position = 0;
            }
        }

        sb.append("}}");
    }

    private static void writeTable(Table table, StringBuilder sb) {
        sb.append("{|");
        writeAll(table.attributes(), sb);
        sb.append('\n');

        for (var caption : table.captions()) {
            sb.append("|+");
            writeAttributes(caption.attributes(), sb);
            writeAll(caption.content(), sb);
            sb.append('\n');
        }

        for (var i = 0; i < table.rows().size(); i++) {
            var row = table.rows().get(i);

            if (i > 0 || !row.attributes().isEmpty()) {
                sb.append("|-");

                if (!row.attributes().isEmpty()) {
                    sb.append(' ');
                    writeAll(row.attributes(), sb);
                }

                sb.append('\n');
            }

            var contents = new ArrayList<String>();

            for (var j = 0; j < row.cells().size(); j++) {
                var cell = row.cells().get(j);
                var marker = cell.header() ? '!' : '|';

                if (j == 0) {
                    sb.append(marker);
                } else if (row.cells().get(j - 1).header() == cell.header() && contents.get(j - 1).indexOf('\n') == -1) {
                    sb.append(marker).append(marker);
                } else {
                    sb.append('\n').append(marker);
                }

                writeAttributes(cell.attributes(), sb);
                var content = toWikitext(cell.content());
                contents.add(content);
                sb.append(content);
            }

            sb.append('\n');
        }

        sb.append("|}\n");
    }

    private static void writeAttributes(List<Spanned<WikitextSimplifiedNode>> attributes, StringBuilder sb) {
        if (attributes != null && !attributes.isEmpty()) {
            writeAll(attributes, sb);
            sb.append('|');
        }
    }

    private static void writeList(WikitextSimplifiedNode list, String prefix, StringBuilder sb) {
        if (list instanceof OrderedList ordered) {
            ordered.items().forEach(item -> writeItem(prefix + "#", item.content(), sb));
        } else if (list instanceof UnorderedList unordered) {
            unordered.items().forEach(item -> writeItem(prefix + "*", item.content(), sb));
        } else if (list instanceof DefinitionList definitions) {
            definitions.items().forEach(item -> writeItem(prefix + item.type().getMarker(), item.content(), sb));
        }
    }

    private static void writeItem(String prefix, List<Spanned<WikitextSimplifiedNode>> content, StringBuilder sb) {
        sb.append(prefix);

        for (var child : content) {
            var value = child.value();

            // nested lists continue the marker prefix of their item
            if (value instanceof OrderedList || value instanceof UnorderedList || value instanceof DefinitionList) {
                endLine(sb);
                writeList(value, prefix, sb);
            } else {
                if (value.isBlockType()) {
                    sb.append('\n');
                }

                write(value, sb);
            }
        }

        endLine(sb);
    }

    private static void endLine(StringBuilder sb) {
        if (sb.length() == 0 || sb.charAt(sb.length() - 1) != '\n') {
            sb.append('\n');
        }
    }
}
