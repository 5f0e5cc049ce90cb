package com.github.wikitext.simplified;

import java.util.List;
import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ExtLink;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Heading;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Link;
import com.github.wikitext.simplified.WikitextSimplifiedNode.OrderedList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Redirect;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Tag;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Template;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;
import com.github.wikitext.simplified.WikitextSimplifiedNode.UnorderedList;

/**
 * JSON rendering of simplified trees. Node objects carry a kebab-case {@code type} discriminant;
 * with spans enabled, list entries are wrapped as {@code {"value": ..., "span": {...}}}.
 * <p>
 * Spans are {@code char} (UTF-16) offsets by default, which differ from UTF-8 byte offsets after
 * the first non-ASCII character. Use {@link #withByteSpans(String)} when the consumer indexes
 * the UTF-8 encoded source.
 */
public final class WikitextJson {
    private final boolean spans;
    private final int[] byteOffsets;

    private WikitextJson(boolean spans, int[] byteOffsets) {
        this.spans = spans;
        this.byteOffsets = byteOffsets;
    }

    public static WikitextJson withSpans() {
        return new WikitextJson(true, null);
    }

    public static WikitextJson withoutSpans() {
        return new WikitextJson(false, null);
    }

    /**
     * Spans translated to UTF-8 byte offsets into {@code source}, which must be the text the
     * rendered nodes were parsed from.
     */
    public static WikitextJson withByteSpans(String source) {
        Objects.requireNonNull(source);
        var offsets = new int[source.length() + 1];

        for (var i = 0; i < source.length(); i++) {
            offsets[i + 1] = offsets[i] + utf8Length(source.charAt(i));
        }

        return new WikitextJson(true, offsets);
    }

    private static int utf8Length(char c) {
        if (c < 0x80) {
            return 1;
        } else if (c < 0x800) {
            return 2;
        } else if (Character.isHighSurrogate(c)) {
            return 4;
        } else if (Character.isLowSurrogate(c)) {
            // counted with its high surrogate
            return 0;
        } else {
            return 3;
        }
    }

    public JSONArray toJson(List<Spanned<WikitextSimplifiedNode>> nodes) {
        var array = new JSONArray();

        for (var node : nodes) {
            array.put(entry(node));
        }

        return array;
    }

    public JSONObject toJson(WikitextSimplifiedNode node) {
        var json = new JSONObject();
        json.put("type", node.nodeType());

        if (node.children() != null) {
            json.put("children", toJson(node.children()));
        }

        if (node instanceof Template template) {
            var parameters = new JSONArray();

            for (var parameter : template.parameters()) {
                parameters.put(new JSONObject().put("name", parameter.name()).put("value", parameter.value()));
            }

            json.put("name", template.name());
            json.put("parameters", parameters);
        } else if (node instanceof TemplateParameterUse use) {
            json.put("name", use.name());
            json.put("default", nullable(use.defaultValue()));
        } else if (node instanceof Heading heading) {
            json.put("level", heading.level());
        } else if (node instanceof Link link) {
            json.put("text", link.text());
            json.put("title", link.title());
        } else if (node instanceof ExtLink link) {
            json.put("link", link.link());
            json.put("text", link.text() != null ? link.text() : JSONObject.NULL);
        } else if (node instanceof Tag tag) {
            json.put("name", tag.name());
            json.put("attributes", tag.attributes() != null ? tag.attributes() : JSONObject.NULL);
        } else if (node instanceof Text text) {
            json.put("text", text.text());
        } else if (node instanceof Table table) {
            var captions = new JSONArray();
            var rows = new JSONArray();

            for (var caption : table.captions()) {
                captions.put(new JSONObject()
                    .put("attributes", nullable(caption.attributes()))
                    .put("content", toJson(caption.content())));
            }

            for (var row : table.rows()) {
                var cells = new JSONArray();

                for (var cell : row.cells()) {
                    cells.put(new JSONObject()
                        .put("is_header", cell.header())
                        .put("attributes", nullable(cell.attributes()))
                        .put("content", toJson(cell.content())));
                }

                rows.put(new JSONObject().put("attributes", toJson(row.attributes())).put("cells", cells));
            }

            json.put("attributes", toJson(table.attributes()));
            json.put("captions", captions);
            json.put("rows", rows);
        } else if (node instanceof OrderedList list) {
            json.put("items", items(list.items()));
        } else if (node instanceof UnorderedList list) {
            json.put("items", items(list.items()));
        } else if (node instanceof DefinitionList list) {
            var items = new JSONArray();

            for (var item : list.items()) {
                items.put(new JSONObject().put("type_", item.type().toString()).put("content", toJson(item.content())));
            }

            json.put("items", items);
        } else if (node instanceof Redirect redirect) {
            json.put("target", redirect.target());
        }

        return json;
    }

    private Object entry(Spanned<WikitextSimplifiedNode> node) {
        if (!spans) {
            return toJson(node.value());
        }

        var span = new JSONObject()
            .put("start", offset(node.span().start()))
            .put("end", offset(node.span().end()));

        return new JSONObject().put("value", toJson(node.value())).put("span", span);
    }

    private int offset(int index) {
        if (byteOffsets == null) {
            return index;
        }

        if (index >= byteOffsets.length) {
            throw new IllegalArgumentException(String.format("Span offset %d is outside the source (length %d)", index, byteOffsets.length - 1));
        }

        return byteOffsets[index];
    }

    private Object nullable(List<Spanned<WikitextSimplifiedNode>> nodes) {
        return nodes != null ? toJson(nodes) : JSONObject.NULL;
    }

    private JSONArray items(List<ListItem> items) {
        var array = new JSONArray();
        items.forEach(item -> array.put(new JSONObject().put("content", toJson(item.content()))));
        return array;
    }
}
