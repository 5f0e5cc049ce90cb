package com.github.wikitext.simplified;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import com.github.wikitext.parsing.Node;
import com.github.wikitext.parsing.NodeMetadata;
import com.github.wikitext.parsing.Nodes;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Blockquote;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Bold;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ExtLink;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Heading;
import com.github.wikitext.simplified.WikitextSimplifiedNode.HorizontalDivider;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Italic;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Link;
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

/**
 * Rewrites a grammar tree into the simplified tree. Bold/italic toggles and start/end tags are
 * resolved with a stack of open layers; every other node is converted on its own.
 */
public final class Simplifier {
    // look like tags, but never open a layer
    private static final Set<String> FAKE_TAGS = Set.of("br/", "hr/", "br", "hr");

    private static final Set<String> IGNORED_TAGS = Set.of("ref", "references", "gallery", "nowiki");

    private static final Map<String, Supplier<WikitextSimplifiedNode>> CONTAINER_TAGS = Map.of(
        "blockquote", () -> new Blockquote(new ArrayList<>()),
        "sup", () -> new Superscript(new ArrayList<>()),
        "sub", () -> new Subscript(new ArrayList<>()),
        "small", () -> new Small(new ArrayList<>()),
        "pre", () -> new Preformatted(new ArrayList<>())
    );

    private Simplifier() {}

    public static List<Spanned<WikitextSimplifiedNode>> simplifyNodes(String wikitext, List<Node> nodes) {
        Objects.requireNonNull(wikitext);
        Objects.requireNonNull(nodes);

        // a lone unmatched tag is kept verbatim, e.g. an unclosed <font size="3">
        if (nodes.size() == 1 && (nodes.get(0) instanceof Node.StartTag || nodes.get(0) instanceof Node.EndTag)) {
            var node = nodes.get(0);
            return new ArrayList<>(List.of(Spanned.of(new Text(Nodes.wikitext(wikitext, nodes)), node.start(), node.end())));
        }

        var stack = new RootStack(wikitext);
        Integer textStartOverride = null;

        for (var node : nodes) {
            stack.setCurrentNode(node);

            if (node instanceof Node.Bold bold) {
                if (stack.lastLayer() instanceof Bold) {
                    stack.addToChildren(stack.popLayer(bold.end()));
                } else {
                    stack.pushLayer(new Bold(new ArrayList<>()), bold.start());
                }
            } else if (node instanceof Node.Italic italic) {
                if (stack.lastLayer() instanceof Italic) {
                    stack.addToChildren(stack.popLayer(italic.end()));
                } else {
                    stack.pushLayer(new Italic(new ArrayList<>()), italic.start());
                }
            } else if (node instanceof Node.BoldItalic boldItalic) {
                if (stack.lastLayer() instanceof Italic) {
                    var closedItalic = stack.popLayer(boldItalic.end());

                    if (!(stack.lastLayer() instanceof Bold)) {
                        throw new InvalidNodeStructureException(new NodeStructureError.MissingBoldLayer(),
                            ErrorContext.of(wikitext, boldItalic.start(), boldItalic.end()));
                    }

                    var closedBold = stack.popLayer(boldItalic.end());
                    closedBold.value().children().add(closedItalic);
                    stack.addToChildren(closedBold);
                } else {
                    stack.pushLayer(new Bold(new ArrayList<>()), boldItalic.start());
                    stack.pushLayer(new Italic(new ArrayList<>()), boldItalic.start());
                }
            } else if (node instanceof Node.StartTag tag && !FAKE_TAGS.contains(tag.name())) {
                var container = CONTAINER_TAGS.get(tag.name());

                if (container != null) {
                    stack.pushLayer(container.get(), tag.start());
                } else {
                    var attributes = extractTagAttributes(openingTag(wikitext, tag.start(), tag.end()));
                    stack.pushLayer(new Tag(tag.name(), attributes, new ArrayList<>()), tag.start());
                }
            } else if (node instanceof Node.EndTag tag && !FAKE_TAGS.contains(tag.name())) {
                stack.closeTag(tag);
            } else {
                var simplified = simplifyNode(wikitext, node, textStartOverride);
                textStartOverride = null;

                if (simplified.isPresent()) {
                    // link trail letters may overlap with the text that follows the link
                    if (simplified.get().value() instanceof Link) {
                        textStartOverride = simplified.get().span().end();
                    }

                    stack.addToChildren(simplified.get());
                }

                continue;
            }

            textStartOverride = null;
        }

        return stack.unwind();
    }

    public static Optional<Spanned<WikitextSimplifiedNode>> simplifyNode(String wikitext, Node node) {
        return simplifyNode(Objects.requireNonNull(wikitext), Objects.requireNonNull(node), null);
    }

    private static Optional<Spanned<WikitextSimplifiedNode>> simplifyNode(String wikitext, Node node, Integer textStartOverride) {
        if (node instanceof Node.Template template) {
            return spanned(simplifyTemplate(wikitext, template), node);
        } else if (node instanceof Node.Heading heading) {
            return spanned(new Heading(heading.level(), simplifyNodes(wikitext, heading.nodes())), node);
        } else if (node instanceof Node.Link link) {
            return spanned(new Link(Nodes.wikitext(wikitext, link.text()), link.target()), node);
        } else if (node instanceof Node.ExternalLink link) {
            var inner = Nodes.wikitext(wikitext, link.nodes());
            var space = inner.indexOf(' ');

            if (space == -1) {
                return spanned(new ExtLink(inner, null), node);
            }

            return spanned(new ExtLink(inner.substring(0, space), inner.substring(space + 1)), node);
        } else if (node instanceof Node.Text text) {
            var textStart = textStartOverride != null ? Math.max(textStartOverride, text.start()) : text.start();
            var offset = Math.min(textStart - text.start(), text.value().length());
            var value = text.value().substring(offset);

            if (value.isEmpty()) {
                return Optional.empty();
            }

            return Optional.of(Spanned.of(new Text(value), textStart, text.end()));
        } else if (node instanceof Node.CharacterEntity entity) {
            return spanned(new Text(entity.character()), node);
        } else if (node instanceof Node.ParagraphBreak) {
            return spanned(new ParagraphBreak(), node);
        } else if (node instanceof Node.Table table) {
            return spanned(simplifyTable(wikitext, table), node);
        } else if (node instanceof Node.OrderedList list) {
            var items = list.items().stream()
                .map(item -> new ListItem(simplifyNodes(wikitext, item.nodes())))
                .toList();

            return spanned(new WikitextSimplifiedNode.OrderedList(items), node);
        } else if (node instanceof Node.UnorderedList list) {
            var items = list.items().stream()
                .map(item -> new ListItem(simplifyNodes(wikitext, item.nodes())))
                .toList();

            return spanned(new WikitextSimplifiedNode.UnorderedList(items), node);
        } else if (node instanceof Node.DefinitionList list) {
            var items = list.items().stream()
                .map(item -> new DefinitionListItem(
                    item.type() == Node.DefinitionListItemType.TERM ? DefinitionListItemType.TERM : DefinitionListItemType.DETAILS,
                    simplifyNodes(wikitext, item.nodes())))
                .toList();

            return spanned(new WikitextSimplifiedNode.DefinitionList(items), node);
        } else if (node instanceof Node.Tag tag) {
            if (IGNORED_TAGS.contains(tag.name())) {
                return Optional.empty();
            }

            var attributes = extractTagAttributes(openingTag(wikitext, tag.start(), tag.end()));
            return spanned(new Tag(tag.name(), attributes, simplifyNodes(wikitext, tag.nodes())), node);
        } else if (node instanceof Node.Preformatted preformatted) {
            return spanned(new Preformatted(simplifyNodes(wikitext, preformatted.nodes())), node);
        } else if (node instanceof Node.Parameter parameter) {
            var defaultValue = parameter.defaultValue() != null ? simplifyNodes(wikitext, parameter.defaultValue()) : null;
            return spanned(new TemplateParameterUse(Nodes.innerText(parameter.name()), defaultValue), node);
        } else if (node instanceof Node.Redirect redirect) {
            return spanned(new Redirect(redirect.target()), node);
        } else if (node instanceof Node.HorizontalDivider) {
            return spanned(new HorizontalDivider(), node);
        } else if (node instanceof Node.StartTag tag && (tag.name().equals("hr") || tag.name().equals("hr/"))) {
            return spanned(new HorizontalDivider(), node);
        } else if (node instanceof Node.StartTag tag && (tag.name().equals("br") || tag.name().equals("br/"))) {
            return spanned(new ParagraphBreak(), node);
        } else if (node instanceof Node.Bold || node instanceof Node.Italic || node instanceof Node.BoldItalic
                || node instanceof Node.MagicWord || node instanceof Node.Category || node instanceof Node.Comment
                || node instanceof Node.Image) {
            return Optional.empty();
        }

        var metadata = NodeMetadata.of(node);
        var type = metadata.type() == NodeMetadata.Type.UNKNOWN ? node.getClass().getSimpleName() : metadata.type().toString();
        throw new UnknownNodeException(type, ErrorContext.of(wikitext, metadata.start(), metadata.end()));
    }

    private static Optional<Spanned<WikitextSimplifiedNode>> spanned(WikitextSimplifiedNode value, Node node) {
        return Optional.of(Spanned.of(value, node.start(), node.end()));
    }

    private static Template simplifyTemplate(String wikitext, Node.Template template) {
        var parameters = new ArrayList<TemplateParameter>();
        var unnamedIndex = 1;

        for (var argument : template.parameters()) {
            String name;

            if (argument.name() != null) {
                name = Nodes.innerText(argument.name());
            } else {
                name = Integer.toString(unnamedIndex++);
            }

            var value = argument.value();
            var valueStart = value.isEmpty() ? 0 : value.get(0).start();
            var valueEnd = value.isEmpty() ? 0 : value.get(value.size() - 1).end();
            parameters.add(new TemplateParameter(name, wikitext.substring(valueStart, valueEnd)));
        }

        return new Template(Nodes.innerText(template.name()), parameters);
    }

    private static Table simplifyTable(String wikitext, Node.Table table) {
        var captions = new ArrayList<TableCaption>();

        for (var caption : table.captions()) {
            var attributes = caption.attributes() != null ? simplifyNodes(wikitext, caption.attributes()) : null;
            captions.add(new TableCaption(attributes, simplifyNodes(wikitext, caption.content())));
        }

        var rows = new ArrayList<TableRow>();

        for (var row : table.rows()) {
            var cells = new ArrayList<TableCell>();

            for (var cell : row.cells()) {
                var attributes = cell.attributes() != null ? simplifyNodes(wikitext, cell.attributes()) : null;
                cells.add(new TableCell(cell.type() == Node.TableCellType.HEADING, attributes, simplifyNodes(wikitext, cell.content())));
            }

            rows.add(new TableRow(simplifyNodes(wikitext, row.attributes()), cells));
        }

        return new Table(simplifyNodes(wikitext, table.attributes()), captions, rows);
    }

    private static String openingTag(String wikitext, int start, int end) {
        var content = wikitext.substring(start, end);
        var bracket = content.indexOf('>');
        return bracket == -1 ? content : content.substring(0, bracket);
    }

    /**
     * Returns the attribute text of an opening tag (without its closing bracket), or {@code null}
     * if it carries none.
     */
    static String extractTagAttributes(String openingTag) {
        var index = 0;

        while (index < openingTag.length() && !Character.isWhitespace(openingTag.charAt(index))) {
            index++;
        }

        if (index == openingTag.length()) {
            return null;
        }

        var attributes = openingTag.substring(index).strip();

        if (attributes.endsWith("/")) {
            attributes = attributes.substring(0, attributes.length() - 1).strip();
        }

        if (attributes.isEmpty()) {
            return null;
        }

        // an attribute value cut off at a stray '>' gets its closing quote back
        if (attributes.startsWith("\"") && !attributes.endsWith("\"")) {
            return attributes + "\"";
        }

        return attributes;
    }

    private static final class RootStack {
        private record Layer(WikitextSimplifiedNode node, int start) {}

        private final Deque<Layer> stack = new ArrayDeque<>();
        private final String wikitext;
        private Node currentNode;

        RootStack(String wikitext) {
            this.wikitext = wikitext;
            stack.push(new Layer(new Fragment(new ArrayList<>()), 0));
        }

        void setCurrentNode(Node node) {
            currentNode = node;
        }

        void pushLayer(WikitextSimplifiedNode node, int start) {
            stack.push(new Layer(node, start));
        }

        Spanned<WikitextSimplifiedNode> popLayer(int end) {
            if (stack.isEmpty()) {
                throw new InvalidNodeStructureException(new NodeStructureError.StackUnderflow(), currentContext());
            }

            var layer = stack.pop();
            return Spanned.of(layer.node(), layer.start(), Math.max(layer.start(), end));
        }

        WikitextSimplifiedNode lastLayer() {
            return stack.peek().node();
        }

        void addToChildren(Spanned<WikitextSimplifiedNode> node) {
            if (stack.isEmpty()) {
                throw new InvalidNodeStructureException(new NodeStructureError.StackUnderflow(), currentContext());
            }

            var parent = stack.peek().node();

            if (parent.children() == null) {
                throw new InvalidNodeStructureException(new NodeStructureError.NoChildren(parent.nodeType()), currentContext());
            }

            parent.children().add(node);
        }

        void closeTag(Node.EndTag tag) {
            if (stack.size() == 1) {
                throw mismatch(tag, lastLayer().nodeType());
            }

            var actual = tagName(lastLayer());

            if (!tag.name().equals(actual)) {
                throw mismatch(tag, actual != null ? actual : lastLayer().nodeType());
            }

            addToChildren(popLayer(tag.end()));
        }

        private InvalidNodeStructureException mismatch(Node.EndTag tag, String actual) {
            return new InvalidNodeStructureException(new NodeStructureError.TagClosureMismatch(tag.name(), actual),
                ErrorContext.of(wikitext, tag.start(), tag.end()));
        }

        private static String tagName(WikitextSimplifiedNode node) {
            if (node instanceof Tag tag) {
                return tag.name();
            }

            if (node instanceof Blockquote) {
                return "blockquote";
            } else if (node instanceof Superscript) {
                return "sup";
            } else if (node instanceof Subscript) {
                return "sub";
            } else if (node instanceof Small) {
                return "small";
            } else if (node instanceof Preformatted) {
                return "pre";
            } else {
                return null;
            }
        }

        List<Spanned<WikitextSimplifiedNode>> unwind() {
            // unclosed layers run until the end of the text
            while (stack.size() > 1) {
                addToChildren(popLayer(wikitext.length()));
            }

            return stack.peek().node().children();
        }

        private ErrorContext currentContext() {
            if (currentNode == null) {
                return new ErrorContext("No current node", 0, 0);
            }

            return ErrorContext.of(wikitext, currentNode.start(), currentNode.end());
        }
    }
}
