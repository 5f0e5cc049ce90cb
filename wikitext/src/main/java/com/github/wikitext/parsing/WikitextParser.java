package com.github.wikitext.parsing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.text.StringEscapeUtils;

/**
 * Recursive-descent wikitext tokenizer. Block constructs (headings, lists, tables, dividers,
 * preformatted lines, paragraph breaks) are recognized at line starts, everything else inline.
 * Constructs that fail to close fall back to plain text.
 */
public class WikitextParser implements Parser {
    public static final int DEFAULT_MAX_NESTING = 256;

    private static final Set<String> HTML_TAGS = Set.of(
        "abbr", "b", "bdi", "bdo", "big", "blockquote", "br", "caption", "center", "cite", "code",
        "data", "dd", "del", "dfn", "div", "dl", "dt", "em", "font", "h1", "h2", "h3", "h4", "h5",
        "h6", "hr", "i", "ins", "kbd", "li", "mark", "ol", "p", "q", "rb", "rp", "rt", "rtc", "ruby",
        "s", "samp", "small", "span", "strike", "strong", "sub", "sup", "table", "td", "th", "time",
        "tr", "tt", "u", "ul", "var", "wbr"
    );

    // extension tags whose content is wikitext; the rest keep their content verbatim
    private static final Set<String> PARSED_EXTENSION_TAGS = Set.of("ref", "references", "poem", "indicator");

    private static final Pattern P_TAG = Pattern.compile("<(/?)([a-zA-Z][a-zA-Z0-9]*)((?:\\s[^<>]*?)?)\\s*(/?)>");
    private static final Pattern P_ENTITY = Pattern.compile("&(?:[a-zA-Z][a-zA-Z0-9]*|#[0-9]{1,7}|#[xX][0-9a-fA-F]{1,6});");
    private static final Pattern P_MAGIC_WORD = Pattern.compile("__([A-Za-z_]+?)__");

    private final Configuration configuration;
    private final int maxNesting;
    private final Pattern redirectPattern;

    public WikitextParser(Configuration configuration) {
        this(configuration, DEFAULT_MAX_NESTING);
    }

    public WikitextParser(Configuration configuration, int maxNesting) {
        this.configuration = Objects.requireNonNull(configuration);

        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be positive: " + maxNesting);
        }

        this.maxNesting = maxNesting;

        if (configuration.getRedirectMagicWords().isEmpty()) {
            redirectPattern = null;
        } else {
            var words = configuration.getRedirectMagicWords().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));

            redirectPattern = Pattern.compile("#(?:" + words + ")\\s*:?\\s*\\[\\[([^\\[\\]|\\n]+)(?:\\|[^\\]\\n]*)?\\]\\]",
                Pattern.CASE_INSENSITIVE);
        }
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    @Override
    public Output parse(String wikitext) {
        Objects.requireNonNull(wikitext);
        return new Output(new Session(wikitext).parseDocument());
    }

    private enum Terminator {
        NONE,
        TEMPLATE_NAME("|", "}}"),
        ARGUMENT_NAME("|", "}}", "="),
        ARGUMENT_VALUE("|", "}}"),
        PARAMETER_NAME("|", "}}}"),
        PARAMETER_DEFAULT("}}}"),
        LINK_TEXT("]]"),
        EXTERNAL_LINK("]", "\n");

        private final String[] tokens;

        Terminator(String... tokens) {
            this.tokens = tokens;
        }

        boolean matches(String text, int pos) {
            for (var token : tokens) {
                if (text.startsWith(token, pos)) {
                    return true;
                }
            }

            return false;
        }
    }

    private enum MarkerKind {
        CAPTION,
        ROW,
        CELL,
        HEADER_CELL
    }

    private record Parsed(Node node, int next) {}

    private record Block(List<Node> nodes, int next) {}

    private record NewlineRun(int next, boolean paragraph) {}

    private record HeadingLine(int level, int contentStart, int contentEnd, int end, int lineEnd) {}

    private record ListLine(String prefix, int start, int contentStart, int end) {}

    private record TableMarker(MarkerKind kind, int lineStart, int contentStart) {}

    private static final class ItemBuilder {
        final char marker;
        final List<Node> nodes;
        final int start;
        int end;

        ItemBuilder(char marker, List<Node> nodes, int start, int end) {
            this.marker = marker;
            this.nodes = nodes;
            this.start = start;
            this.end = end;
        }
    }

    private static final class RowBuilder {
        final List<Node> attributes;
        final List<Node.TableCell> cells = new ArrayList<>();
        final int start;

        RowBuilder(List<Node> attributes, int start) {
            this.attributes = attributes;
            this.start = start;
        }

        Node.TableRow build() {
            return new Node.TableRow(attributes, cells, start, cells.get(cells.size() - 1).end());
        }
    }

    private final class Session {
        private final String text;
        private int depth;

        Session(String text) {
            this.text = text;
        }

        List<Node> parseDocument() {
            var nodes = new ArrayList<Node>();
            var start = 0;

            if (redirectPattern != null) {
                var m = redirectPattern.matcher(text);

                if (m.lookingAt()) {
                    nodes.add(new Node.Redirect(m.group(1).strip(), 0, m.end()));
                    start = m.end();
                }
            }

            nodes.addAll(parseBlocks(start, text.length()));
            return nodes;
        }

        private void enter(int position) {
            if (++depth > maxNesting) {
                throw new ParsingException("Constructs nested deeper than " + maxNesting + " levels", position);
            }
        }

        private void leave() {
            depth--;
        }

        private List<Node> parseBlocks(int from, int to) {
            var nodes = new ArrayList<Node>();
            var pos = from;

            while (pos < to) {
                if (Utils.isLineStart(text, pos)) {
                    var block = parseBlock(pos, to);

                    if (block != null) {
                        nodes.addAll(block.nodes());
                        pos = block.next();
                        continue;
                    }
                }

                pos = parseInline(pos, to, Terminator.NONE, true, nodes);
            }

            return nodes;
        }

        private Block parseBlock(int pos, int to) {
            var ch = text.charAt(pos);

            if (ch == '=') {
                var heading = headingLine(pos, to);
                return heading != null ? parseHeading(pos, heading) : null;
            } else if (isListMarker(ch)) {
                return parseList(pos, to);
            } else if (text.startsWith("{|", pos)) {
                return parseTable(pos, to);
            } else if (text.startsWith("----", pos)) {
                var end = pos + 4;

                while (end < to && text.charAt(end) == '-') {
                    end++;
                }

                return new Block(List.of(new Node.HorizontalDivider(pos, end)), end);
            } else if (ch == ' ' && !isBlankLine(pos, to)) {
                return parsePreformatted(pos, to);
            } else {
                return null;
            }
        }

        private boolean startsSkippableBlock(int pos, int to) {
            var ch = text.charAt(pos);
            return isListMarker(ch) || text.startsWith("{|", pos) || (ch == '=' && headingLine(pos, to) != null);
        }

        private boolean startsLineConstruct(int pos, int to) {
            return text.startsWith("----", pos) || (text.charAt(pos) == ' ' && !isBlankLine(pos, to));
        }

        private boolean isBlankLine(int pos, int to) {
            var end = Utils.lineEnd(text, pos, to);

            for (var i = pos; i < end; i++) {
                if (!Character.isWhitespace(text.charAt(i))) {
                    return false;
                }
            }

            return true;
        }

        private HeadingLine headingLine(int pos, int to) {
            var lineEnd = Utils.lineEnd(text, pos, to);
            var end = lineEnd;

            while (end > pos && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                end--;
            }

            var lead = 0;

            while (pos + lead < end && text.charAt(pos + lead) == '=') {
                lead++;
            }

            var trail = 0;

            while (end - trail - 1 >= pos + lead && text.charAt(end - trail - 1) == '=') {
                trail++;
            }

            if (trail == 0) {
                return null;
            }

            var level = Math.min(Math.min(lead, trail), 6);
            var contentStart = pos + level;
            var contentEnd = end - level;

            while (contentStart < contentEnd && Character.isWhitespace(text.charAt(contentStart))) {
                contentStart++;
            }

            while (contentEnd > contentStart && Character.isWhitespace(text.charAt(contentEnd - 1))) {
                contentEnd--;
            }

            if (contentStart >= contentEnd) {
                return null;
            }

            return new HeadingLine(level, contentStart, contentEnd, end, lineEnd);
        }

        private Block parseHeading(int pos, HeadingLine heading) {
            enter(pos);

            try {
                var nodes = new ArrayList<Node>();
                parseInline(heading.contentStart(), heading.contentEnd(), Terminator.NONE, false, nodes);
                return new Block(List.of(new Node.Heading(heading.level(), nodes, pos, heading.end())), heading.lineEnd());
            } finally {
                leave();
            }
        }

        private Block parsePreformatted(int pos, int to) {
            var end = pos;
            var p = pos;

            while (p < to && Utils.isLineStart(text, p) && text.charAt(p) == ' ' && !isBlankLine(p, to)) {
                end = Utils.lineEnd(text, p, to);
                p = end + 1;
            }

            enter(pos);

            try {
                var nodes = new ArrayList<Node>();
                parseInline(pos + 1, end, Terminator.NONE, false, nodes);
                return new Block(List.of(new Node.Preformatted(nodes, pos, end)), end);
            } finally {
                leave();
            }
        }

        private boolean isListMarker(char ch) {
            return ch == '*' || ch == '#' || ch == ';' || ch == ':';
        }

        private char listKind(char marker) {
            return marker == ':' ? ';' : marker;
        }

        private Block parseList(int pos, int to) {
            var lines = new ArrayList<ListLine>();
            var p = pos;

            while (p < to && isListMarker(text.charAt(p))) {
                var lineEnd = Utils.lineEnd(text, p, to);
                var q = p;

                while (q < lineEnd && isListMarker(text.charAt(q))) {
                    q++;
                }

                lines.add(new ListLine(text.substring(p, q), p, q, lineEnd));
                p = lineEnd < to ? lineEnd + 1 : lineEnd;
            }

            return new Block(buildLists(lines, 0), p);
        }

        private List<Node> buildLists(List<ListLine> lines, int level) {
            enter(lines.get(0).start());

            try {
                var lists = new ArrayList<Node>();
                var i = 0;

                while (i < lines.size()) {
                    var kind = listKind(lines.get(i).prefix().charAt(level));
                    var items = new ArrayList<ItemBuilder>();
                    var j = i;

                    while (j < lines.size() && lines.get(j).prefix().length() > level
                            && listKind(lines.get(j).prefix().charAt(level)) == kind) {
                        var line = lines.get(j);

                        if (line.prefix().length() == level + 1) {
                            var nodes = new ArrayList<Node>();
                            var contentStart = line.contentStart();

                            while (contentStart < line.end() && Character.isWhitespace(text.charAt(contentStart))) {
                                contentStart++;
                            }

                            parseInline(contentStart, line.end(), Terminator.NONE, false, nodes);
                            items.add(new ItemBuilder(line.prefix().charAt(level), nodes, line.start(), line.end()));
                            j++;
                        } else {
                            var k = j;

                            while (k < lines.size() && lines.get(k).prefix().length() > level + 1
                                    && listKind(lines.get(k).prefix().charAt(level)) == kind) {
                                k++;
                            }

                            if (items.isEmpty()) {
                                items.add(new ItemBuilder(line.prefix().charAt(level), new ArrayList<>(), line.start(), line.start()));
                            }

                            var item = items.get(items.size() - 1);
                            item.nodes.addAll(buildLists(lines.subList(j, k), level + 1));
                            item.end = lines.get(k - 1).end();
                            j = k;
                        }
                    }

                    lists.add(makeList(kind, items, lines.get(i).start(), lines.get(j - 1).end()));
                    i = j;
                }

                return lists;
            } finally {
                leave();
            }
        }

        private Node makeList(char kind, List<ItemBuilder> items, int start, int end) {
            if (kind == ';') {
                var entries = items.stream()
                    .map(item -> new Node.DefinitionListItem(
                        item.marker == ';' ? Node.DefinitionListItemType.TERM : Node.DefinitionListItemType.DETAILS,
                        item.nodes, item.start, item.end))
                    .toList();

                return new Node.DefinitionList(entries, start, end);
            }

            var entries = items.stream()
                .map(item -> new Node.ListItem(item.nodes, item.start, item.end))
                .toList();

            return kind == '#' ? new Node.OrderedList(entries, start, end) : new Node.UnorderedList(entries, start, end);
        }

        private Block parseTable(int pos, int to) {
            enter(pos);

            try {
                var firstLineEnd = Utils.lineEnd(text, pos, to);
                var attributes = parseInlineTrimmed(pos + 2, firstLineEnd);
                var markers = new ArrayList<TableMarker>();
                var tableEnd = to;
                var closeEnd = to;
                var nested = 0;
                var braces = 0;
                var links = 0;
                var i = firstLineEnd;

                scan:
                while (i < to) {
                    if (text.charAt(i) == '\n') {
                        var lineStart = i + 1;
                        i++;

                        if (braces != 0 || links != 0 || lineStart >= to) {
                            continue;
                        }

                        var q = lineStart;

                        while (q < to && (text.charAt(q) == ' ' || text.charAt(q) == '\t')) {
                            q++;
                        }

                        if (text.startsWith("{|", q)) {
                            nested++;
                        } else if (text.startsWith("|}", q)) {
                            if (nested == 0) {
                                tableEnd = lineStart;
                                closeEnd = q + 2;
                                break scan;
                            }

                            nested--;
                        } else if (nested == 0 && q < to) {
                            if (text.startsWith("|+", q)) {
                                markers.add(new TableMarker(MarkerKind.CAPTION, lineStart, q + 2));
                            } else if (text.startsWith("|-", q)) {
                                var r = q + 1;

                                while (r < to && text.charAt(r) == '-') {
                                    r++;
                                }

                                markers.add(new TableMarker(MarkerKind.ROW, lineStart, r));
                            } else if (text.charAt(q) == '|') {
                                markers.add(new TableMarker(MarkerKind.CELL, lineStart, q + 1));
                            } else if (text.charAt(q) == '!') {
                                markers.add(new TableMarker(MarkerKind.HEADER_CELL, lineStart, q + 1));
                            }
                        }
                    } else if (text.startsWith("<!--", i)) {
                        var close = text.indexOf("-->", i + 4);
                        i = close == -1 || close + 3 > to ? to : close + 3;
                    } else if (text.startsWith("{{", i)) {
                        braces++;
                        i += 2;
                    } else if (braces > 0 && text.startsWith("}}", i)) {
                        braces--;
                        i += 2;
                    } else if (text.startsWith("[[", i)) {
                        links++;
                        i += 2;
                    } else if (links > 0 && text.startsWith("]]", i)) {
                        links--;
                        i += 2;
                    } else {
                        i++;
                    }
                }

                var captions = new ArrayList<Node.TableCaption>();
                var rows = new ArrayList<Node.TableRow>();
                RowBuilder row = null;

                for (var k = 0; k < markers.size(); k++) {
                    var marker = markers.get(k);
                    int segmentEnd;

                    if (k + 1 < markers.size()) {
                        segmentEnd = markers.get(k + 1).lineStart() - 1;
                    } else {
                        segmentEnd = tableEnd < to ? tableEnd - 1 : to;
                    }

                    segmentEnd = Math.max(segmentEnd, marker.contentStart());

                    switch (marker.kind()) {
                        case CAPTION -> {
                            var split = splitAttributes(marker.contentStart(), segmentEnd);
                            captions.add(new Node.TableCaption(split.get(0), split.get(1), marker.lineStart(), segmentEnd));
                        }
                        case ROW -> {
                            if (row != null && !row.cells.isEmpty()) {
                                rows.add(row.build());
                            }

                            var rowLineEnd = Utils.lineEnd(text, marker.contentStart(), segmentEnd);
                            row = new RowBuilder(parseInlineTrimmed(marker.contentStart(), rowLineEnd), marker.lineStart());
                        }
                        case CELL, HEADER_CELL -> {
                            if (row == null) {
                                row = new RowBuilder(new ArrayList<>(), marker.lineStart());
                            }

                            row.cells.addAll(parseCells(marker, segmentEnd));
                        }
                    }
                }

                if (row != null && !row.cells.isEmpty()) {
                    rows.add(row.build());
                }

                var next = closeEnd < to && text.charAt(closeEnd) == '\n' ? closeEnd + 1 : closeEnd;
                return new Block(List.of(new Node.Table(attributes, captions, rows, pos, closeEnd)), next);
            } finally {
                leave();
            }
        }

        private List<Node.TableCell> parseCells(TableMarker marker, int segmentEnd) {
            var header = marker.kind() == MarkerKind.HEADER_CELL;
            var type = header ? Node.TableCellType.HEADING : Node.TableCellType.ORDINARY;
            var firstLineEnd = topLevelLineEnd(marker.contentStart(), segmentEnd);
            var cells = new ArrayList<Node.TableCell>();
            var cellStart = marker.lineStart();
            var contentStart = marker.contentStart();
            var braces = 0;
            var links = 0;
            var i = marker.contentStart();

            while (i < firstLineEnd) {
                if (text.startsWith("{{", i)) {
                    braces++;
                    i += 2;
                } else if (braces > 0 && text.startsWith("}}", i)) {
                    braces--;
                    i += 2;
                } else if (text.startsWith("[[", i)) {
                    links++;
                    i += 2;
                } else if (links > 0 && text.startsWith("]]", i)) {
                    links--;
                    i += 2;
                } else if (braces == 0 && links == 0 && (text.startsWith("||", i) || (header && text.startsWith("!!", i)))) {
                    cells.add(makeCell(type, cellStart, contentStart, i));
                    cellStart = i;
                    contentStart = i + 2;
                    i += 2;
                } else {
                    i++;
                }
            }

            cells.add(makeCell(type, cellStart, contentStart, segmentEnd));
            return cells;
        }

        private Node.TableCell makeCell(Node.TableCellType type, int cellStart, int contentStart, int cellEnd) {
            var split = splitAttributes(contentStart, cellEnd);
            return new Node.TableCell(type, split.get(0), split.get(1), cellStart, cellEnd);
        }

        // [attributes or null, content]
        private List<List<Node>> splitAttributes(int from, int to) {
            var firstLineEnd = topLevelLineEnd(from, to);
            var braces = 0;
            var links = 0;
            var i = from;

            while (i < firstLineEnd) {
                if (text.startsWith("{{", i)) {
                    braces++;
                    i += 2;
                } else if (braces > 0 && text.startsWith("}}", i)) {
                    braces--;
                    i += 2;
                } else if (text.startsWith("[[", i)) {
                    links++;
                    i += 2;
                } else if (links > 0 && text.startsWith("]]", i)) {
                    links--;
                    i += 2;
                } else if (braces == 0 && links == 0 && text.charAt(i) == '|') {
                    var attributes = parseInlineTrimmed(from, i);
                    var result = new ArrayList<List<Node>>();
                    result.add(attributes.isEmpty() ? null : attributes);
                    result.add(parseBlocksTrimmed(i + 1, to));
                    return result;
                } else {
                    i++;
                }
            }

            var result = new ArrayList<List<Node>>();
            result.add(null);
            result.add(parseBlocksTrimmed(from, to));
            return result;
        }

        private int topLevelLineEnd(int from, int to) {
            var braces = 0;
            var i = from;

            while (i < to) {
                if (text.startsWith("{{", i)) {
                    braces++;
                    i += 2;
                } else if (braces > 0 && text.startsWith("}}", i)) {
                    braces--;
                    i += 2;
                } else if (braces == 0 && text.charAt(i) == '\n') {
                    return i;
                } else {
                    i++;
                }
            }

            return to;
        }

        private List<Node> parseInlineTrimmed(int from, int to) {
            while (from < to && Character.isWhitespace(text.charAt(from))) {
                from++;
            }

            while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
                to--;
            }

            var nodes = new ArrayList<Node>();

            if (from < to) {
                parseInline(from, to, Terminator.NONE, false, nodes);
            }

            return nodes;
        }

        private List<Node> parseBlocksTrimmed(int from, int to) {
            while (from < to && Character.isWhitespace(text.charAt(from))) {
                from++;
            }

            while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
                to--;
            }

            return parseBlocks(from, to);
        }

        private NewlineRun newlineRun(int pos, int to) {
            var next = pos + 1;
            var paragraph = false;

            while (true) {
                var end = next;

                while (end < to && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
                    end++;
                }

                if (end < to && text.charAt(end) == '\n') {
                    paragraph = true;
                    next = end + 1;
                } else {
                    break;
                }
            }

            return new NewlineRun(next, paragraph);
        }

        private int parseInline(int from, int to, Terminator stop, boolean blocks, List<Node> out) {
            var pos = from;
            var textStart = from;

            while (pos < to) {
                if (stop.matches(text, pos)) {
                    break;
                }

                var ch = text.charAt(pos);

                if (ch == '\n' && blocks) {
                    var run = newlineRun(pos, to);
                    var next = run.next();

                    if (next < to && startsSkippableBlock(next, to)) {
                        flushText(textStart, pos, out);
                        return next;
                    } else if (run.paragraph()) {
                        flushText(textStart, pos, out);
                        out.add(new Node.ParagraphBreak(pos, next));
                        return next;
                    } else if (next < to && startsLineConstruct(next, to)) {
                        flushText(textStart, next, out);
                        return next;
                    }

                    pos = next;
                    continue;
                }

                if (ch == '\'') {
                    var run = pos;

                    while (run < to && text.charAt(run) == '\'') {
                        run++;
                    }

                    var count = run - pos;

                    if (count < 2) {
                        pos = run;
                        continue;
                    }

                    var length = count == 4 ? 3 : Math.min(count, 5);
                    var tokenStart = run - length;
                    flushText(textStart, tokenStart, out);

                    switch (length) {
                        case 2 -> out.add(new Node.Italic(tokenStart, run));
                        case 3 -> out.add(new Node.Bold(tokenStart, run));
                        default -> out.add(new Node.BoldItalic(tokenStart, run));
                    }

                    pos = run;
                    textStart = run;
                    continue;
                }

                var parsed = parseConstruct(ch, pos, to);

                if (parsed != null) {
                    flushText(textStart, pos, out);
                    out.add(parsed.node());
                    pos = parsed.next();
                    textStart = pos;
                } else {
                    pos++;
                }
            }

            flushText(textStart, pos, out);
            return pos;
        }

        private void flushText(int from, int to, List<Node> out) {
            if (to > from) {
                out.add(new Node.Text(text.substring(from, to), from, to));
            }
        }

        private Parsed parseConstruct(char ch, int pos, int to) {
            switch (ch) {
                case '{' -> {
                    Parsed parsed = null;

                    if (text.startsWith("{{{", pos)) {
                        parsed = parseParameter(pos, to);
                    }

                    if (parsed == null && text.startsWith("{{", pos)) {
                        parsed = parseTemplate(pos, to);
                    }

                    return parsed;
                }
                case '[' -> {
                    Parsed parsed = null;

                    if (text.startsWith("[[", pos)) {
                        parsed = parseLink(pos, to);
                    }

                    return parsed != null ? parsed : parseExternalLink(pos, to);
                }
                case '<' -> {
                    return text.startsWith("<!--", pos) ? parseComment(pos, to) : parseTag(pos, to);
                }
                case '&' -> {
                    return parseEntity(pos, to);
                }
                case '_' -> {
                    return parseMagicWord(pos, to);
                }
                default -> {
                    return null;
                }
            }
        }

        private Parsed parseParameter(int pos, int to) {
            enter(pos);

            try {
                var name = new ArrayList<Node>();
                var p = parseInline(pos + 3, to, Terminator.PARAMETER_NAME, false, name);

                if (p >= to) {
                    return null;
                }

                List<Node> defaultValue = null;

                if (text.charAt(p) == '|') {
                    defaultValue = new ArrayList<>();
                    p = parseInline(p + 1, to, Terminator.PARAMETER_DEFAULT, false, defaultValue);

                    if (p >= to) {
                        return null;
                    }
                }

                return new Parsed(new Node.Parameter(name, defaultValue, pos, p + 3), p + 3);
            } finally {
                leave();
            }
        }

        private Parsed parseTemplate(int pos, int to) {
            enter(pos);

            try {
                var name = new ArrayList<Node>();
                var p = parseInline(pos + 2, to, Terminator.TEMPLATE_NAME, false, name);

                if (p >= to) {
                    return null;
                }

                var arguments = new ArrayList<Node.TemplateArgument>();

                while (text.charAt(p) == '|') {
                    var argumentStart = p + 1;
                    var first = new ArrayList<Node>();
                    p = parseInline(argumentStart, to, Terminator.ARGUMENT_NAME, false, first);

                    if (p >= to) {
                        return null;
                    }

                    if (text.charAt(p) == '=') {
                        var value = new ArrayList<Node>();
                        p = parseInline(p + 1, to, Terminator.ARGUMENT_VALUE, false, value);

                        if (p >= to) {
                            return null;
                        }

                        arguments.add(new Node.TemplateArgument(trim(first), trim(value), argumentStart, p));
                    } else {
                        arguments.add(new Node.TemplateArgument(null, first, argumentStart, p));
                    }
                }

                return new Parsed(new Node.Template(trim(name), arguments, pos, p + 2), p + 2);
            } finally {
                leave();
            }
        }

        // named arguments and template names ignore surrounding whitespace
        private List<Node> trim(List<Node> nodes) {
            var result = new ArrayList<Node>(nodes);

            if (!result.isEmpty() && result.get(0) instanceof Node.Text first) {
                var stripped = first.value().stripLeading();
                var start = first.end() - stripped.length();
                result.set(0, new Node.Text(stripped, start, first.end()));
            }

            if (!result.isEmpty() && result.get(result.size() - 1) instanceof Node.Text last) {
                var stripped = last.value().stripTrailing();
                result.set(result.size() - 1, new Node.Text(stripped, last.start(), last.start() + stripped.length()));
            }

            result.removeIf(node -> node instanceof Node.Text t && t.value().isEmpty());
            return result;
        }

        private Parsed parseLink(int pos, int to) {
            var targetStart = pos + 2;
            var p = targetStart;

            while (p < to && text.charAt(p) != '|' && !text.startsWith("]]", p)) {
                if ("[]{}<>\n".indexOf(text.charAt(p)) != -1) {
                    return null;
                }

                p++;
            }

            if (p >= to) {
                return null;
            }

            var target = text.substring(targetStart, p).strip();

            if (target.isEmpty()) {
                return null;
            }

            enter(pos);

            try {
                var piped = text.charAt(p) == '|';
                List<Node> textNodes = new ArrayList<>();
                int close;

                if (piped) {
                    close = parseInline(p + 1, to, Terminator.LINK_TEXT, false, textNodes);

                    if (close >= to) {
                        return null;
                    }
                } else {
                    close = p;
                    textNodes.add(new Node.Text(text.substring(targetStart, p), targetStart, p));
                }

                var end = close + 2;
                var colon = target.indexOf(':');

                if (colon > 0) {
                    var namespace = target.substring(0, colon).strip();

                    if (configuration.isCategoryNamespace(namespace)) {
                        var ordinal = piped ? Nodes.wikitext(text, textNodes) : null;
                        return new Parsed(new Node.Category(target, ordinal, pos, end), end);
                    }

                    if (configuration.isFileNamespace(namespace)) {
                        return new Parsed(new Node.Image(target, piped ? textNodes : List.of(), pos, end), end);
                    }
                }

                var trailEnd = end;

                while (trailEnd < to && configuration.isLinkTrailCharacter(text.charAt(trailEnd))) {
                    trailEnd++;
                }

                if (trailEnd > end) {
                    textNodes.add(new Node.Text(text.substring(end, trailEnd), end, trailEnd));
                }

                return new Parsed(new Node.Link(target, textNodes, pos, trailEnd), trailEnd);
            } finally {
                leave();
            }
        }

        private Parsed parseExternalLink(int pos, int to) {
            var urlStart = pos + 1;
            var known = configuration.getProtocols().stream()
                .anyMatch(protocol -> Utils.startsWithIgnoreCase(text, urlStart, protocol));

            if (!known) {
                return null;
            }

            enter(pos);

            try {
                var nodes = new ArrayList<Node>();
                var close = parseInline(urlStart, to, Terminator.EXTERNAL_LINK, false, nodes);

                if (close >= to || text.charAt(close) != ']') {
                    return null;
                }

                return new Parsed(new Node.ExternalLink(nodes, pos, close + 1), close + 1);
            } finally {
                leave();
            }
        }

        private Parsed parseComment(int pos, int to) {
            var close = text.indexOf("-->", pos + 4);
            var end = close == -1 || close + 3 > to ? to : close + 3;
            return new Parsed(new Node.Comment(pos, end), end);
        }

        private Parsed parseTag(int pos, int to) {
            var m = P_TAG.matcher(text).region(pos, to);

            if (!m.lookingAt()) {
                return null;
            }

            var closing = !m.group(1).isEmpty();
            var name = m.group(2).toLowerCase(Locale.ROOT);
            var selfClosing = !m.group(4).isEmpty();
            var end = m.end();
            var extension = configuration.isExtensionTag(name);

            if (!extension && !HTML_TAGS.contains(name)) {
                return null;
            }

            if (closing) {
                return new Parsed(new Node.EndTag(name, pos, end), end);
            }

            if (extension) {
                return parseExtensionTag(name, pos, end, to, selfClosing);
            }

            if (selfClosing) {
                if (name.equals("br") || name.equals("hr")) {
                    return new Parsed(new Node.StartTag(name + "/", pos, end), end);
                }

                return new Parsed(new Node.Tag(name, List.of(), pos, end), end);
            }

            return new Parsed(new Node.StartTag(name, pos, end), end);
        }

        private Parsed parseExtensionTag(String name, int pos, int openEnd, int to, boolean selfClosing) {
            if (selfClosing) {
                return new Parsed(new Node.Tag(name, List.of(), pos, openEnd), openEnd);
            }

            var closer = Pattern.compile("</" + Pattern.quote(name) + "\\s*>", Pattern.CASE_INSENSITIVE)
                .matcher(text)
                .region(openEnd, to);

            if (!closer.find()) {
                return new Parsed(new Node.StartTag(name, pos, openEnd), openEnd);
            }

            var end = closer.end();

            if (name.equals("pre")) {
                return new Parsed(new Node.Preformatted(rawText(openEnd, closer.start()), pos, end), end);
            }

            if (!PARSED_EXTENSION_TAGS.contains(name)) {
                return new Parsed(new Node.Tag(name, rawText(openEnd, closer.start()), pos, end), end);
            }

            enter(pos);

            try {
                return new Parsed(new Node.Tag(name, parseBlocks(openEnd, closer.start()), pos, end), end);
            } finally {
                leave();
            }
        }

        private List<Node> rawText(int from, int to) {
            var nodes = new ArrayList<Node>();
            flushText(from, to, nodes);
            return nodes;
        }

        private Parsed parseEntity(int pos, int to) {
            var m = P_ENTITY.matcher(text).region(pos, to);

            if (!m.lookingAt()) {
                return null;
            }

            var raw = m.group();
            var decoded = StringEscapeUtils.unescapeHtml4(raw);

            if (decoded.equals(raw)) {
                return null;
            }

            return new Parsed(new Node.CharacterEntity(decoded, pos, m.end()), m.end());
        }

        private Parsed parseMagicWord(int pos, int to) {
            if (!text.startsWith("__", pos)) {
                return null;
            }

            var m = P_MAGIC_WORD.matcher(text).region(pos, to);

            if (!m.lookingAt() || !configuration.isMagicWord(m.group(1))) {
                return null;
            }

            return new Parsed(new Node.MagicWord(m.group(1).toUpperCase(Locale.ROOT), pos, m.end()), m.end());
        }
    }
}
