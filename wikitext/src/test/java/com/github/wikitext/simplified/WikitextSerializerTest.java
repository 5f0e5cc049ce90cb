package com.github.wikitext.simplified;

import static com.github.wikitext.simplified.Unspanned.nodes;
import static com.github.wikitext.simplified.Unspanned.strip;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.wikitext.simplified.WikitextSimplifiedNode.Bold;
import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ExtLink;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Heading;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Italic;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Link;
import com.github.wikitext.simplified.WikitextSimplifiedNode.OrderedList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Template;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;
import com.github.wikitext.simplified.WikitextSimplifiedNode.UnorderedList;

class WikitextSerializerTest {
    @Test
    void inlineFormatting() {
        assertThat(new Bold(nodes(new Text("bold"))).toWikitext()).isEqualTo("'''bold'''");
        assertThat(new Italic(nodes(new Text("italic"))).toWikitext()).isEqualTo("''italic''");
        assertThat(new Bold(nodes(new Italic(nodes(new Text("both"))))).toWikitext()).isEqualTo("'''''both'''''");
    }

    @Test
    void emptyFormattingIsSkipped() {
        assertThat(new Bold(nodes(new Text("x"), new Italic(nodes()))).toWikitext()).isEqualTo("'''x'''");
        assertThat(WikitextSerializer.toWikitext(WikitextSimplified.parseAndSimplify("'''x''"))).isEqualTo("'''x'''");
    }

    @Test
    void links() {
        assertThat(new Link("Main Page", "Main Page").toWikitext()).isEqualTo("[[Main Page]]");
        assertThat(new Link("Home", "Main Page").toWikitext()).isEqualTo("[[Main Page|Home]]");
        assertThat(new ExtLink("https://example.com", null).toWikitext()).isEqualTo("[https://example.com]");
        assertThat(new ExtLink("https://example.com", "Example").toWikitext()).isEqualTo("[https://example.com Example]");
    }

    @Test
    void headings() {
        assertThat(new Heading(2, nodes(new Text("Heading"))).toWikitext()).isEqualTo("== Heading ==");
    }

    @Test
    void templatesUsePositionalArgumentsWhileNumberingLinesUp() {
        var template = new Template("Tpl", List.of(
            new TemplateParameter("1", "a"),
            new TemplateParameter("2", "b"),
            new TemplateParameter("key", "c"),
            new TemplateParameter("3", "d")));

        assertThat(template.toWikitext()).isEqualTo("{{Tpl|a|b|key=c|3=d}}");
    }

    @Test
    void positionalValueContainingEqualsIsNamed() {
        var template = new Template("Tpl", List.of(new TemplateParameter("1", "a=b")));
        assertThat(template.toWikitext()).isEqualTo("{{Tpl|1=a=b}}");
    }

    @Test
    void parameterUses() {
        assertThat(new TemplateParameterUse("1", null).toWikitext()).isEqualTo("{{{1}}}");
        assertThat(new TemplateParameterUse("name", nodes(new Text("fallback"))).toWikitext()).isEqualTo("{{{name|fallback}}}");
    }

    @Test
    void nonBreakingSpacesAreEscaped() {
        assertThat(new Text("a\u00a0b").toWikitext()).isEqualTo("a&nbsp;b");
    }

    @Test
    void tables() {
        var table = new Table(
            nodes(new Text("class=\"wikitable\"")),
            List.of(new TableCaption(null, nodes(new Text("Caption")))),
            List.of(new TableRow(List.of(), List.of(
                new TableCell(false, null, nodes(new Text("Cell 1"))),
                new TableCell(false, null, nodes(new Text("Cell 2")))))));

        assertThat(table.toWikitext()).isEqualTo("{|class=\"wikitable\"\n|+Caption\n|Cell 1||Cell 2\n|}\n");
    }

    @Test
    void tableCellsWithAttributes() {
        var wikitext = "{|\n!width=\"120\" align=\"right\"|<font size=\"3\">Returns</font> &nbsp;&nbsp;\n|<font size=\"3\">None</font>\n|}\n";
        var table = WikitextSimplified.parseAndSimplify(wikitext).get(0).value();

        assertThat(table).isInstanceOf(Table.class);
        assertThat(table.toWikitext()).isEqualTo(wikitext);
    }

    @Test
    void orderedList() {
        var list = new OrderedList(List.of(new ListItem(nodes(new Text("Item 1"))), new ListItem(nodes(new Text("Item 2")))));
        assertThat(list.toWikitext()).isEqualTo("#Item 1\n#Item 2\n");
    }

    @Test
    void nestedListsExtendThePrefix() {
        var inner = new OrderedList(List.of(new ListItem(nodes(new Text("Inner")))));
        var list = new UnorderedList(List.of(new ListItem(nodes(new Text("Outer"), inner))));

        assertThat(list.toWikitext()).isEqualTo("*Outer\n*#Inner\n");
    }

    @Test
    void definitionList() {
        var list = new DefinitionList(List.of(
            new DefinitionListItem(DefinitionListItemType.TERM, nodes(new Text("Term 1"))),
            new DefinitionListItem(DefinitionListItemType.DETAILS, nodes(new Text("Definition 1")))));

        assertThat(list.toWikitext()).isEqualTo(";Term 1\n:Definition 1\n");
    }

    @Test
    void blockNodesStartOnANewLine() {
        var list = new UnorderedList(List.of(new ListItem(nodes(new Text("item")))));
        assertThat(WikitextSerializer.toWikitext(nodes(new Text("before"), list))).isEqualTo("before\n*item\n");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{|\n|-\n|Cell 1\n|Cell 2\n|-\n|Cell 3\n|Cell 4\n|}",
        "{| class=\"wikitable\"\n|+ Caption\n|-\n! Header 1 !! Header 2\n|-\n| Cell 1 || Cell 2\n|}",
        "<center>'''Warning''': this is <span style=\"color:red\">important</span></center>",
        ";Term 1\n:Definition 1",
        "* Outer\n** Inner\n* Second",
        "== Heading ==\nText with [[Link|label]] and {{Tpl|a|key=b}}"
    })
    void serializedOutputParsesToTheSameTree(String wikitext) {
        var simplified = strip(WikitextSimplified.parseAndSimplify(wikitext));
        var reparsed = strip(WikitextSimplified.parseAndSimplify(WikitextSerializer.toWikitext(simplified)));

        assertThat(reparsed).isEqualTo(simplified);
    }
}
