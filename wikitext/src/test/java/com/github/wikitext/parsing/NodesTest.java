package com.github.wikitext.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NodesTest {
    private static List<Node> parse(String wikitext) {
        return Configuration.wikipedia().parser().parse(wikitext).nodes();
    }

    @Test
    void wikitextConcatenatesSourceSlices() {
        var source = "a '''b''' [[c]]";
        assertThat(Nodes.wikitext(source, parse(source))).isEqualTo(source);
        assertThat(Nodes.wikitext(source, List.of())).isEmpty();
    }

    @Test
    void innerTextSkipsFormatting() {
        assertThat(Nodes.innerText(parse(" '''bold''' and [[Target|label]] &amp; more "))).isEqualTo("bold and label & more");
    }

    @Test
    void innerTextOfHeadingsAndLinks() {
        assertThat(Nodes.innerText(parse("== A ''b'' =="))).isEqualTo("A b");
        assertThat(Nodes.innerText(parse("[[Page]]s"))).isEqualTo("Pages");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "'{{lang|fr|bonjour}}'|bonjour",
        "'{{Lang|fr|text=salut}}'|salut",
        "'{{transl|ar|DIN|arabi}}'|arabi",
        "'{{tlit|ru|privet}}'|privet",
        "'{{transliteration|ru}}'|''",
        "'{{other|x}}'|''"
    })
    void languageTemplatesCarryText(String wikitext, String expected) {
        assertThat(Nodes.innerText(parse(wikitext))).isEqualTo(expected);
    }

    @Test
    void stopAfterBr() {
        var nodes = parse("first<br/>second");

        assertThat(Nodes.innerText(nodes)).isEqualTo("firstsecond");
        assertThat(Nodes.innerText(nodes, new InnerTextConfig(true))).isEqualTo("first");
        assertThat(Nodes.innerText(parse("first<br>second"), new InnerTextConfig(true))).isEqualTo("first");
    }

    @Test
    void metadataExposesChildren() {
        var heading = parse("==Title==").get(0);
        var metadata = NodeMetadata.of(heading);

        assertThat(metadata.type()).isEqualTo(NodeMetadata.Type.HEADING);
        assertThat(metadata.type()).hasToString("Heading");
        assertThat(metadata.start()).isZero();
        assertThat(metadata.end()).isEqualTo(9);
        assertThat(metadata.children()).containsExactly(new Node.Text("Title", 2, 7));
    }

    @Test
    void metadataOfLeaves() {
        var metadata = NodeMetadata.of(new Node.Comment(3, 10));

        assertThat(metadata.type()).isEqualTo(NodeMetadata.Type.COMMENT);
        assertThat(metadata.children()).isNull();
    }

    @Test
    void metadataOfForeignNodes() {
        record Foreign(int start, int end) implements Node {}

        assertThat(NodeMetadata.of(new Foreign(1, 2)).type()).isEqualTo(NodeMetadata.Type.UNKNOWN);
    }
}
