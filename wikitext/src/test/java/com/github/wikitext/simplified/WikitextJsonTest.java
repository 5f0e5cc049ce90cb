package com.github.wikitext.simplified;

import static com.github.wikitext.simplified.Unspanned.nodes;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import com.github.wikitext.simplified.WikitextSimplifiedNode.DefinitionList;
import com.github.wikitext.simplified.WikitextSimplifiedNode.ExtLink;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Template;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;

class WikitextJsonTest {
    @Test
    void spansWrapEveryEntry() {
        var json = WikitextJson.withSpans().toJson(WikitextSimplified.parseAndSimplify("'''bold'''"));
        var expected = new JSONArray("""
            [{"value": {"type": "bold", "children": [
                {"value": {"type": "text", "text": "bold"}, "span": {"start": 3, "end": 7}}
            ]}, "span": {"start": 0, "end": 10}}]""");

        assertThat(json.similar(expected)).isTrue();
    }

    @Test
    void byteSpansCountUtf8Bytes() {
        var source = "\u00e9 [[b]]s";
        var nodes = WikitextSimplified.parseAndSimplify(source);

        var chars = WikitextJson.withSpans().toJson(nodes);
        var bytes = WikitextJson.withByteSpans(source).toJson(nodes);

        assertThat(chars.getJSONObject(1).getJSONObject("span").getInt("start")).isEqualTo(2);
        assertThat(bytes.getJSONObject(1).getJSONObject("span").getInt("start")).isEqualTo(3);
        assertThat(bytes.getJSONObject(1).getJSONObject("span").getInt("end"))
            .isEqualTo(chars.getJSONObject(1).getJSONObject("span").getInt("end") + 1);
    }

    @Test
    void withoutSpansOnlyValuesRemain() {
        var json = WikitextJson.withoutSpans().toJson(WikitextSimplified.parseAndSimplify("[[Main Page|Home]]"));
        var expected = new JSONArray("[{\"type\": \"link\", \"text\": \"Home\", \"title\": \"Main Page\"}]");

        assertThat(json.similar(expected)).isTrue();
    }

    @Test
    void templateParameters() {
        var template = new Template("Tpl", List.of(new TemplateParameter("1", "a"), new TemplateParameter("key", "b")));
        var json = WikitextJson.withoutSpans().toJson(template);

        assertThat(json.getString("type")).isEqualTo("template");
        assertThat(json.getString("name")).isEqualTo("Tpl");
        assertThat(json.getJSONArray("parameters").getJSONObject(1).getString("name")).isEqualTo("key");
        assertThat(json.getJSONArray("parameters").getJSONObject(1).getString("value")).isEqualTo("b");
        assertThat(json.has("children")).isFalse();
    }

    @Test
    void missingOptionalValuesAreNull() {
        var json = WikitextJson.withoutSpans();

        assertThat(json.toJson(new TemplateParameterUse("1", null)).isNull("default")).isTrue();
        assertThat(json.toJson(new ExtLink("https://example.com", null)).isNull("text")).isTrue();
    }

    @Test
    void tablesCarryCaptionsRowsAndCells() {
        var table = new Table(
            nodes(),
            List.of(new TableCaption(null, nodes(new Text("Caption")))),
            List.of(new TableRow(List.of(), List.of(new TableCell(true, null, nodes(new Text("H")))))));

        JSONObject json = WikitextJson.withoutSpans().toJson(table);
        var cell = json.getJSONArray("rows").getJSONObject(0).getJSONArray("cells").getJSONObject(0);

        assertThat(json.getJSONArray("captions").getJSONObject(0).isNull("attributes")).isTrue();
        assertThat(cell.getBoolean("is_header")).isTrue();
        assertThat(cell.isNull("attributes")).isTrue();
        assertThat(cell.getJSONArray("content").getJSONObject(0).getString("text")).isEqualTo("H");
    }

    @Test
    void definitionItemsNameTheirType() {
        var list = new DefinitionList(List.of(
            new DefinitionListItem(DefinitionListItemType.TERM, nodes(new Text("t"))),
            new DefinitionListItem(DefinitionListItemType.DETAILS, nodes(new Text("d")))));

        var items = WikitextJson.withoutSpans().toJson(list).getJSONArray("items");

        assertThat(items.getJSONObject(0).getString("type_")).isEqualTo("Term");
        assertThat(items.getJSONObject(1).getString("type_")).isEqualTo("Details");
    }
}
