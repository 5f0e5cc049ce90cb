package com.github.wikitext.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.github.wikitext.parsing.Configuration;
import com.github.wikitext.simplified.TemplateParameter;
import com.github.wikitext.simplified.WikitextSerializer;
import com.github.wikitext.simplified.WikitextSimplified;
import com.github.wikitext.simplified.WikitextSimplifiedNode;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Bold;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Link;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;

class TemplateEvaluatorTest {
    private final MapTemplateContext context = new MapTemplateContext(Configuration.wikipedia());

    private WikitextSimplifiedNode instantiate(String name, TemplateParameter... parameters) throws InterruptedException {
        return new TemplateEvaluator(context).instantiateAndWait(TemplateTarget.ofName(name), List.of(parameters));
    }

    @Test
    void parametersAreSubstitutedAndReparsed() throws InterruptedException {
        context.template("Bold", "'''{{{1}}}'''");

        var result = instantiate("Bold", new TemplateParameter("1", "important"));

        assertThat(result).isInstanceOf(Fragment.class);
        assertThat(result.children()).hasSize(1);
        assertThat(result.children().get(0).value()).isInstanceOf(Bold.class);
        assertThat(result.toWikitext()).isEqualTo("'''important'''");
    }

    @Test
    void magicVariables() throws InterruptedException {
        context.template("Greeting", "Hello, {{{subpagename}}}!").magicVariable("subpagename", "TestPage");

        assertThat(instantiate("Greeting").toWikitext()).isEqualTo("Hello, TestPage!");
    }

    @Test
    void magicVariableAsTemplateName() throws InterruptedException {
        context.magicVariable("PAGENAME", "Main Page");

        assertThat(instantiate("PAGENAME")).isEqualTo(new Text("Main Page"));
    }

    @Test
    void explicitArgumentsWinOverMagicVariables() throws InterruptedException {
        context.template("Greeting", "Hello, {{{subpagename}}}!").magicVariable("subpagename", "TestPage");

        assertThat(instantiate("Greeting", new TemplateParameter("subpagename", "Other")).toWikitext()).isEqualTo("Hello, Other!");
    }

    @Test
    void parameterDefaults() throws InterruptedException {
        context.template("Optional", "[{{{name|fallback}}}|{{{missing}}}]");

        assertThat(instantiate("Optional").toWikitext()).isEqualTo("[fallback|]");
        assertThat(instantiate("Optional", new TemplateParameter("name", "given")).toWikitext()).isEqualTo("[given|]");
    }

    @Test
    void nestedTemplatesSeeTheirCallersArguments() throws InterruptedException {
        context.template("Outer", "x {{Inner|{{{1}}}}} y").template("Inner", "({{{1}}})");

        assertThat(instantiate("Outer", new TemplateParameter("1", "v")).toWikitext()).isEqualTo("x (v) y");
    }

    @Test
    void templateNamesAreNormalized() throws InterruptedException {
        context.template("Lua/Cell Align", "ok");

        assertThat(instantiate("lua/cell_align").toWikitext()).isEqualTo("ok");
    }

    @Test
    void missingTemplatesAreRenderedInline() throws InterruptedException {
        assertThat(instantiate("Missing")).isEqualTo(new Text("{{Template error: Template not found: Missing (key: missing)}}"));
    }

    @Test
    void missingNestedTemplateKeepsTheRest() throws InterruptedException {
        context.template("Page", "before {{Nowhere}} after");

        assertThat(instantiate("Page").toWikitext())
            .isEqualTo("before {{Template error: Template not found: Nowhere (key: nowhere)}} after");
    }

    @Test
    void recursionIsDetected() throws InterruptedException {
        context.template("Loop", "a{{Loop}}");

        assertThat(instantiate("Loop").toWikitext()).isEqualTo("a{{Template error: Template recursion detected: Loop}}");
    }

    @Test
    void templateNestedInItsOwnArgumentIsExpanded() throws InterruptedException {
        context.template("Wrap", "({{{1}}})");

        assertThat(instantiate("Wrap", new TemplateParameter("1", "{{Wrap|x}}")).toWikitext()).isEqualTo("((x))");
    }

    @Test
    void sameTemplateInSeveralArgumentsIsExpanded() throws InterruptedException {
        context.template("Two", "{{{1}}}-{{{2}}}");
        var tree = new Fragment(WikitextSimplified.parseAndSimplify("x {{Two|{{Two|1|2}}|{{Two|3|4}}}} y"));

        var result = new TemplateEvaluator(context).instantiateAndWait(TemplateTarget.ofNode(tree), List.of());

        assertThat(result.toWikitext()).isEqualTo("x 1-2-3-4 y");
    }

    @Test
    void mutualRecursionIsDetected() throws InterruptedException {
        context.template("Ping", "ping {{Pong}}").template("Pong", "pong {{Ping}}");

        assertThat(instantiate("Ping").toWikitext()).contains("Template recursion detected: Ping");
    }

    @Test
    void unparsableTemplatesAreRenderedInline() throws InterruptedException {
        context.template("Broken", "<span>text</div>");

        assertThat(instantiate("Broken").toWikitext()).startsWith("{{Template error: Failed to parse template 'Broken': Invalid node structure");
    }

    @Test
    void contextFailuresAreWrapped() throws InterruptedException {
        var failing = new TemplateContext() {
            @Override
            public Configuration configuration() {
                return Configuration.wikipedia();
            }

            @Override
            public Optional<String> resolveMagicVariable(String name) {
                return Optional.empty();
            }

            @Override
            public CompletableFuture<String> loadTemplate(String name) {
                throw new IllegalStateException("boom");
            }
        };

        var result = new TemplateEvaluator(failing).instantiateAndWait(TemplateTarget.ofName("Any"), List.of());

        assertThat(result).isEqualTo(new Text("{{Template error: boom}}"));
    }

    @Test
    void parsedTemplatesAreCached() throws InterruptedException {
        var loads = new AtomicInteger();
        var counting = new TemplateContext() {
            @Override
            public Configuration configuration() {
                return context.configuration();
            }

            @Override
            public Optional<String> resolveMagicVariable(String name) {
                return context.resolveMagicVariable(name);
            }

            @Override
            public CompletableFuture<String> loadTemplate(String name) {
                loads.incrementAndGet();
                return context.loadTemplate(name);
            }
        };

        context.template("Twice", "'''x'''").template("Page", "{{Twice}} {{Twice}}");
        var evaluator = new TemplateEvaluator(counting);

        evaluator.instantiateAndWait(TemplateTarget.ofName("Page"), List.of());
        evaluator.instantiateAndWait(TemplateTarget.ofName("Page"), List.of());

        assertThat(loads).hasValue(2);
    }

    @Test
    void treesCanBeInstantiatedDirectly() throws InterruptedException {
        context.template("Name", "World");
        var tree = new Fragment(WikitextSimplified.parseAndSimplify("Hello, {{Name}}!"));

        var result = new TemplateEvaluator(context).instantiateAndWait(TemplateTarget.ofNode(tree), List.of());

        assertThat(result.toWikitext()).isEqualTo("Hello, World!");
    }

    @Test
    void treesWithoutTemplatesAreReturnedAsIs() throws InterruptedException {
        var tree = new Fragment(WikitextSimplified.parseAndSimplify("'''plain'''"));

        assertThat(new TemplateEvaluator(context).instantiateAndWait(TemplateTarget.ofNode(tree), List.of())).isSameAs(tree);
    }

    @Test
    void tablesAreExpandedCellByCell() throws InterruptedException {
        context
            .template("Lua/TestTable", String.join("\n",
                "{| class=\"wikitable\"",
                "! Name !! Type",
                "|-",
                "|{{Lua/CellAlign}}| TypeA || '''bold'''",
                "|-",
                "| plain || {{Lua/Link|Target}}",
                "|}"))
            .template("Lua/CellAlign", "align=\"right\"")
            .template("Lua/Link", "[[{{{1}}}]]");

        var result = instantiate("Lua/TestTable");
        var table = (Table) result.children().get(0).value();

        assertThat(table.rows()).hasSize(3);

        var first = table.rows().get(1).cells();
        assertThat(first).hasSize(2);
        assertThat(WikitextSerializer.toWikitext(first.get(0).attributes())).contains("right");
        assertThat(WikitextSerializer.toWikitext(first.get(0).content())).isEqualTo("TypeA");
        assertThat(first.get(1).content().get(0).value()).isInstanceOf(Bold.class);

        var second = table.rows().get(2).cells();
        assertThat(second.get(1).content().get(0).value()).isEqualTo(new Link("Target", "Target"));
    }

    @Test
    void depthMustBePositive() {
        var evaluator = new TemplateEvaluator(context);

        assertThat(evaluator.getMaxDepth()).isEqualTo(TemplateEvaluator.DEFAULT_MAX_DEPTH);
        assertThatIllegalArgumentException().isThrownBy(() -> evaluator.maxDepth(0));
    }

    @Test
    void targetsNeedExactlyOneComponent() {
        assertThatIllegalArgumentException().isThrownBy(() -> new TemplateTarget(null, null));
        assertThatIllegalArgumentException().isThrownBy(() -> new TemplateTarget("a", new Text("b")));
    }
}
