package com.github.wikitext.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.wikitext.parsing.Configuration;
import com.github.wikitext.simplified.TemplateParameter;

class DirectoryTemplateContextTest {
    @TempDir
    Path directory;

    private DirectoryTemplateContext context() {
        return new DirectoryTemplateContext(directory, Configuration.wikipedia(), Runnable::run, Map.of("subpagename", "Sub"));
    }

    private void write(String relative, String content) throws IOException {
        var path = directory.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    @Test
    void loadsNestedTemplatesByNormalizedName() throws Exception {
        write("lua/cellalign.wikitext", "align=\"right\"");
        write("Greeting.txt", "Hello");

        var context = context();

        assertThat(context.loadTemplate("Lua/CellAlign").get()).isEqualTo("align=\"right\"");
        assertThat(context.loadTemplate("greeting").get()).isEqualTo("Hello");
    }

    @Test
    void wikitextFilesWinOverTextFiles() throws Exception {
        write("Notice.txt", "from txt");
        write("Notice.wikitext", "from wikitext");

        assertThat(context().loadTemplate("Notice").get()).isEqualTo("from wikitext");
    }

    @Test
    void otherExtensionsAreIgnored() throws Exception {
        write("notes.md", "ignored");

        assertThatExceptionOfType(ExecutionException.class)
            .isThrownBy(() -> context().loadTemplate("notes").get())
            .withCauseInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    void missingTemplates() {
        assertThatExceptionOfType(ExecutionException.class)
            .isThrownBy(() -> context().loadTemplate("Missing Page").get())
            .havingCause()
            .isInstanceOf(TemplateNotFoundException.class)
            .withMessage("Template not found: Missing Page (key: missing_page)");
    }

    @Test
    void missingDirectoryFailsTheScan() {
        var missing = new DirectoryTemplateContext(directory.resolve("absent"), Configuration.wikipedia(), Runnable::run);

        assertThatExceptionOfType(CompletionException.class)
            .isThrownBy(() -> missing.loadTemplate("Any").join())
            .withCauseInstanceOf(DirectoryScanFailedException.class);
    }

    @Test
    void magicVariables() {
        assertThat(context().resolveMagicVariable("subpagename")).contains("Sub");
        assertThat(context().resolveMagicVariable("pagename")).isEmpty();
    }

    @Test
    void evaluatesTemplatesFromFiles() throws Exception {
        write("page.wikitext", "{{{subpagename}}}: {{Box|{{{1}}}}}");
        write("box.wikitext", "'''{{{1}}}'''");

        var result = new TemplateEvaluator(context())
            .instantiateAndWait(TemplateTarget.ofName("Page"), List.of(new TemplateParameter("1", "content")));

        assertThat(result.toWikitext()).isEqualTo("Sub: '''content'''");
    }
}
