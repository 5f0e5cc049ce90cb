package com.github.wikitext.main;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONArray;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SimplifyWikitextTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String input, String... args) throws InterruptedException {
        var in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return SimplifyWikitext.run(args, in, new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsJsonWithSpans() throws InterruptedException {
        assertThat(run("'''bold'''")).isZero();

        var json = new JSONArray(out());
        assertThat(json.getJSONObject(0).getJSONObject("span").getInt("end")).isEqualTo(10);
        assertThat(json.getJSONObject(0).getJSONObject("value").getString("type")).isEqualTo("bold");
    }

    @Test
    void printsByteOffsets() throws InterruptedException {
        assertThat(run("'''\u00e9'''", "--byte-offsets")).isZero();

        var json = new JSONArray(out());
        assertThat(json.getJSONObject(0).getJSONObject("span").getInt("end")).isEqualTo(8);
    }

    @Test
    void byteOffsetsNeedUnexpandedInput() throws InterruptedException {
        assertThat(run("x", "--byte-offsets", "--expand")).isEqualTo(1);
        assertThat(err()).contains("--byte-offsets cannot be combined with --expand");
    }

    @Test
    void printsJsonWithoutSpans() throws InterruptedException {
        assertThat(run("[[Page]]", "--no-spans")).isZero();

        var json = new JSONArray(out());
        assertThat(json.getJSONObject(0).getString("type")).isEqualTo("link");
        assertThat(json.getJSONObject(0).has("span")).isFalse();
    }

    @Test
    void printsWikitext() throws InterruptedException {
        assertThat(run("==Heading==", "-w")).isZero();
        assertThat(out()).isEqualTo("\n== Heading ==" + System.lineSeparator());
    }

    @Test
    void expandsWithMagicVariables() throws InterruptedException {
        assertThat(run("Hi {{{who}}} from {{PAGENAME}}", "--expand", "-m", "who=there", "-m", "PAGENAME=Main", "-w")).isZero();
        assertThat(out()).isEqualTo("Hi there from Main" + System.lineSeparator());
    }

    @Test
    void expandsTemplatesFromADirectory(@TempDir Path templates) throws IOException, InterruptedException {
        Files.writeString(templates.resolve("greeting.wikitext"), "Hello, '''{{{1}}}'''");

        assertThat(run("{{Greeting|world}}", "-e", "-t", templates.toString(), "-w")).isZero();
        assertThat(out()).isEqualTo("Hello, '''world'''" + System.lineSeparator());
    }

    @Test
    void readsInputFromAFile(@TempDir Path directory) throws IOException, InterruptedException {
        var file = directory.resolve("page.wikitext");
        Files.writeString(file, "plain");

        assertThat(run("", "--file", file.toString(), "-w")).isZero();
        assertThat(out()).isEqualTo("plain" + System.lineSeparator());
    }

    @Test
    void missingInputFile(@TempDir Path directory) throws InterruptedException {
        assertThat(run("", "-f", directory.resolve("absent.txt").toString())).isEqualTo(1);
        assertThat(err()).startsWith("Unable to read input:");
    }

    @Test
    void simplificationErrorsAreReported() throws InterruptedException {
        assertThat(run("<span>text</div>")).isEqualTo(1);
        assertThat(err()).contains("tag closure mismatch");
    }

    @Test
    void invalidMagicVariable() throws InterruptedException {
        assertThat(run("x", "-e", "-m", "novalue")).isEqualTo(1);
        assertThat(err()).contains("Invalid magic variable definition: novalue");
    }

    @Test
    void help() throws InterruptedException {
        assertThat(run("", "--help")).isZero();
        assertThat(out()).contains("--no-spans").contains("--templates");
    }

    @Test
    void unknownOptions() throws InterruptedException {
        assertThat(run("", "--bogus")).isEqualTo(1);
        assertThat(err()).contains("Unrecognized option: --bogus").contains("usage:");
    }
}
