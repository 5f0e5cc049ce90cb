package com.github.wikitext.main;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.LogManager;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONException;
import org.json.JSONObject;

import com.github.wikitext.parsing.Configuration;
import com.github.wikitext.parsing.ParsingException;
import com.github.wikitext.simplified.Spanned;
import com.github.wikitext.simplified.WikitextJson;
import com.github.wikitext.simplified.WikitextSerializer;
import com.github.wikitext.simplified.WikitextSimplified;
import com.github.wikitext.simplified.WikitextSimplifiedNode;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.template.DirectoryTemplateContext;
import com.github.wikitext.template.MapTemplateContext;
import com.github.wikitext.template.TemplateContext;
import com.github.wikitext.template.TemplateEvaluator;
import com.github.wikitext.template.TemplateTarget;

/**
 * Prints the simplified tree of a wikitext document as JSON, optionally after template expansion.
 */
public final class SimplifyWikitext {
    private SimplifyWikitext() {}

    public static void main(String[] args) throws Exception {
        try (var stream = SimplifyWikitext.class.getResourceAsStream("/logging.properties")) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        }

        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) throws InterruptedException {
        var options = buildOptions();
        CommandLine line;

        try {
            line = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(options, err);
            return 1;
        }

        if (line.hasOption("help")) {
            printHelp(options, out);
            return 0;
        }

        try {
            var configuration = line.hasOption("config")
                ? Configuration.fromJson(new JSONObject(FileUtils.readFileToString(new File(line.getOptionValue("config")), StandardCharsets.UTF_8)))
                : Configuration.wikipedia();

            var wikitext = line.hasOption("file")
                ? FileUtils.readFileToString(new File(line.getOptionValue("file")), StandardCharsets.UTF_8)
                : IOUtils.toString(in, StandardCharsets.UTF_8);

            if (line.hasOption("byte-offsets") && line.hasOption("expand")) {
                err.println("--byte-offsets cannot be combined with --expand");
                return 1;
            }

            var nodes = WikitextSimplified.parseAndSimplify(wikitext, configuration);

            if (line.hasOption("expand")) {
                nodes = expand(nodes, configuration, line);
            }

            if (line.hasOption("wikitext")) {
                out.println(WikitextSerializer.toWikitext(nodes));
            } else {
                WikitextJson json;

                if (line.hasOption("no-spans")) {
                    json = WikitextJson.withoutSpans();
                } else if (line.hasOption("byte-offsets")) {
                    json = WikitextJson.withByteSpans(wikitext);
                } else {
                    json = WikitextJson.withSpans();
                }

                out.println(json.toJson(nodes).toString(2));
            }

            return 0;
        } catch (IOException e) {
            err.println("Unable to read input: " + e.getMessage());
            return 1;
        } catch (ParsingException | JSONException | IllegalArgumentException e) {
            err.println(e.getMessage());
            return 1;
        }
    }

    private static List<Spanned<WikitextSimplifiedNode>> expand(List<Spanned<WikitextSimplifiedNode>> nodes, Configuration configuration, CommandLine line) throws InterruptedException {
        var magicVariables = new HashMap<String, String>();

        for (var definition : line.getOptionValues("magic") != null ? line.getOptionValues("magic") : new String[0]) {
            var name = StringUtils.substringBefore(definition, "=");

            if (name.equals(definition) || name.isBlank()) {
                throw new IllegalArgumentException("Invalid magic variable definition: " + definition);
            }

            magicVariables.put(name.strip(), StringUtils.substringAfter(definition, "="));
        }

        var evaluator = new TemplateEvaluator(makeContext(configuration, line, magicVariables));
        var fragment = new Fragment(nodes);

        try {
            var result = evaluator.instantiate(TemplateTarget.ofNode(fragment), List.of()).get();

            if (result instanceof Fragment expanded) {
                return expanded.children();
            }

            return List.of(Spanned.of(result, 0, 0));
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    private static TemplateContext makeContext(Configuration configuration, CommandLine line, Map<String, String> magicVariables) {
        if (line.hasOption("templates")) {
            return new DirectoryTemplateContext(Path.of(line.getOptionValue("templates")), configuration, ForkJoinPool.commonPool(), magicVariables);
        }

        var context = new MapTemplateContext(configuration);
        magicVariables.forEach(context::magicVariable);
        return context;
    }

    private static Options buildOptions() {
        var options = new Options();
        options.addOption("f", "file", true, "read wikitext from this file instead of stdin");
        options.addOption("t", "templates", true, "directory of *.wikitext/*.txt templates");
        options.addOption("e", "expand", false, "instantiate templates and parameters");
        options.addOption("m", "magic", true, "define a magic variable as NAME=VALUE (repeatable)");
        options.addOption("n", "no-spans", false, "omit source spans from the JSON output");
        options.addOption("b", "byte-offsets", false, "report spans as UTF-8 byte offsets instead of UTF-16 offsets");
        options.addOption("w", "wikitext", false, "print serialized wikitext instead of JSON");
        options.addOption("c", "config", true, "JSON tokenizer profile (defaults to Wikipedia)");
        options.addOption("h", "help", false, "print this help");
        return options;
    }

    private static void printHelp(Options options, PrintStream stream) {
        var writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, SimplifyWikitext.class.getName(), null, options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        writer.flush();
    }
}
