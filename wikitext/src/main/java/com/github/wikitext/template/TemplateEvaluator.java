package com.github.wikitext.template;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.mutable.MutableBoolean;

import com.github.wikitext.parsing.ParsingException;
import com.github.wikitext.simplified.Spanned;
import com.github.wikitext.simplified.TableCell;
import com.github.wikitext.simplified.TableRow;
import com.github.wikitext.simplified.TemplateParameter;
import com.github.wikitext.simplified.NodeTraversal;
import com.github.wikitext.simplified.WikitextSerializer;
import com.github.wikitext.simplified.WikitextSimplified;
import com.github.wikitext.simplified.WikitextSimplifiedNode;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Fragment;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Table;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Template;
import com.github.wikitext.simplified.WikitextSimplifiedNode.TemplateParameterUse;
import com.github.wikitext.simplified.WikitextSimplifiedNode.Text;

/**
 * Expands templates, template parameters and magic variables in simplified trees.
 * <p>
 * Parsed templates are cached per evaluator. Expansion never fails because of a template:
 * missing, unreadable or unparsable templates as well as recursive calls are rendered inline as
 * {@code {{Template error: ...}}} markers.
 */
public class TemplateEvaluator {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private static final String ERROR_PREFIX = "Template error:";
    private static final String PLACEHOLDER_PREFIX = "__TEMPLATE_PLACEHOLDER_";

    private final Logger logger = Logger.getLogger("wikitext-templates");
    private final TemplateContext context;
    private final Map<String, WikitextSimplifiedNode> templates = new ConcurrentHashMap<>();
    private final AtomicLong placeholders = new AtomicLong();
    private int maxDepth = DEFAULT_MAX_DEPTH;

    public TemplateEvaluator(TemplateContext context) {
        this.context = Objects.requireNonNull(context);
    }

    /**
     * Limits nested instantiations (template calls, reparse rounds, fixed-point rounds); the tree
     * is returned as expanded so far when the limit is hit.
     */
    public TemplateEvaluator maxDepth(int maxDepth) {
        Validate.isTrue(maxDepth > 0, "maxDepth must be positive: %d", maxDepth);
        this.maxDepth = maxDepth;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public CompletableFuture<WikitextSimplifiedNode> instantiate(TemplateTarget target, List<TemplateParameter> parameters) {
        Objects.requireNonNull(target);
        Objects.requireNonNull(parameters);
        return instantiate(target, parameters, new Expansion(Set.of(), 0));
    }

    /**
     * Blocking variant of {@link #instantiate(TemplateTarget, List)}.
     */
    public WikitextSimplifiedNode instantiateAndWait(TemplateTarget target, List<TemplateParameter> parameters) throws InterruptedException {
        try {
            return instantiate(target, parameters).get();
        } catch (ExecutionException e) {
            // only programming errors get here, template failures are rendered inline
            throw new IllegalStateException(e.getCause());
        }
    }

    private CompletableFuture<WikitextSimplifiedNode> instantiate(TemplateTarget target, List<TemplateParameter> parameters, Expansion expansion) {
        if (target.node() != null) {
            return expand(target.node(), parameters, expansion);
        }

        var name = target.name();
        var magic = context.resolveMagicVariable(name);

        if (magic.isPresent()) {
            return CompletableFuture.completedFuture(new Text(magic.get()));
        }

        if (name.startsWith(ERROR_PREFIX)) {
            // marker produced by an earlier round, keep it as it is
            return CompletableFuture.completedFuture(new Text(new Template(name, parameters).toWikitext()));
        }

        var key = TemplateKeys.normalize(name);
        var call = signature(key, parameters);

        if (expansion.chain().contains(call)) {
            logger.logp(Level.WARNING, "TemplateEvaluator", "instantiate", "Template recursion detected: {0}", name);
            return CompletableFuture.completedFuture(errorMarker("Template recursion detected: " + name));
        }

        return get(name, key).handle((template, error) -> {
            if (error != null) {
                var exception = asTemplateException(error);
                logger.logp(Level.WARNING, "TemplateEvaluator", "instantiate", exception.getMessage());
                return CompletableFuture.<WikitextSimplifiedNode>completedFuture(errorMarker(exception.getMessage()));
            }

            return expand(template, parameters, expansion.enter(call));
        }).thenCompose(Function.identity());
    }

    private CompletableFuture<WikitextSimplifiedNode> get(String name, String key) {
        var cached = templates.get(key);

        if (cached != null) {
            logger.logp(Level.FINE, "TemplateEvaluator", "get", "Cache hit: {0}", key);
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<String> source;

        try {
            source = context.loadTemplate(name);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return source.thenApply(content -> {
            List<Spanned<WikitextSimplifiedNode>> simplified;

            try {
                simplified = WikitextSimplified.parseAndSimplify(content, context.configuration());
            } catch (ParsingException e) {
                throw new CompletionException(new ParseFailedException(name, e.getMessage()));
            }

            WikitextSimplifiedNode fragment = new Fragment(simplified);
            templates.putIfAbsent(key, fragment);
            return fragment;
        });
    }

    private CompletableFuture<WikitextSimplifiedNode> expand(WikitextSimplifiedNode node, List<TemplateParameter> parameters, Expansion expansion) {
        if (!contains(node, n -> n instanceof Template || n instanceof TemplateParameterUse)) {
            return CompletableFuture.completedFuture(node);
        }

        if (expansion.depth() >= maxDepth) {
            logger.logp(Level.WARNING, "TemplateEvaluator", "expand", "Expansion depth limit reached ({0})", maxDepth);
            return CompletableFuture.completedFuture(node);
        }

        return replaceOnce(node, parameters, expansion).thenCompose(replaced -> {
            if (contains(replaced, n -> n instanceof Table)) {
                return expandToFixedPoint(replaced, parameters, expansion, 0)
                    .thenCompose(expanded -> reparseTableCells(expanded, expansion));
            }

            var wikitext = replaced.toWikitext();

            if (wikitext.equals(node.toWikitext())) {
                return CompletableFuture.completedFuture(replaced);
            }

            List<Spanned<WikitextSimplifiedNode>> reparsed;

            try {
                reparsed = WikitextSimplified.parseAndSimplify(wikitext, context.configuration());
            } catch (ParsingException e) {
                logger.logp(Level.WARNING, "TemplateEvaluator", "expand", "Failed to reparse expansion, keeping it as is: " + e.getMessage());
                return CompletableFuture.completedFuture(replaced);
            }

            logger.logp(Level.FINE, "TemplateEvaluator", "expand", "Reparsing round at depth {0}", expansion.depth());
            return instantiate(TemplateTarget.ofNode(new Fragment(reparsed)), parameters, expansion.deeper());
        });
    }

    private CompletableFuture<WikitextSimplifiedNode> expandToFixedPoint(WikitextSimplifiedNode node, List<TemplateParameter> parameters, Expansion expansion, int round) {
        if (round >= maxDepth) {
            logger.logp(Level.WARNING, "TemplateEvaluator", "expandToFixedPoint", "No fixed point after {0} rounds", round);
            return CompletableFuture.completedFuture(node);
        }

        var before = node.toWikitext();

        return replaceOnce(node, parameters, expansion).thenCompose(after -> {
            if (after.toWikitext().equals(before)) {
                return CompletableFuture.completedFuture(after);
            }

            return expandToFixedPoint(after, parameters, expansion, round + 1);
        });
    }

    /**
     * One substitution round: parameter uses are resolved in place, template calls are
     * instantiated one after another and spliced back into the tree.
     */
    private CompletableFuture<WikitextSimplifiedNode> replaceOnce(WikitextSimplifiedNode node, List<TemplateParameter> parameters, Expansion expansion) {
        var calls = new ArrayList<Template>();
        var tokens = new ArrayList<String>();

        var substituted = node.visitAndReplace(child -> {
            if (child instanceof Template template) {
                var token = PLACEHOLDER_PREFIX + placeholders.getAndIncrement() + "__";
                calls.add(template);
                tokens.add(token);
                return new Text(token);
            } else if (child instanceof TemplateParameterUse use) {
                return new Text(resolveParameter(use, parameters));
            } else {
                return child;
            }
        });

        if (calls.isEmpty()) {
            return CompletableFuture.completedFuture(substituted);
        }

        return sequentially(calls, call -> instantiate(TemplateTarget.ofName(call.name()), call.parameters(), expansion).thenApply(TemplateEvaluator::flatten))
            .thenApply(results -> substitute(substituted, tokens, results));
    }

    private String resolveParameter(TemplateParameterUse use, List<TemplateParameter> parameters) {
        for (var parameter : parameters) {
            if (parameter.name().equals(use.name())) {
                return parameter.value();
            }
        }

        var magic = context.resolveMagicVariable(use.name());

        if (magic.isPresent()) {
            return magic.get();
        }

        if (use.defaultValue() != null) {
            return WikitextSerializer.toWikitext(use.defaultValue());
        }

        return "";
    }

    private static WikitextSimplifiedNode substitute(WikitextSimplifiedNode node, List<String> tokens, List<WikitextSimplifiedNode> results) {
        return node.visitAndReplace(child -> {
            if (!(child instanceof Text text) || !text.text().contains(PLACEHOLDER_PREFIX)) {
                return child;
            }

            var index = tokens.indexOf(text.text());

            if (index != -1) {
                return results.get(index);
            }

            // placeholder embedded in a longer run, e.g. a serialized parameter default
            var value = text.text();

            for (var i = 0; i < tokens.size(); i++) {
                if (value.contains(tokens.get(i))) {
                    value = value.replace(tokens.get(i), results.get(i).toWikitext());
                }
            }

            return new Text(value);
        });
    }

    /**
     * Cells whose text still carries markup after expansion (typically produced by templates in
     * cell position) are parsed again and instantiated.
     */
    private CompletableFuture<WikitextSimplifiedNode> reparseTableCells(WikitextSimplifiedNode node, Expansion expansion) {
        if (node instanceof Table table) {
            return sequentially(table.rows(), row -> sequentially(row.cells(), cell -> reparseCell(cell, expansion))
                    .thenApply(cells -> new TableRow(row.attributes(), cells)))
                .thenApply(rows -> new Table(table.attributes(), table.captions(), rows));
        } else if (node.children() != null) {
            return sequentially(node.children(), child -> reparseTableCells(child.value(), expansion)
                    .thenApply(value -> new Spanned<>(value, child.span())))
                .thenApply(children -> NodeTraversal.withChildren(node, children));
        } else {
            return CompletableFuture.completedFuture(node);
        }
    }

    private CompletableFuture<TableCell> reparseCell(TableCell cell, Expansion expansion) {
        var wikitext = WikitextSerializer.toWikitext(cell.content());

        if (!hasMarkup(wikitext)) {
            return CompletableFuture.completedFuture(cell);
        }

        List<Spanned<WikitextSimplifiedNode>> parsed;

        try {
            parsed = WikitextSimplified.parseAndSimplify(wikitext, context.configuration());
        } catch (ParsingException e) {
            logger.logp(Level.FINE, "TemplateEvaluator", "reparseCell", "Keeping cell content: " + e.getMessage());
            return CompletableFuture.completedFuture(cell);
        }

        if (parsed.isEmpty()) {
            return CompletableFuture.completedFuture(cell);
        }

        var start = cell.content().isEmpty() ? 0 : cell.content().get(0).span().start();
        var end = cell.content().isEmpty() ? 0 : cell.content().get(cell.content().size() - 1).span().end();

        return instantiate(TemplateTarget.ofNode(new Fragment(parsed)), List.of(), expansion.deeper()).thenApply(result -> {
            if (result instanceof Fragment fragment) {
                return new TableCell(cell.header(), cell.attributes(), fragment.children());
            } else {
                return new TableCell(cell.header(), cell.attributes(), List.of(Spanned.of(result, start, end)));
            }
        });
    }

    private static boolean hasMarkup(String wikitext) {
        return wikitext.contains("[[") || wikitext.contains("'''") || wikitext.contains("''") || wikitext.contains("{{");
    }

    private static boolean contains(WikitextSimplifiedNode node, Predicate<WikitextSimplifiedNode> predicate) {
        var found = new MutableBoolean(false);

        node.visit(child -> {
            if (predicate.test(child)) {
                found.setTrue();
            }
        });

        return found.booleanValue();
    }

    private static WikitextSimplifiedNode flatten(WikitextSimplifiedNode node) {
        if (node instanceof Fragment fragment && fragment.children().size() == 1) {
            return fragment.children().get(0).value();
        }

        return node;
    }

    /**
     * Identifies a call by template and arguments, so that a template nested in its own argument
     * is not mistaken for recursion.
     */
    private static String signature(String key, List<TemplateParameter> parameters) {
        var sb = new StringBuilder(key);

        for (var parameter : parameters) {
            sb.append('|').append(parameter.name()).append('=').append(parameter.value());
        }

        return sb.toString();
    }

    private static Text errorMarker(String message) {
        return new Text("{{" + ERROR_PREFIX + " " + message + "}}");
    }

    private static TemplateException asTemplateException(Throwable error) {
        var cause = error;

        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof TemplateException e) {
            return e;
        }

        return new UserTemplateException(cause);
    }

    /**
     * Runs the action on each item only after the previous one completed.
     */
    private static <T, R> CompletableFuture<List<R>> sequentially(List<T> items, Function<T, CompletableFuture<R>> action) {
        CompletableFuture<List<R>> result = CompletableFuture.completedFuture(new ArrayList<>(items.size()));

        for (var item : items) {
            result = result.thenCompose(list -> action.apply(item).thenApply(value -> {
                list.add(value);
                return list;
            }));
        }

        return result;
    }

    /**
     * Signatures of the calls being expanded, and the nesting depth.
     */
    private record Expansion(Set<String> chain, int depth) {
        Expansion enter(String call) {
            var extended = new HashSet<>(chain);
            extended.add(call);
            return new Expansion(Set.copyOf(extended), depth + 1);
        }

        Expansion deeper() {
            return new Expansion(chain, depth + 1);
        }
    }
}
