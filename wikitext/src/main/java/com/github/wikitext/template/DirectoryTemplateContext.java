package com.github.wikitext.template;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.ArrayUtils;

import com.github.wikitext.parsing.Configuration;

/**
 * Templates stored as {@code *.wikitext} or {@code *.txt} files below a directory. The path
 * relative to the directory, without extension, is the template name, so {@code Lua/CellAlign}
 * lives in {@code lua/cellalign.wikitext}. The directory is scanned once, on first use.
 */
public class DirectoryTemplateContext implements TemplateContext {
    private static final String[] EXTENSIONS = {"wikitext", "txt"};

    private final Logger logger = Logger.getLogger("wikitext-templates");
    private final Path directory;
    private final Configuration configuration;
    private final Executor executor;
    private final Map<String, String> magicVariables;
    private Map<String, Path> index;

    public DirectoryTemplateContext(Path directory, Configuration configuration, Executor executor) {
        this(directory, configuration, executor, Map.of());
    }

    public DirectoryTemplateContext(Path directory, Configuration configuration, Executor executor, Map<String, String> magicVariables) {
        this.directory = Objects.requireNonNull(directory);
        this.configuration = Objects.requireNonNull(configuration);
        this.executor = Objects.requireNonNull(executor);
        this.magicVariables = Map.copyOf(magicVariables);
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public Optional<String> resolveMagicVariable(String name) {
        return Optional.ofNullable(magicVariables.get(name));
    }

    @Override
    public CompletableFuture<String> loadTemplate(String name) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return read(name);
            } catch (TemplateException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    private String read(String name) throws TemplateException {
        var key = TemplateKeys.normalize(name);
        var path = index().get(key);

        if (path == null) {
            throw new TemplateNotFoundException(name, key);
        }

        try {
            logger.logp(Level.FINE, "DirectoryTemplateContext", "read", "Loading {0} from {1}", new Object[] {name, path});
            return FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoadFailedException(name, path.toString(), e);
        }
    }

    synchronized Map<String, Path> index() throws DirectoryScanFailedException {
        if (index == null) {
            try (var stream = Files.walk(directory)) {
                index = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> FilenameUtils.isExtension(path.getFileName().toString(), EXTENSIONS))
                    .collect(Collectors.toMap(this::keyOf, path -> path, DirectoryTemplateContext::preferred, HashMap::new));
            } catch (IOException e) {
                throw new DirectoryScanFailedException(directory.toString(), e);
            } catch (UncheckedIOException e) {
                throw new DirectoryScanFailedException(directory.toString(), e.getCause());
            }

            logger.logp(Level.INFO, "DirectoryTemplateContext", "index", "Found {0} templates in {1}", new Object[] {index.size(), directory});
        }

        return index;
    }

    /**
     * Picks between two files for the same template: {@code .wikitext} over {@code .txt}, then
     * the lexicographically smaller path.
     */
    private static Path preferred(Path first, Path second) {
        var byExtension = Integer.compare(rank(first), rank(second));

        if (byExtension != 0) {
            return byExtension < 0 ? first : second;
        }

        return first.compareTo(second) <= 0 ? first : second;
    }

    private static int rank(Path path) {
        return ArrayUtils.indexOf(EXTENSIONS, FilenameUtils.getExtension(path.getFileName().toString()));
    }

    private String keyOf(Path path) {
        var relative = FilenameUtils.separatorsToUnix(directory.relativize(path).toString());
        return TemplateKeys.normalize(FilenameUtils.removeExtension(relative));
    }
}
