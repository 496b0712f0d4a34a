package com.chemked.data.loader.schema;

import com.chemked.data.loader.LoaderException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads schema files, resolving the {@code !include <file>} lines allowed at the top of each file.
 * Included files are spliced in front of the including file so that their anchors are visible to
 * it; their top-level keys are definitions and do not become fields of the root schema.
 */
public final class SchemaLoader {
    private static final Logger LOGGER = Logger.getLogger(SchemaLoader.class.getName());

    private static final String INCLUDE_DIRECTIVE = "!include";
    private static final Pattern TOP_LEVEL_KEY = Pattern.compile("^([^\\s#][^:]*):");

    /** Source of schema file text, addressed by file name. */
    @FunctionalInterface
    public interface SchemaSource {
        /** Text of the named file, or empty when it does not exist. */
        Optional<String> read(String fileName) throws IOException;
    }

    private final SchemaSource source;

    public SchemaLoader(SchemaSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /** Schema files packaged as class path resources below {@code directory}. */
    public static SchemaLoader classpath(ClassLoader classLoader, String directory) {
        Objects.requireNonNull(classLoader, "classLoader");
        String prefix = directory.endsWith("/") ? directory : directory + "/";
        return new SchemaLoader(
                fileName -> {
                    try (InputStream in = classLoader.getResourceAsStream(prefix + fileName)) {
                        if (in == null) {
                            return Optional.empty();
                        }
                        return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
                    }
                });
    }

    /** Schema files in a directory on disk. */
    public static SchemaLoader directory(Path directory) {
        Objects.requireNonNull(directory, "directory");
        return new SchemaLoader(
                fileName -> {
                    try {
                        return Optional.of(Files.readString(directory.resolve(fileName), StandardCharsets.UTF_8));
                    } catch (NoSuchFileException ex) {
                        return Optional.empty();
                    }
                });
    }

    public ChemKedSchema load(String rootFile) throws LoaderException {
        Objects.requireNonNull(rootFile, "rootFile");
        IncludeState state = new IncludeState();
        StringBuilder text = new StringBuilder();
        expand(rootFile, state, text, true);

        Object parsed;
        try {
            parsed = newYaml().load(text.toString());
        } catch (YAMLException ex) {
            throw new LoaderException("Schema " + rootFile + " is not valid YAML: " + ex.getMessage(), ex);
        }
        if (!(parsed instanceof Map<?, ?> definitions)) {
            throw new LoaderException("Schema " + rootFile + " must be a mapping of field definitions");
        }
        Map<Object, Object> fields = new LinkedHashMap<>(definitions);
        fields.keySet().removeAll(state.definitionKeys);
        LOGGER.log(
                Level.FINE,
                "Loaded schema {0} with {1} include(s) and {2} field(s)",
                new Object[] {rootFile, state.includedFiles.size() - 1, fields.size()});
        try {
            return new ChemKedSchema(new SchemaCompiler().compileRoot(fields));
        } catch (IllegalArgumentException ex) {
            throw new LoaderException("Schema " + rootFile + " is invalid: " + ex.getMessage(), ex);
        }
    }

    private void expand(String fileName, IncludeState state, StringBuilder out, boolean root)
            throws LoaderException {
        if (state.activeFiles.contains(fileName)) {
            throw new LoaderException("Recursive include detected: " + fileName);
        }
        if (!state.includedFiles.add(fileName)) {
            return;
        }
        String contents;
        try {
            contents = source.read(fileName).orElseThrow(() -> new NoSuchFileException(fileName));
        } catch (NoSuchFileException ex) {
            throw new LoaderException("Schema file not found: " + fileName, ex);
        } catch (IOException ex) {
            throw new LoaderException("Failed to read schema file: " + fileName, ex);
        }

        state.activeFiles.add(fileName);
        String[] lines = contents.split("\n", -1);
        StringBuilder body = new StringBuilder();
        boolean header = true;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String trimmed = line.strip();
            if (trimmed.startsWith(INCLUDE_DIRECTIVE)) {
                if (!header) {
                    throw new LoaderException(
                            fileName + ":" + (i + 1) + ": include directives must precede schema content");
                }
                String included = trimmed.substring(INCLUDE_DIRECTIVE.length()).strip();
                if (included.isEmpty()) {
                    throw new LoaderException(fileName + ":" + (i + 1) + ": include directive without a file name");
                }
                expand(included, state, out, false);
                continue;
            }
            if (header && !trimmed.isEmpty() && !trimmed.startsWith("#")) {
                header = false;
            }
            body.append(line).append('\n');
            if (!root) {
                Matcher matcher = TOP_LEVEL_KEY.matcher(line);
                if (matcher.find()) {
                    state.definitionKeys.add(unquote(matcher.group(1).strip()));
                }
            }
        }
        state.activeFiles.remove(fileName);
        out.append(body);
    }

    private static String unquote(String key) {
        if (key.length() >= 2
                && (key.startsWith("'") && key.endsWith("'") || key.startsWith("\"") && key.endsWith("\""))) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }

    private static final class IncludeState {
        private final Set<String> activeFiles = new HashSet<>();
        private final Set<String> includedFiles = new LinkedHashSet<>();
        private final List<String> definitionKeys = new ArrayList<>();
    }
}
