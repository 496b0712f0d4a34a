package com.chemked.data.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads ChemKED YAML text into plain maps and lists. Anchors and aliases are resolved by the parser;
 * everything beyond core YAML types is refused.
 */
public final class YamlDocumentReader {
    private static final Logger LOGGER = Logger.getLogger(YamlDocumentReader.class.getName());

    static final String INCLUDE_DIRECTIVE = "!include";
    private static final int MAX_ALIASES = 10_000;

    public Object read(Path file) throws DocumentParseException {
        Objects.requireNonNull(file, "file");
        String contents;
        try {
            contents = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new DocumentParseException("Document file not found: " + file, ex);
        } catch (IOException ex) {
            throw new DocumentParseException("Unable to read " + file + ": " + ex.getMessage(), ex);
        }
        return read(contents, file.toString());
    }

    public Object read(String contents, String sourceName) throws DocumentParseException {
        Objects.requireNonNull(contents, "contents");
        int carriageReturn = contents.indexOf('\r');
        if (carriageReturn >= 0) {
            int line = lineOf(contents, carriageReturn);
            throw new DocumentParseException(
                    sourceName + ":" + line + ": carriage return found; ChemKED files must use UNIX line endings");
        }
        String[] lines = contents.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].stripLeading().startsWith(INCLUDE_DIRECTIVE)) {
                throw new DocumentParseException(
                        sourceName + ":" + (i + 1) + ": include directives are only allowed in schema files");
            }
        }
        LOGGER.log(Level.FINE, "Parsing YAML document {0}", sourceName);
        try {
            return newYaml().load(contents);
        } catch (YAMLException ex) {
            throw new DocumentParseException(sourceName + ": " + ex.getMessage(), ex);
        }
    }

    static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        options.setMaxAliasesForCollections(MAX_ALIASES);
        return new Yaml(new SafeConstructor(options));
    }

    private static int lineOf(String contents, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (contents.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
