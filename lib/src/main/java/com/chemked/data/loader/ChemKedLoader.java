package com.chemked.data.loader;

import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.normalize.DocumentNormalizer;
import com.chemked.data.loader.normalize.NormalizedDocument;
import com.chemked.data.loader.validation.SchemaValidator;
import com.chemked.data.loader.validation.ValidationResult;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.record.ChemKedRecord;
import com.chemked.data.record.RecordBuilder;
import com.chemked.data.record.RecordDocuments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for loading ChemKED documents: YAML text is parsed, normalized, validated against the
 * bundled schema and built into a {@link ChemKedRecord}.
 */
public final class ChemKedLoader {
    private static final Logger LOGGER = Logger.getLogger(ChemKedLoader.class.getName());

    private final YamlDocumentReader reader = new YamlDocumentReader();
    private final DocumentNormalizer normalizer = new DocumentNormalizer();
    private final SchemaValidator validator;
    private final boolean skipValidation;

    /** Loader using the registries configured through system properties or the environment. */
    public ChemKedLoader() {
        this(LookupServices.fromSettings());
    }

    public ChemKedLoader(LookupServices lookups) {
        this(SchemaValidator.standard(lookups), false);
    }

    public ChemKedLoader(SchemaValidator validator) {
        this(validator, false);
    }

    private ChemKedLoader(SchemaValidator validator, boolean skipValidation) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.skipValidation = skipValidation;
    }

    /**
     * A loader that builds records without running the validator. Documents that would fail
     * validation may then fail while building instead, with less precise messages.
     */
    public ChemKedLoader skipValidation() {
        return new ChemKedLoader(validator, true);
    }

    public LoaderResult load(Path file) throws DocumentParseException, LoaderException {
        Objects.requireNonNull(file, "file");
        Object parsed = reader.read(file);
        Path parent = file.toAbsolutePath().getParent();
        return build(normalizer.normalize(parsed), parent, file.toString());
    }

    /**
     * @param contents YAML text
     * @param sourceName name used in messages, typically the file name
     */
    public LoaderResult load(String contents, String sourceName) throws DocumentParseException, LoaderException {
        Object parsed = reader.read(contents, sourceName);
        return build(normalizer.normalize(parsed), null, sourceName);
    }

    /** Load a document that is already in memory as nested maps and lists. */
    public LoaderResult loadMap(Map<String, ?> document) throws DocumentParseException, LoaderException {
        Objects.requireNonNull(document, "document");
        return build(normalizer.normalize(document), null, "<map>");
    }

    /** Validate a document without building a record. */
    public ValidationResult validate(Map<String, ?> document) throws DocumentParseException {
        NormalizedDocument normalized = normalizer.normalize(document);
        List<LoaderMessage> messages = new ArrayList<>(normalized.getMessages());
        messages.addAll(validator.validate(normalized.getRoot()).getMessages());
        return new ValidationResult(messages);
    }

    /** Validate the document form of a record, e.g. after {@code withFileAuthor}. */
    public ValidationResult validate(ChemKedRecord record) throws DocumentParseException {
        return validate(RecordDocuments.toDocument(record));
    }

    private LoaderResult build(NormalizedDocument normalized, Path baseDirectory, String sourceName)
            throws LoaderException {
        List<LoaderMessage> messages = new ArrayList<>(normalized.getMessages());
        MapNode root = normalized.getRoot();
        if (!skipValidation) {
            ValidationResult result = validator.validate(root);
            messages.addAll(result.getMessages());
            List<LoaderMessage> errors = new ArrayList<>();
            for (LoaderMessage message : messages) {
                if (message.isError()) {
                    errors.add(message);
                }
            }
            if (!errors.isEmpty()) {
                LOGGER.log(
                        Level.FINE,
                        "{0} failed validation with {1} error(s)",
                        new Object[] {sourceName, errors.size()});
                throw new LoaderException(errors);
            }
        }
        ChemKedRecord record;
        try {
            record = new RecordBuilder(baseDirectory).build(root, messages);
        } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException ex) {
            throw new LoaderException("Unable to build record from " + sourceName + ": " + ex.getMessage(), ex);
        }
        LOGGER.log(
                Level.FINE,
                "Loaded {0} with {1} data point(s)",
                new Object[] {sourceName, record.getDatapoints().size()});
        return new LoaderResult(record, messages, root);
    }
}
