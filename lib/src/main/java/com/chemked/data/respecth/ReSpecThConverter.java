package com.chemked.data.respecth;

import com.chemked.data.loader.ChemKedLoader;
import com.chemked.data.loader.DocumentParseException;
import com.chemked.data.loader.LoaderException;
import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderResult;
import com.chemked.data.loader.YamlDocumentWriter;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.record.Author;
import com.chemked.data.record.ChemKedRecord;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.w3c.dom.Document;

/**
 * Converts between ChemKED YAML files and ReSpecTh XML files. Both directions validate the ChemKED
 * side with the schema validator, so a converted file is never written for a document that would
 * not load.
 */
public final class ReSpecThConverter {
    private static final Logger LOGGER = Logger.getLogger(ReSpecThConverter.class.getName());

    private final ReSpecThReader reader;
    private final ReSpecThWriter writer = new ReSpecThWriter();
    private final ChemKedLoader loader;
    private final YamlDocumentWriter yamlWriter = new YamlDocumentWriter();

    public ReSpecThConverter(LookupServices lookups) {
        this(lookups, new ChemKedLoader(lookups));
    }

    public ReSpecThConverter(LookupServices lookups, ChemKedLoader loader) {
        Objects.requireNonNull(lookups, "lookups");
        this.reader = new ReSpecThReader(lookups.bibliographic());
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * The file author override given on a command line or in a call.
     *
     * @return the author, or null when neither a name nor an ORCID is given
     * @throws ConversionException if an ORCID is given without a name
     */
    public static Author fileAuthor(String name, String orcid) throws ConversionException {
        boolean hasName = name != null && !name.isBlank();
        boolean hasOrcid = orcid != null && !orcid.isBlank();
        if (hasOrcid && !hasName) {
            throw new ConversionException(
                    "", "If a file author ORCID is specified, the file author name must be as well");
        }
        return hasName ? new Author(name.strip(), hasOrcid ? orcid.strip() : null) : null;
    }

    /** ChemKED document properties read from a ReSpecTh file, not yet validated. */
    public ConversionResult<Map<String, Object>> readReSpecTh(Path xmlFile, Author fileAuthor)
            throws IOException, ConversionException {
        return reader.read(xmlFile, fileAuthor);
    }

    /** Read and validate a ReSpecTh file as a ChemKED record. */
    public ConversionResult<ChemKedRecord> toChemKed(Path xmlFile, Author fileAuthor)
            throws IOException, ConversionException, DocumentParseException, LoaderException {
        ConversionResult<Map<String, Object>> properties = reader.read(xmlFile, fileAuthor);
        LoaderResult loaded = loader.loadMap(properties.getOutput());
        logWarnings(loaded);
        return new ConversionResult<>(loaded.getRecord(), properties.getReport());
    }

    /** @param fileAuthor author written instead of the record's first file author, or null */
    public ConversionResult<Document> toReSpecTh(ChemKedRecord record, Author fileAuthor) throws ConversionException {
        return writer.write(record, fileAuthor);
    }

    /** Convert a ReSpecTh file into a validated ChemKED YAML file. */
    public ConversionReport convertXmlToYaml(Path xmlFile, Path yamlFile, Author fileAuthor)
            throws IOException, ConversionException, DocumentParseException, LoaderException {
        ConversionResult<Map<String, Object>> properties = reader.read(xmlFile, fileAuthor);
        logWarnings(loader.loadMap(properties.getOutput()));
        yamlWriter.write(properties.getOutput(), yamlFile);
        LOGGER.log(Level.INFO, "Converted {0} to {1}", new Object[] {xmlFile, yamlFile});
        return properties.getReport();
    }

    /** Convert a ChemKED YAML file into a ReSpecTh file. */
    public ConversionReport convertYamlToXml(Path yamlFile, Path xmlFile, Author fileAuthor)
            throws IOException, ConversionException, DocumentParseException, LoaderException {
        LoaderResult loaded = loader.load(yamlFile);
        logWarnings(loaded);
        ConversionResult<Document> converted = writer.write(loaded.getRecord(), fileAuthor);
        try (OutputStream out = Files.newOutputStream(xmlFile)) {
            writeXml(converted.getOutput(), out);
        }
        LOGGER.log(Level.INFO, "Converted {0} to {1}", new Object[] {yamlFile, xmlFile});
        return converted.getReport();
    }

    public static void writeXml(Document document, OutputStream out) throws IOException {
        ReSpecThXml.write(document, out);
    }

    private static void logWarnings(LoaderResult loaded) {
        for (LoaderMessage warning : loaded.getWarnings()) {
            LOGGER.log(Level.WARNING, "{0}", warning);
        }
    }
}
