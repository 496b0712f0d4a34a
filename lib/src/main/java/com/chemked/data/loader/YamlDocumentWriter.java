package com.chemked.data.loader;

import com.chemked.data.record.ChemKedRecord;
import com.chemked.data.record.RecordDocuments;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/** Writes ChemKED documents as YAML with UNIX line endings. */
public final class YamlDocumentWriter {
    private final YAMLMapper mapper =
            new YAMLMapper(
                    YAMLFactory.builder()
                            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                            .disable(YAMLGenerator.Feature.SPLIT_LINES)
                            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                            .build());

    public String toYaml(Map<String, ?> document) {
        Objects.requireNonNull(document, "document");
        try {
            return mapper.writeValueAsString(document).replace("\r\n", "\n");
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize document: " + ex.getOriginalMessage(), ex);
        }
    }

    public String toYaml(ChemKedRecord record) {
        return toYaml(RecordDocuments.toDocument(record));
    }

    public void write(Map<String, ?> document, Path file) throws IOException {
        Files.writeString(file, toYaml(document), StandardCharsets.UTF_8);
    }

    public void write(ChemKedRecord record, Path file) throws IOException {
        write(RecordDocuments.toDocument(record), file);
    }
}
