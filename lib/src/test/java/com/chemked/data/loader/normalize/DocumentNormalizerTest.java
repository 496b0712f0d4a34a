package com.chemked.data.loader.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chemked.data.loader.DocumentParseException;
import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.YamlDocumentReader;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class DocumentNormalizerTest {

    private static final String ANCHORED =
            String.join(
                    "\n",
                    "common-properties:",
                    "  pressure: &pres",
                    "    - 220 kPa",
                    "  ignition-type: &ign",
                    "    target: pressure",
                    "    type: d/dt max",
                    "datapoints:",
                    "  - temperature: [1164.48 K]",
                    "    pressure: *pres",
                    "    ignition-type: *ign",
                    "  - temperature: [1264.2 K]",
                    "    pressure: *pres",
                    "");

    private final DocumentNormalizer normalizer = new DocumentNormalizer();

    @Test
    void dropsCommonPropertiesAndKeepsExpandedAliases() throws Exception {
        Object parsed = new YamlDocumentReader().read(ANCHORED, "anchored.yaml");
        NormalizedDocument normalized = normalizer.normalize(parsed);
        MapNode root = normalized.getRoot();

        assertFalse(root.has(DocumentNormalizer.COMMON_PROPERTIES));
        ListNode datapoints = root.list(DocumentNormalizer.DATAPOINTS).orElseThrow();
        MapNode first = (MapNode) datapoints.get(0);
        MapNode second = (MapNode) datapoints.get(1);
        assertEquals(List.of("220 kPa"), first.get("pressure").toPlain());
        assertEquals(List.of("220 kPa"), second.get("pressure").toPlain());
        assertEquals("datapoints[0].pressure", first.get("pressure").getPath().toString());
        assertEquals("datapoints[1].pressure[0]", second.list("pressure").orElseThrow().get(0).getPath().toString());
    }

    @Test
    void omittedCommonPropertiesAreReportedNotInherited() throws Exception {
        Object parsed = new YamlDocumentReader().read(ANCHORED, "anchored.yaml");
        NormalizedDocument normalized = normalizer.normalize(parsed);

        MapNode second = (MapNode) normalized.getRoot().list("datapoints").orElseThrow().get(1);
        assertFalse(second.has("ignition-type"));

        List<LoaderMessage> messages = normalized.getMessages();
        assertEquals(1, messages.size());
        LoaderMessage warning = messages.get(0);
        assertEquals(LoaderMessage.Level.WARNING, warning.getLevel());
        assertEquals(Category.NORMALIZATION, warning.getCategory());
        assertEquals("datapoints[1]", warning.getPath());
        assertEquals(
                "common property 'ignition-type' is not referenced by this data point; "
                        + "common properties are not inherited",
                warning.getMessage());
    }

    @Test
    void commonPropertiesMustBeAMapping() throws Exception {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("common-properties", List.of("220 kPa"));
        document.put("datapoints", List.of(Map.of("temperature", List.of("1000 K"))));

        NormalizedDocument normalized = normalizer.normalize(document);
        assertFalse(normalized.getRoot().has("common-properties"));
        assertEquals(1, normalized.getMessages().size());
        LoaderMessage error = normalized.getMessages().get(0);
        assertTrue(error.isError());
        assertEquals(Category.STRUCTURAL, error.getCategory());
        assertEquals("common-properties", error.getPath());
        assertEquals("must be of dict type", error.getMessage());
    }

    @Test
    void documentsWithoutCommonPropertiesPassThrough() throws Exception {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("file-version", 0);
        document.put("datapoints", List.of(Map.of("temperature", List.of("1000 K"))));

        NormalizedDocument normalized = normalizer.normalize(document);
        assertTrue(normalized.getMessages().isEmpty());
        assertEquals(document, normalized.getRoot().toPlain());
    }

    @Test
    void rootMustBeAMapping() {
        DocumentParseException empty = assertThrows(DocumentParseException.class, () -> normalizer.normalize(null));
        assertTrue(empty.getMessage().contains("an empty document"));
        assertThrows(DocumentParseException.class, () -> normalizer.normalize(List.of("datapoints")));
    }
}
