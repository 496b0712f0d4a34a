package com.chemked.data.respecth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chemked.data.lookup.OfflineLookup;
import com.chemked.data.record.Author;
import com.chemked.data.testing.InMemoryLookups;
import com.chemked.data.testing.TestResources;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

final class ReSpecThReaderTest {

    private final ReSpecThReader reader = new ReSpecThReader(InMemoryLookups.standard().bibliographic());

    private ConversionResult<Map<String, Object>> readEdited(String resource, UnaryOperator<String> edit)
            throws Exception {
        String xml = edit.apply(TestResources.readResource(resource));
        return reader.read(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "edited.xml", null);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> datapoints(Map<String, Object> properties) {
        return (List<Map<String, Object>>) properties.get("datapoints");
    }

    @Test
    @SuppressWarnings("unchecked")
    void readsShockTubeFile() throws Exception {
        ConversionResult<Map<String, Object>> result =
                reader.read(TestResources.resolveResource("respecth/ignition_st.xml"), null);
        Map<String, Object> properties = result.getOutput();

        assertEquals(List.of(Map.of("name", "Tamas Varga")), properties.get("file-authors"));
        assertEquals(0, properties.get("file-version"));
        assertEquals("ignition delay", properties.get("experiment-type"));
        assertEquals(Map.of("kind", "shock tube"), properties.get("apparatus"));

        Map<String, Object> reference = (Map<String, Object>) properties.get("reference");
        assertEquals(InMemoryLookups.CHAUMEIX_2007_DOI, reference.get("doi"));
        assertEquals(2007, reference.get("year"));
        assertEquals(32, reference.get("volume"));
        assertEquals("2216-2226", reference.get("pages"));
        assertEquals("International Journal of Hydrogen Energy", reference.get("journal"));
        assertEquals(
                List.of(
                        Map.of("name", "N. Chaumeix"),
                        Map.of("name", "S. Pichon"),
                        Map.of("name", "F. Lafosse"),
                        Map.of("name", "C.-E. Paillard")),
                reference.get("authors"));
        assertEquals("Converted from ReSpecTh XML file ignition_st.xml", reference.get("detail"));
        assertEquals(
                List.of("Using DOI to obtain reference information, rather than preferredKey."),
                result.getReport().getNotes());

        List<Map<String, Object>> datapoints = datapoints(properties);
        assertEquals(2, datapoints.size());
        Map<String, Object> first = datapoints.get(0);
        assertEquals(
                List.of("1164.48 K", Map.of("uncertainty-type", "absolute", "uncertainty", 10.0)),
                first.get("temperature"));
        assertEquals(
                List.of("471.54 us", Map.of("uncertainty-type", "relative", "uncertainty", 0.1)),
                first.get("ignition-delay"));
        assertEquals(List.of("220.0 kPa"), first.get("pressure"));
        assertEquals(List.of("0.1 1/ms"), first.get("pressure-rise"));
        assertEquals(0.4, first.get("equivalence-ratio"));
        assertEquals(Map.of("target", "pressure", "type", "d/dt max"), first.get("ignition-type"));

        Map<String, Object> composition = (Map<String, Object>) first.get("composition");
        assertEquals("mole fraction", composition.get("kind"));
        assertEquals(
                Map.of("species-name", "H2", "InChI", "1S/H2/h1H", "amount", List.of(0.00444)),
                ((List<Object>) composition.get("species")).get(0));

        Map<String, Object> second = datapoints.get(1);
        assertEquals(
                List.of("299.47 us", Map.of("uncertainty-type", "relative", "uncertainty", 0.2)),
                second.get("ignition-delay"));
        assertEquals(
                List.of("1264.2 K", Map.of("uncertainty-type", "absolute", "uncertainty", 10.0)),
                second.get("temperature"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void readsRapidCompressionMachineFileWithHistory() throws Exception {
        ConversionResult<Map<String, Object>> result =
                reader.read(
                        TestResources.resolveResource("respecth/ignition_rcm.xml"),
                        new Author("Jane Doe", "0000-0002-1825-0097"));
        Map<String, Object> properties = result.getOutput();

        assertEquals(
                List.of(
                        Map.of("name", "Kyle E Niemeyer"),
                        Map.of("name", "Jane Doe", "ORCID", "0000-0002-1825-0097")),
                properties.get("file-authors"));
        assertTrue(result.getReport().getNotes().contains("Assuming percent in composition means mole percent"));

        List<Map<String, Object>> datapoints = datapoints(properties);
        assertEquals(1, datapoints.size());
        Map<String, Object> point = datapoints.get(0);
        assertEquals(List.of("958.0 torr"), point.get("pressure"));
        assertEquals(List.of("297.4 K"), point.get("temperature"));
        assertEquals(List.of("1.0 ms"), point.get("ignition-delay"));
        assertEquals("mole percent", ((Map<String, Object>) point.get("composition")).get("kind"));

        List<Object> histories = (List<Object>) point.get("time-histories");
        assertEquals(1, histories.size());
        Map<String, Object> volume = (Map<String, Object>) histories.get(0);
        assertEquals("volume", volume.get("type"));
        assertEquals(Map.of("units", "s", "column", 0), volume.get("time"));
        assertEquals(Map.of("units", "cm3", "column", 1), volume.get("quantity"));
        List<Object> values = (List<Object>) volume.get("values");
        assertEquals(3, values.size());
        assertEquals(List.of(0.001, 546.608789894), values.get(1));
    }

    @Test
    void fallsBackToPreferredKeyWithoutRegistry() throws Exception {
        ReSpecThReader offline = new ReSpecThReader(OfflineLookup.bibliographic());
        ConversionResult<Map<String, Object>> result =
                offline.read(TestResources.resolveResource("respecth/ignition_st.xml"), null);

        @SuppressWarnings("unchecked")
        Map<String, Object> reference = (Map<String, Object>) result.getOutput().get("reference");
        assertEquals(
                Map.of(
                        "detail",
                        "N. Chaumeix, S. Pichon, F. Lafosse, C.-E. Paillard, International Journal of Hydrogen "
                                + "Energy 32 (2007) 2216-2226. Converted from ReSpecTh XML file ignition_st.xml"),
                reference);
        assertEquals(1, result.getReport().getNotes().size());
        assertTrue(result.getReport().getNotes().get(0).startsWith("DOI lookup failed."));
    }

    @Test
    void convertsPartsPerMillion() throws Exception {
        ConversionResult<Map<String, Object>> result =
                readEdited(
                        "respecth/ignition_st.xml",
                        xml -> xml.replace(
                                "<amount units=\"mole fraction\">0.00444</amount>",
                                "<amount units=\"ppm\">4440</amount>"));

        @SuppressWarnings("unchecked")
        Map<String, Object> composition =
                (Map<String, Object>) datapoints(result.getOutput()).get(0).get("composition");
        assertEquals("mole fraction", composition.get("kind"));
        assertEquals(
                Map.of("species-name", "H2", "InChI", "1S/H2/h1H", "amount", List.of(0.00444)),
                ((List<?>) composition.get("species")).get(0));
        assertTrue(
                result.getReport()
                        .getNotes()
                        .contains("Assuming molar ppm in composition and converting to mole fraction"));
    }

    @Test
    void commonPropertiesOverrideDatapointValues() throws Exception {
        ConversionResult<Map<String, Object>> result =
                readEdited(
                        "respecth/ignition_st.xml",
                        xml -> xml.replace(
                                "<property name=\"equivalence ratio\" id=\"x3\" label=\"phi\" units=\"unitless\" "
                                        + "sourcetype=\"reported\"/>",
                                "<property name=\"pressure\" id=\"x3\" label=\"p\" units=\"atm\" "
                                        + "sourcetype=\"reported\"/>"));

        List<Map<String, Object>> datapoints = datapoints(result.getOutput());
        assertEquals(List.of("220.0 kPa"), datapoints.get(0).get("pressure"));
        assertFalse(datapoints.get(0).containsKey("equivalence-ratio"));
    }

    @Test
    void rejectsUnsupportedFiles() {
        ConversionException multipleTargets =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited("respecth/ignition_st.xml", xml -> xml.replace("\"P;\"", "\"P;OH;\"")));
        assertEquals(
                "experiment/ignitionType: Multiple ignition targets not supported.", multipleTargets.getMessage());

        ConversionException pressureRise =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited(
                                "respecth/ignition_st.xml",
                                xml -> xml.replace(
                                        "<kind>shock tube</kind>", "<kind>rapid compression machine</kind>")));
        assertEquals("experiment: Pressure rise cannot be defined for RCM.", pressureRise.getMessage());

        ConversionException volumeHistory =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited(
                                "respecth/ignition_rcm.xml",
                                xml -> xml.replace(
                                        "<kind>rapid compression machine</kind>", "<kind>shock tube</kind>")));
        assertEquals("experiment: Volume history cannot be defined for shock tube.", volumeHistory.getMessage());

        ConversionException noAuthor =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited(
                                "respecth/ignition_st.xml",
                                xml -> xml.replace("<fileAuthor>Tamas Varga</fileAuthor>", "")));
        assertEquals("experiment: required element fileAuthor is missing", noAuthor.getMessage());

        ConversionException experiment =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited(
                                "respecth/ignition_st.xml",
                                xml -> xml.replace(
                                        "Ignition delay measurement", "Laminar burning velocity measurement")));
        assertEquals(
                "experiment/experimentType: Laminar burning velocity measurement not (yet) supported",
                experiment.getMessage());

        ConversionException units =
                assertThrows(
                        ConversionException.class,
                        () -> readEdited(
                                "respecth/ignition_st.xml",
                                xml -> xml.replace("units=\"kPa\"", "units=\"K\"")));
        assertTrue(units.getMessage().endsWith("units incompatible for property pressure"), units.getMessage());
    }

    @Test
    void rejectsOtherXmlDocuments() {
        ConversionException ex =
                assertThrows(
                        ConversionException.class,
                        () -> reader.read(
                                new ByteArrayInputStream("<dataset/>".getBytes(StandardCharsets.UTF_8)),
                                "other.xml",
                                null));
        assertEquals("dataset: root element must be <experiment>", ex.getMessage());
    }
}
