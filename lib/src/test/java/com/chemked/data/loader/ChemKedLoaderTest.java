package com.chemked.data.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.validation.ValidationResult;
import com.chemked.data.lookup.LookupServices;
import com.chemked.data.quantity.Quantity;
import com.chemked.data.record.ApparatusKind;
import com.chemked.data.record.ChemKedRecord;
import com.chemked.data.record.DataPoint;
import com.chemked.data.record.IgnitionMeasure;
import com.chemked.data.record.IgnitionTarget;
import com.chemked.data.record.RcmConditions;
import com.chemked.data.record.RecordDocuments;
import com.chemked.data.record.TimeHistory;
import com.chemked.data.record.TimeHistoryType;
import com.chemked.data.testing.TestResources;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class ChemKedLoaderTest {

    private final ChemKedLoader loader = new ChemKedLoader(LookupServices.offline());

    @Test
    void loadsRapidCompressionMachineDocument() throws Exception {
        LoaderResult result = loader.load(TestResources.resolveResource("documents/testfile_rcm.yaml"));
        ChemKedRecord record = result.getRecord();

        assertEquals("Kyle E Niemeyer", record.getFileAuthors().get(0).getName());
        assertEquals("0000-0003-4425-7097", record.getFileAuthors().get(0).getOrcid().orElseThrow());
        assertEquals(0, record.getFileVersion());
        assertEquals("0.4.1", record.getChemKedVersion());
        assertEquals("10.1002/kin.20180", record.getReference().getDoi().orElseThrow());
        assertEquals(3, record.getReference().getAuthors().size());
        assertEquals(38, record.getReference().getVolume().getAsInt());
        assertEquals(ApparatusKind.RAPID_COMPRESSION_MACHINE, record.getApparatus().getKind());
        assertEquals("CWRU RCM", record.getApparatus().getFacility().orElseThrow());
        assertEquals(2, record.getDatapoints().size());

        DataPoint first = record.getDatapoints().get(0);
        assertEquals(Quantity.parse("297.4 kelvin"), first.getTemperature());
        assertEquals(127722.76, first.getPressure("Pa").getMagnitude(), 0.01);
        assertEquals(0.001, first.getIgnitionDelay("s").getMagnitude(), 1e-12);
        assertEquals(IgnitionTarget.PRESSURE, first.getIgnitionType().target());
        assertEquals(IgnitionMeasure.D_DT_MAX, first.getIgnitionType().measure());
        assertTrue(first.getPressureRise().isEmpty());

        RcmConditions rcm = first.getRcmConditions().orElseThrow();
        assertEquals(Quantity.parse("38.0 ms"), rcm.getCompressionTime().orElseThrow());
        assertTrue(rcm.getCompressedPressure().isEmpty());

        TimeHistory volume = first.getTimeHistory(TimeHistoryType.VOLUME).orElseThrow();
        assertEquals(6, volume.size());
        assertEquals(Quantity.of(0.0, "s"), volume.getTimes().get(0));
        assertEquals(Quantity.of(547.669375, "cm3"), volume.getQuantities().get(0));
        assertEquals(0.005, volume.getTimes().get(5).getMagnitude(), 1e-15);

        DataPoint second = record.getDatapoints().get(1);
        assertTrue(second.getTimeHistories().isEmpty());
        assertEquals(2.0, second.getIgnitionDelay().getMagnitude());
    }

    @Test
    void offlineLookupsOnlyProduceWarnings() throws Exception {
        LoaderResult result = loader.load(TestResources.resolveResource("documents/testfile_rcm.yaml"));

        List<LoaderMessage> warnings = result.getWarnings();
        assertFalse(warnings.isEmpty());
        assertTrue(warnings.stream().allMatch(message -> message.getCategory() == Category.LOOKUP));
        assertTrue(
                warnings.stream()
                        .anyMatch(message -> message.getMessage().equals("network not available, DOI not validated.")));
        assertTrue(
                warnings.stream()
                        .anyMatch(message -> message.getPath().equals("file-authors[0]")
                                && message.getMessage().equals("network not available, ORCID not validated.")));
    }

    @Test
    void commonPropertiesAreConsumedWithoutInheritance() throws Exception {
        LoaderResult result = loader.load(TestResources.resolveResource("documents/testfile_st.yaml"));
        ChemKedRecord record = result.getRecord();

        assertFalse(result.getDocument().has("common-properties"));
        assertEquals(3, record.getDatapoints().size());
        for (DataPoint point : record.getDatapoints()) {
            assertEquals(Quantity.parse("220 kPa"), point.getPressure());
            assertEquals(0.4, point.getEquivalenceRatio().getAsDouble());
            assertEquals("H2:0.00444, O2:0.00556, Ar:0.99", point.getMoleFractionString());
        }
        assertEquals(Quantity.parse("0.10 1/ms"), record.getDatapoints().get(0).getPressureRise().orElseThrow());
        assertTrue(record.getDatapoints().get(2).getPressureRise().isEmpty());

        List<LoaderMessage> normalization =
                result.getWarnings().stream()
                        .filter(message -> message.getCategory() == Category.NORMALIZATION)
                        .collect(Collectors.toList());
        assertEquals(1, normalization.size());
        assertEquals("datapoints[2]", normalization.get(0).getPath());
        assertTrue(normalization.get(0).getMessage().startsWith("common property 'pressure-rise'"));
    }

    @Test
    void uncertaintiesAreCarriedIntoTheModel() throws Exception {
        LoaderResult result = loader.load(TestResources.resolveResource("documents/testfile_st.yaml"));
        List<DataPoint> points = result.getRecord().getDatapoints();

        assertTrue(points.get(0).getTemperature().getUncertainty().isEmpty());
        assertEquals(10.0, points.get(1).getTemperature().getAbsoluteUncertainty().getAsDouble());
        assertEquals(47.154, points.get(1).getIgnitionDelay().getAbsoluteUncertainty().getAsDouble(), 1e-9);
        assertEquals(0.1, points.get(1).getIgnitionDelay().getRelativeUncertainty().getAsDouble());

        // upper 5 K, lower 3 K
        assertEquals(5.0, points.get(2).getTemperature().getAbsoluteUncertainty().getAsDouble());
        List<LoaderMessage> model =
                result.getWarnings().stream()
                        .filter(message -> message.getCategory() == Category.MODEL)
                        .collect(Collectors.toList());
        assertEquals(1, model.size());
        assertEquals("datapoints[2].temperature[1]", model.get(0).getPath());
        assertTrue(model.get(0).getMessage().startsWith("Asymmetric uncertainties are not supported"));
    }

    @Test
    void dimensionlessUncertaintiesThatValidateAlsoLoad() throws Exception {
        String yaml =
                TestResources.readResource("documents/testfile_rcm.yaml")
                        .replaceFirst(
                                "            - 0.12500\n",
                                "            - 0.12500\n            - uncertainty-type: absolute\n"
                                        + "              uncertainty: 0.01\n")
                        .replaceFirst(
                                "          column: 1\n",
                                "          column: 1\n        uncertainty:\n          type: relative\n"
                                        + "          value: 0.05\n");

        DataPoint point = loader.load(yaml, "uncertain.yaml").getRecord().getDatapoints().get(0);
        Quantity hydrogen = point.getComposition().getSpecies().get(0).getAmount();
        assertEquals(0.01, hydrogen.getAbsoluteUncertainty().getAsDouble(), 1e-12);
        assertEquals(0.05, point.getTimeHistories().get(0).getUncertainty().get().getValue(), 1e-12);
    }

    @Test
    void readsHistoryRowsFromSiblingFile() throws Exception {
        TestResources.resolveResource("documents/pressure_history.csv");
        LoaderResult result = loader.load(TestResources.resolveResource("documents/testfile_rcm_csv.yaml"));
        DataPoint point = result.getRecord().getDatapoints().get(0);

        TimeHistory pressure = point.getTimeHistory(TimeHistoryType.PRESSURE).orElseThrow();
        assertEquals(3, pressure.size());
        assertEquals(List.of(Quantity.of(0.0, "ms"), Quantity.of(10.0, "ms"), Quantity.of(20.0, "ms")),
                pressure.getTimes());
        assertEquals(Quantity.of(12.5, "bar"), pressure.getQuantities().get(2));
        assertEquals(1.25e6, pressure.getQuantities().get(2).magnitudeIn("Pa"), 1e-6);
        assertTrue(point.getRcmConditions().orElseThrow().isEmpty());
    }

    @Test
    void missingHistoryFileFailsWhileBuilding() throws Exception {
        Path dir = Files.createTempDirectory("chemked-loader");
        Path document = TestResources.copyToDirectory("documents/testfile_rcm_csv.yaml", dir);

        LoaderException ex = assertThrows(LoaderException.class, () -> loader.load(document));
        assertTrue(ex.getMessage().contains("pressure_history.csv"));
        assertTrue(ex.getErrors().isEmpty());
    }

    @Test
    void reportsEveryValidationError() throws Exception {
        String yaml =
                TestResources.readResource("documents/testfile_rcm.yaml")
                                .replaceFirst("297\\.4 kelvin", "-297.4 kelvin")
                                .replaceFirst("958\\.0 torr", "958.0 meter")
                                .replace("year: 2006", "year: 1600")
                                .stripTrailing()
                        + "\n    pressure-rise:\n      - 0.1 1/ms\n";

        LoaderException ex = assertThrows(LoaderException.class, () -> loader.load(yaml, "broken.yaml"));
        List<String> errors =
                ex.getErrors().stream()
                        .map(error -> error.getPath() + ": " + error.getMessage())
                        .collect(Collectors.toList());
        assertTrue(errors.contains("reference.year: min value is 1601"), errors::toString);
        assertTrue(errors.contains("datapoints[0].temperature[0]: value must be greater than 0.0 K"), errors::toString);
        assertTrue(
                errors.contains("datapoints[0].pressure[0]: incompatible units; should be consistent with Pa"),
                errors::toString);
        assertTrue(
                errors.contains(
                        "datapoints[1].pressure-rise: pressure-rise is not valid for rapid compression machine "
                                + "experiments"),
                errors::toString);
        assertTrue(ex.getMessage().startsWith("Validation failed with"));
    }

    @Test
    void skipValidationBuildsDocumentsThatWouldFail() throws Exception {
        String yaml = TestResources.readResource("documents/testfile_rcm.yaml").replace("year: 2006", "year: 1600");

        assertThrows(LoaderException.class, () -> loader.load(yaml, "old.yaml"));
        ChemKedRecord record = loader.skipValidation().load(yaml, "old.yaml").getRecord();
        assertEquals(1600, record.getReference().getYear());
    }

    @Test
    void rejectsDocumentsThatAreNotChemKedYaml() {
        DocumentParseException windows =
                assertThrows(
                        DocumentParseException.class,
                        () -> loader.load("file-version: 0\r\nchemked-version: 0.4.1\r\n", "dos.yaml"));
        assertTrue(windows.getMessage().contains("carriage return found"));

        DocumentParseException include =
                assertThrows(
                        DocumentParseException.class, () -> loader.load("!include other.yaml\n", "include.yaml"));
        assertTrue(include.getMessage().contains("include directives are only allowed in schema files"));

        DocumentParseException scalar =
                assertThrows(DocumentParseException.class, () -> loader.load("just text\n", "scalar.yaml"));
        assertTrue(scalar.getMessage().contains("must be a mapping"));

        assertThrows(DocumentParseException.class, () -> loader.load(Path.of("does-not-exist.yaml")));
    }

    @Test
    void validatesRecordsAfterEditing() throws Exception {
        ChemKedRecord record =
                loader.load(TestResources.resolveResource("documents/testfile_rcm.yaml")).getRecord();
        ValidationResult valid = loader.validate(record.withFileVersion(2));
        assertTrue(valid.isValid(), valid::toString);

        Map<String, Object> document = RecordDocuments.toDocument(record);
        document.put("file-version", -1);
        ValidationResult invalid = loader.validate(document);
        assertFalse(invalid.isValid());
        LoaderMessage error = invalid.getErrors().get(0);
        assertEquals("file-version", error.getPath());
        assertEquals("min value is 0", error.getMessage());
        assertNotNull(error.toString());
    }
}
