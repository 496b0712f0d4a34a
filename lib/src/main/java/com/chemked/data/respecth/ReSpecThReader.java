package com.chemked.data.respecth;

import static com.chemked.data.respecth.ReSpecThXml.attribute;
import static com.chemked.data.respecth.ReSpecThXml.child;
import static com.chemked.data.respecth.ReSpecThXml.childText;
import static com.chemked.data.respecth.ReSpecThXml.children;
import static com.chemked.data.respecth.ReSpecThXml.path;
import static com.chemked.data.respecth.ReSpecThXml.text;

import com.chemked.data.Version;
import com.chemked.data.lookup.BibliographicLookup;
import com.chemked.data.lookup.BibliographicRecord;
import com.chemked.data.lookup.LookupUnavailableException;
import com.chemked.data.quantity.DecimalText;
import com.chemked.data.quantity.PropertyUnits;
import com.chemked.data.quantity.UnitFormatException;
import com.chemked.data.record.ApparatusKind;
import com.chemked.data.record.Author;
import com.chemked.data.record.IgnitionMeasure;
import com.chemked.data.record.IgnitionTarget;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads a ReSpecTh ignition delay file into the plain ChemKED document form (nested maps and
 * lists), ready for {@code ChemKedLoader.loadMap} or YAML output. Common properties are copied into
 * every data point; time-based data groups become time histories of the first data point.
 */
public final class ReSpecThReader {
    private static final Logger LOGGER = Logger.getLogger(ReSpecThReader.class.getName());

    static final String CONVERTED_FROM = "Converted from ReSpecTh XML file ";
    static final String IGNITION_DELAY_EXPERIMENT = "Ignition delay measurement";

    /** ReSpecTh property names that map to ChemKED quantity fields. */
    private static final Map<String, String> QUANTITY_FIELDS =
            Map.of(
                    "temperature", "temperature",
                    "pressure", "pressure",
                    "ignition delay", "ignition-delay",
                    "pressure rise", "pressure-rise");

    private static final Set<String> HISTORY_QUANTITIES = Set.of("volume", "temperature", "pressure");

    private final BibliographicLookup bibliographicLookup;

    public ReSpecThReader(BibliographicLookup bibliographicLookup) {
        this.bibliographicLookup = Objects.requireNonNull(bibliographicLookup, "bibliographicLookup");
    }

    /** @param fileAuthor additional file author to credit, or null */
    public ConversionResult<Map<String, Object>> read(Path file, Author fileAuthor)
            throws IOException, ConversionException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.getFileName().toString(), fileAuthor);
        }
    }

    /**
     * @param fileName name recorded in the reference detail
     * @param fileAuthor additional file author to credit, or null
     */
    public ConversionResult<Map<String, Object>> read(InputStream in, String fileName, Author fileAuthor)
            throws IOException, ConversionException {
        Document document = ReSpecThXml.parse(in, fileName);
        Element root = document.getDocumentElement();
        if (!ReSpecThXml.ROOT_ELEMENT.equals(root.getTagName())) {
            throw new ConversionException(root.getTagName(), "root element must be <experiment>");
        }
        ConversionReport report = new ConversionReport();

        Map<String, Object> properties = new LinkedHashMap<>();
        List<Object> fileAuthors = new ArrayList<>();
        String originalAuthor =
                childText(root, "fileAuthor").orElseThrow(() -> missingElement(root, "fileAuthor"));
        fileAuthors.add(authorEntry(originalAuthor, null));
        if (fileAuthor != null) {
            fileAuthors.add(authorEntry(fileAuthor.getName(), fileAuthor.getOrcid().orElse(null)));
        }
        properties.put("file-authors", fileAuthors);
        properties.put("file-version", 0);
        properties.put("chemked-version", Version.CHEMKED_SCHEMA);

        Map<String, Object> reference = reference(root, report);
        Object detail = reference.get("detail");
        reference.put("detail", (detail == null ? "" : detail + " ") + CONVERTED_FROM + fileName);
        properties.put("reference", reference);

        experimentType(root);
        ApparatusKind apparatusKind = apparatusKind(root);
        Map<String, Object> apparatus = new LinkedHashMap<>();
        apparatus.put("kind", apparatusKind.getDocumentName());
        properties.put("experiment-type", "ignition delay");
        properties.put("apparatus", apparatus);

        Map<String, UncertaintySpec> commonUncertainties = new LinkedHashMap<>();
        Map<String, Object> common = commonProperties(root, commonUncertainties, report);
        common.put("ignition-type", ignitionType(root));

        List<Map<String, Object>> datapoints = datapoints(root, report);
        checkApparatusConsistency(root, apparatusKind, common, datapoints);

        for (Map<String, Object> datapoint : datapoints) {
            datapoint.putAll(copy(common));
            for (Map.Entry<String, UncertaintySpec> entry : commonUncertainties.entrySet()) {
                attachUncertainty(datapoint, entry.getKey(), entry.getValue());
            }
        }
        properties.put("datapoints", datapoints);
        LOGGER.log(
                Level.FINE,
                "Read {0} data point(s) from ReSpecTh file {1}",
                new Object[] {datapoints.size(), fileName});
        return new ConversionResult<>(properties, report);
    }

    private static Map<String, Object> authorEntry(String name, String orcid) {
        Map<String, Object> author = new LinkedHashMap<>();
        author.put("name", name);
        if (orcid != null) {
            author.put("ORCID", orcid);
        }
        return author;
    }

    private Map<String, Object> reference(Element root, ConversionReport report) throws ConversionException {
        Element link = child(root, "bibliographyLink").orElseThrow(() -> missingElement(root, "bibliographyLink"));
        Optional<String> doi = attribute(link, "doi").map(String::strip).filter(value -> !value.isEmpty());
        Optional<String> preferredKey =
                attribute(link, "preferredKey").map(String::strip).filter(value -> !value.isEmpty());

        Map<String, Object> reference = new LinkedHashMap<>();
        if (doi.isPresent()) {
            Optional<BibliographicRecord> found;
            try {
                found = bibliographicLookup.lookup(doi.get());
            } catch (LookupUnavailableException ex) {
                LOGGER.log(Level.WARNING, "DOI lookup for " + doi.get() + " failed", ex);
                found = Optional.empty();
            }
            if (found.isPresent()) {
                if (preferredKey.isPresent()) {
                    report.note("Using DOI to obtain reference information, rather than preferredKey.");
                }
                fillFromRegistry(reference, doi.get(), found.get(), report);
                return reference;
            }
            if (preferredKey.isEmpty()) {
                throw new ConversionException(path(link), "DOI not found and preferredKey attribute not set");
            }
            report.note("DOI lookup failed. Setting \"detail\" key as a fallback; "
                    + "please update to the appropriate fields.");
        } else if (preferredKey.isPresent()) {
            report.note("Missing doi attribute in bibliographyLink. Setting \"detail\" key as a fallback; "
                    + "please update to the appropriate fields.");
        } else {
            throw new ConversionException(path(link), "required attribute preferredKey of bibliographyLink is missing");
        }
        String key = preferredKey.get();
        reference.put("detail", key.endsWith(".") ? key : key + ".");
        return reference;
    }

    private static void fillFromRegistry(
            Map<String, Object> reference, String doi, BibliographicRecord record, ConversionReport report) {
        reference.put("doi", doi);
        List<Object> authors = new ArrayList<>();
        for (BibliographicRecord.RegisteredAuthor author : record.getAuthors()) {
            authors.add(authorEntry(author.fullName(), author.getOrcid().orElse(null)));
        }
        reference.put("authors", authors);
        record.getJournal().ifPresent(journal -> reference.put("journal", journal));
        if (record.getYear() > 0) {
            reference.put("year", record.getYear());
        }
        record.getVolume().ifPresent(volume -> {
            try {
                reference.put("volume", Integer.parseInt(volume.strip()));
            } catch (NumberFormatException ex) {
                report.note("Registry volume '" + volume + "' is not a number and was left out");
            }
        });
        record.getPages().ifPresent(pages -> reference.put("pages", pages));
    }

    private static void experimentType(Element root) throws ConversionException {
        Element type = child(root, "experimentType").orElseThrow(() -> missingElement(root, "experimentType"));
        if (!IGNITION_DELAY_EXPERIMENT.equals(text(type))) {
            throw new ConversionException(path(type), text(type) + " not (yet) supported");
        }
    }

    private static ApparatusKind apparatusKind(Element root) throws ConversionException {
        Element apparatus = child(root, "apparatus").orElseThrow(() -> missingElement(root, "apparatus/kind"));
        Element kind = child(apparatus, "kind").orElseThrow(() -> missingElement(root, "apparatus/kind"));
        String name = text(kind);
        if (name.isEmpty()) {
            throw missingElement(root, "apparatus/kind");
        }
        try {
            return ApparatusKind.fromDocumentName(name);
        } catch (IllegalArgumentException ex) {
            throw new ConversionException(path(kind), name + " experiment not (yet) supported", ex);
        }
    }

    private static Map<String, Object> commonProperties(
            Element root, Map<String, UncertaintySpec> uncertainties, ConversionReport report)
            throws ConversionException {
        Map<String, Object> common = new LinkedHashMap<>();
        Optional<Element> section = child(root, "commonProperties");
        if (section.isEmpty()) {
            return common;
        }
        for (Element property : children(section.get(), "property")) {
            String name = requireAttribute(property, "name");
            if ("initial composition".equals(name)) {
                common.put("composition", initialComposition(property, report));
            } else if (QUANTITY_FIELDS.containsKey(name)) {
                String field = QUANTITY_FIELDS.get(name);
                String units = units(property, field);
                Element value = child(property, "value").orElseThrow(() -> missingElement(property, "value"));
                common.put(field, quantity(value, units));
            } else if ("equivalence ratio".equals(name)) {
                Element value = child(property, "value").orElseThrow(() -> missingElement(property, "value"));
                common.put("equivalence-ratio", decimal(value));
            } else if ("uncertainty".equals(name)) {
                String referenced = requireAttribute(property, "reference");
                if (!QUANTITY_FIELDS.containsKey(referenced)) {
                    report.dropped(
                            "commonProperties uncertainty of " + referenced,
                            "only uncertainties of temperature, pressure, ignition delay and pressure rise "
                                    + "are converted");
                    continue;
                }
                Element value = child(property, "value").orElseThrow(() -> missingElement(property, "value"));
                uncertainties.put(
                        QUANTITY_FIELDS.get(referenced), uncertaintySpec(property, decimal(value)));
            } else {
                throw new ConversionException(path(property), "Property " + name + " not supported as common property");
            }
        }
        return common;
    }

    private static Map<String, Object> initialComposition(Element property, ConversionReport report)
            throws ConversionException {
        List<Object> species = new ArrayList<>();
        String kind = null;
        for (Element component : children(property, "component")) {
            Element link = child(component, "speciesLink").orElseThrow(() -> missingElement(component, "speciesLink"));
            Element amount = child(component, "amount").orElseThrow(() -> missingElement(component, "amount"));
            Map<String, Object> entry = speciesEntry(link, report);
            String units = requireAttribute(amount, "units");
            ScaledAmount scaled = scaleAmount(amount, units, report);
            entry.put("amount", new ArrayList<>(List.of(scaled.value())));
            species.add(entry);
            kind = consistentKind(kind, scaled.kind(), component);
        }
        if (species.isEmpty()) {
            throw missingElement(property, "component");
        }
        Map<String, Object> composition = new LinkedHashMap<>();
        composition.put("kind", kind);
        composition.put("species", species);
        return composition;
    }

    private static Map<String, Object> speciesEntry(Element link, ConversionReport report)
            throws ConversionException {
        Map<String, Object> entry = new LinkedHashMap<>();
        String name = requireAttribute(link, "preferredKey");
        entry.put("species-name", name);
        Optional<String> inchi = attribute(link, "InChI").filter(value -> !value.isBlank());
        Optional<String> smiles = attribute(link, "SMILES").filter(value -> !value.isBlank());
        if (inchi.isPresent()) {
            entry.put("InChI", inchi.get());
        } else if (smiles.isPresent()) {
            entry.put("SMILES", smiles.get());
        } else {
            report.note("Missing InChI for species " + name);
        }
        return entry;
    }

    private record ScaledAmount(double value, String kind) {}

    private static ScaledAmount scaleAmount(Element value, String units, ConversionReport report)
            throws ConversionException {
        BigDecimal amount;
        try {
            amount = new BigDecimal(text(value));
        } catch (NumberFormatException ex) {
            throw new ConversionException(path(value), "'" + text(value) + "' is not a number", ex);
        }
        switch (units) {
            case "mole fraction":
            case "mass fraction":
            case "mole percent":
                return new ScaledAmount(amount.doubleValue(), units);
            case "percent":
                report.note("Assuming percent in composition means mole percent");
                return new ScaledAmount(amount.doubleValue(), "mole percent");
            case "ppm":
                report.note("Assuming molar ppm in composition and converting to mole fraction");
                return new ScaledAmount(amount.movePointLeft(6).doubleValue(), "mole fraction");
            case "ppb":
                report.note("Assuming molar ppb in composition and converting to mole fraction");
                return new ScaledAmount(amount.movePointLeft(9).doubleValue(), "mole fraction");
            default:
                throw new ConversionException(
                        path(value),
                        "Composition units need to be one of: mole fraction, mass fraction, mole percent, "
                                + "percent, ppm, or ppb.");
        }
    }

    private static String consistentKind(String current, String next, Element element) throws ConversionException {
        if (current != null && !current.equals(next)) {
            throw new ConversionException(
                    path(element), "composition units " + next + " not consistent with " + current);
        }
        return next;
    }

    private static Object ignitionType(Element root) throws ConversionException {
        Element element = child(root, "ignitionType").orElseThrow(() -> missingElement(root, "ignitionType"));
        String targetText = requireAttribute(element, "target").strip();
        while (targetText.endsWith(";")) {
            targetText = targetText.substring(0, targetText.length() - 1);
        }
        if (targetText.contains(";")) {
            throw new ConversionException(path(element), "Multiple ignition targets not supported.");
        }
        String typeText = requireAttribute(element, "type");
        String target = targetText;
        IgnitionTarget ignitionTarget =
                IgnitionTypeMapping.target(target)
                        .orElseThrow(() -> new ConversionException(
                                path(element), target + " not valid ignition target"));
        IgnitionMeasure measure =
                IgnitionTypeMapping.measure(typeText)
                        .orElseThrow(() -> new ConversionException(
                                path(element), typeText + " not valid ignition type"));
        Map<String, Object> ignitionType = new LinkedHashMap<>();
        ignitionType.put("target", ignitionTarget.getDocumentName());
        ignitionType.put("type", measure.getDocumentName());
        return ignitionType;
    }

    private static List<Map<String, Object>> datapoints(Element root, ConversionReport report)
            throws ConversionException {
        List<Element> groups = children(root, "dataGroup");
        if (groups.isEmpty()) {
            throw missingElement(root, "dataGroup");
        }
        List<Map<String, Object>> datapoints = new ArrayList<>();
        List<Element> historyGroups = new ArrayList<>();
        for (Element group : groups) {
            if (isHistoryGroup(group)) {
                historyGroups.add(group);
            } else {
                datapoints.addAll(ignitionDelayGroup(group, report));
            }
        }
        if (datapoints.isEmpty()) {
            throw missingElement(root, "dataPoint");
        }
        if (!historyGroups.isEmpty()) {
            List<Object> histories = new ArrayList<>();
            for (Element group : historyGroups) {
                histories.addAll(historyGroup(group));
            }
            datapoints.get(0).put("time-histories", histories);
        }
        return datapoints;
    }

    private static boolean isHistoryGroup(Element group) {
        for (Element property : children(group, "property")) {
            if ("time".equals(property.getAttribute("name"))) {
                return true;
            }
        }
        return false;
    }

    /** One column of an ignition delay data group. */
    private record Column(String field, String units, Map<String, Object> species, UncertaintySpec uncertainty) {}

    private static List<Map<String, Object>> ignitionDelayGroup(Element group, ConversionReport report)
            throws ConversionException {
        Map<String, Column> columns = new LinkedHashMap<>();
        Map<String, Element> uncertaintyColumns = new LinkedHashMap<>();
        boolean hasComposition = false;
        for (Element property : children(group, "property")) {
            String id = requireAttribute(property, "id");
            String name = requireAttribute(property, "name");
            if (QUANTITY_FIELDS.containsKey(name)) {
                String field = QUANTITY_FIELDS.get(name);
                columns.put(id, new Column(field, units(property, field), null, null));
            } else if ("composition".equals(name)) {
                Element link =
                        child(property, "speciesLink").orElseThrow(() -> missingElement(property, "speciesLink"));
                String units = requireAttribute(property, "units");
                columns.put(id, new Column("composition", units, speciesEntry(link, report), null));
                hasComposition = true;
            } else if ("equivalence ratio".equals(name)) {
                columns.put(id, new Column("equivalence-ratio", "", null, null));
            } else if ("uncertainty".equals(name)) {
                uncertaintyColumns.put(id, property);
            } else {
                throw new ConversionException(path(property), name + " not valid dataPoint property");
            }
        }
        if (columns.isEmpty()) {
            throw missingElement(group, "property");
        }
        for (Map.Entry<String, Element> entry : uncertaintyColumns.entrySet()) {
            Element property = entry.getValue();
            String referenced = requireAttribute(property, "reference");
            if (!QUANTITY_FIELDS.containsKey(referenced)) {
                report.dropped(
                        "dataGroup uncertainty of " + referenced,
                        "only uncertainties of temperature, pressure, ignition delay and pressure rise are converted");
                columns.put(entry.getKey(), new Column(null, "", null, null));
                continue;
            }
            columns.put(entry.getKey(), new Column(QUANTITY_FIELDS.get(referenced), "", null,
                    uncertaintySpec(property, null)));
        }

        List<Map<String, Object>> datapoints = new ArrayList<>();
        for (Element point : children(group, "dataPoint")) {
            Map<String, Object> datapoint = new LinkedHashMap<>();
            List<Object> species = new ArrayList<>();
            String kind = null;
            Map<String, UncertaintySpec> pointUncertainties = new HashMap<>();
            for (Element value : children(point)) {
                Column column = columns.get(value.getTagName());
                if (column == null) {
                    throw new ConversionException(path(value), "value missing from properties: " + value.getTagName());
                }
                if (column.field() == null) {
                    continue;
                }
                if (column.uncertainty() != null) {
                    pointUncertainties.put(column.field(), column.uncertainty().withValue(decimal(value)));
                } else if (column.species() != null) {
                    Map<String, Object> entry = new LinkedHashMap<>(column.species());
                    ScaledAmount scaled = scaleAmount(value, column.units(), report);
                    entry.put("amount", new ArrayList<>(List.of(scaled.value())));
                    species.add(entry);
                    kind = consistentKind(kind, scaled.kind(), value);
                } else if ("equivalence-ratio".equals(column.field())) {
                    datapoint.put("equivalence-ratio", decimal(value));
                } else {
                    datapoint.put(column.field(), quantity(value, column.units()));
                }
            }
            if (hasComposition) {
                Map<String, Object> composition = new LinkedHashMap<>();
                composition.put("kind", kind);
                composition.put("species", species);
                datapoint.put("composition", composition);
            }
            for (Map.Entry<String, UncertaintySpec> entry : pointUncertainties.entrySet()) {
                attachUncertainty(datapoint, entry.getKey(), entry.getValue());
            }
            datapoints.add(datapoint);
        }
        return datapoints;
    }

    private static List<Object> historyGroup(Element group) throws ConversionException {
        String timeId = null;
        Map<String, Object> timeColumn = null;
        List<String> quantityIds = new ArrayList<>();
        List<Map<String, Object>> histories = new ArrayList<>();
        List<List<Object>> historyValues = new ArrayList<>();
        for (Element property : children(group, "property")) {
            String name = requireAttribute(property, "name");
            String id = requireAttribute(property, "id");
            if ("time".equals(name)) {
                timeId = id;
                timeColumn = column(requireAttribute(property, "units"), 0);
            } else if (HISTORY_QUANTITIES.contains(name)) {
                Map<String, Object> history = new LinkedHashMap<>();
                history.put("type", name);
                history.put("quantity", column(requireAttribute(property, "units"), 1));
                List<Object> values = new ArrayList<>();
                history.put("values", values);
                histories.add(history);
                historyValues.add(values);
                quantityIds.add(id);
            } else {
                throw new ConversionException(
                        path(property),
                        "Only volume, temperature, pressure, and time are allowed in a time-history dataGroup.");
            }
        }
        if (timeId == null || quantityIds.isEmpty()) {
            throw new ConversionException(path(group), "Both time and quantity properties required for time-history.");
        }
        for (Map<String, Object> history : histories) {
            history.put("time", timeColumn);
        }

        for (Element point : children(group, "dataPoint")) {
            Double time = null;
            Double[] quantities = new Double[quantityIds.size()];
            for (Element value : children(point)) {
                String tag = value.getTagName();
                if (tag.equals(timeId)) {
                    time = decimal(value);
                } else if (quantityIds.contains(tag)) {
                    quantities[quantityIds.indexOf(tag)] = decimal(value);
                } else {
                    throw new ConversionException(
                            path(value), "Value tag " + tag + " not found in dataGroup tags: " + quantityIds);
                }
            }
            for (int i = 0; i < quantities.length; i++) {
                if (time == null || quantities[i] == null) {
                    throw new ConversionException(
                            path(point), "Both time and quantity values required in each time-history dataPoint.");
                }
                historyValues.get(i).add(List.of(time, quantities[i]));
            }
        }
        return new ArrayList<>(histories);
    }

    private static Map<String, Object> column(String units, int index) {
        Map<String, Object> column = new LinkedHashMap<>();
        column.put("units", units);
        column.put("column", index);
        return column;
    }

    private static void checkApparatusConsistency(
            Element root, ApparatusKind kind, Map<String, Object> common, List<Map<String, Object>> datapoints)
            throws ConversionException {
        boolean pressureRise =
                common.containsKey("pressure-rise")
                        || datapoints.stream().anyMatch(point -> point.containsKey("pressure-rise"));
        if (pressureRise && kind == ApparatusKind.RAPID_COMPRESSION_MACHINE) {
            throw new ConversionException(path(root), "Pressure rise cannot be defined for RCM.");
        }
        boolean volumeHistory =
                datapoints.stream()
                        .map(point -> point.get("time-histories"))
                        .filter(List.class::isInstance)
                        .flatMap(histories -> ((List<?>) histories).stream())
                        .anyMatch(history -> history instanceof Map<?, ?> map && "volume".equals(map.get("type")));
        if (volumeHistory && kind == ApparatusKind.SHOCK_TUBE) {
            throw new ConversionException(path(root), "Volume history cannot be defined for shock tube.");
        }
    }

    /** Units attribute of a quantity property, checked against the dimension of its ChemKED field. */
    private static String units(Element property, String field) throws ConversionException {
        String units = requireAttribute(property, "units");
        if ("Torr".equals(units)) {
            units = "torr";
        }
        try {
            if (!PropertyUnits.isCompatible(field, units)) {
                throw new ConversionException(
                        path(property), "units incompatible for property " + property.getAttribute("name"));
            }
        } catch (UnitFormatException ex) {
            throw new ConversionException(path(property), "unable to parse units '" + units + "'", ex);
        }
        return units;
    }

    private static List<Object> quantity(Element value, String units) throws ConversionException {
        List<Object> quantity = new ArrayList<>();
        quantity.add(DecimalText.format(decimal(value)) + " " + units);
        return quantity;
    }

    private static double decimal(Element value) throws ConversionException {
        try {
            return DecimalText.parse(text(value));
        } catch (NumberFormatException ex) {
            throw new ConversionException(path(value), "'" + text(value) + "' is not a number", ex);
        }
    }

    /** Uncertainty declared by a ReSpecTh {@code uncertainty} property; the value comes per point or inline. */
    private record UncertaintySpec(String kind, String units, Double value) {

        UncertaintySpec withValue(double newValue) {
            return new UncertaintySpec(kind, units, newValue);
        }

        Map<String, Object> toDocument(String quantityUnits) {
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("uncertainty-type", kind);
            if ("relative".equals(kind) || units.isEmpty() || units.equals(quantityUnits)) {
                block.put("uncertainty", value);
            } else {
                block.put("uncertainty", DecimalText.format(value) + " " + units);
            }
            return block;
        }
    }

    private static UncertaintySpec uncertaintySpec(Element property, Double value) throws ConversionException {
        String kind = requireAttribute(property, "kind");
        if (!"absolute".equals(kind) && !"relative".equals(kind)) {
            throw new ConversionException(path(property), "uncertainty kind must be absolute or relative, not " + kind);
        }
        String units = attribute(property, "units").orElse("");
        if ("unitless".equals(units)) {
            units = "";
        } else if ("Torr".equals(units)) {
            units = "torr";
        }
        attribute(property, "bound")
                .filter(bound -> !"plusminus".equals(bound))
                .ifPresent(bound -> LOGGER.log(
                        Level.WARNING, "Treating {0} uncertainty bound as symmetric", bound));
        return new UncertaintySpec(kind, units, value);
    }

    private static void attachUncertainty(Map<String, Object> datapoint, String field, UncertaintySpec uncertainty) {
        Object value = datapoint.get(field);
        if (!(value instanceof List<?> list) || list.size() != 1 || uncertainty.value() == null) {
            return;
        }
        String text = (String) list.get(0);
        String quantityUnits = text.substring(text.indexOf(' ') + 1);
        List<Object> withUncertainty = new ArrayList<>(list);
        withUncertainty.add(uncertainty.toDocument(quantityUnits));
        datapoint.put(field, withUncertainty);
    }

    /** Deep copy so that data points never share mutable lists or maps. */
    private static Map<String, Object> copy(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put((String) entry.getKey(), copyValue(entry.getValue()));
        }
        return result;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copy(map);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(copyValue(item));
            }
            return result;
        }
        return value;
    }

    private static String requireAttribute(Element element, String name) throws ConversionException {
        return attribute(element, name)
                .orElseThrow(() -> new ConversionException(
                        path(element),
                        "required attribute " + name + " of " + element.getTagName() + " is missing"));
    }

    private static ConversionException missingElement(Element parent, String name) {
        return new ConversionException(path(parent), "required element " + name + " is missing");
    }
}
