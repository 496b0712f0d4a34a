package com.chemked.data.respecth;

import static com.chemked.data.respecth.ReSpecThXml.append;

import com.chemked.data.quantity.DecimalText;
import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.Uncertainty;
import com.chemked.data.quantity.UncertaintyKind;
import com.chemked.data.record.Author;
import com.chemked.data.record.ChemKedRecord;
import com.chemked.data.record.Composition;
import com.chemked.data.record.DataPoint;
import com.chemked.data.record.IgnitionType;
import com.chemked.data.record.Reference;
import com.chemked.data.record.Species;
import com.chemked.data.record.SpeciesIdentity;
import com.chemked.data.record.TimeHistory;
import com.chemked.data.record.TimeHistoryType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Writes a record as a ReSpecTh ignition delay file. Values that are identical in every data point
 * go to {@code commonProperties}, the rest to the first {@code dataGroup}; the time histories of the
 * first data point become additional data groups. Everything ReSpecTh cannot hold is listed in the
 * {@link ConversionReport}.
 */
public final class ReSpecThWriter {
    private static final Logger LOGGER = Logger.getLogger(ReSpecThWriter.class.getName());

    static final int RESPECTH_MAJOR_VERSION = 1;
    static final int RESPECTH_MINOR_VERSION = 0;

    private static final Set<TimeHistoryType> EXPORTABLE_HISTORIES =
            Set.of(TimeHistoryType.VOLUME, TimeHistoryType.TEMPERATURE, TimeHistoryType.PRESSURE);

    /** A ChemKED quantity field with its ReSpecTh name and column label. */
    private enum Field {
        TEMPERATURE("temperature", "temperature", "T", point -> Optional.of(point.getTemperature())),
        PRESSURE("pressure", "pressure", "P", point -> Optional.of(point.getPressure())),
        IGNITION_DELAY("ignition-delay", "ignition delay", "tau", point -> Optional.of(point.getIgnitionDelay())),
        PRESSURE_RISE("pressure-rise", "pressure rise", "dP/dt", DataPoint::getPressureRise);

        private final String documentName;
        private final String xmlName;
        private final String label;
        private final Function<DataPoint, Optional<Quantity>> accessor;

        Field(String documentName, String xmlName, String label, Function<DataPoint, Optional<Quantity>> accessor) {
            this.documentName = documentName;
            this.xmlName = xmlName;
            this.label = label;
            this.accessor = accessor;
        }
    }

    /** @param fileAuthor author written as {@code fileAuthor} instead of the record's first file author, or null */
    public ConversionResult<Document> write(ChemKedRecord record, Author fileAuthor) throws ConversionException {
        Objects.requireNonNull(record, "record");
        ConversionReport report = new ConversionReport();
        Document document = ReSpecThXml.newDocument();
        Element root = document.createElement(ReSpecThXml.ROOT_ELEMENT);
        document.appendChild(root);

        fileMetadata(root, record, fileAuthor, report);
        bibliography(root, record.getReference(), report);
        append(root, "experimentType", ReSpecThReader.IGNITION_DELAY_EXPERIMENT);
        Element apparatus = append(root, "apparatus");
        append(apparatus, "kind", record.getApparatus().getKind().getDocumentName());
        record.getApparatus().getInstitution().ifPresent(value -> report.dropped("apparatus.institution",
                "ReSpecTh apparatus has no institution"));
        record.getApparatus().getFacility().ifPresent(value -> report.dropped("apparatus.facility",
                "ReSpecTh apparatus has no facility"));

        List<DataPoint> datapoints = record.getDatapoints();
        Element common = append(root, "commonProperties");
        Element group = document.createElement("dataGroup");
        group.setAttribute("id", "dg1");
        List<Column> columns = new ArrayList<>();

        for (Field field : Field.values()) {
            quantityField(field, datapoints, common, columns, report);
        }
        equivalenceRatio(datapoints, common, columns, report);
        composition(datapoints, common, columns, report);
        droppedPerPointFields(datapoints, report);

        for (Column column : columns) {
            Element property = append(group, "property");
            column.describe(property, "x" + (columns.indexOf(column) + 1));
        }
        for (DataPoint datapoint : datapoints) {
            Element point = append(group, "dataPoint");
            for (int i = 0; i < columns.size(); i++) {
                append(point, "x" + (i + 1), columns.get(i).value(datapoint));
            }
        }
        root.appendChild(group);
        if (!common.hasChildNodes()) {
            root.removeChild(common);
        }

        histories(root, datapoints, report);

        IgnitionType ignitionType = datapoints.get(0).getIgnitionType();
        for (int i = 1; i < datapoints.size(); i++) {
            if (!datapoints.get(i).getIgnitionType().equals(ignitionType)) {
                throw new ConversionException(
                        "datapoints[" + i + "].ignition-type",
                        "ReSpecTh files hold a single ignition type, but data points disagree");
            }
        }
        Element ignition = append(root, "ignitionType");
        ignition.setAttribute("target", IgnitionTypeMapping.toXml(ignitionType.target()));
        ignition.setAttribute("type", IgnitionTypeMapping.toXml(ignitionType.measure()));

        LOGGER.log(
                Level.FINE,
                "Wrote {0} data point(s) as ReSpecTh, {1} field(s) not converted",
                new Object[] {datapoints.size(), report.getDroppedFields().size()});
        return new ConversionResult<>(document, report);
    }

    private static void fileMetadata(Element root, ChemKedRecord record, Author fileAuthor, ConversionReport report) {
        List<Author> authors = record.getFileAuthors();
        Author written = fileAuthor != null ? fileAuthor : authors.get(0);
        append(root, "fileAuthor", written.getName());
        String writtenField = fileAuthor != null ? "file author override ORCID" : "file-authors[0].ORCID";
        if (written.getOrcid().isPresent()) {
            report.dropped(writtenField, "ReSpecTh has no field for author identifiers");
        }
        for (int i = 0; i < authors.size(); i++) {
            Author author = authors.get(i);
            if (author == written) {
                continue;
            }
            if (author.getOrcid().isPresent()) {
                report.dropped("file-authors[" + i + "].ORCID", "ReSpecTh has no field for author identifiers");
            }
            report.dropped("file-authors[" + i + "]", "ReSpecTh holds a single file author");
        }
        Element fileVersion = append(root, "fileVersion");
        append(fileVersion, "major", Integer.toString(record.getFileVersion()));
        append(fileVersion, "minor", "0");
        Element respecthVersion = append(root, "ReSpecThVersion");
        append(respecthVersion, "major", Integer.toString(RESPECTH_MAJOR_VERSION));
        append(respecthVersion, "minor", Integer.toString(RESPECTH_MINOR_VERSION));
    }

    private static void bibliography(Element root, Reference reference, ConversionReport report) {
        Element link = append(root, "bibliographyLink");
        List<String> names = new ArrayList<>();
        for (int i = 0; i < reference.getAuthors().size(); i++) {
            Author author = reference.getAuthors().get(i);
            names.add(author.getName());
            if (author.getOrcid().isPresent()) {
                report.dropped("reference.authors[" + i + "].ORCID", "ReSpecTh has no field for author identifiers");
            }
        }
        StringBuilder citation = new StringBuilder(String.join(", ", names));
        reference.getJournal().ifPresent(journal -> citation.append(", ").append(journal));
        reference.getVolume().ifPresent(volume -> citation.append(' ').append(volume));
        citation.append(" (").append(reference.getYear()).append(')');
        reference.getPages().ifPresent(pages -> citation.append(' ').append(pages));
        link.setAttribute("preferredKey", citation.toString());
        reference.getDoi().ifPresent(doi -> link.setAttribute("doi", doi));
        reference.getDetail().ifPresent(detail -> report.dropped("reference.detail",
                "ReSpecTh has no field for reference notes"));
    }

    private static void quantityField(
            Field field, List<DataPoint> datapoints, Element common, List<Column> columns, ConversionReport report) {
        List<Quantity> values = new ArrayList<>();
        for (DataPoint datapoint : datapoints) {
            field.accessor.apply(datapoint).ifPresent(values::add);
        }
        if (values.isEmpty()) {
            return;
        }
        if (values.size() < datapoints.size()) {
            report.dropped("datapoints[*]." + field.documentName, "present in only some data points");
            return;
        }
        boolean identical = field != Field.IGNITION_DELAY && allEqual(values, Quantity::withoutUncertainty);
        String units = values.get(0).getUnits();
        if (identical) {
            Element property = commonProperty(common, field.xmlName, field.label, units);
            append(property, "value", DecimalText.format(values.get(0).getMagnitude()));
        } else {
            columns.add(new QuantityColumn(field, units));
        }
        uncertainty(field, values, common, report);
    }

    private static void uncertainty(Field field, List<Quantity> values, Element common, ConversionReport report) {
        List<Optional<Uncertainty>> uncertainties = new ArrayList<>();
        for (Quantity value : values) {
            uncertainties.add(value.getUncertainty());
        }
        if (uncertainties.stream().allMatch(Optional::isEmpty)) {
            return;
        }
        if (!allEqual(uncertainties, Function.identity()) || uncertainties.get(0).isEmpty()) {
            report.dropped(
                    "datapoints[*]." + field.documentName + " uncertainty",
                    "ReSpecTh common uncertainties must be identical in every data point");
            return;
        }
        Uncertainty uncertainty = uncertainties.get(0).get();
        Element property = append(common, "property");
        property.setAttribute("name", "uncertainty");
        property.setAttribute("reference", field.xmlName);
        property.setAttribute("kind", uncertainty.getKind().getDocumentName());
        property.setAttribute("bound", "plusminus");
        String units = uncertainty.getKind() == UncertaintyKind.RELATIVE || uncertainty.getUnits().isEmpty()
                ? "unitless"
                : uncertainty.getUnits();
        property.setAttribute("units", units);
        append(property, "value", DecimalText.format(uncertainty.getValue()));
    }

    private static void equivalenceRatio(
            List<DataPoint> datapoints, Element common, List<Column> columns, ConversionReport report) {
        List<Double> values = new ArrayList<>();
        for (DataPoint datapoint : datapoints) {
            OptionalDouble phi = datapoint.getEquivalenceRatio();
            if (phi.isPresent()) {
                values.add(phi.getAsDouble());
            }
        }
        if (values.isEmpty()) {
            return;
        }
        if (values.size() < datapoints.size()) {
            report.dropped("datapoints[*].equivalence-ratio", "present in only some data points");
        } else if (allEqual(values, Function.identity())) {
            Element property = commonProperty(common, "equivalence ratio", "phi", "unitless");
            append(property, "value", DecimalText.format(values.get(0)));
        } else {
            columns.add(new EquivalenceRatioColumn());
        }
    }

    private static void composition(
            List<DataPoint> datapoints, Element common, List<Column> columns, ConversionReport report)
            throws ConversionException {
        Composition first = datapoints.get(0).getComposition();
        for (int i = 0; i < datapoints.size(); i++) {
            List<Species> species = datapoints.get(i).getComposition().getSpecies();
            for (int j = 0; j < species.size(); j++) {
                Species s = species.get(j);
                if (s.getAmount().getUncertainty().isPresent()) {
                    report.dropped(
                            "datapoints[" + i + "].composition.species[" + j + "].amount uncertainty",
                            "ReSpecTh components carry no uncertainty");
                }
                if (s.getIdentity() instanceof SpeciesIdentity.AtomicComposition) {
                    report.dropped(
                            "datapoints[" + i + "].composition.species[" + j + "].atomic-composition",
                            "ReSpecTh species links use InChI or SMILES");
                }
            }
        }
        if (allEqual(datapoints, DataPoint::getComposition)) {
            Element property = append(common, "property");
            property.setAttribute("name", "initial composition");
            property.setAttribute("sourcetype", "reported");
            for (Species species : first.getSpecies()) {
                Element component = append(property, "component");
                speciesLink(component, species);
                Element amount = append(component, "amount", DecimalText.format(species.getAmount().getMagnitude()));
                amount.setAttribute("units", first.getKind().getDocumentName());
            }
            return;
        }
        List<String> names = speciesNames(first);
        for (int i = 1; i < datapoints.size(); i++) {
            Composition composition = datapoints.get(i).getComposition();
            if (composition.getKind() != first.getKind()) {
                throw new ConversionException(
                        "datapoints[" + i + "].composition.kind",
                        "composition kind " + composition.getKind() + " differs from " + first.getKind()
                                + " in the first data point");
            }
            if (!speciesNames(composition).equals(names)) {
                throw new ConversionException(
                        "datapoints[" + i + "].composition.species",
                        "data points list different species; ReSpecTh data groups need the same species in "
                                + "every data point");
            }
        }
        for (int j = 0; j < first.getSpecies().size(); j++) {
            columns.add(new SpeciesColumn(j, first.getSpecies().get(j), first.getKind().getDocumentName()));
        }
    }

    private static List<String> speciesNames(Composition composition) {
        List<String> names = new ArrayList<>();
        for (Species species : composition.getSpecies()) {
            names.add(species.getName());
        }
        return names;
    }

    private static void speciesLink(Element parent, Species species) {
        Element link = append(parent, "speciesLink");
        link.setAttribute("preferredKey", species.getName());
        if (species.getIdentity() instanceof SpeciesIdentity.InChI inchi) {
            link.setAttribute("InChI", inchi.value());
        } else if (species.getIdentity() instanceof SpeciesIdentity.Smiles smiles) {
            link.setAttribute("SMILES", smiles.value());
        }
    }

    private static void droppedPerPointFields(List<DataPoint> datapoints, ConversionReport report) {
        for (int i = 0; i < datapoints.size(); i++) {
            DataPoint datapoint = datapoints.get(i);
            if (datapoint.getFirstStageIgnitionDelay().isPresent()) {
                report.dropped("datapoints[" + i + "].first-stage-ignition-delay",
                        "ReSpecTh ignition delay files hold a single delay");
            }
            if (datapoint.getRcmConditions().filter(rcm -> !rcm.isEmpty()).isPresent()) {
                report.dropped("datapoints[" + i + "].rcm-data", "ReSpecTh has no RCM data block");
            }
        }
    }

    private static void histories(Element root, List<DataPoint> datapoints, ConversionReport report) {
        int groupNumber = 2;
        int id = 1;
        for (int i = 0; i < datapoints.size(); i++) {
            List<TimeHistory> histories = datapoints.get(i).getTimeHistories();
            for (int j = 0; j < histories.size(); j++) {
                TimeHistory history = histories.get(j);
                String field = "datapoints[" + i + "].time-histories[" + j + "]";
                if (i > 0) {
                    report.dropped(field, "ReSpecTh data groups cannot be tied to a data point other than the first");
                    continue;
                }
                if (!EXPORTABLE_HISTORIES.contains(history.getType())) {
                    report.dropped(field, history.getType().getDocumentName() + " histories have no ReSpecTh form");
                    continue;
                }
                if (history.getUncertainty().isPresent()) {
                    report.dropped(field + ".uncertainty", "ReSpecTh history groups carry no uncertainty");
                }
                Element group = append(root, "dataGroup");
                group.setAttribute("id", "dg" + groupNumber++);
                String timeId = "x" + id++;
                String quantityId = "x" + id++;
                Element time = append(group, "property");
                time.setAttribute("name", "time");
                time.setAttribute("id", timeId);
                time.setAttribute("label", "t");
                time.setAttribute("units", history.getTime().units());
                time.setAttribute("sourcetype", "reported");
                Element quantity = append(group, "property");
                quantity.setAttribute("name", history.getType().getDocumentName());
                quantity.setAttribute("id", quantityId);
                quantity.setAttribute("label", history.getType() == TimeHistoryType.VOLUME ? "V"
                        : history.getType() == TimeHistoryType.PRESSURE ? "P" : "T");
                quantity.setAttribute("units", history.getQuantity().units());
                quantity.setAttribute("sourcetype", "reported");
                List<Quantity> times = history.getTimes();
                List<Quantity> quantities = history.getQuantities();
                for (int row = 0; row < history.size(); row++) {
                    Element point = append(group, "dataPoint");
                    append(point, timeId, DecimalText.format(times.get(row).getMagnitude()));
                    append(point, quantityId, DecimalText.format(quantities.get(row).getMagnitude()));
                }
            }
        }
    }

    private static Element commonProperty(Element common, String name, String label, String units) {
        Element property = append(common, "property");
        property.setAttribute("name", name);
        property.setAttribute("label", label);
        property.setAttribute("units", units);
        property.setAttribute("sourcetype", "reported");
        return property;
    }

    private static <T, K> boolean allEqual(List<T> values, Function<T, K> key) {
        K first = key.apply(values.get(0));
        for (T value : values) {
            if (!Objects.equals(first, key.apply(value))) {
                return false;
            }
        }
        return true;
    }

    /** One column of the ignition delay data group. */
    private interface Column {
        void describe(Element property, String id);

        String value(DataPoint datapoint);
    }

    private static final class QuantityColumn implements Column {
        private final Field field;
        private final String units;

        QuantityColumn(Field field, String units) {
            this.field = field;
            this.units = units;
        }

        @Override
        public void describe(Element property, String id) {
            property.setAttribute("name", field.xmlName);
            property.setAttribute("id", id);
            property.setAttribute("label", field.label);
            property.setAttribute("units", units);
            property.setAttribute("sourcetype", "reported");
        }

        @Override
        public String value(DataPoint datapoint) {
            Quantity quantity = field.accessor.apply(datapoint).orElseThrow();
            return DecimalText.format(quantity.getUnits().equals(units) ? quantity.getMagnitude()
                    : quantity.magnitudeIn(units));
        }
    }

    private static final class EquivalenceRatioColumn implements Column {
        @Override
        public void describe(Element property, String id) {
            property.setAttribute("name", "equivalence ratio");
            property.setAttribute("id", id);
            property.setAttribute("label", "phi");
            property.setAttribute("units", "unitless");
            property.setAttribute("sourcetype", "reported");
        }

        @Override
        public String value(DataPoint datapoint) {
            return DecimalText.format(datapoint.getEquivalenceRatio().orElseThrow());
        }
    }

    private static final class SpeciesColumn implements Column {
        private final int index;
        private final Species species;
        private final String units;

        SpeciesColumn(int index, Species species, String units) {
            this.index = index;
            this.species = species;
            this.units = units;
        }

        @Override
        public void describe(Element property, String id) {
            property.setAttribute("name", "composition");
            property.setAttribute("id", id);
            property.setAttribute("label", "[" + species.getName() + "]");
            property.setAttribute("units", units);
            property.setAttribute("sourcetype", "reported");
            speciesLink(property, species);
        }

        @Override
        public String value(DataPoint datapoint) {
            return DecimalText.format(datapoint.getComposition().getSpecies().get(index).getAmount().getMagnitude());
        }
    }
}
