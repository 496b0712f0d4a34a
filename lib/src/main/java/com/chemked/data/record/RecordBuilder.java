package com.chemked.data.record;

import com.chemked.data.loader.LoaderException;
import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;
import com.chemked.data.quantity.DecimalText;
import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.Uncertainty;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the typed model from a document tree that already passed validation. Shape problems that
 * validation would have caught surface here as {@link IllegalArgumentException}; problems only
 * visible while building (unreadable history files) raise {@link LoaderException}.
 */
public final class RecordBuilder {
    private static final Logger LOGGER = Logger.getLogger(RecordBuilder.class.getName());

    static final String ASYMMETRIC_UNCERTAINTY_WARNING =
            "Asymmetric uncertainties are not supported. The maximum of lower-uncertainty and "
                    + "upper-uncertainty has been used as the symmetric uncertainty.";

    private final Path baseDirectory;

    /** @param baseDirectory directory that relative history file names resolve against; may be null */
    public RecordBuilder(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    /**
     * @param document normalized, validated document
     * @param messages receives warnings about simplifications applied while building
     */
    public ChemKedRecord build(MapNode document, List<LoaderMessage> messages) throws LoaderException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(messages, "messages");
        Apparatus apparatus = apparatus(require(document, "apparatus", MapNode.class));
        List<DataPoint> datapoints = new ArrayList<>();
        for (DocumentNode node : require(document, "datapoints", ListNode.class).getItems()) {
            datapoints.add(datapoint((MapNode) node, apparatus.getKind(), messages));
        }
        return new ChemKedRecord(
                authors(require(document, "file-authors", ListNode.class)),
                require(document, "file-version", NumberNode.class).getValue().intValue(),
                require(document, "chemked-version", TextNode.class).getValue(),
                reference(require(document, "reference", MapNode.class)),
                ExperimentType.fromDocumentName(require(document, "experiment-type", TextNode.class).getValue()),
                apparatus,
                datapoints);
    }

    private static List<Author> authors(ListNode list) {
        List<Author> authors = new ArrayList<>();
        for (DocumentNode node : list.getItems()) {
            MapNode author = (MapNode) node;
            authors.add(new Author(author.text("name").orElseThrow(), author.text("ORCID").orElse(null)));
        }
        return authors;
    }

    private static Reference reference(MapNode reference) {
        return new Reference(
                reference.text("doi").orElse(null),
                reference.text("journal").orElse(null),
                require(reference, "year", NumberNode.class).getValue().intValue(),
                reference.number("volume").map(number -> number.getValue().intValue()).orElse(null),
                reference.text("pages").orElse(null),
                reference.text("detail").orElse(null),
                authors(require(reference, "authors", ListNode.class)));
    }

    private static Apparatus apparatus(MapNode apparatus) {
        return new Apparatus(
                ApparatusKind.fromDocumentName(require(apparatus, "kind", TextNode.class).getValue()),
                apparatus.text("institution").orElse(null),
                apparatus.text("facility").orElse(null));
    }

    private DataPoint datapoint(MapNode point, ApparatusKind kind, List<LoaderMessage> messages)
            throws LoaderException {
        DataPoint.Builder builder =
                DataPoint.builder()
                        .temperature(quantity(require(point, "temperature", ListNode.class), messages))
                        .pressure(quantity(require(point, "pressure", ListNode.class), messages))
                        .ignitionDelay(quantity(require(point, "ignition-delay", ListNode.class), messages))
                        .composition(composition(require(point, "composition", MapNode.class), messages))
                        .ignitionType(ignitionType(require(point, "ignition-type", MapNode.class)));
        point.list("first-stage-ignition-delay")
                .ifPresent(list -> builder.firstStageIgnitionDelay(quantity(list, messages)));
        point.number("equivalence-ratio").ifPresent(number -> builder.equivalenceRatio(number.doubleValue()));

        if (kind == ApparatusKind.RAPID_COMPRESSION_MACHINE) {
            RcmConditions.Builder rcm = RcmConditions.builder();
            point.map("rcm-data").ifPresent(data -> {
                data.list("compressed-pressure").ifPresent(list -> rcm.compressedPressure(quantity(list, messages)));
                data.list("compressed-temperature")
                        .ifPresent(list -> rcm.compressedTemperature(quantity(list, messages)));
                data.list("compression-time").ifPresent(list -> rcm.compressionTime(quantity(list, messages)));
                data.list("stroke").ifPresent(list -> rcm.stroke(quantity(list, messages)));
                data.list("clearance").ifPresent(list -> rcm.clearance(quantity(list, messages)));
                data.list("compression-ratio").ifPresent(list -> rcm.compressionRatio(quantity(list, messages)));
            });
            builder.conditions(rcm.build());
        } else {
            Quantity pressureRise = point.list("pressure-rise").map(list -> quantity(list, messages)).orElse(null);
            builder.conditions(new ShockTubeConditions(pressureRise));
        }

        List<TimeHistory> histories = new ArrayList<>();
        if (point.list("time-histories").isPresent()) {
            for (DocumentNode node : point.list("time-histories").get().getItems()) {
                histories.add(timeHistory((MapNode) node));
            }
        }
        builder.timeHistories(histories);
        return builder.build();
    }

    /** {@code ["value unit", {uncertainty block}?]} to a quantity. */
    Quantity quantity(ListNode list, List<LoaderMessage> messages) {
        Quantity value = Quantity.parse(((TextNode) list.get(0)).getValue());
        if (list.size() < 2) {
            return value;
        }
        return value.withUncertainty(uncertainty((MapNode) list.get(1), value.getUnits(), messages));
    }

    private Uncertainty uncertainty(MapNode block, String defaultUnits, List<LoaderMessage> messages) {
        boolean relative = block.text("uncertainty-type").map("relative"::equals).orElse(false);
        if (block.has("uncertainty")) {
            return uncertaintyValue(block.get("uncertainty"), relative, defaultUnits);
        }
        Uncertainty upper =
                uncertaintyValue(require(block, "upper-uncertainty", DocumentNode.class), relative, defaultUnits);
        Uncertainty lower =
                uncertaintyValue(require(block, "lower-uncertainty", DocumentNode.class), relative, defaultUnits);
        LOGGER.log(Level.WARNING, "Collapsing asymmetric uncertainty at {0}", block.getPath());
        messages.add(LoaderMessage.warning(Category.MODEL, block.getPath().toString(), ASYMMETRIC_UNCERTAINTY_WARNING));
        return Uncertainty.largerOf(upper, lower);
    }

    private static Uncertainty uncertaintyValue(DocumentNode node, boolean relative, String defaultUnits) {
        if (node instanceof NumberNode number) {
            return relative
                    ? Uncertainty.relative(number.doubleValue())
                    : Uncertainty.absolute(number.doubleValue(), defaultUnits);
        }
        if (node instanceof TextNode text) {
            Quantity parsed = Quantity.parse(text.getValue());
            return relative
                    ? Uncertainty.relative(parsed.magnitudeIn("dimensionless"))
                    : Uncertainty.absolute(parsed);
        }
        throw new IllegalArgumentException("Uncertainty at " + node.getPath() + " must be a number or a quantity");
    }

    private Composition composition(MapNode composition, List<LoaderMessage> messages) {
        CompositionKind kind =
                CompositionKind.fromDocumentName(require(composition, "kind", TextNode.class).getValue());
        List<Species> species = new ArrayList<>();
        for (DocumentNode node : require(composition, "species", ListNode.class).getItems()) {
            MapNode entry = (MapNode) node;
            ListNode amountList = require(entry, "amount", ListNode.class);
            Quantity amount = Quantity.dimensionless(((NumberNode) amountList.get(0)).doubleValue());
            if (amountList.size() > 1) {
                amount = amount.withUncertainty(uncertainty((MapNode) amountList.get(1), "", messages));
            }
            String name = require(entry, "species-name", TextNode.class).getValue();
            species.add(new Species(name, identity(entry), amount));
        }
        return new Composition(kind, species);
    }

    private static SpeciesIdentity identity(MapNode species) {
        if (species.text("InChI").isPresent()) {
            return new SpeciesIdentity.InChI(species.text("InChI").get());
        }
        if (species.text("SMILES").isPresent()) {
            return new SpeciesIdentity.Smiles(species.text("SMILES").get());
        }
        List<SpeciesIdentity.ElementAmount> elements = new ArrayList<>();
        for (DocumentNode node : require(species, "atomic-composition", ListNode.class).getItems()) {
            MapNode element = (MapNode) node;
            elements.add(
                    new SpeciesIdentity.ElementAmount(
                            require(element, "element", TextNode.class).getValue(),
                            require(element, "amount", NumberNode.class).doubleValue()));
        }
        return new SpeciesIdentity.AtomicComposition(elements);
    }

    private static IgnitionType ignitionType(MapNode node) {
        return new IgnitionType(
                IgnitionTarget.fromDocumentName(require(node, "target", TextNode.class).getValue()),
                IgnitionMeasure.fromDocumentName(require(node, "type", TextNode.class).getValue()));
    }

    private TimeHistory timeHistory(MapNode history) throws LoaderException {
        TimeHistoryType type = TimeHistoryType.fromDocumentName(require(history, "type", TextNode.class).getValue());
        HistoryColumn time = column(require(history, "time", MapNode.class));
        HistoryColumn quantity = column(require(history, "quantity", MapNode.class));
        DocumentNode valuesNode = require(history, "values", DocumentNode.class);
        List<double[]> rows;
        if (valuesNode instanceof MapNode file) {
            rows = readRows(require(file, "filename", TextNode.class).getValue());
        } else {
            rows = new ArrayList<>();
            for (DocumentNode rowNode : ((ListNode) valuesNode).getItems()) {
                ListNode row = (ListNode) rowNode;
                rows.add(
                        new double[] {
                            ((NumberNode) row.get(0)).doubleValue(), ((NumberNode) row.get(1)).doubleValue()
                        });
            }
        }
        Uncertainty uncertainty =
                history.map("uncertainty").map(block -> historyUncertainty(block, quantity.units())).orElse(null);
        return new TimeHistory(type, time, quantity, rows, uncertainty);
    }

    private static Uncertainty historyUncertainty(MapNode block, String quantityUnits) {
        boolean relative = block.text("type").map("relative"::equals).orElse(false);
        return uncertaintyValue(
                require(block, "value", DocumentNode.class), relative, block.text("units").orElse(quantityUnits));
    }

    private static HistoryColumn column(MapNode node) {
        return new HistoryColumn(
                require(node, "units", TextNode.class).getValue(),
                require(node, "column", NumberNode.class).getValue().intValue());
    }

    private List<double[]> readRows(String fileName) throws LoaderException {
        Path file = baseDirectory == null ? Path.of(fileName) : baseDirectory.resolve(fileName);
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LoaderException("Unable to read time history file " + file, ex);
        }
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] fields = line.split("\\s*,\\s*|\\s+");
            if (fields.length != 2) {
                throw new LoaderException(file + ":" + (i + 1) + ": expected two values per row");
            }
            try {
                rows.add(new double[] {DecimalText.parse(fields[0]), DecimalText.parse(fields[1])});
            } catch (NumberFormatException ex) {
                throw new LoaderException(file + ":" + (i + 1) + ": " + ex.getMessage(), ex);
            }
        }
        return rows;
    }

    private static <T extends DocumentNode> T require(MapNode node, String key, Class<T> type) {
        DocumentNode child = node.get(key);
        if (!type.isInstance(child)) {
            throw new IllegalArgumentException(
                    "Expected " + type.getSimpleName() + " at " + node.getPath().key(key) + " but found "
                            + (child == null ? "nothing" : child.getTypeName()));
        }
        return type.cast(child);
    }
}
