package com.chemked.data.record;

import com.chemked.data.quantity.DecimalText;
import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.Uncertainty;
import com.chemked.data.quantity.UncertaintyKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders records back into the plain document form (maps, lists, strings and numbers) accepted by
 * the validator, for serializers and for re-validation.
 */
public final class RecordDocuments {

    private RecordDocuments() {}

    public static Map<String, Object> toDocument(ChemKedRecord record) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("file-authors", authors(record.getFileAuthors()));
        document.put("file-version", record.getFileVersion());
        document.put("chemked-version", record.getChemKedVersion());
        document.put("reference", reference(record.getReference()));
        document.put("experiment-type", record.getExperimentType().getDocumentName());
        document.put("apparatus", apparatus(record.getApparatus()));
        List<Object> datapoints = new ArrayList<>();
        for (DataPoint datapoint : record.getDatapoints()) {
            datapoints.add(datapoint(datapoint));
        }
        document.put("datapoints", datapoints);
        return document;
    }

    public static Map<String, Object> datapoint(DataPoint datapoint) {
        Map<String, Object> point = new LinkedHashMap<>();
        point.put("temperature", quantity(datapoint.getTemperature()));
        point.put("pressure", quantity(datapoint.getPressure()));
        point.put("ignition-delay", quantity(datapoint.getIgnitionDelay()));
        datapoint.getFirstStageIgnitionDelay().ifPresent(q -> point.put("first-stage-ignition-delay", quantity(q)));
        datapoint.getPressureRise().ifPresent(q -> point.put("pressure-rise", quantity(q)));
        datapoint.getEquivalenceRatio().ifPresent(phi -> point.put("equivalence-ratio", phi));
        point.put("composition", composition(datapoint.getComposition()));
        Map<String, Object> ignitionType = new LinkedHashMap<>();
        ignitionType.put("target", datapoint.getIgnitionType().target().getDocumentName());
        ignitionType.put("type", datapoint.getIgnitionType().measure().getDocumentName());
        point.put("ignition-type", ignitionType);
        datapoint.getRcmConditions().filter(rcm -> !rcm.isEmpty()).ifPresent(rcm -> point.put("rcm-data", rcm(rcm)));
        if (!datapoint.getTimeHistories().isEmpty()) {
            List<Object> histories = new ArrayList<>();
            for (TimeHistory history : datapoint.getTimeHistories()) {
                histories.add(timeHistory(history));
            }
            point.put("time-histories", histories);
        }
        return point;
    }

    /** {@code ["value unit", {uncertainty}]}, the list form quantities take in documents. */
    public static List<Object> quantity(Quantity quantity) {
        List<Object> value = new ArrayList<>();
        value.add(quantity.toValueString());
        quantity.getUncertainty().ifPresent(uncertainty -> value.add(uncertainty(uncertainty, quantity.getUnits())));
        return value;
    }

    private static Map<String, Object> uncertainty(Uncertainty uncertainty, String quantityUnits) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("uncertainty-type", uncertainty.getKind().getDocumentName());
        if (uncertainty.getKind() == UncertaintyKind.RELATIVE || uncertainty.getUnits().equals(quantityUnits)) {
            block.put("uncertainty", uncertainty.getValue());
        } else {
            block.put("uncertainty", DecimalText.format(uncertainty.getValue()) + " " + uncertainty.getUnits());
        }
        return block;
    }

    private static List<Object> authors(List<Author> authors) {
        List<Object> result = new ArrayList<>();
        for (Author author : authors) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", author.getName());
            author.getOrcid().ifPresent(orcid -> entry.put("ORCID", orcid));
            result.add(entry);
        }
        return result;
    }

    private static Map<String, Object> reference(Reference reference) {
        Map<String, Object> entry = new LinkedHashMap<>();
        reference.getDoi().ifPresent(doi -> entry.put("doi", doi));
        entry.put("authors", authors(reference.getAuthors()));
        reference.getJournal().ifPresent(journal -> entry.put("journal", journal));
        entry.put("year", reference.getYear());
        reference.getVolume().ifPresent(volume -> entry.put("volume", volume));
        reference.getPages().ifPresent(pages -> entry.put("pages", pages));
        reference.getDetail().ifPresent(detail -> entry.put("detail", detail));
        return entry;
    }

    private static Map<String, Object> apparatus(Apparatus apparatus) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("kind", apparatus.getKind().getDocumentName());
        apparatus.getInstitution().ifPresent(institution -> entry.put("institution", institution));
        apparatus.getFacility().ifPresent(facility -> entry.put("facility", facility));
        return entry;
    }

    private static Map<String, Object> composition(Composition composition) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("kind", composition.getKind().getDocumentName());
        List<Object> species = new ArrayList<>();
        for (Species s : composition.getSpecies()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("species-name", s.getName());
            SpeciesIdentity identity = s.getIdentity();
            if (identity instanceof SpeciesIdentity.InChI inchi) {
                item.put(identity.documentKey(), inchi.value());
            } else if (identity instanceof SpeciesIdentity.Smiles smiles) {
                item.put(identity.documentKey(), smiles.value());
            } else if (identity instanceof SpeciesIdentity.AtomicComposition atoms) {
                List<Object> elements = new ArrayList<>();
                for (SpeciesIdentity.ElementAmount element : atoms.elements()) {
                    Map<String, Object> atom = new LinkedHashMap<>();
                    atom.put("element", element.element());
                    atom.put("amount", element.amount());
                    elements.add(atom);
                }
                item.put(identity.documentKey(), elements);
            }
            List<Object> amount = new ArrayList<>();
            amount.add(s.getAmount().getMagnitude());
            s.getAmount().getUncertainty().ifPresent(u -> amount.add(uncertainty(u, "")));
            item.put("amount", amount);
            species.add(item);
        }
        entry.put("species", species);
        return entry;
    }

    private static Map<String, Object> rcm(RcmConditions rcm) {
        Map<String, Object> entry = new LinkedHashMap<>();
        putQuantity(entry, "compressed-pressure", rcm.getCompressedPressure());
        putQuantity(entry, "compressed-temperature", rcm.getCompressedTemperature());
        putQuantity(entry, "compression-time", rcm.getCompressionTime());
        putQuantity(entry, "stroke", rcm.getStroke());
        putQuantity(entry, "clearance", rcm.getClearance());
        putQuantity(entry, "compression-ratio", rcm.getCompressionRatio());
        return entry;
    }

    private static void putQuantity(Map<String, Object> entry, String key, Optional<Quantity> value) {
        value.ifPresent(q -> entry.put(key, quantity(q)));
    }

    private static Map<String, Object> timeHistory(TimeHistory history) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", history.getType().getDocumentName());
        entry.put("time", column(history.getTime()));
        entry.put("quantity", column(history.getQuantity()));
        history.getUncertainty().ifPresent(uncertainty -> {
            Map<String, Object> block = new LinkedHashMap<>();
            block.put("type", uncertainty.getKind().getDocumentName());
            block.put("value", uncertainty.getValue());
            if (uncertainty.getKind() == UncertaintyKind.ABSOLUTE && !uncertainty.getUnits().isEmpty()) {
                block.put("units", uncertainty.getUnits());
            }
            entry.put("uncertainty", block);
        });
        List<Object> rows = new ArrayList<>();
        for (int i = 0; i < history.size(); i++) {
            double[] row = history.getRow(i);
            rows.add(List.of(row[0], row[1]));
        }
        entry.put("values", rows);
        return entry;
    }

    private static Map<String, Object> column(HistoryColumn column) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("units", column.units());
        entry.put("column", column.column());
        return entry;
    }
}
