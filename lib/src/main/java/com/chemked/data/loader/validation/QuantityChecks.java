package com.chemked.data.loader.validation;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.LoaderMessage.Category;
import com.chemked.data.quantity.PropertyUnits;
import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.UnitFormatException;
import com.chemked.data.quantity.UnitParser;
import java.util.List;
import java.util.Optional;
import javax.measure.Unit;

/** Dimension and sign checks shared by the quantity, uncertainty, unit and history rules. */
final class QuantityChecks {
    private static final String DIMENSIONLESS = "dimensionless";

    private QuantityChecks() {}

    /**
     * Check a {@code "value unit"} string for a field: it must parse, have the field's dimension and
     * be strictly positive. Fields without a reference unit are only checked for syntax.
     */
    static void checkQuantity(String field, String text, String path, List<LoaderMessage> out) {
        Quantity quantity;
        try {
            quantity = Quantity.parse(text);
        } catch (UnitFormatException ex) {
            out.add(semantic(path, "unable to parse quantity '" + text + "': " + ex.getMessage()));
            return;
        }
        Optional<String> reference = PropertyUnits.referenceUnits(field);
        if (reference.isEmpty()) {
            return;
        }
        if (!quantity.isCompatibleWith(reference.get())) {
            out.add(incompatible(path, reference.get()));
            return;
        }
        if (quantity.magnitudeIn(reference.get()) <= 0.0) {
            out.add(semantic(path, "value must be greater than 0.0 " + reference.get()));
        }
    }

    /** Check that a bare unit expression has the dimension of {@code dimensionField}. */
    static void checkUnits(String dimensionField, String units, String path, String prefix, List<LoaderMessage> out) {
        Optional<String> reference = PropertyUnits.referenceUnits(dimensionField);
        Unit<?> unit;
        try {
            unit = UnitParser.parse(units);
        } catch (UnitFormatException ex) {
            out.add(semantic(path, "unable to parse units '" + units + "': " + ex.getMessage()));
            return;
        }
        if (reference.isPresent() && !unit.isCompatible(UnitParser.parse(reference.get()))) {
            out.add(semantic(path, prefix + "incompatible units; should be consistent with " + reference.get()));
        }
    }

    /**
     * Check a plain fraction written as text, such as a relative uncertainty: it must parse, be
     * dimensionless and be strictly positive. {@code label} names the value in the messages.
     */
    static void checkDimensionless(String label, String text, String path, List<LoaderMessage> out) {
        Quantity quantity;
        try {
            quantity = Quantity.parse(text);
        } catch (UnitFormatException ex) {
            out.add(semantic(path, "unable to parse " + label + " '" + text + "': " + ex.getMessage()));
            return;
        }
        if (!quantity.isCompatibleWith(DIMENSIONLESS)) {
            out.add(semantic(path, label + " must be dimensionless"));
        } else if (quantity.magnitudeIn(DIMENSIONLESS) <= 0.0) {
            out.add(semantic(path, label + " must be greater than 0.0"));
        }
    }

    /** Check that a bare unit expression carries no dimension. */
    static void checkDimensionlessUnits(String label, String units, String path, List<LoaderMessage> out) {
        try {
            if (!UnitParser.parse(units).isCompatible(UnitParser.parse(DIMENSIONLESS))) {
                out.add(semantic(path, label + " must be dimensionless"));
            }
        } catch (UnitFormatException ex) {
            out.add(semantic(path, "unable to parse units '" + units + "': " + ex.getMessage()));
        }
    }

    static LoaderMessage incompatible(String path, String referenceUnits) {
        return semantic(path, "incompatible units; should be consistent with " + referenceUnits);
    }

    static LoaderMessage semantic(String path, String message) {
        return LoaderMessage.error(Category.SEMANTIC, path, message);
    }
}
