package com.chemked.data.quantity;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.measure.Unit;
import javax.measure.UnitConverter;

/**
 * Scalar magnitude with a unit expression and an optional symmetric uncertainty. Instances are
 * immutable; conversions return new quantities and keep the unit text the caller asked for.
 */
public final class Quantity {

    private static final Pattern VALUE_UNIT =
            Pattern.compile("^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)\\s*(.*?)\\s*$");

    private final double magnitude;
    private final String units;
    private final Uncertainty uncertainty;

    private Quantity(double magnitude, String units, Uncertainty uncertainty) {
        if (Double.isNaN(magnitude) || Double.isInfinite(magnitude)) {
            throw new IllegalArgumentException("Quantity magnitude must be finite: " + magnitude);
        }
        this.magnitude = magnitude;
        this.units = units == null ? "" : units.trim();
        this.uncertainty = uncertainty;
        UnitParser.parse(this.units);
        if (uncertainty != null && uncertainty.getKind() == UncertaintyKind.ABSOLUTE) {
            Unit<?> own = getUnit();
            Unit<?> other = uncertainty.getUnit();
            if (!own.isCompatible(other)) {
                throw new IllegalArgumentException(
                        "Uncertainty unit '" + uncertainty.getUnits() + "' is incompatible with '" + this.units + "'");
            }
        }
    }

    public static Quantity of(double magnitude, String units) {
        return new Quantity(magnitude, units, null);
    }

    public static Quantity of(double magnitude, String units, Uncertainty uncertainty) {
        return new Quantity(magnitude, units, uncertainty);
    }

    public static Quantity dimensionless(double magnitude) {
        return new Quantity(magnitude, "", null);
    }

    /**
     * Parse a {@code "value unit"} string such as {@code "297.4 K"} or {@code "0.10 1/ms"}. A missing
     * unit means dimensionless.
     *
     * @throws UnitFormatException if the text has no leading number or the unit is unknown
     */
    public static Quantity parse(String text) {
        Objects.requireNonNull(text, "text");
        Matcher matcher = VALUE_UNIT.matcher(text);
        if (!matcher.matches()) {
            throw new UnitFormatException(text, "Expected '<value> <unit>' but found '" + text + "'");
        }
        double value = DecimalText.parse(matcher.group(1));
        return new Quantity(value, matcher.group(2), null);
    }

    public double getMagnitude() {
        return magnitude;
    }

    public String getUnits() {
        return units;
    }

    public Unit<?> getUnit() {
        return UnitParser.parse(units);
    }

    public Optional<Uncertainty> getUncertainty() {
        return Optional.ofNullable(uncertainty);
    }

    public Quantity withUncertainty(Uncertainty newUncertainty) {
        return new Quantity(magnitude, units, newUncertainty);
    }

    public Quantity withoutUncertainty() {
        return uncertainty == null ? this : new Quantity(magnitude, units, null);
    }

    /** Uncertainty expressed in this quantity's unit, whatever kind it was given as. */
    public OptionalDouble getAbsoluteUncertainty() {
        if (uncertainty == null) {
            return OptionalDouble.empty();
        }
        if (uncertainty.getKind() == UncertaintyKind.RELATIVE) {
            return OptionalDouble.of(Math.abs(magnitude) * uncertainty.getValue());
        }
        return OptionalDouble.of(Uncertainty.convertDelta(uncertainty.getValue(), uncertainty.getUnit(), getUnit()));
    }

    /** Uncertainty as a fraction of the magnitude. */
    public OptionalDouble getRelativeUncertainty() {
        if (uncertainty == null) {
            return OptionalDouble.empty();
        }
        if (uncertainty.getKind() == UncertaintyKind.RELATIVE) {
            return OptionalDouble.of(uncertainty.getValue());
        }
        if (magnitude == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(getAbsoluteUncertainty().getAsDouble() / Math.abs(magnitude));
    }

    public boolean isCompatibleWith(String otherUnits) {
        return getUnit().isCompatible(UnitParser.parse(otherUnits));
    }

    /**
     * Convert to another unit. An absolute uncertainty is carried over as the converted width of the
     * interval {@code [magnitude, magnitude + uncertainty]}, which keeps it correct for offset units.
     *
     * @throws IllegalArgumentException if the units have different dimensions
     */
    public Quantity to(String targetUnits) {
        Unit<?> target = UnitParser.parse(targetUnits);
        UnitConverter converter = Uncertainty.converter(getUnit(), target);
        double converted = converter.convert(magnitude);
        Uncertainty convertedUncertainty = uncertainty;
        if (uncertainty != null && uncertainty.getKind() == UncertaintyKind.ABSOLUTE) {
            double width = Uncertainty.convertDelta(uncertainty.getValue(), uncertainty.getUnit(), getUnit());
            double upper = converter.convert(magnitude + width);
            convertedUncertainty = Uncertainty.absolute(Math.abs(upper - converted), targetUnits);
        }
        return new Quantity(converted, targetUnits, convertedUncertainty);
    }

    public double magnitudeIn(String targetUnits) {
        return Uncertainty.converter(getUnit(), UnitParser.parse(targetUnits)).convert(magnitude);
    }

    /** The {@code "value unit"} form used in documents. */
    public String toValueString() {
        String value = DecimalText.format(magnitude);
        return units.isEmpty() ? value : value + " " + units;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Quantity that)) {
            return false;
        }
        return Double.compare(magnitude, that.magnitude) == 0
                && units.equals(that.units)
                && Objects.equals(uncertainty, that.uncertainty);
    }

    @Override
    public int hashCode() {
        return Objects.hash(magnitude, units, uncertainty);
    }

    @Override
    public String toString() {
        return uncertainty == null ? toValueString() : toValueString() + " " + uncertainty;
    }
}
