package com.chemked.data.quantity;

import java.util.Objects;
import java.util.Optional;
import javax.measure.IncommensurableException;
import javax.measure.UnconvertibleException;
import javax.measure.Unit;
import javax.measure.UnitConverter;

/**
 * Symmetric uncertainty attached to a {@link Quantity}. Absolute uncertainties carry their own unit
 * (which must have the dimension of the quantity they qualify); relative uncertainties are plain
 * fractions of the magnitude.
 */
public final class Uncertainty {

    private final UncertaintyKind kind;
    private final double value;
    private final String units;

    private Uncertainty(UncertaintyKind kind, double value, String units) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("Uncertainty must be non-negative: " + value);
        }
        this.value = value;
        this.units = units == null ? "" : units.trim();
    }

    public static Uncertainty absolute(double value, String units) {
        return new Uncertainty(UncertaintyKind.ABSOLUTE, value, units);
    }

    public static Uncertainty absolute(Quantity value) {
        return new Uncertainty(UncertaintyKind.ABSOLUTE, value.getMagnitude(), value.getUnits());
    }

    public static Uncertainty relative(double value) {
        return new Uncertainty(UncertaintyKind.RELATIVE, value, "");
    }

    /**
     * Collapse an asymmetric pair to the larger bound. Both bounds must be of the same kind; absolute
     * bounds are compared in the unit of {@code upper}.
     */
    public static Uncertainty largerOf(Uncertainty upper, Uncertainty lower) {
        Objects.requireNonNull(upper, "upper");
        Objects.requireNonNull(lower, "lower");
        if (upper.kind != lower.kind) {
            throw new IllegalArgumentException("Upper and lower uncertainty must be of the same kind");
        }
        if (upper.kind == UncertaintyKind.RELATIVE) {
            return upper.value >= lower.value ? upper : lower;
        }
        double lowerInUpperUnits = convertDelta(lower.value, lower.getUnit(), upper.getUnit());
        return upper.value >= lowerInUpperUnits ? upper : lower;
    }

    public UncertaintyKind getKind() {
        return kind;
    }

    public double getValue() {
        return value;
    }

    /** Unit of an absolute uncertainty; empty for relative and dimensionless uncertainties. */
    public String getUnits() {
        return units;
    }

    public Optional<Quantity> asQuantity() {
        if (kind == UncertaintyKind.RELATIVE) {
            return Optional.empty();
        }
        return Optional.of(Quantity.of(value, units));
    }

    Unit<?> getUnit() {
        return UnitParser.parse(units);
    }

    /** Express this uncertainty in another unit; relative uncertainties are returned unchanged. */
    public Uncertainty to(String targetUnits) {
        if (kind == UncertaintyKind.RELATIVE) {
            return this;
        }
        return absolute(convertDelta(value, getUnit(), UnitParser.parse(targetUnits)), targetUnits);
    }

    /**
     * Convert a difference between two values rather than a point value, so affine units (degC) only
     * contribute their scale.
     */
    static double convertDelta(double delta, Unit<?> from, Unit<?> to) {
        UnitConverter converter = converter(from, to);
        return converter.convert(delta) - converter.convert(0.0);
    }

    static UnitConverter converter(Unit<?> from, Unit<?> to) {
        try {
            return from.getConverterToAny(to);
        } catch (IncommensurableException | UnconvertibleException ex) {
            throw new IllegalArgumentException("Cannot convert " + from + " to " + to, ex);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Uncertainty that)) {
            return false;
        }
        return kind == that.kind && Double.compare(value, that.value) == 0 && units.equals(that.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, units);
    }

    @Override
    public String toString() {
        if (kind == UncertaintyKind.RELATIVE) {
            return "±" + DecimalText.format(value) + " (relative)";
        }
        return "±" + DecimalText.format(value) + (units.isEmpty() ? "" : " " + units);
    }
}
