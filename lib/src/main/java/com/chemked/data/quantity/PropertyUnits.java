package com.chemked.data.quantity;

import java.util.Map;
import java.util.Optional;
import javax.measure.Unit;

/** SI reference unit for every unit-bearing ChemKED field, used for dimension checks. */
public final class PropertyUnits {

    private static final Map<String, String> REFERENCE_UNITS =
            Map.ofEntries(
                    Map.entry("temperature", "K"),
                    Map.entry("pressure", "Pa"),
                    Map.entry("ignition-delay", "s"),
                    Map.entry("first-stage-ignition-delay", "s"),
                    Map.entry("pressure-rise", "1/s"),
                    Map.entry("compression-time", "s"),
                    Map.entry("compressed-pressure", "Pa"),
                    Map.entry("compressed-temperature", "K"),
                    Map.entry("stroke", "m"),
                    Map.entry("clearance", "m"),
                    Map.entry("compression-ratio", "dimensionless"),
                    Map.entry("volume", "m**3"),
                    Map.entry("time", "s"),
                    Map.entry("piston position", "m"),
                    Map.entry("light emission", "dimensionless"),
                    Map.entry("OH emission", "dimensionless"),
                    Map.entry("absorption", "dimensionless"));

    private PropertyUnits() {}

    /** Reference unit expression for a field, e.g. {@code "K"} for {@code temperature}. */
    public static Optional<String> referenceUnits(String field) {
        return Optional.ofNullable(REFERENCE_UNITS.get(field));
    }

    public static Optional<Unit<?>> referenceUnit(String field) {
        return referenceUnits(field).map(UnitParser::parse);
    }

    /** True when {@code units} parses and has the dimension of the field's reference unit. */
    public static boolean isCompatible(String field, String units) {
        Optional<Unit<?>> reference = referenceUnit(field);
        if (reference.isEmpty()) {
            throw new IllegalArgumentException("No reference unit for field '" + field + "'");
        }
        return UnitParser.parse(units).isCompatible(reference.get());
    }
}
