package com.chemked.data.quantity;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.measure.MetricPrefix;
import javax.measure.Unit;
import tech.units.indriya.AbstractUnit;
import tech.units.indriya.function.MultiplyConverter;
import tech.units.indriya.unit.Units;

/**
 * Named units accepted in ChemKED documents. Names follow the spelling used by the format's
 * examples ("K", "kelvin", "torr", "cm3", "1/ms", "kPa", ...). Metric prefixes are accepted on the
 * SI symbols and on the spelled-out names, and spelled-out names may be plural.
 */
final class UnitRegistry {

    private static final Unit<?> RANKINE = Units.KELVIN.transform(MultiplyConverter.ofRational(5, 9));
    private static final Unit<?> ATMOSPHERE = Units.PASCAL.transform(MultiplyConverter.of(101325.0));
    private static final Unit<?> INCH = Units.METRE.transform(MultiplyConverter.of(0.0254));

    private static final Map<String, Unit<?>> SYMBOLS = new HashMap<>();
    private static final Map<String, Unit<?>> NAMES = new HashMap<>();
    private static final Set<String> PREFIXABLE_SYMBOLS = Set.of("s", "m", "Pa", "bar", "L", "l", "g", "mol", "K");
    private static final Set<String> PREFIXABLE_NAMES =
            Set.of("second", "meter", "metre", "pascal", "bar", "liter", "litre", "gram", "mole", "kelvin");
    private static final Map<String, MetricPrefix> PREFIX_SYMBOLS = new LinkedHashMap<>();
    private static final Map<String, MetricPrefix> PREFIX_NAMES = new LinkedHashMap<>();

    static {
        SYMBOLS.put("dimensionless", AbstractUnit.ONE);
        SYMBOLS.put("K", Units.KELVIN);
        SYMBOLS.put("degK", Units.KELVIN);
        SYMBOLS.put("degC", Units.CELSIUS);
        SYMBOLS.put("°C", Units.CELSIUS);
        SYMBOLS.put("degR", RANKINE);
        SYMBOLS.put("degF", RANKINE.shift(459.67));
        SYMBOLS.put("°F", RANKINE.shift(459.67));
        SYMBOLS.put("s", Units.SECOND);
        SYMBOLS.put("sec", Units.SECOND);
        SYMBOLS.put("min", Units.MINUTE);
        SYMBOLS.put("h", Units.HOUR);
        SYMBOLS.put("hr", Units.HOUR);
        SYMBOLS.put("Pa", Units.PASCAL);
        SYMBOLS.put("atm", ATMOSPHERE);
        SYMBOLS.put("bar", Units.PASCAL.transform(MultiplyConverter.of(1.0e5)));
        SYMBOLS.put("torr", ATMOSPHERE.transform(MultiplyConverter.ofRational(1, 760)));
        SYMBOLS.put("Torr", ATMOSPHERE.transform(MultiplyConverter.ofRational(1, 760)));
        SYMBOLS.put("mmHg", Units.PASCAL.transform(MultiplyConverter.of(133.322387415)));
        SYMBOLS.put("psi", Units.PASCAL.transform(MultiplyConverter.of(6894.757293168361)));
        SYMBOLS.put("m", Units.METRE);
        SYMBOLS.put("in", INCH);
        SYMBOLS.put("ft", INCH.transform(MultiplyConverter.of(12.0)));
        SYMBOLS.put("L", Units.LITRE);
        SYMBOLS.put("l", Units.LITRE);
        SYMBOLS.put("g", Units.GRAM);
        SYMBOLS.put("mol", Units.MOLE);

        NAMES.put("kelvin", Units.KELVIN);
        NAMES.put("celsius", Units.CELSIUS);
        NAMES.put("degree_Celsius", Units.CELSIUS);
        NAMES.put("rankine", RANKINE);
        NAMES.put("fahrenheit", RANKINE.shift(459.67));
        NAMES.put("degree_Fahrenheit", RANKINE.shift(459.67));
        NAMES.put("second", Units.SECOND);
        NAMES.put("minute", Units.MINUTE);
        NAMES.put("hour", Units.HOUR);
        NAMES.put("pascal", Units.PASCAL);
        NAMES.put("atmosphere", ATMOSPHERE);
        NAMES.put("bar", SYMBOLS.get("bar"));
        NAMES.put("meter", Units.METRE);
        NAMES.put("metre", Units.METRE);
        NAMES.put("inch", INCH);
        NAMES.put("foot", SYMBOLS.get("ft"));
        NAMES.put("liter", Units.LITRE);
        NAMES.put("litre", Units.LITRE);
        NAMES.put("gram", Units.GRAM);
        NAMES.put("mole", Units.MOLE);

        // Two-letter prefixes first so "da" wins over "d".
        PREFIX_SYMBOLS.put("da", MetricPrefix.DECA);
        PREFIX_SYMBOLS.put("G", MetricPrefix.GIGA);
        PREFIX_SYMBOLS.put("M", MetricPrefix.MEGA);
        PREFIX_SYMBOLS.put("k", MetricPrefix.KILO);
        PREFIX_SYMBOLS.put("h", MetricPrefix.HECTO);
        PREFIX_SYMBOLS.put("d", MetricPrefix.DECI);
        PREFIX_SYMBOLS.put("c", MetricPrefix.CENTI);
        PREFIX_SYMBOLS.put("m", MetricPrefix.MILLI);
        PREFIX_SYMBOLS.put("u", MetricPrefix.MICRO);
        PREFIX_SYMBOLS.put("µ", MetricPrefix.MICRO);
        PREFIX_SYMBOLS.put("μ", MetricPrefix.MICRO);
        PREFIX_SYMBOLS.put("n", MetricPrefix.NANO);
        PREFIX_SYMBOLS.put("p", MetricPrefix.PICO);

        PREFIX_NAMES.put("giga", MetricPrefix.GIGA);
        PREFIX_NAMES.put("mega", MetricPrefix.MEGA);
        PREFIX_NAMES.put("kilo", MetricPrefix.KILO);
        PREFIX_NAMES.put("hecto", MetricPrefix.HECTO);
        PREFIX_NAMES.put("deci", MetricPrefix.DECI);
        PREFIX_NAMES.put("centi", MetricPrefix.CENTI);
        PREFIX_NAMES.put("milli", MetricPrefix.MILLI);
        PREFIX_NAMES.put("micro", MetricPrefix.MICRO);
        PREFIX_NAMES.put("nano", MetricPrefix.NANO);
        PREFIX_NAMES.put("pico", MetricPrefix.PICO);
    }

    private UnitRegistry() {}

    static Optional<Unit<?>> lookup(String name) {
        Unit<?> unit = SYMBOLS.get(name);
        if (unit != null) {
            return Optional.of(unit);
        }
        unit = NAMES.get(name);
        if (unit != null) {
            return Optional.of(unit);
        }
        Optional<Unit<?>> prefixed = lookupPrefixed(name);
        if (prefixed.isPresent()) {
            return prefixed;
        }
        if (name.length() > 3 && name.endsWith("s")) {
            String singular = name.substring(0, name.length() - 1);
            unit = NAMES.get(singular);
            if (unit != null) {
                return Optional.of(unit);
            }
            return lookupPrefixedName(singular);
        }
        return Optional.empty();
    }

    private static Optional<Unit<?>> lookupPrefixed(String name) {
        for (Map.Entry<String, MetricPrefix> entry : PREFIX_SYMBOLS.entrySet()) {
            String prefix = entry.getKey();
            if (name.length() > prefix.length() && name.startsWith(prefix)) {
                String base = name.substring(prefix.length());
                if (PREFIXABLE_SYMBOLS.contains(base)) {
                    return Optional.of(SYMBOLS.get(base).prefix(entry.getValue()));
                }
            }
        }
        return lookupPrefixedName(name);
    }

    private static Optional<Unit<?>> lookupPrefixedName(String name) {
        for (Map.Entry<String, MetricPrefix> entry : PREFIX_NAMES.entrySet()) {
            String prefix = entry.getKey();
            if (name.length() > prefix.length() && name.startsWith(prefix)) {
                String base = name.substring(prefix.length());
                if (PREFIXABLE_NAMES.contains(base)) {
                    return Optional.of(NAMES.get(base).prefix(entry.getValue()));
                }
            }
        }
        return Optional.empty();
    }
}
