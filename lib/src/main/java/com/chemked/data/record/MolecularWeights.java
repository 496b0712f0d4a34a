package com.chemked.data.record;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Molecular weights in g/mol from standard atomic weights. Species identified by InChI use the
 * formula layer ({@code InChI=1S/C2H6O/...} gives {@code C2H6O}); atomic compositions are summed
 * directly. SMILES strings are not interpreted.
 */
public final class MolecularWeights {
    private static final Pattern ELEMENT_COUNT = Pattern.compile("([A-Z][a-z]?)(\\d*)");
    private static final Pattern COMPONENT = Pattern.compile("^(\\d*)((?:[A-Z][a-z]?\\d*)+)$");

    private static final Map<String, Double> ATOMIC_WEIGHTS =
            Map.ofEntries(
                    Map.entry("H", 1.008),
                    Map.entry("He", 4.002602),
                    Map.entry("Li", 6.94),
                    Map.entry("Be", 9.0121831),
                    Map.entry("B", 10.81),
                    Map.entry("C", 12.011),
                    Map.entry("N", 14.007),
                    Map.entry("O", 15.999),
                    Map.entry("F", 18.998403163),
                    Map.entry("Ne", 20.1797),
                    Map.entry("Na", 22.98976928),
                    Map.entry("Mg", 24.305),
                    Map.entry("Al", 26.9815385),
                    Map.entry("Si", 28.085),
                    Map.entry("P", 30.973761998),
                    Map.entry("S", 32.06),
                    Map.entry("Cl", 35.45),
                    Map.entry("Ar", 39.948),
                    Map.entry("K", 39.0983),
                    Map.entry("Ca", 40.078),
                    Map.entry("Ti", 47.867),
                    Map.entry("Fe", 55.845),
                    Map.entry("Br", 79.904),
                    Map.entry("Kr", 83.798),
                    Map.entry("I", 126.90447),
                    Map.entry("Xe", 131.293));

    private MolecularWeights() {}

    public static OptionalDouble atomicWeight(String element) {
        Double weight = ATOMIC_WEIGHTS.get(element);
        return weight == null ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    /** Molecular weight of a species, or empty when its identity does not determine one. */
    public static OptionalDouble of(SpeciesIdentity identity) {
        if (identity instanceof SpeciesIdentity.InChI inchi) {
            return ofInChI(inchi.value());
        }
        if (identity instanceof SpeciesIdentity.AtomicComposition atoms) {
            double total = 0.0;
            for (SpeciesIdentity.ElementAmount element : atoms.elements()) {
                OptionalDouble weight = atomicWeight(element.element());
                if (weight.isEmpty()) {
                    return OptionalDouble.empty();
                }
                total += weight.getAsDouble() * element.amount();
            }
            return OptionalDouble.of(total);
        }
        return OptionalDouble.empty();
    }

    static OptionalDouble ofInChI(String inchi) {
        String body = inchi.startsWith("InChI=") ? inchi.substring("InChI=".length()) : inchi;
        String[] layers = body.split("/");
        if (layers.length < 2) {
            return OptionalDouble.empty();
        }
        return ofFormula(layers[1]);
    }

    /** Weight of a Hill formula such as {@code C2H6O}; dot-separated components may carry a count. */
    public static OptionalDouble ofFormula(String formula) {
        double total = 0.0;
        for (String component : formula.split("\\.")) {
            Matcher matcher = COMPONENT.matcher(component);
            if (!matcher.matches()) {
                return OptionalDouble.empty();
            }
            int multiplier = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
            Matcher elements = ELEMENT_COUNT.matcher(matcher.group(2));
            double componentWeight = 0.0;
            while (elements.find()) {
                OptionalDouble weight = atomicWeight(elements.group(1));
                if (weight.isEmpty()) {
                    return OptionalDouble.empty();
                }
                int count = elements.group(2).isEmpty() ? 1 : Integer.parseInt(elements.group(2));
                componentWeight += weight.getAsDouble() * count;
            }
            total += multiplier * componentWeight;
        }
        return OptionalDouble.of(total);
    }
}
