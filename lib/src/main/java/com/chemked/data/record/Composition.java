package com.chemked.data.record;

import com.chemked.data.quantity.DecimalText;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/** Initial mixture of a data point: the basis and the ordered species, unique by name. */
public final class Composition {
    private final CompositionKind kind;
    private final List<Species> species;

    public Composition(CompositionKind kind, List<Species> species) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.species = List.copyOf(species);
        if (this.species.isEmpty()) {
            throw new IllegalArgumentException("composition needs at least one species");
        }
        Set<String> names = new HashSet<>();
        for (Species s : this.species) {
            if (!names.add(s.getName())) {
                throw new IllegalArgumentException("Species " + s.getName() + " is listed more than once");
            }
        }
    }

    public CompositionKind getKind() {
        return kind;
    }

    public List<Species> getSpecies() {
        return species;
    }

    /**
     * Mole fraction of every species, keyed by species name in document order. Mass fractions are
     * converted with molecular weights.
     *
     * @throws IllegalStateException if a mass-fraction species has no known molecular weight
     */
    public Map<String, Double> getMoleFractions() {
        Map<String, Double> fractions = new LinkedHashMap<>();
        switch (kind) {
            case MOLE_FRACTION:
                species.forEach(s -> fractions.put(s.getName(), s.getAmount().getMagnitude()));
                break;
            case MOLE_PERCENT:
                species.forEach(s -> fractions.put(s.getName(), fromPercent(s.getAmount().getMagnitude())));
                break;
            case MASS_FRACTION:
                double moles = 0.0;
                List<Double> perSpecies = new ArrayList<>();
                for (Species s : species) {
                    double value = s.getAmount().getMagnitude() / molecularWeight(s);
                    perSpecies.add(value);
                    moles += value;
                }
                for (int i = 0; i < species.size(); i++) {
                    fractions.put(species.get(i).getName(), perSpecies.get(i) / moles);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled composition kind " + kind);
        }
        return fractions;
    }

    /**
     * Mass fraction of every species, keyed by species name in document order.
     *
     * @throws IllegalStateException if a molar-basis species has no known molecular weight
     */
    public Map<String, Double> getMassFractions() {
        if (kind == CompositionKind.MASS_FRACTION) {
            Map<String, Double> fractions = new LinkedHashMap<>();
            species.forEach(s -> fractions.put(s.getName(), s.getAmount().getMagnitude()));
            return fractions;
        }
        Map<String, Double> moleFractions = getMoleFractions();
        double mass = 0.0;
        List<Double> perSpecies = new ArrayList<>();
        for (Species s : species) {
            double value = moleFractions.get(s.getName()) * molecularWeight(s);
            perSpecies.add(value);
            mass += value;
        }
        Map<String, Double> fractions = new LinkedHashMap<>();
        for (int i = 0; i < species.size(); i++) {
            fractions.put(species.get(i).getName(), perSpecies.get(i) / mass);
        }
        return fractions;
    }

    /**
     * {@code "name:value, name:value"} rendering of fractions. Species names can be replaced through
     * {@code speciesConversion}, keyed by species name, InChI or SMILES.
     *
     * @throws IllegalArgumentException if a conversion key matches no species
     */
    String toFractionString(Map<String, Double> fractions, Map<String, String> speciesConversion) {
        Map<String, String> remaining = new LinkedHashMap<>(speciesConversion);
        List<String> parts = new ArrayList<>();
        for (Species s : species) {
            String label = s.getName();
            String byName = remaining.remove(s.getName());
            String byIdentity = identityKey(s).map(remaining::remove).orElse(null);
            if (byName != null) {
                label = byName;
            } else if (byIdentity != null) {
                label = byIdentity;
            }
            parts.add(label + ":" + DecimalText.format(fractions.get(s.getName())));
        }
        if (!remaining.isEmpty()) {
            throw new IllegalArgumentException(
                    "Species conversion keys not found in composition: " + remaining.keySet());
        }
        return parts.stream().collect(Collectors.joining(", "));
    }

    private static Optional<String> identityKey(Species s) {
        if (s.getIdentity() instanceof SpeciesIdentity.InChI inchi) {
            return Optional.of(inchi.value());
        }
        if (s.getIdentity() instanceof SpeciesIdentity.Smiles smiles) {
            return Optional.of(smiles.value());
        }
        return Optional.empty();
    }

    private static double molecularWeight(Species s) {
        OptionalDouble weight = MolecularWeights.of(s.getIdentity());
        if (weight.isEmpty() || weight.getAsDouble() <= 0.0) {
            throw new IllegalStateException("No molecular weight known for species " + s.getName());
        }
        return weight.getAsDouble();
    }

    private static double fromPercent(double percent) {
        return BigDecimal.valueOf(percent).movePointLeft(2).doubleValue();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Composition that)) {
            return false;
        }
        return kind == that.kind && species.equals(that.species);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, species);
    }
}
