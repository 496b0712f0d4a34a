package com.chemked.data.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.chemked.data.quantity.Quantity;
import com.chemked.data.record.SpeciesIdentity.AtomicComposition;
import com.chemked.data.record.SpeciesIdentity.ElementAmount;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class CompositionTest {

    private static final double H2 = 2.016;
    private static final double O2 = 31.998;

    static Species inchi(String name, String inchi, double amount) {
        return new Species(name, new SpeciesIdentity.InChI(inchi), Quantity.dimensionless(amount));
    }

    static Species atoms(String name, String element, int count, double amount) {
        return new Species(
                name,
                new AtomicComposition(List.of(new ElementAmount(element, count))),
                Quantity.dimensionless(amount));
    }

    @Test
    void molePercentIsScaledExactly() {
        Composition composition =
                new Composition(
                        CompositionKind.MOLE_PERCENT,
                        List.of(
                                inchi("H2", "1S/H2/h1H", 0.444),
                                inchi("O2", "1S/O2/c1-2", 0.556),
                                inchi("Ar", "1S/Ar", 99.0)));

        Map<String, Double> fractions = composition.getMoleFractions();
        assertEquals(List.of("H2", "O2", "Ar"), List.copyOf(fractions.keySet()));
        assertEquals(0.00444, fractions.get("H2"));
        assertEquals(0.00556, fractions.get("O2"));
        assertEquals(0.99, fractions.get("Ar"));
    }

    @Test
    void massFractionsUseInChIFormulaLayer() {
        Composition composition =
                new Composition(
                        CompositionKind.MOLE_FRACTION,
                        List.of(inchi("H2", "1S/H2/h1H", 0.5), inchi("O2", "InChI=1S/O2/c1-2", 0.5)));

        Map<String, Double> mass = composition.getMassFractions();
        assertEquals(H2 / (H2 + O2), mass.get("H2"), 1e-12);
        assertEquals(O2 / (H2 + O2), mass.get("O2"), 1e-12);
    }

    @Test
    void moleFractionsFromMassUseAtomicComposition() {
        Composition composition =
                new Composition(
                        CompositionKind.MASS_FRACTION, List.of(atoms("H2", "H", 2, 0.5), atoms("O2", "O", 2, 0.5)));

        Map<String, Double> moles = composition.getMoleFractions();
        assertEquals(O2 / (H2 + O2), moles.get("H2"), 1e-12);
        assertEquals(H2 / (H2 + O2), moles.get("O2"), 1e-12);
        assertEquals(Map.of("H2", 0.5, "O2", 0.5), composition.getMassFractions());
    }

    @Test
    void conversionNeedsKnownMolecularWeight() {
        Composition composition =
                new Composition(
                        CompositionKind.MASS_FRACTION,
                        List.of(
                                new Species("H2", new SpeciesIdentity.Smiles("[HH]"), Quantity.dimensionless(0.5)),
                                atoms("O2", "O", 2, 0.5)));

        IllegalStateException ex = assertThrows(IllegalStateException.class, composition::getMoleFractions);
        assertEquals("No molecular weight known for species H2", ex.getMessage());
    }

    @Test
    void molecularWeightsFromFormulas() {
        assertEquals(46.069, MolecularWeights.ofFormula("C2H6O").getAsDouble(), 1e-9);
        assertEquals(2 * 18.015, MolecularWeights.ofFormula("2H2O").getAsDouble(), 1e-9);
        assertEquals(39.948, MolecularWeights.ofInChI("InChI=1S/Ar").getAsDouble(), 1e-12);
        assertEquals(true, MolecularWeights.ofFormula("Xx2").isEmpty());
        assertEquals(true, MolecularWeights.of(new SpeciesIdentity.Smiles("CCO")).isEmpty());
    }

    @Test
    void needsAtLeastOneSpecies() {
        assertThrows(IllegalArgumentException.class, () -> new Composition(CompositionKind.MOLE_FRACTION, List.of()));
        assertThrows(IllegalArgumentException.class, () -> CompositionKind.fromDocumentName("volume fraction"));
    }

    @Test
    void speciesNamesAreUnique() {
        IllegalArgumentException ex =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> new Composition(
                                CompositionKind.MOLE_FRACTION,
                                List.of(inchi("H2", "1S/H2/h1H", 0.5), atoms("H2", "H", 2, 0.5))));
        assertEquals("Species H2 is listed more than once", ex.getMessage());
    }
}
