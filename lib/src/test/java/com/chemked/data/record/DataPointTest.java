package com.chemked.data.record;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.Uncertainty;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class DataPointTest {

    private static Composition hydrogenOxygen() {
        return new Composition(
                CompositionKind.MOLE_FRACTION,
                List.of(
                        CompositionTest.inchi("H2", "1S/H2/h1H", 0.125),
                        CompositionTest.inchi("O2", "1S/O2/c1-2", 0.0625),
                        CompositionTest.inchi("N2", "1S/N2/c1-2", 0.18125),
                        new Species("Ar", new SpeciesIdentity.Smiles("[Ar]"), Quantity.dimensionless(0.63125))));
    }

    private static DataPoint.Builder point() {
        return DataPoint.builder()
                .temperature(Quantity.parse("297.4 kelvin"))
                .pressure(Quantity.parse("958.0 torr"))
                .ignitionDelay(Quantity.of(1.0, "ms", Uncertainty.relative(0.1)))
                .composition(hydrogenOxygen())
                .ignitionType(new IgnitionType(IgnitionTarget.PRESSURE, IgnitionMeasure.D_DT_MAX));
    }

    @Test
    void moleFractionStringKeepsDocumentOrder() {
        assertEquals("H2:0.125, O2:0.0625, N2:0.18125, Ar:0.63125", point().build().getMoleFractionString());
    }

    @Test
    void speciesNamesCanBeConverted() {
        DataPoint datapoint = point().build();

        assertEquals(
                "h2:0.125, O2:0.0625, N2:0.18125, Ar:0.63125",
                datapoint.getMoleFractionString(Map.of("H2", "h2")));
        assertEquals(
                "H2:0.125, oxygen:0.0625, N2:0.18125, AR:0.63125",
                datapoint.getMoleFractionString(Map.of("1S/O2/c1-2", "oxygen", "[Ar]", "AR")));

        IllegalArgumentException ex =
                assertThrows(
                        IllegalArgumentException.class,
                        () -> datapoint.getMoleFractionString(Map.of("CH4", "methane")));
        assertEquals("Species conversion keys not found in composition: [CH4]", ex.getMessage());
    }

    @Test
    void massFractionStringNeedsMolecularWeights() {
        DataPoint withSmiles = point().build();
        assertThrows(IllegalStateException.class, withSmiles::getMassFractionString);

        DataPoint massBasis =
                point().composition(
                                new Composition(
                                        CompositionKind.MASS_FRACTION,
                                        List.of(
                                                CompositionTest.atoms("H2", "H", 2, 0.5),
                                                CompositionTest.atoms("O2", "O", 2, 0.5))))
                        .build();
        assertEquals("H2:0.5, O2:0.5", massBasis.getMassFractionString());
        assertEquals("hydrogen:0.5, O2:0.5", massBasis.getMassFractionString(Map.of("H2", "hydrogen")));
    }

    @Test
    void accessorsConvertUnits() {
        DataPoint datapoint = point().build();

        assertEquals(24.25, datapoint.getTemperature("degC").getMagnitude(), 1e-9);
        assertEquals(958.0 / 760.0, datapoint.getPressure("atm").getMagnitude(), 1e-9);
        Quantity delay = datapoint.getIgnitionDelay("us");
        assertEquals(1000.0, delay.getMagnitude(), 1e-9);
        assertEquals(100.0, delay.getAbsoluteUncertainty().getAsDouble(), 1e-9);
    }

    @Test
    void conditionsFollowApparatus() {
        DataPoint shockTube = point().conditions(new ShockTubeConditions(Quantity.parse("0.10 1/ms"))).build();
        assertEquals(Quantity.parse("0.10 1/ms"), shockTube.getPressureRise().orElseThrow());
        assertTrue(shockTube.getRcmConditions().isEmpty());

        DataPoint rcm =
                point().conditions(RcmConditions.builder().compressionTime(Quantity.parse("38.0 ms")).build())
                        .build();
        assertTrue(rcm.getPressureRise().isEmpty());
        assertEquals(ApparatusKind.RAPID_COMPRESSION_MACHINE, rcm.getConditions().getApparatusKind());
        RcmConditions conditions = rcm.getRcmConditions().orElseThrow();
        assertEquals(Quantity.parse("38.0 ms"), conditions.getCompressionTime().orElseThrow());
    }

    @Test
    void historiesAreLookedUpByType() {
        TimeHistory volume =
                new TimeHistory(
                        TimeHistoryType.VOLUME,
                        new HistoryColumn("s", 0),
                        new HistoryColumn("cm3", 1),
                        List.of(new double[] {0.0, 547.669375}, new double[] {0.001, 546.608789894}),
                        null);
        DataPoint datapoint =
                point().conditions(RcmConditions.builder().build()).timeHistories(List.of(volume)).build();

        assertEquals(2, datapoint.getTimeHistory(TimeHistoryType.VOLUME).orElseThrow().size());
        assertTrue(datapoint.getTimeHistory(TimeHistoryType.PRESSURE).isEmpty());
        assertThrows(
                IllegalArgumentException.class,
                () -> new TimeHistory(
                        TimeHistoryType.VOLUME,
                        new HistoryColumn("s", 0),
                        new HistoryColumn("cm3", 0),
                        List.of(),
                        null));
    }

    @Test
    void requiredValuesAreEnforced() {
        assertThrows(NullPointerException.class, () -> point().composition(null).build());
        assertThrows(IllegalArgumentException.class, () -> point().equivalenceRatio(-0.5).build());
        assertEquals(0.4, point().equivalenceRatio(0.4).build().getEquivalenceRatio().getAsDouble());
        assertTrue(point().build().getFirstStageIgnitionDelay().isEmpty());
    }
}
