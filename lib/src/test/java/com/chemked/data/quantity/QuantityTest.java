package com.chemked.data.quantity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class QuantityTest {

    @Test
    void parsesValueAndUnitText() {
        Quantity temperature = Quantity.parse("297.4 kelvin");
        assertEquals(297.4, temperature.getMagnitude());
        assertEquals("kelvin", temperature.getUnits());
        assertEquals("297.4 kelvin", temperature.toValueString());

        Quantity rise = Quantity.parse("0.10 1/ms");
        assertEquals(0.1, rise.getMagnitude());
        assertEquals(100.0, rise.magnitudeIn("1/s"), 1e-9);
    }

    @Test
    void missingUnitMeansDimensionless() {
        Quantity ratio = Quantity.parse("12.5");
        assertEquals("", ratio.getUnits());
        assertTrue(ratio.isCompatibleWith("dimensionless"));
        assertEquals("12.5", ratio.toValueString());
    }

    @Test
    void rejectsTextWithoutLeadingNumber() {
        UnitFormatException ex = assertThrows(UnitFormatException.class, () -> Quantity.parse("K 297.4"));
        assertEquals("K 297.4", ex.getExpression());
        assertThrows(UnitFormatException.class, () -> Quantity.parse("297.4 furlongs"));
    }

    @Test
    void convertsBetweenCompatibleUnits() {
        Quantity pressure = Quantity.parse("958.0 torr");
        assertEquals(127722.76, pressure.magnitudeIn("Pa"), 0.01);
        assertEquals(1.26052, pressure.to("atm").getMagnitude(), 1e-5);
        assertEquals("atm", pressure.to("atm").getUnits());

        Quantity delay = Quantity.parse("471.54 us");
        assertEquals(0.47154, delay.magnitudeIn("ms"), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> delay.to("K"));
    }

    @Test
    void volumesUseTrailingExponentShorthand() {
        Quantity volume = Quantity.of(547.669375, "cm3");
        assertEquals(5.47669375e-4, volume.magnitudeIn("m**3"), 1e-15);
        assertTrue(PropertyUnits.isCompatible("volume", "cm3"));
        assertFalse(PropertyUnits.isCompatible("volume", "cm2"));
    }

    @Test
    void absoluteUncertaintyFollowsConversion() {
        Quantity temperature = Quantity.of(1164.48, "K", Uncertainty.absolute(10.0, "K"));
        assertEquals(10.0, temperature.getAbsoluteUncertainty().getAsDouble(), 1e-12);
        assertEquals(10.0 / 1164.48, temperature.getRelativeUncertainty().getAsDouble(), 1e-12);

        Quantity celsius = temperature.to("degC");
        assertEquals(891.33, celsius.getMagnitude(), 1e-9);
        assertEquals(10.0, celsius.getUncertainty().orElseThrow().getValue(), 1e-9);
        assertEquals("degC", celsius.getUncertainty().orElseThrow().getUnits());
    }

    @Test
    void relativeUncertaintyScalesWithMagnitude() {
        Quantity delay = Quantity.of(471.54, "us", Uncertainty.relative(0.1));
        assertEquals(47.154, delay.getAbsoluteUncertainty().getAsDouble(), 1e-9);
        assertEquals(0.1, delay.getRelativeUncertainty().getAsDouble());
        assertEquals(Uncertainty.relative(0.1), delay.to("ms").getUncertainty().orElseThrow());
    }

    @Test
    void uncertaintyMustShareTheQuantityDimension() {
        assertThrows(
                IllegalArgumentException.class, () -> Quantity.of(1164.48, "K", Uncertainty.absolute(10.0, "Pa")));
        assertThrows(IllegalArgumentException.class, () -> Uncertainty.absolute(-1.0, "K"));
    }

    @Test
    void asymmetricBoundsCollapseToTheLargerOne() {
        Uncertainty upper = Uncertainty.absolute(5.0, "K");
        Uncertainty lower = Uncertainty.absolute(3.0, "K");
        assertEquals(upper, Uncertainty.largerOf(upper, lower));
        assertEquals(upper, Uncertainty.largerOf(lower, upper));

        Uncertainty millis = Uncertainty.absolute(0.5, "ms");
        Uncertainty micros = Uncertainty.absolute(700.0, "us");
        assertEquals(micros, Uncertainty.largerOf(millis, micros));

        assertThrows(
                IllegalArgumentException.class,
                () -> Uncertainty.largerOf(Uncertainty.relative(0.1), Uncertainty.absolute(1.0, "K")));
    }

    @Test
    void equalityIncludesUnitsAndUncertainty() {
        assertEquals(Quantity.parse("220 kPa"), Quantity.of(220.0, "kPa"));
        assertFalse(Quantity.parse("220 kPa").equals(Quantity.of(220000.0, "Pa")));
        assertFalse(
                Quantity.of(220.0, "kPa").equals(Quantity.of(220.0, "kPa", Uncertainty.relative(0.01))));
    }
}
