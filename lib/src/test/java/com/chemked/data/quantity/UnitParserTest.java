package com.chemked.data.quantity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import javax.measure.Unit;
import org.junit.jupiter.api.Test;
import tech.units.indriya.AbstractUnit;

final class UnitParserTest {

    @Test
    void blankAndDimensionlessAreTheSameUnit() {
        assertSame(AbstractUnit.ONE, UnitParser.parse(""));
        assertTrue(UnitParser.parse("dimensionless").isCompatible(AbstractUnit.ONE));
    }

    @Test
    void acceptsPrefixedSymbolsAndSpelledOutNames() {
        assertEquals(1e-3, factor("ms", "s"), 1e-15);
        assertEquals(1e-6, factor("us", "s"), 1e-18);
        assertEquals(1e-6, factor("microseconds", "s"), 1e-18);
        assertEquals(1e3, factor("kPa", "Pa"), 1e-9);
        assertEquals(101325.0, factor("atmosphere", "Pa"), 1e-6);
        assertEquals(133.322368, factor("Torr", "Pa"), 1e-6);
    }

    @Test
    void handlesProductsQuotientsAndPowers() {
        assertEquals(1e3, factor("1/ms", "1/s"), 1e-9);
        assertEquals(1e-6, factor("cm**3", "m**3"), 1e-18);
        assertEquals(1e-6, factor("cm^3", "m^3"), 1e-18);
        assertEquals(1e-6, factor("cm3", "m3"), 1e-18);
        assertEquals(1e3, factor("kg*m/s**2", "g m s^-2"), 1e-9);
        assertEquals(1.0, factor("(Pa)/(s)", "Pa/s"), 1e-12);
    }

    @Test
    void reportsUnknownUnitsAndSyntaxErrors() {
        UnitFormatException unknown = assertThrows(UnitFormatException.class, () -> UnitParser.parse("furlong"));
        assertTrue(unknown.getMessage().contains("Unknown unit 'furlong'"));
        UnitFormatException syntax = assertThrows(UnitFormatException.class, () -> UnitParser.parse("m//s"));
        assertEquals("m//s", syntax.getExpression());
        assertEquals(3, syntax.getColumn().getAsInt());
        assertTrue(syntax.getMessage().startsWith("Invalid unit expression 'm//s' at column 3: "));
        assertTrue(unknown.getColumn().isEmpty());
        assertThrows(UnitFormatException.class, () -> UnitParser.parse("0 m"));
    }

    private static double factor(String from, String to) {
        Unit<?> source = UnitParser.parse(from);
        Unit<?> target = UnitParser.parse(to);
        return Uncertainty.converter(source, target).convert(1.0);
    }
}
