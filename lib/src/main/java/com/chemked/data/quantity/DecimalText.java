package com.chemked.data.quantity;

import java.math.BigDecimal;

/**
 * Shortest round-trip decimal rendering of doubles. Values between 1e-4 and 1e16 print in plain
 * notation with at least one fractional digit ({@code 0.125}, {@code 958.0}); others use a
 * two-digit exponent ({@code 1e-05}, {@code 2.5e+16}).
 */
public final class DecimalText {

    private DecimalText() {}

    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1.0 / value) < 0 ? "-0.0" : "0.0";
        }
        BigDecimal digits = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String unscaled = digits.unscaledValue().abs().toString();
        int exponent = unscaled.length() - 1 - digits.scale();
        if (exponent >= -4 && exponent < 16) {
            String plain = digits.toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
        StringBuilder builder = new StringBuilder();
        if (value < 0) {
            builder.append('-');
        }
        builder.append(unscaled.charAt(0));
        if (unscaled.length() > 1) {
            builder.append('.').append(unscaled, 1, unscaled.length());
        }
        builder.append('e').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            builder.append('0');
        }
        builder.append(magnitude);
        return builder.toString();
    }

    /**
     * Parse a decimal literal as written in documents and XML files ({@code 1164.48},
     * {@code 5.47669375000E+002}, {@code .5}).
     *
     * @throws NumberFormatException if the text is not a finite decimal number
     */
    public static double parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()
                || trimmed.endsWith("d")
                || trimmed.endsWith("D")
                || trimmed.endsWith("f")
                || trimmed.endsWith("F")) {
            throw new NumberFormatException("Not a decimal number: '" + text + "'");
        }
        double value = Double.parseDouble(trimmed);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: '" + text + "'");
        }
        return value;
    }
}
