package com.chemked.data.quantity;

import java.util.OptionalInt;

/** Thrown when a unit expression or a "value unit" string cannot be interpreted. */
public final class UnitFormatException extends IllegalArgumentException {
    private final String expression;
    private final int column;

    public UnitFormatException(String expression, String message) {
        this(expression, message, null);
    }

    public UnitFormatException(String expression, String message, Throwable cause) {
        this(expression, 0, message, cause);
    }

    /** {@code column} is 1-based; 0 when the error has no single position. */
    public UnitFormatException(String expression, int column, String message, Throwable cause) {
        super(message, cause);
        this.expression = expression;
        this.column = column;
    }

    public String getExpression() {
        return expression;
    }

    public OptionalInt getColumn() {
        return column > 0 ? OptionalInt.of(column) : OptionalInt.empty();
    }
}
