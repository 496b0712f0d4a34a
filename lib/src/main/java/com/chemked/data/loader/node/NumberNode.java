package com.chemked.data.loader.node;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/** Integer or floating point scalar. Integers keep their exact value. */
public final class NumberNode extends DocumentNode {
    private final Number value;

    public NumberNode(NodePath path, Number value) {
        super(path);
        this.value = Objects.requireNonNull(value, "value");
    }

    public Number getValue() {
        return value;
    }

    public boolean isIntegral() {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    public BigDecimal decimalValue() {
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        if (isIntegral()) {
            return BigDecimal.valueOf(value.longValue());
        }
        return new BigDecimal(Double.toString(value.doubleValue()));
    }

    @Override
    public String getTypeName() {
        return isIntegral() ? "integer" : "float";
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        return new NumberNode(newPath, value);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
