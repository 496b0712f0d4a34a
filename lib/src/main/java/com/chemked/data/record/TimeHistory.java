package com.chemked.data.record;

import com.chemked.data.quantity.Quantity;
import com.chemked.data.quantity.Uncertainty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A two-column table of a quantity against time, such as the volume trace of an RCM run. */
public final class TimeHistory {
    private final TimeHistoryType type;
    private final HistoryColumn time;
    private final HistoryColumn quantity;
    private final List<double[]> values;
    private final Uncertainty uncertainty;

    public TimeHistory(
            TimeHistoryType type,
            HistoryColumn time,
            HistoryColumn quantity,
            List<double[]> values,
            Uncertainty uncertainty) {
        this.type = Objects.requireNonNull(type, "type");
        this.time = Objects.requireNonNull(time, "time");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        if (time.column() == quantity.column()) {
            throw new IllegalArgumentException("time and quantity must use different columns");
        }
        List<double[]> rows = new ArrayList<>(values.size());
        for (double[] row : values) {
            if (row.length != 2) {
                throw new IllegalArgumentException("time history rows must have two values");
            }
            rows.add(row.clone());
        }
        this.values = Collections.unmodifiableList(rows);
        this.uncertainty = uncertainty;
    }

    public TimeHistoryType getType() {
        return type;
    }

    public HistoryColumn getTime() {
        return time;
    }

    public HistoryColumn getQuantity() {
        return quantity;
    }

    public int size() {
        return values.size();
    }

    /** Row {@code index} as written, in column order. */
    public double[] getRow(int index) {
        return values.get(index).clone();
    }

    public List<Quantity> getTimes() {
        return column(time);
    }

    public List<Quantity> getQuantities() {
        return column(quantity);
    }

    public Optional<Uncertainty> getUncertainty() {
        return Optional.ofNullable(uncertainty);
    }

    private List<Quantity> column(HistoryColumn column) {
        List<Quantity> result = new ArrayList<>(values.size());
        for (double[] row : values) {
            result.add(Quantity.of(row[column.column()], column.units()));
        }
        return result;
    }
}
