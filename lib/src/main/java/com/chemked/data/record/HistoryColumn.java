package com.chemked.data.record;

import java.util.Objects;

/** Units of one column of a time history table and the index of that column (0 or 1). */
public record HistoryColumn(String units, int column) {

    public HistoryColumn {
        Objects.requireNonNull(units, "units");
        if (column != 0 && column != 1) {
            throw new IllegalArgumentException("history column must be 0 or 1: " + column);
        }
    }
}
