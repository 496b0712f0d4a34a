package com.chemked.data.respecth;

import java.util.Objects;

/** Output of one conversion together with its report. */
public final class ConversionResult<T> {
    private final T output;
    private final ConversionReport report;

    ConversionResult(T output, ConversionReport report) {
        this.output = Objects.requireNonNull(output, "output");
        this.report = Objects.requireNonNull(report, "report");
    }

    public T getOutput() {
        return output;
    }

    public ConversionReport getReport() {
        return report;
    }
}
