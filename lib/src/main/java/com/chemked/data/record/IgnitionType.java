package com.chemked.data.record;

import java.util.Objects;

/** How the ignition point was determined: which observable, and which feature of its trace. */
public record IgnitionType(IgnitionTarget target, IgnitionMeasure measure) {

    public IgnitionType {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(measure, "measure");
    }
}
