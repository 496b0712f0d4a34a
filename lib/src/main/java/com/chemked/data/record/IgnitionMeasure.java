package com.chemked.data.record;

/** Feature of the target trace taken as the ignition point. */
public enum IgnitionMeasure {
    D_DT_MAX("d/dt max"),
    MAX("max"),
    HALF_MAX("1/2 max"),
    MIN("min"),
    D_DT_MAX_EXTRAPOLATED("d/dt max extrapolated");

    private final String documentName;

    IgnitionMeasure(String documentName) {
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }

    public static IgnitionMeasure fromDocumentName(String name) {
        for (IgnitionMeasure value : values()) {
            if (value.documentName.equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ignition type '" + name + "'");
    }
}
