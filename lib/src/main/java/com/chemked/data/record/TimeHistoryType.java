package com.chemked.data.record;

/** Quantity recorded by a time history; the name doubles as its unit-dimension key. */
public enum TimeHistoryType {
    VOLUME("volume"),
    TEMPERATURE("temperature"),
    PRESSURE("pressure"),
    PISTON_POSITION("piston position"),
    LIGHT_EMISSION("light emission"),
    OH_EMISSION("OH emission"),
    ABSORPTION("absorption");

    private final String documentName;

    TimeHistoryType(String documentName) {
        this.documentName = documentName;
    }

    /** Spelling used in ChemKED documents. */
    public String getDocumentName() {
        return documentName;
    }

    public static TimeHistoryType fromDocumentName(String name) {
        for (TimeHistoryType value : values()) {
            if (value.documentName.equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown time history type '" + name + "'");
    }
}
