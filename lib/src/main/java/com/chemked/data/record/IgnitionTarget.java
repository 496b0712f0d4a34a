package com.chemked.data.record;

/** Observable whose trace defines the ignition point. */
public enum IgnitionTarget {
    TEMPERATURE("temperature"),
    PRESSURE("pressure"),
    OH("OH"),
    OH_STAR("OH*"),
    CH("CH"),
    CH_STAR("CH*");

    private final String documentName;

    IgnitionTarget(String documentName) {
        this.documentName = documentName;
    }

    /** Spelling used in ChemKED documents. */
    public String getDocumentName() {
        return documentName;
    }

    public static IgnitionTarget fromDocumentName(String name) {
        for (IgnitionTarget value : values()) {
            if (value.documentName.equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ignition target '" + name + "'");
    }

    @Override
    public String toString() {
        return documentName;
    }
}
