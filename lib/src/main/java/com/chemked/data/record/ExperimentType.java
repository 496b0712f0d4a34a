package com.chemked.data.record;

/** Kind of experiment a record describes. Only ignition delay measurements are supported. */
public enum ExperimentType {
    IGNITION_DELAY("ignition delay");

    private final String documentName;

    ExperimentType(String documentName) {
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }

    public static ExperimentType fromDocumentName(String name) {
        for (ExperimentType value : values()) {
            if (value.documentName.equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown experiment type '" + name + "'");
    }
}
