package com.chemked.data.record;

/** Experimental apparatus. */
public enum ApparatusKind {
    SHOCK_TUBE("shock tube"),
    RAPID_COMPRESSION_MACHINE("rapid compression machine");

    private final String documentName;

    ApparatusKind(String documentName) {
        this.documentName = documentName;
    }

    /** Spelling used in ChemKED documents. */
    public String getDocumentName() {
        return documentName;
    }

    public static ApparatusKind fromDocumentName(String name) {
        for (ApparatusKind value : values()) {
            if (value.documentName.equals(name)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown apparatus kind '" + name + "'");
    }

    @Override
    public String toString() {
        return documentName;
    }
}
