package com.chemked.data.record;

/** Basis of a composition and the total its amounts sum to. */
public enum CompositionKind {
    MOLE_FRACTION("mole fraction", 1.0),
    MASS_FRACTION("mass fraction", 1.0),
    MOLE_PERCENT("mole percent", 100.0);

    private final String documentName;
    private final double total;

    CompositionKind(String documentName, double total) {
        this.documentName = documentName;
        this.total = total;
    }

    public String getDocumentName() {
        return documentName;
    }

    public double getTotal() {
        return total;
    }

    public boolean isMolarBasis() {
        return this != MASS_FRACTION;
    }

    public static CompositionKind fromDocumentName(String name) {
        for (CompositionKind kind : values()) {
            if (kind.documentName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown composition kind '" + name + "'");
    }

    @Override
    public String toString() {
        return documentName;
    }
}
