package com.chemked.data.quantity;

import java.util.Locale;

public enum UncertaintyKind {
    ABSOLUTE("absolute"),
    RELATIVE("relative");

    private final String documentName;

    UncertaintyKind(String documentName) {
        this.documentName = documentName;
    }

    public String getDocumentName() {
        return documentName;
    }

    public static UncertaintyKind fromDocumentName(String name) {
        for (UncertaintyKind kind : values()) {
            if (kind.documentName.equals(name.toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown uncertainty type: " + name);
    }
}
