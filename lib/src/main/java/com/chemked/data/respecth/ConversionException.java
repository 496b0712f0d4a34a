package com.chemked.data.respecth;

/**
 * Checked exception raised when a document cannot be mapped between ChemKED and ReSpecTh. The
 * element path points at the offending XML element or ChemKED field.
 */
public final class ConversionException extends Exception {
    private final String elementPath;

    public ConversionException(String elementPath, String message) {
        super(elementPath == null || elementPath.isEmpty() ? message : elementPath + ": " + message);
        this.elementPath = elementPath == null ? "" : elementPath;
    }

    public ConversionException(String elementPath, String message, Throwable cause) {
        this(elementPath, message);
        initCause(cause);
    }

    public String getElementPath() {
        return elementPath;
    }
}
