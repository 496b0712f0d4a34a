package com.chemked.data.loader;

/** The document text is not well-formed YAML, or is not shaped like a ChemKED mapping at all. */
public final class DocumentParseException extends Exception {
    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
