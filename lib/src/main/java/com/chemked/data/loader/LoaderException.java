package com.chemked.data.loader;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Checked exception signalling that a ChemKED document could not be loaded. When validation fails
 * the exception carries every error the validator reported, in document order.
 */
public final class LoaderException extends Exception {
    private final List<LoaderMessage> errors;

    public LoaderException(String message) {
        super(message);
        this.errors = List.of();
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of();
    }

    public LoaderException(List<LoaderMessage> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<LoaderMessage> getErrors() {
        return errors;
    }

    private static String describe(List<LoaderMessage> errors) {
        return "Validation failed with "
                + errors.size()
                + (errors.size() == 1 ? " error" : " errors")
                + ":"
                + errors.stream()
                        .map(error -> System.lineSeparator() + "  " + error.getPath() + ": " + error.getMessage())
                        .collect(Collectors.joining());
    }
}
