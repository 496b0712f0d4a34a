package com.chemked.data.loader;

import java.util.Objects;

/**
 * Diagnostic produced while normalizing, validating or building a ChemKED document. The path uses
 * dotted keys with bracketed list indexes, e.g. {@code datapoints[0].composition.species[1].InChI}.
 */
public final class LoaderMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public enum Category {
        /** Shape of the document: missing, unknown or mistyped fields, bounds, exclusions. */
        STRUCTURAL,
        /** Meaning of well-formed values: units, sums, identifier checks. */
        SEMANTIC,
        /** An external registry could not be consulted. */
        LOOKUP,
        /** Advisory notes about common-properties handling. */
        NORMALIZATION,
        /** Simplifications applied while building the typed model. */
        MODEL
    }

    private final Level level;
    private final Category category;
    private final String path;
    private final String message;

    public LoaderMessage(Level level, Category category, String path, String message) {
        this.level = Objects.requireNonNull(level, "level");
        this.category = Objects.requireNonNull(category, "category");
        this.path = path == null ? "" : path;
        this.message = Objects.requireNonNull(message, "message");
    }

    public static LoaderMessage error(Category category, String path, String message) {
        return new LoaderMessage(Level.ERROR, category, path, message);
    }

    public static LoaderMessage warning(Category category, String path, String message) {
        return new LoaderMessage(Level.WARNING, category, path, message);
    }

    public Level getLevel() {
        return level;
    }

    public Category getCategory() {
        return category;
    }

    public String getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    public boolean isError() {
        return level == Level.ERROR;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LoaderMessage that)) {
            return false;
        }
        return level == that.level
                && category == that.category
                && path.equals(that.path)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, category, path, message);
    }

    @Override
    public String toString() {
        return level + " [" + category + "] " + (path.isEmpty() ? "" : path + ": ") + message;
    }
}
