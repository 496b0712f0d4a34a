package com.chemked.data.respecth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * What a conversion could not carry over, and the assumptions it made on the way. A conversion is
 * lossless when nothing was dropped; notes alone do not make it lossy.
 */
public final class ConversionReport {
    private static final Logger LOGGER = Logger.getLogger(ConversionReport.class.getName());

    private final List<String> droppedFields = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    ConversionReport() {}

    void dropped(String field, String reason) {
        String entry = field + " (" + reason + ")";
        if (!droppedFields.contains(entry)) {
            droppedFields.add(entry);
            LOGGER.log(Level.WARNING, "Not converted: {0}", entry);
        }
    }

    void note(String message) {
        if (!notes.contains(message)) {
            notes.add(message);
            LOGGER.warning(message);
        }
    }

    /** Fields left out of the output, each with the reason, e.g. {@code file-authors[0].ORCID (...)}. */
    public List<String> getDroppedFields() {
        return Collections.unmodifiableList(droppedFields);
    }

    public List<String> getNotes() {
        return Collections.unmodifiableList(notes);
    }

    public boolean isLossless() {
        return droppedFields.isEmpty();
    }
}
