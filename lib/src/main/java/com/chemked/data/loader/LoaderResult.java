package com.chemked.data.loader;

import com.chemked.data.loader.node.MapNode;
import com.chemked.data.record.ChemKedRecord;
import java.util.List;

/**
 * Container for the results of loading a ChemKED document: the typed record, the normalized tree it
 * was built from, and every non-fatal message produced on the way.
 */
public final class LoaderResult {
    private final ChemKedRecord record;
    private final List<LoaderMessage> messages;
    private final MapNode document;

    public LoaderResult(ChemKedRecord record, List<LoaderMessage> messages, MapNode document) {
        this.record = record;
        this.messages = List.copyOf(messages);
        this.document = document;
    }

    public ChemKedRecord getRecord() {
        return record;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    public List<LoaderMessage> getWarnings() {
        return messages.stream().filter(message -> message.getLevel() == LoaderMessage.Level.WARNING).toList();
    }

    /** The normalized document, without {@code common-properties}. */
    public MapNode getDocument() {
        return document;
    }
}
