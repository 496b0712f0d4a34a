package com.chemked.data.loader.normalize;

import com.chemked.data.loader.LoaderMessage;
import com.chemked.data.loader.node.MapNode;
import java.util.List;
import java.util.Objects;

/** Document tree with common properties consumed, plus the advisories produced on the way. */
public final class NormalizedDocument {
    private final MapNode root;
    private final List<LoaderMessage> messages;

    public NormalizedDocument(MapNode root, List<LoaderMessage> messages) {
        this.root = Objects.requireNonNull(root, "root");
        this.messages = List.copyOf(messages);
    }

    public MapNode getRoot() {
        return root;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
