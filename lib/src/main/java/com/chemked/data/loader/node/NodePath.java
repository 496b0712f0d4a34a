package com.chemked.data.loader.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Location of a node inside a document: a sequence of mapping keys and list indexes. */
public final class NodePath {
    public static final NodePath ROOT = new NodePath(List.of());

    private final List<Object> segments;

    private NodePath(List<Object> segments) {
        this.segments = segments;
    }

    public NodePath key(String key) {
        return append(Objects.requireNonNull(key, "key"));
    }

    public NodePath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative: " + index);
        }
        return append(index);
    }

    private NodePath append(Object segment) {
        List<Object> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(segment);
        return new NodePath(Collections.unmodifiableList(extended));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /** Last mapping key on the path, skipping list indexes; empty for the root. */
    public String lastKey() {
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (segments.get(i) instanceof String key) {
                return key;
            }
        }
        return "";
    }

    public List<Object> getSegments() {
        return segments;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof NodePath that && segments.equals(that.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Object segment : segments) {
            if (segment instanceof Integer index) {
                builder.append('[').append(index).append(']');
            } else {
                if (builder.length() > 0) {
                    builder.append('.');
                }
                builder.append(segment);
            }
        }
        return builder.toString();
    }
}
