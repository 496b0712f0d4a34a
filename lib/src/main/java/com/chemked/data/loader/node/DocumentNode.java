package com.chemked.data.loader.node;

import java.util.Objects;

/**
 * Immutable tree form of a parsed document. Every node knows where it sits in the document so that
 * diagnostics can point at it. Nodes never share children; two aliases of the same YAML anchor
 * become two independent subtrees.
 */
public sealed abstract class DocumentNode
        permits MapNode, ListNode, TextNode, NumberNode, BooleanNode, NullNode {

    private final NodePath path;

    protected DocumentNode(NodePath path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public NodePath getPath() {
        return path;
    }

    /** Schema type name of this node: dict, list, string, integer, float, boolean or null. */
    public abstract String getTypeName();

    /** Deep copy as plain Java collections and scalars, suitable for serializers. */
    public abstract Object toPlain();

    /** Copy of this subtree re-rooted at {@code newPath}. */
    public abstract DocumentNode relocate(NodePath newPath);
}
