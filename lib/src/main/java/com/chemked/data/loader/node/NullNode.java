package com.chemked.data.loader.node;

public final class NullNode extends DocumentNode {

    public NullNode(NodePath path) {
        super(path);
    }

    @Override
    public String getTypeName() {
        return "null";
    }

    @Override
    public Object toPlain() {
        return null;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        return new NullNode(newPath);
    }

    @Override
    public String toString() {
        return "null";
    }
}
