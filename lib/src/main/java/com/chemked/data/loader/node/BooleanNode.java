package com.chemked.data.loader.node;

public final class BooleanNode extends DocumentNode {
    private final boolean value;

    public BooleanNode(NodePath path, boolean value) {
        super(path);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "boolean";
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        return new BooleanNode(newPath, value);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
