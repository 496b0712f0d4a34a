package com.chemked.data.loader.node;

import java.util.Objects;

public final class TextNode extends DocumentNode {
    private final String value;

    public TextNode(NodePath path, String value) {
        super(path);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "string";
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        return new TextNode(newPath, value);
    }

    @Override
    public String toString() {
        return value;
    }
}
