package com.chemked.data.loader.schema;

import com.chemked.data.loader.node.BooleanNode;
import com.chemked.data.loader.node.DocumentNode;
import com.chemked.data.loader.node.ListNode;
import com.chemked.data.loader.node.MapNode;
import com.chemked.data.loader.node.NumberNode;
import com.chemked.data.loader.node.TextNode;

/** Value types a schema can require. {@code number} accepts both integers and floats. */
public enum FieldType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DICT("dict"),
    LIST("list");

    private final String schemaName;

    FieldType(String schemaName) {
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public boolean matches(DocumentNode node) {
        switch (this) {
            case STRING:
                return node instanceof TextNode;
            case INTEGER:
                return node instanceof NumberNode number && number.isIntegral();
            case FLOAT:
                return node instanceof NumberNode number && !number.isIntegral();
            case NUMBER:
                return node instanceof NumberNode;
            case BOOLEAN:
                return node instanceof BooleanNode;
            case DICT:
                return node instanceof MapNode;
            case LIST:
                return node instanceof ListNode;
            default:
                throw new IllegalStateException("Unhandled field type " + this);
        }
    }

    public static FieldType fromSchemaName(String name) {
        for (FieldType type : values()) {
            if (type.schemaName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schema type '" + name + "'");
    }
}
