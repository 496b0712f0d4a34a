package com.chemked.data.loader.node;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts the plain object graph produced by a YAML parser (maps, lists, strings, numbers,
 * booleans, nulls) into a {@link DocumentNode} tree. Aliased subgraphs are copied at every use.
 */
public final class DocumentNodes {

    private DocumentNodes() {}

    /**
     * @throws IllegalArgumentException if the graph is self-referencing or holds an unsupported
     *     scalar type
     */
    public static DocumentNode fromPlain(Object value) {
        return convert(value, NodePath.ROOT, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    public static DocumentNode fromPlain(Object value, NodePath path) {
        return convert(value, path, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static DocumentNode convert(Object value, NodePath path, Set<Object> ancestors) {
        if (value == null) {
            return new NullNode(path);
        }
        if (value instanceof String text) {
            return new TextNode(path, text);
        }
        if (value instanceof Boolean bool) {
            return new BooleanNode(path, bool);
        }
        if (value instanceof Integer
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Double
                || value instanceof Float) {
            return new NumberNode(path, (Number) value);
        }
        if (value instanceof Date date) {
            // YAML timestamps; ChemKED has no date fields, keep the text form.
            String text = DateTimeFormatter.ISO_LOCAL_DATE.format(date.toInstant().atOffset(ZoneOffset.UTC));
            return new TextNode(path, text);
        }
        if (value instanceof byte[] bytes) {
            return new TextNode(path, new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof Map<?, ?> map) {
            enter(value, path, ancestors);
            Map<String, DocumentNode> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                entries.put(key, convert(entry.getValue(), path.key(key), ancestors));
            }
            ancestors.remove(value);
            return new MapNode(path, entries);
        }
        if (value instanceof List<?> list) {
            enter(value, path, ancestors);
            List<DocumentNode> items = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(convert(list.get(i), path.index(i), ancestors));
            }
            ancestors.remove(value);
            return new ListNode(path, items);
        }
        throw new IllegalArgumentException(
                "Unsupported value of type " + value.getClass().getSimpleName() + " at " + describe(path));
    }

    private static void enter(Object container, NodePath path, Set<Object> ancestors) {
        if (!ancestors.add(container)) {
            throw new IllegalArgumentException("Recursive alias detected at " + describe(path));
        }
    }

    private static String describe(NodePath path) {
        return path.isRoot() ? "document root" : path.toString();
    }
}
