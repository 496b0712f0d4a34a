package com.chemked.data.loader.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Mapping node. Key order follows the source document. */
public final class MapNode extends DocumentNode {
    private final Map<String, DocumentNode> entries;

    public MapNode(NodePath path, Map<String, DocumentNode> entries) {
        super(path);
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Map<String, DocumentNode> getEntries() {
        return entries;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    /** The child under {@code key}, or {@code null} when absent. */
    public DocumentNode get(String key) {
        return entries.get(key);
    }

    public Optional<String> text(String key) {
        DocumentNode node = entries.get(key);
        return node instanceof TextNode text ? Optional.of(text.getValue()) : Optional.empty();
    }

    public Optional<MapNode> map(String key) {
        DocumentNode node = entries.get(key);
        return node instanceof MapNode map ? Optional.of(map) : Optional.empty();
    }

    public Optional<ListNode> list(String key) {
        DocumentNode node = entries.get(key);
        return node instanceof ListNode list ? Optional.of(list) : Optional.empty();
    }

    public Optional<NumberNode> number(String key) {
        DocumentNode node = entries.get(key);
        return node instanceof NumberNode number ? Optional.of(number) : Optional.empty();
    }

    /** Copy without {@code key}. */
    public MapNode without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<String, DocumentNode> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return new MapNode(getPath(), copy);
    }

    /** Copy with {@code key} bound to {@code value} relocated under this node. */
    public MapNode with(String key, DocumentNode value) {
        Map<String, DocumentNode> copy = new LinkedHashMap<>(entries);
        copy.put(key, value.relocate(getPath().key(key)));
        return new MapNode(getPath(), copy);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String getTypeName() {
        return "dict";
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : entries.entrySet()) {
            plain.put(entry.getKey(), entry.getValue().toPlain());
        }
        return plain;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        Map<String, DocumentNode> moved = new LinkedHashMap<>();
        for (Map.Entry<String, DocumentNode> entry : entries.entrySet()) {
            moved.put(entry.getKey(), entry.getValue().relocate(newPath.key(entry.getKey())));
        }
        return new MapNode(newPath, moved);
    }
}
