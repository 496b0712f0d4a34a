package com.chemked.data.loader.node;

import java.util.ArrayList;
import java.util.List;

public final class ListNode extends DocumentNode {
    private final List<DocumentNode> items;

    public ListNode(NodePath path, List<DocumentNode> items) {
        super(path);
        this.items = List.copyOf(items);
    }

    public List<DocumentNode> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public DocumentNode get(int index) {
        return items.get(index);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String getTypeName() {
        return "list";
    }

    @Override
    public Object toPlain() {
        List<Object> plain = new ArrayList<>(items.size());
        for (DocumentNode item : items) {
            plain.add(item.toPlain());
        }
        return plain;
    }

    @Override
    public DocumentNode relocate(NodePath newPath) {
        List<DocumentNode> moved = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            moved.add(items.get(i).relocate(newPath.index(i)));
        }
        return new ListNode(newPath, moved);
    }
}
