package com.gedcomtree.parser;

import com.gedcomtree.model.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derived views of a tree: every element in pre-order, and the logical records keyed by
 * the pointer they declare.
 *
 * <p>Both views are rebuilt on the next read after {@link #invalidate()}. Nothing detects
 * mutation by itself; reads after an edit without an invalidation may be stale.
 */
public class ElementIndex {

    private final Element root;
    private List<Element> elements = List.of();
    private Map<String, Element> byPointer = Map.of();
    private boolean dirty = true;

    public ElementIndex(Element root) {
        this.root = root;
    }

    public void invalidate() {
        dirty = true;
    }

    public boolean isDirty() {
        return dirty;
    }

    /** All elements except the root, in file order. */
    public List<Element> elementList() {
        rebuildIfDirty();
        return elements;
    }

    /** Level-0 records with a non-empty pointer. A repeated pointer maps to its last record. */
    public Map<String, Element> pointerMap() {
        rebuildIfDirty();
        return byPointer;
    }

    private void rebuildIfDirty() {
        if (!dirty) {
            return;
        }
        List<Element> list = new ArrayList<>();
        for (Element record : root.getChildElements()) {
            collect(record, list);
        }

        Map<String, Element> map = new LinkedHashMap<>();
        for (Element record : root.getChildElements()) {
            if (!record.getPointer().isEmpty()) {
                map.put(record.getPointer(), record);
            }
        }

        elements = Collections.unmodifiableList(list);
        byPointer = Collections.unmodifiableMap(map);
        dirty = false;
    }

    private static void collect(Element element, List<Element> list) {
        list.add(element);
        for (Element child : element.getChildElements()) {
            collect(child, list);
        }
    }
}
