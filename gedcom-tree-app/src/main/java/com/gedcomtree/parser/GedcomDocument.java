package com.gedcomtree.parser;

import com.gedcomtree.model.Element;
import com.gedcomtree.model.IndividualElement;
import com.gedcomtree.model.RootElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed GEDCOM tree with its derived indexes.
 *
 * <p>After editing elements (values, children) call {@link #invalidateCache()} before the
 * next lookup; the indexes do not notice edits on their own. The document is not
 * thread-safe.
 */
public class GedcomDocument {

    private final RootElement root;
    private final ElementIndex index;

    public GedcomDocument(RootElement root) {
        this.root = root;
        this.index = new ElementIndex(root);
    }

    public RootElement getRootElement() {
        return root;
    }

    /** Logical records (level 0) in file order. */
    public List<Element> getRootChildElements() {
        return root.getChildElements();
    }

    public List<Element> getElementList() {
        return index.elementList();
    }

    public Map<String, Element> getElementDictionary() {
        return index.pointerMap();
    }

    public void invalidateCache() {
        index.invalidate();
    }

    public Optional<Element> findByPointer(String pointer) {
        return Optional.ofNullable(index.pointerMap().get(pointer));
    }

    public List<IndividualElement> getIndividuals() {
        List<IndividualElement> individuals = new ArrayList<>();
        for (Element record : root.getChildElements()) {
            if (record instanceof IndividualElement individual) {
                individuals.add(individual);
            }
        }
        return individuals;
    }

    /** The whole document as GEDCOM text, byte-for-byte as parsed apart from edits. */
    public String toGedcomString() {
        return root.toGedcomString(true);
    }
}
