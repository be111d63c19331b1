package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * One line of a GEDCOM document.
 *
 * <p>Each line has the form {@code level [pointer] tag [value]} followed by a line
 * terminator. Elements form a tree by level: a parent owns its children in file order,
 * each child keeps a non-owning reference back to its parent, and a child's level is
 * always {@code parent.level + 1}. Cross references between records ({@code @I1@},
 * {@code @F1@}) are plain values and never tree edges.
 *
 * <p>The tree is not thread-safe. Callers that mutate it must invalidate the derived
 * indexes of the owning {@link com.gedcomtree.parser.GedcomDocument} themselves.
 */
public class Element {

    /** Longest physical line the multi-line encoder produces, terminator included. */
    public static final int MAX_LINE_LENGTH = 255;

    private final int level;
    private final String pointer;
    private final String tag;
    private final String terminator;
    private final List<Element> children = new ArrayList<>();
    private String value;
    private Element parent;

    protected Element(int level, String pointer, String tag, String value, String terminator) {
        this.level = level;
        this.pointer = pointer != null ? pointer : "";
        this.tag = tag;
        this.value = value != null ? value : "";
        this.terminator = terminator != null ? terminator : "\n";
    }

    /**
     * Creates the element variant matching the tag. The variant is fixed here and never
     * re-derived later.
     */
    public static Element create(int level, String pointer, String tag, String value, String terminator) {
        return switch (tag) {
            case GedcomTags.INDIVIDUAL -> new IndividualElement(level, pointer, tag, value, terminator);
            case GedcomTags.FAMILY -> new FamilyElement(level, pointer, tag, value, terminator);
            case GedcomTags.FILE -> new FileElement(level, pointer, tag, value, terminator);
            case GedcomTags.OBJECT -> new ObjectElement(level, pointer, tag, value, terminator);
            default -> new Element(level, pointer, tag, value, terminator);
        };
    }

    public int getLevel() { return level; }
    public String getPointer() { return pointer; }
    public String getTag() { return tag; }
    public String getValue() { return value; }
    public String getTerminator() { return terminator; }

    public void setValue(String value) {
        this.value = value != null ? value : "";
    }

    public boolean isIndividual() { return false; }
    public boolean isFamily() { return false; }
    public boolean isFile() { return false; }
    public boolean isObject() { return false; }

    // ========== TREE STRUCTURE ==========

    public List<Element> getChildElements() {
        return Collections.unmodifiableList(children);
    }

    public Element getParentElement() {
        return parent;
    }

    /**
     * Appends an element as the last child of this one.
     *
     * @throws IllegalArgumentException if the child's level is not this level + 1, or the
     *                                  child already belongs to another parent
     */
    public Element addChildElement(Element child) {
        if (child.getLevel() != level + 1) {
            throw new IllegalArgumentException("Child level " + child.getLevel()
                    + " does not follow parent level " + level);
        }
        if (child.parent != null) {
            throw new IllegalArgumentException("Element " + child.describe() + " already has a parent");
        }
        children.add(child);
        child.parent = this;
        return child;
    }

    /**
     * Creates a child of the variant matching {@code tag}, one level deeper than this element
     * and with this element's terminator. A non-empty value is stored through
     * {@link #setMultiLineValue(String)}.
     */
    public Element newChildElement(String tag, String pointer, String value) {
        Element child = create(level + 1, pointer, tag, "", terminator);
        addChildElement(child);
        if (value != null && !value.isEmpty()) {
            child.setMultiLineValue(value);
        }
        return child;
    }

    public Element newChildElement(String tag) {
        return newChildElement(tag, "", "");
    }

    /**
     * Detaches a direct child together with its subtree.
     *
     * @return false if the element was not a child of this one
     */
    public boolean removeChildElement(Element child) {
        Iterator<Element> it = children.iterator();
        while (it.hasNext()) {
            if (it.next() == child) {
                it.remove();
                child.parent = null;
                return true;
            }
        }
        return false;
    }

    /** Returns the first direct child with the given tag, or null. */
    public Element getFirstChild(String childTag) {
        for (Element child : children) {
            if (child.getTag().equals(childTag)) {
                return child;
            }
        }
        return null;
    }

    // ========== MULTI-LINE VALUES ==========

    /**
     * Returns the value including CONC and CONT children. A CONT child starts a new line,
     * joined with the terminator of the physical line before it.
     */
    public String getMultiLineValue() {
        StringBuilder result = new StringBuilder(value);
        String lastTerminator = terminator;
        for (Element child : children) {
            if (GedcomTags.CONCATENATION.equals(child.getTag())) {
                result.append(child.getValue());
                lastTerminator = child.getTerminator();
            } else if (GedcomTags.CONTINUED.equals(child.getTag())) {
                result.append(lastTerminator).append(child.getValue());
                lastTerminator = child.getTerminator();
            }
        }
        return result.toString();
    }

    /**
     * Replaces the value and any CONC/CONT children. Line breaks become CONT children and
     * overflow beyond {@link #MAX_LINE_LENGTH} becomes CONC children.
     *
     * <p>{@code \r\n}, {@code \n} and a lone {@code \r} all count as line breaks and are not
     * stored: {@link #getMultiLineValue()} reads every break back as this element's terminator,
     * so {@code "a\r\nb"} on an element ending in {@code \n} reads back as {@code "a\nb"}.
     */
    public void setMultiLineValue(String multiLineValue) {
        setValue("");
        children.removeIf(child -> {
            if (GedcomTags.isContinuation(child.getTag())) {
                child.parent = null;
                return true;
            }
            return false;
        });

        List<String> lines = multiLineValue != null ? multiLineValue.lines().toList() : List.of();
        if (lines.isEmpty()) {
            return;
        }

        String first = lines.get(0);
        int n = setBoundedValue(first);
        addConcatenation(first.substring(n));

        for (String line : lines.subList(1, lines.size())) {
            n = addBoundedChild(GedcomTags.CONTINUED, line);
            addConcatenation(line.substring(n));
        }
    }

    // called while the value is still empty; the extra one is the space before the value
    private int availableCharacters() {
        int used = toGedcomString().length() + 1;
        return used > MAX_LINE_LENGTH ? 0 : MAX_LINE_LENGTH - used;
    }

    /**
     * Number of leading characters of {@code line} that fit on this element's line. Trailing
     * spaces are pushed to the next segment unless the segment would hold nothing but
     * spaces. A surrogate pair is never split. At least one character is taken so encoding
     * always makes progress.
     */
    private int lineLength(String line) {
        int available = availableCharacters();
        if (line.length() <= available) {
            return line.length();
        }
        if (available == 0) {
            return 1;
        }
        int spaces = 0;
        while (spaces < available && line.charAt(available - spaces - 1) == ' ') {
            spaces++;
        }
        int length = spaces == available ? available : available - spaces;
        if (length > 1 && Character.isHighSurrogate(line.charAt(length - 1))) {
            length--;
        }
        return length;
    }

    private int setBoundedValue(String line) {
        int length = lineLength(line);
        setValue(line.substring(0, length));
        return length;
    }

    private int addBoundedChild(String childTag, String line) {
        Element child = create(level + 1, "", childTag, "", terminator);
        addChildElement(child);
        return child.setBoundedValue(line);
    }

    private void addConcatenation(String rest) {
        int index = 0;
        while (index < rest.length()) {
            index += addBoundedChild(GedcomTags.CONCATENATION, rest.substring(index));
        }
    }

    // ========== SERIALIZATION ==========

    /** Formats this line only. */
    public String toGedcomString() {
        return toGedcomString(false);
    }

    /**
     * Formats this element, and with {@code recursive} every descendant in pre-order, exactly
     * as read: {@code level [pointer] tag [value]} plus the stored terminator. Elements with
     * a negative level contribute nothing themselves.
     */
    public String toGedcomString(boolean recursive) {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, recursive);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb, boolean recursive) {
        if (level >= 0) {
            sb.append(level);
            if (!pointer.isEmpty()) {
                sb.append(' ').append(pointer);
            }
            sb.append(' ').append(tag);
            if (!value.isEmpty()) {
                sb.append(' ').append(value);
            }
            sb.append(terminator);
        }
        if (recursive) {
            for (Element child : children) {
                child.appendTo(sb, true);
            }
        }
    }

    /** Short form used in log and error messages. */
    public String describe() {
        return pointer.isEmpty() ? level + " " + tag : level + " " + pointer + " " + tag;
    }

    @Override
    public String toString() {
        return toGedcomString();
    }
}
