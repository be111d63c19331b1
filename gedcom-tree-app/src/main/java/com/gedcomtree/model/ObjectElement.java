package com.gedcomtree.model;

/** Multimedia object record ({@code OBJE}). */
public class ObjectElement extends Element {

    ObjectElement(int level, String pointer, String tag, String value, String terminator) {
        super(level, pointer, tag, value, terminator);
    }

    @Override
    public boolean isObject() {
        return true;
    }
}
