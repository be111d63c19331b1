package com.gedcomtree.model;

/** Multimedia file reference ({@code FILE}). */
public class FileElement extends Element {

    FileElement(int level, String pointer, String tag, String value, String terminator) {
        super(level, pointer, tag, value, terminator);
    }

    @Override
    public boolean isFile() {
        return true;
    }
}
