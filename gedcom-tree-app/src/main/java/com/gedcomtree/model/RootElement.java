package com.gedcomtree.model;

/**
 * Virtual root owning every level-0 record. It has level -1, no parent, and serializes
 * to nothing itself.
 */
public class RootElement extends Element {

    public static final String TAG = "ROOT";

    public RootElement() {
        super(-1, "", TAG, "", "\n");
    }
}
