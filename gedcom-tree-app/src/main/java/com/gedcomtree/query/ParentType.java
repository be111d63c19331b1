package com.gedcomtree.query;

/**
 * ALL follows every parent link; NATURAL only parents whose child link carries a
 * {@code _MREL}/{@code _FREL} qualifier of {@code Natural}.
 */
public enum ParentType {
    ALL,
    NATURAL
}
