package com.gedcomtree.model;

/**
 * Given name and surname of an individual; either part may be empty.
 */
public record PersonName(
    String given,
    String surname
) {}
