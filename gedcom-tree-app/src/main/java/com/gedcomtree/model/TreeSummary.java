package com.gedcomtree.model;

/**
 * A configured tree as listed by the API.
 */
public record TreeSummary(
    String slug,
    String displayName,
    boolean strict,
    int recordCount,       // level-0 records
    int elementCount,      // every line
    int individualCount,
    int familyCount
) {}
