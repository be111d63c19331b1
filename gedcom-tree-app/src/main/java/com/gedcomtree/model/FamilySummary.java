package com.gedcomtree.model;

import java.util.List;

/**
 * A family with its resolved members, for API responses.
 */
public record FamilySummary(
    String pointer,
    List<IndividualSummary> parents,
    List<IndividualSummary> children,
    List<Marriage> marriages
) {}
