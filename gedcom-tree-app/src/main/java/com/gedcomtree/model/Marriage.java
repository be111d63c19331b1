package com.gedcomtree.model;

/**
 * A marriage event of a family. Both fields are empty strings when not recorded.
 */
public record Marriage(
    String date,
    String place
) {
    /** Year from the last token of the date, or null when it is not a number. */
    public Integer year() {
        return EventYears.lastTokenYear(date);
    }
}
