package com.gedcomtree.model;

/**
 * Year extraction from free-form GEDCOM dates such as {@code ABT 12 MAR 1850}.
 */
public final class EventYears {

    private EventYears() {
    }

    /**
     * Parses the last whitespace-separated token of a date as a year.
     *
     * @return the year, or null if the date is blank or the token is not an integer
     */
    public static Integer lastTokenYear(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        String[] tokens = date.trim().split("\\s+");
        try {
            return Integer.parseInt(tokens[tokens.length - 1]);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
