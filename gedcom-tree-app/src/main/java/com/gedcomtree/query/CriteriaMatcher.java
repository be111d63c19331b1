package com.gedcomtree.query;

import com.gedcomtree.model.IndividualElement;

/**
 * Matches an individual against a criteria string: colon-separated {@code key=value}
 * items that must all hold.
 *
 * <pre>
 * surname=[text]        text occurs in the surname, ignoring case
 * name=[text]           text occurs in the given name, ignoring case
 * birth=[year]          birth year equals year
 * birth_range=[y1-y2]   birth year within y1..y2, both included
 * death=[year]
 * death_range=[y1-y2]
 * </pre>
 *
 * Unknown keys are ignored. A malformed item makes the whole match false.
 */
public final class CriteriaMatcher {

    private CriteriaMatcher() {
    }

    public static boolean matches(IndividualElement individual, String criteria) {
        if (criteria == null) {
            return false;
        }
        for (String criterion : criteria.split(":", -1)) {
            String[] keyValue = criterion.split("=", -1);
            if (keyValue.length != 2 || !matchesCriterion(individual, keyValue[0], keyValue[1])) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesCriterion(IndividualElement individual, String key, String value) {
        try {
            return switch (key) {
                case "surname" -> individual.surnameMatch(value);
                case "name" -> individual.givenMatch(value);
                case "birth" -> individual.birthYearMatch(parseYear(value));
                case "death" -> individual.deathYearMatch(parseYear(value));
                case "birth_range" -> {
                    int[] range = parseRange(value);
                    yield individual.birthRangeMatch(range[0], range[1]);
                }
                case "death_range" -> {
                    int[] range = parseRange(value);
                    yield individual.deathRangeMatch(range[0], range[1]);
                }
                default -> true;
            };
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static int parseYear(String value) {
        return Integer.parseInt(value.trim());
    }

    private static int[] parseRange(String value) {
        String[] years = value.split("-", -1);
        if (years.length != 2) {
            throw new IllegalArgumentException("Range must be 'from-to': " + value);
        }
        return new int[]{parseYear(years[0]), parseYear(years[1])};
    }
}
