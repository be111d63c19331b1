package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Individual record ({@code INDI}) with accessors for names, vital events and
 * year matching. Relationship traversal lives in
 * {@link com.gedcomtree.query.RelationshipQueries} because it needs the pointer index.
 */
public class IndividualElement extends Element {

    IndividualElement(int level, String pointer, String tag, String value, String terminator) {
        super(level, pointer, tag, value, terminator);
    }

    @Override
    public boolean isIndividual() {
        return true;
    }

    // ========== NAMES ==========

    /**
     * Returns the first usable name. A {@code NAME} value of the form {@code Given /Surname/}
     * wins immediately; otherwise the {@code GIVN} and {@code SURN} sub-records of a
     * {@code NAME} are used once both are present.
     */
    public PersonName getName() {
        String given = "";
        String surname = "";

        for (Element child : getChildElements()) {
            if (!GedcomTags.NAME.equals(child.getTag())) {
                continue;
            }
            // some files put the whole name in the value instead of using sub-records
            if (!child.getValue().isEmpty()) {
                String[] parts = child.getValue().split("/", -1);
                given = parts[0].trim();
                if (parts.length > 1) {
                    surname = parts[1].trim();
                }
                return new PersonName(given, surname);
            }

            boolean foundGiven = false;
            boolean foundSurname = false;
            for (Element part : child.getChildElements()) {
                if (GedcomTags.GIVEN_NAME.equals(part.getTag())) {
                    given = part.getValue();
                    foundGiven = true;
                }
                if (GedcomTags.SURNAME.equals(part.getTag())) {
                    surname = part.getValue();
                    foundSurname = true;
                }
            }
            if (foundGiven && foundSurname) {
                return new PersonName(given, surname);
            }
        }
        return new PersonName(given, surname);
    }

    public boolean surnameMatch(String name) {
        return containsIgnoreCase(getName().surname(), name);
    }

    public boolean givenMatch(String name) {
        return containsIgnoreCase(getName().given(), name);
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }

    // ========== FLAGS ==========

    /** True if the individual is linked as a child of any family. */
    public boolean isChild() {
        return getFirstChild(GedcomTags.FAMILY_CHILD) != null;
    }

    /** True if the last {@code PRIV} sub-record says {@code Y}. */
    public boolean isPrivate() {
        boolean result = false;
        for (Element child : getChildElements()) {
            if (GedcomTags.PRIVATE.equals(child.getTag())) {
                result = "Y".equals(child.getValue());
            }
        }
        return result;
    }

    public boolean isDeceased() {
        return getFirstChild(GedcomTags.DEATH) != null;
    }

    public String getGender() {
        return lastValueOf(GedcomTags.SEX);
    }

    public String getOccupation() {
        return lastValueOf(GedcomTags.OCCUPATION);
    }

    public String getLastChangeDate() {
        String date = "";
        for (Element child : getChildElements()) {
            if (GedcomTags.CHANGE.equals(child.getTag())) {
                for (Element detail : child.getChildElements()) {
                    if (GedcomTags.DATE.equals(detail.getTag())) {
                        date = detail.getValue();
                    }
                }
            }
        }
        return date;
    }

    private String lastValueOf(String childTag) {
        String result = "";
        for (Element child : getChildElements()) {
            if (childTag.equals(child.getTag())) {
                result = child.getValue();
            }
        }
        return result;
    }

    // ========== EVENTS ==========

    public VitalEvent getBirthData() {
        return mergedEvent(GedcomTags.BIRTH);
    }

    public VitalEvent getDeathData() {
        return mergedEvent(GedcomTags.DEATH);
    }

    public VitalEvent getBurial() {
        return mergedEvent(GedcomTags.BURIAL);
    }

    /** One entry per {@code CENS} sub-record, in file order. */
    public List<VitalEvent> getCensus() {
        List<VitalEvent> census = new ArrayList<>();
        for (Element child : getChildElements()) {
            if (GedcomTags.CENSUS.equals(child.getTag())) {
                census.add(readEvent(List.of(child)));
            }
        }
        return census;
    }

    /** Year of the last birth date, or -1 when absent or not a number. */
    public int getBirthYear() {
        return eventYear(GedcomTags.BIRTH);
    }

    /** Year of the last death date, or -1 when absent or not a number. */
    public int getDeathYear() {
        return eventYear(GedcomTags.DEATH);
    }

    public boolean birthYearMatch(int year) {
        return getBirthYear() == year;
    }

    public boolean birthRangeMatch(int fromYear, int toYear) {
        int year = getBirthYear();
        return fromYear <= year && year <= toYear;
    }

    public boolean deathYearMatch(int year) {
        return getDeathYear() == year;
    }

    public boolean deathRangeMatch(int fromYear, int toYear) {
        int year = getDeathYear();
        return fromYear <= year && year <= toYear;
    }

    // Several BIRT/DEAT/BURI records are merged: the last date and place win, sources add up.
    private VitalEvent mergedEvent(String eventTag) {
        List<Element> events = new ArrayList<>();
        for (Element child : getChildElements()) {
            if (eventTag.equals(child.getTag())) {
                events.add(child);
            }
        }
        return events.isEmpty() ? VitalEvent.EMPTY : readEvent(events);
    }

    private static VitalEvent readEvent(List<Element> events) {
        String date = "";
        String place = "";
        List<String> sources = new ArrayList<>();
        for (Element event : events) {
            for (Element detail : event.getChildElements()) {
                switch (detail.getTag()) {
                    case GedcomTags.DATE -> date = detail.getValue();
                    case GedcomTags.PLACE -> place = detail.getValue();
                    case GedcomTags.SOURCE -> sources.add(detail.getValue());
                    default -> { }
                }
            }
        }
        return new VitalEvent(date, place, List.copyOf(sources));
    }

    private int eventYear(String eventTag) {
        String date = "";
        for (Element child : getChildElements()) {
            if (eventTag.equals(child.getTag())) {
                for (Element detail : child.getChildElements()) {
                    if (GedcomTags.DATE.equals(detail.getTag())) {
                        date = detail.getValue();
                    }
                }
            }
        }
        Integer year = EventYears.lastTokenYear(date);
        return year != null ? year : -1;
    }
}
