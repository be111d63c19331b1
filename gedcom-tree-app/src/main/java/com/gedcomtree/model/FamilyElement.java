package com.gedcomtree.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Family record ({@code FAM}). Members are linked by {@code HUSB}, {@code WIFE} and
 * {@code CHIL} children whose values are individual pointers.
 */
public class FamilyElement extends Element {

    FamilyElement(int level, String pointer, String tag, String value, String terminator) {
        super(level, pointer, tag, value, terminator);
    }

    @Override
    public boolean isFamily() {
        return true;
    }

    /** Pointers of the member links matching the filter, in file order. */
    public List<String> getMemberPointers(FamilyMemberFilter filter) {
        List<String> pointers = new ArrayList<>();
        for (Element child : getChildElements()) {
            if (filter.accepts(child.getTag())) {
                pointers.add(child.getValue());
            }
        }
        return pointers;
    }

    /** Marriage events as (date, place), one per {@code MARR} sub-record. */
    public List<Marriage> getMarriages() {
        List<Marriage> marriages = new ArrayList<>();
        for (Element child : getChildElements()) {
            if (GedcomTags.MARRIAGE.equals(child.getTag())) {
                String date = "";
                String place = "";
                for (Element detail : child.getChildElements()) {
                    if (GedcomTags.DATE.equals(detail.getTag())) {
                        date = detail.getValue();
                    }
                    if (GedcomTags.PLACE.equals(detail.getTag())) {
                        place = detail.getValue();
                    }
                }
                marriages.add(new Marriage(date, place));
            }
        }
        return marriages;
    }
}
