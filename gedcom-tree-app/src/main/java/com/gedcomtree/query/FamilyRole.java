package com.gedcomtree.query;

import com.gedcomtree.model.GedcomTags;

/**
 * Role an individual plays in a family, named by the link tag on the individual.
 */
public enum FamilyRole {
    SPOUSE(GedcomTags.FAMILY_SPOUSE),
    CHILD(GedcomTags.FAMILY_CHILD);

    private final String linkTag;

    FamilyRole(String linkTag) {
        this.linkTag = linkTag;
    }

    public String linkTag() {
        return linkTag;
    }
}
