package com.gedcomtree.model;

/**
 * Which member links of a family to follow.
 */
public enum FamilyMemberFilter {
    ALL,
    PARENTS,
    HUSBAND,
    WIFE,
    CHILDREN;

    public boolean accepts(String tag) {
        return switch (this) {
            case ALL -> GedcomTags.HUSBAND.equals(tag) || GedcomTags.WIFE.equals(tag) || GedcomTags.CHILD.equals(tag);
            case PARENTS -> GedcomTags.HUSBAND.equals(tag) || GedcomTags.WIFE.equals(tag);
            case HUSBAND -> GedcomTags.HUSBAND.equals(tag);
            case WIFE -> GedcomTags.WIFE.equals(tag);
            case CHILDREN -> GedcomTags.CHILD.equals(tag);
        };
    }
}
