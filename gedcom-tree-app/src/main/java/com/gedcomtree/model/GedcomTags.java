package com.gedcomtree.model;

/**
 * GEDCOM 5.5 tags the parser and queries look at.
 * Tags starting with an underscore are program defined.
 */
public final class GedcomTags {

    /** Mother relationship qualifier written by some genealogy programs. */
    public static final String MOTHER_RELATION = "_MREL";
    /** Father relationship qualifier written by some genealogy programs. */
    public static final String FATHER_RELATION = "_FREL";

    public static final String BIRTH = "BIRT";
    public static final String BURIAL = "BURI";
    public static final String CENSUS = "CENS";
    public static final String CHANGE = "CHAN";
    public static final String CHILD = "CHIL";
    public static final String CONCATENATION = "CONC";
    public static final String CONTINUED = "CONT";
    public static final String DATE = "DATE";
    public static final String DEATH = "DEAT";
    public static final String FAMILY = "FAM";
    public static final String FAMILY_CHILD = "FAMC";
    public static final String FAMILY_SPOUSE = "FAMS";
    public static final String FILE = "FILE";
    public static final String GIVEN_NAME = "GIVN";
    public static final String HUSBAND = "HUSB";
    public static final String INDIVIDUAL = "INDI";
    public static final String MARRIAGE = "MARR";
    public static final String NAME = "NAME";
    public static final String OBJECT = "OBJE";
    public static final String OCCUPATION = "OCCU";
    public static final String PLACE = "PLAC";
    public static final String PRIVATE = "PRIV";
    public static final String SEX = "SEX";
    public static final String SOURCE = "SOUR";
    public static final String SURNAME = "SURN";
    public static final String WIFE = "WIFE";

    /** Value of a relationship qualifier marking a genetic parent. */
    public static final String NATURAL = "Natural";

    private GedcomTags() {
    }

    public static boolean isContinuation(String tag) {
        return CONCATENATION.equals(tag) || CONTINUED.equals(tag);
    }
}
