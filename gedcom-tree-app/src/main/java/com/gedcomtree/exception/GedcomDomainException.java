package com.gedcomtree.exception;

/**
 * A relationship query was asked of an element of the wrong kind.
 */
public abstract class GedcomDomainException extends RuntimeException {

    private final String requiredTag;

    protected GedcomDomainException(String requiredTag, String actual) {
        super("Operation only valid for elements with " + requiredTag + " tag, got " + actual);
        this.requiredTag = requiredTag;
    }

    public String getRequiredTag() {
        return requiredTag;
    }
}
