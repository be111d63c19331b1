package com.gedcomtree.exception;

import com.gedcomtree.model.GedcomTags;

public class NotAnIndividualException extends GedcomDomainException {

    public NotAnIndividualException(String actual) {
        super(GedcomTags.INDIVIDUAL, actual);
    }
}
