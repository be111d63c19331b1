package com.gedcomtree.exception;

import com.gedcomtree.model.GedcomTags;

public class NotAFamilyException extends GedcomDomainException {

    public NotAFamilyException(String actual) {
        super(GedcomTags.FAMILY, actual);
    }
}
