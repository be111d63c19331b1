package com.gedcomtree.exception;

/**
 * Thrown by a strict parse when a line does not follow the GEDCOM line grammar or
 * jumps more than one level deeper than the line before it.
 *
 * <p>The parse is abandoned; no partial tree is handed out.
 */
public class GedcomFormatViolationException extends RuntimeException {

    private final int lineNumber;

    public GedcomFormatViolationException(int lineNumber, String reason) {
        super("Line " + lineNumber + " of document violates GEDCOM format 5.5: " + reason);
        this.lineNumber = lineNumber;
    }

    /** 1-based number of the offending line. */
    public int getLineNumber() {
        return lineNumber;
    }
}
