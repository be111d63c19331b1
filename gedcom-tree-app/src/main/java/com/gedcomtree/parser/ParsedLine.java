package com.gedcomtree.parser;

/**
 * The parts of one recognized line.
 *
 * @param level      depth of the line, 0 for logical records
 * @param pointer    {@code @id@} declared by the line, empty if none
 * @param tag        record tag
 * @param value      text after the tag, empty if none
 * @param terminator line terminator as found ({@code \n} when it was missing)
 * @param recovery   how lenient mode repaired the line, {@link Recovery#NONE} if it was well-formed
 */
public record ParsedLine(
    int level,
    String pointer,
    String tag,
    String value,
    String terminator,
    Recovery recovery
) {

    public enum Recovery {
        NONE,
        /** Grammar matched once the terminator requirement was dropped. */
        MISSING_TERMINATOR,
        /** Line without a level, taken as text continuing the previous element. */
        CONTINUATION_FRAGMENT,
        /** Level more than one deeper than the previous line, pulled up to previous + 1. */
        LEVEL_CLAMPED
    }

    ParsedLine withLevel(int newLevel, Recovery newRecovery) {
        return new ParsedLine(newLevel, pointer, tag, value, terminator, newRecovery);
    }
}
