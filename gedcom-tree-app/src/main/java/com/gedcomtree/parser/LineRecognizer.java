package com.gedcomtree.parser;

import com.gedcomtree.exception.GedcomFormatViolationException;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.GedcomTags;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a single line into {@code level [pointer] tag [value]} plus terminator.
 *
 * <p>In strict mode a line that does not follow the grammar is a format violation. In
 * lenient mode the grammar is retried without a terminator, and failing that the whole
 * line is taken as text continuing the previous element. Either way a level may stay,
 * drop, or rise by exactly one relative to the previous element.
 */
public class LineRecognizer {

    // Level is a non-negative integer without leading zeros
    private static final String LEVEL = "(0|[1-9][0-9]*) ";
    // Pointer is optional and flanked by '@'
    private static final String POINTER = "(@[^@]+@ |)";
    private static final String TAG = "([A-Za-z0-9_]+)";
    // Value is optional, anything after a space up to the end of the line
    private static final String VALUE = "( [^\n\r]*|)";
    private static final String TERMINATOR = "([\r\n]{1,2})";

    private static final Pattern LINE = Pattern.compile(LEVEL + POINTER + TAG + VALUE + TERMINATOR);
    private static final Pattern UNTERMINATED_LINE = Pattern.compile(LEVEL + POINTER + TAG + VALUE);
    private static final Pattern FRAGMENT = Pattern.compile("([^\n\r]*)([\r\n]{0,2})");

    private final boolean strict;

    public LineRecognizer(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Recognizes one line.
     *
     * @param lineNumber 1-based line number, used in error messages
     * @param line       the raw line, terminator included when present
     * @param previous   the element built from the line before, or the root for the first line
     * @throws GedcomFormatViolationException in strict mode, for a malformed line or a level jump
     */
    public ParsedLine recognize(int lineNumber, String line, Element previous) {
        ParsedLine parsed = match(LINE, line, null);

        if (parsed == null) {
            if (strict) {
                throw new GedcomFormatViolationException(lineNumber,
                        "line does not match 'level [pointer] tag [value]'");
            }
            parsed = match(UNTERMINATED_LINE, line, ParsedLine.Recovery.MISSING_TERMINATOR);
            if (parsed == null) {
                parsed = continuationOf(line, previous);
            }
        }

        if (parsed.level() > previous.getLevel() + 1) {
            if (strict) {
                throw new GedcomFormatViolationException(lineNumber,
                        "level " + parsed.level() + " is more than one higher than previous level "
                                + previous.getLevel());
            }
            parsed = parsed.withLevel(previous.getLevel() + 1, ParsedLine.Recovery.LEVEL_CLAMPED);
        }
        return parsed;
    }

    private static ParsedLine match(Pattern pattern, String line, ParsedLine.Recovery recovery) {
        Matcher m = pattern.matcher(line);
        if (!m.matches()) {
            return null;
        }
        int level;
        try {
            level = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // digits beyond int range
            return null;
        }
        String pointer = m.group(2).stripTrailing();
        String value = m.group(4).isEmpty() ? "" : m.group(4).substring(1);
        String terminator = recovery == null ? m.group(5) : "\n";
        return new ParsedLine(level, pointer, m.group(3), value, terminator,
                recovery == null ? ParsedLine.Recovery.NONE : recovery);
    }

    /*
     * Text fields sometimes carry a bare line break, which leaves a line without level or
     * tag. It continues the previous element: a CONC/CONT keeps its level and tag, anything
     * else gets a new CONC one level deeper.
     */
    private static ParsedLine continuationOf(String line, Element previous) {
        Matcher m = FRAGMENT.matcher(line);
        String text = line;
        String terminator = "\n";
        if (m.matches()) {
            text = m.group(1);
            if (!m.group(2).isEmpty()) {
                terminator = m.group(2);
            }
        }

        int level = previous.getLevel();
        String tag = previous.getTag();
        if (!GedcomTags.isContinuation(tag)) {
            level += 1;
            tag = GedcomTags.CONCATENATION;
        }
        return new ParsedLine(level, "", tag, text, terminator, ParsedLine.Recovery.CONTINUATION_FRAGMENT);
    }
}
