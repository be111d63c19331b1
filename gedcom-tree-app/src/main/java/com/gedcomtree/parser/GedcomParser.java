package com.gedcomtree.parser;

import com.gedcomtree.exception.GedcomFormatViolationException;
import com.gedcomtree.model.Element;
import com.gedcomtree.model.RootElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds an element tree from GEDCOM 5.5 lines.
 *
 * <p>Hierarchy comes from levels alone: each new element is attached to the nearest
 * ancestor of the previous element whose level is one less than its own, so no lookahead
 * is needed.
 */
public class GedcomParser {

    private static final Logger log = LoggerFactory.getLogger(GedcomParser.class);

    private final LineRecognizer recognizer;

    public GedcomParser(boolean strict) {
        this.recognizer = new LineRecognizer(strict);
    }

    public static GedcomParser strict() {
        return new GedcomParser(true);
    }

    public static GedcomParser lenient() {
        return new GedcomParser(false);
    }

    public boolean isStrict() {
        return recognizer.isStrict();
    }

    public GedcomDocument parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    public GedcomDocument parse(InputStream in) throws IOException {
        return parse(GedcomLineReader.readLines(in));
    }

    public GedcomDocument parse(String text) {
        return parse(GedcomLineReader.splitLines(text));
    }

    /**
     * Parses lines that still carry their terminators.
     *
     * @throws GedcomFormatViolationException in strict mode, on the first bad line
     */
    public GedcomDocument parse(List<String> lines) {
        RootElement root = new RootElement();
        Element last = root;
        int lineNumber = 1;

        for (String line : lines) {
            last = parseLine(lineNumber, line, last);
            lineNumber++;
        }

        log.debug("Parsed {} lines into {} records", lines.size(), root.getChildElements().size());
        return new GedcomDocument(root);
    }

    private Element parseLine(int lineNumber, String line, Element last) {
        ParsedLine parsed = recognizer.recognize(lineNumber, line, last);
        if (parsed.recovery() != ParsedLine.Recovery.NONE) {
            log.warn("Line {} recovered in lenient mode ({})", lineNumber, parsed.recovery());
        }

        Element element = Element.create(parsed.level(), parsed.pointer(), parsed.tag(),
                parsed.value(), parsed.terminator());

        // Start with the last element as parent, back up as necessary
        Element parent = last;
        while (parent.getLevel() > parsed.level() - 1) {
            parent = parent.getParentElement();
        }
        parent.addChildElement(element);
        return element;
    }
}
