package com.gedcomtree.parser;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a document back out in the exact form it was read.
 */
public final class GedcomWriter {

    private GedcomWriter() {
    }

    public static void write(GedcomDocument document, Writer out) throws IOException {
        out.write(document.toGedcomString());
        out.flush();
    }

    /** Writes UTF-8 without a byte order mark. The stream is flushed, not closed. */
    public static void write(GedcomDocument document, OutputStream out) throws IOException {
        write(document, new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }
}
