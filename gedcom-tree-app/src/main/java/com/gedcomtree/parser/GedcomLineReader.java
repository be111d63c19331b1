package com.gedcomtree.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes GEDCOM bytes as UTF-8 and splits them into physical lines, keeping each
 * line's terminator ({@code \r\n}, {@code \n} or a lone {@code \r}).
 */
public final class GedcomLineReader {

    private static final char BOM = '\uFEFF';

    private GedcomLineReader() {
    }

    /**
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public static List<String> readLines(InputStream in) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return splitLines(decoder.decode(ByteBuffer.wrap(in.readAllBytes())).toString());
    }

    /** Splits text into lines with terminators kept. A leading byte order mark is dropped. */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = !text.isEmpty() && text.charAt(0) == BOM ? 1 : 0;
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = i + 1 < text.length() && text.charAt(i + 1) == '\n' ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
