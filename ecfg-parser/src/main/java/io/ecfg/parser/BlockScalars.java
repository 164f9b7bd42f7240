/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Decoding of YAML block scalars: header, indentation, chomping and folding.
 */
final class BlockScalars {

    enum Chomping {
        STRIP,
        CLIP,
        KEEP;

        String apply(String text) {
            int end = text.length();
            while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
                end--;
            }
            return switch (this) {
                case STRIP -> text.substring(0, end);
                case CLIP -> end == text.length() ? text : text.substring(0, end) + "\n";
                case KEEP -> text;
            };
        }
    }

    /**
     * The modifiers following the {@code |} or {@code >} indicator.
     * @param indentationIndicator the explicit indentation, or 0 if absent
     * @param chomping the chomping mode
     */
    record Header(int indentationIndicator, Chomping chomping) {

        static Header parse(String source) {
            int indicator = 0;
            Chomping chomping = Chomping.CLIP;
            for (int i = 1; i <= 2 && i < source.length(); i++) {
                char c = source.charAt(i);
                if (c >= '1' && c <= '9') {
                    indicator = c - '0';
                }
                else if (c == '-') {
                    chomping = Chomping.STRIP;
                }
                else if (c == '+') {
                    chomping = Chomping.KEEP;
                }
                else {
                    break;
                }
            }
            return new Header(indicator, chomping);
        }
    }

    private BlockScalars() {
    }

    static String literal(String source, int indentation) {
        Header header = Header.parse(source);
        return header.chomping().apply(content(source, indentation, header));
    }

    static String folded(String source, int indentation) {
        Header header = Header.parse(source);
        return header.chomping().apply(fold(content(source, indentation, header)));
    }

    /**
     * The length of the prefix of a block scalar's source that holds its header and content,
     * excluding the line break after the last non-blank line and anything after it.
     */
    static int contentEnd(String source) {
        int headerEnd = lineEnd(source, 0);
        int end = headerEnd;
        int lineStart = nextLineStart(source, headerEnd);
        while (lineStart < source.length()) {
            int lineEnd = lineEnd(source, lineStart);
            if (!source.substring(lineStart, lineEnd).isBlank()) {
                end = lineEnd;
            }
            lineStart = nextLineStart(source, lineEnd);
        }
        return end;
    }

    private static String content(String source, int indentation, Header header) {
        int bodyStart = nextLineStart(source, lineEnd(source, 0));
        List<String> lines = linesKeepingBreaks(normalizeBreaks(source.substring(bodyStart)));
        int indent = indentation >= 0 ? indentation : header.indentationIndicator() > 0 ? header.indentationIndicator() : detectIndentation(lines);
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            int spaces = leadingSpaces(line);
            if (spaces >= indent) {
                out.append(line, indent, line.length());
            }
            else if (line.isBlank()) {
                out.append(line, spaces, line.length());
            }
            else {
                out.append(line);
            }
        }
        return out.toString();
    }

    // CRLF and lone CR become LF in block scalar content
    private static String normalizeBreaks(String body) {
        return body.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static int detectIndentation(List<String> lines) {
        for (String line : lines) {
            if (!line.isBlank()) {
                return leadingSpaces(line);
            }
        }
        return 0;
    }

    /**
     * Replaces the line break of a line ending in a non-blank char with a space when the next line
     * starts with a non-blank char. Right after such a run of joins, one blank line is dropped.
     */
    static String fold(String text) {
        List<String> lines = linesKeepingBreaks(text);
        boolean folding = false;
        boolean doneFolding = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String next = i + 1 < lines.size() ? lines.get(i + 1) : null;
            if (endsWithNonBlankBreak(line) && next != null && startsWithNonBlank(next)) {
                lines.set(i, line.substring(0, line.length() - 1) + " ");
                folding = true;
            }
            else {
                if (doneFolding) {
                    if (line.equals("\n")) {
                        lines.set(i, "");
                    }
                    doneFolding = false;
                }
                if (folding) {
                    doneFolding = true;
                }
                folding = false;
            }
        }
        return String.join("", lines);
    }

    private static boolean endsWithNonBlankBreak(String line) {
        return line.length() >= 2 && line.charAt(line.length() - 1) == '\n' && !Character.isWhitespace(line.charAt(line.length() - 2));
    }

    private static boolean startsWithNonBlank(String line) {
        return !line.isEmpty() && !Character.isWhitespace(line.charAt(0));
    }

    private static List<String> linesKeepingBreaks(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private static int leadingSpaces(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    // index of the line break (or end of text) of the line containing from, excluding a CR before LF
    private static int lineEnd(String source, int from) {
        int newline = source.indexOf('\n', from);
        if (newline < 0) {
            return source.length();
        }
        return newline > from && source.charAt(newline - 1) == '\r' ? newline - 1 : newline;
    }

    private static int nextLineStart(String source, int lineEnd) {
        int newline = source.indexOf('\n', lineEnd);
        return newline < 0 ? source.length() : newline + 1;
    }
}
