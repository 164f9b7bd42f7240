/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

/**
 * Line folding for multi-line flow scalars: a break between two non-empty lines becomes a space,
 * every empty line becomes a line feed, and white space around breaks is dropped.
 */
final class LineFolding {

    private LineFolding() {
    }

    /**
     * Folds the content of a flow scalar. Content without line breaks is returned unchanged.
     * @param content the scalar text, without quotes
     * @param backslashEscapes whether the content may contain backslash escapes, so that
     * escaped white space is preserved and an escaped line break joins lines without a space
     * @return the folded text, escapes still in place
     */
    static String fold(String content, boolean backslashEscapes) {
        if (content.indexOf('\n') < 0 && content.indexOf('\r') < 0) {
            return content;
        }
        String[] lines = content.split("\r\n|\r|\n", -1);
        StringBuilder out = new StringBuilder(content.length());
        int pendingBreaks = 0;
        boolean joinTight = false;
        for (int i = 0; i < lines.length; i++) {
            boolean first = i == 0;
            boolean last = i == lines.length - 1;
            String line = first ? lines[i] : stripLeading(lines[i]);
            boolean escapedBreak = false;
            if (!last) {
                if (backslashEscapes && endsWithEscapingBackslash(line)) {
                    line = line.substring(0, line.length() - 1);
                    escapedBreak = true;
                }
                else {
                    line = stripTrailing(line, backslashEscapes);
                }
            }
            if (first) {
                out.append(line);
            }
            else if (!last && line.isEmpty() && !escapedBreak) {
                pendingBreaks++;
                continue;
            }
            else {
                if (pendingBreaks > 0) {
                    out.append("\n".repeat(pendingBreaks));
                }
                else if (!joinTight) {
                    out.append(' ');
                }
                out.append(line);
            }
            pendingBreaks = 0;
            joinTight = escapedBreak;
        }
        return out.toString();
    }

    private static String stripLeading(String line) {
        int i = 0;
        while (i < line.length() && isWhite(line.charAt(i))) {
            i++;
        }
        return line.substring(i);
    }

    private static String stripTrailing(String line, boolean backslashEscapes) {
        int end = line.length();
        while (end > 0 && isWhite(line.charAt(end - 1))) {
            end--;
        }
        if (backslashEscapes && end < line.length() && isOddBackslashRun(line, end)) {
            // the first trailing white space char is escaped
            end++;
        }
        return line.substring(0, end);
    }

    private static boolean endsWithEscapingBackslash(String line) {
        return !line.isEmpty() && line.charAt(line.length() - 1) == '\\' && isOddBackslashRun(line, line.length());
    }

    // whether the run of backslashes ending just before index has odd length
    private static boolean isOddBackslashRun(String line, int index) {
        int count = 0;
        for (int i = index - 1; i >= 0 && line.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }

    private static boolean isWhite(char c) {
        return c == ' ' || c == '\t';
    }
}
