/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

/**
 * Backslash escape processing shared by YAML, JSON and TOML double-quoted strings.
 */
final class Escapes {

    private Escapes() {
    }

    /**
     * Replaces escape sequences with the chars they denote. Unknown escapes are kept verbatim.
     * @param text the quoted content, without delimiters
     * @param lineContinuations whether a backslash at the end of a line swallows the break and following white space
     * @return the unescaped text
     */
    static String unescape(String text, boolean lineContinuations) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                out.append(c);
                i++;
                continue;
            }
            if (lineContinuations) {
                int afterContinuation = skipLineContinuation(text, i + 1);
                if (afterContinuation > 0) {
                    i = afterContinuation;
                    continue;
                }
            }
            char e = text.charAt(i + 1);
            switch (e) {
                case '0' -> out.append('\0');
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 't', '\t' -> out.append('\t');
                case 'n' -> out.append('\n');
                case 'v' -> out.append('\u000B');
                case 'f' -> out.append('\f');
                case 'r' -> out.append('\r');
                case 'e' -> out.append('\u001B');
                case ' ' -> out.append(' ');
                case '"' -> out.append('"');
                case '\'' -> out.append('\'');
                case '/' -> out.append('/');
                case '\\' -> out.append('\\');
                case 'N' -> out.append('\u0085');
                case '_' -> out.append('\u00A0');
                case 'L' -> out.append('\u2028');
                case 'P' -> out.append('\u2029');
                case 'x' -> {
                    if (appendHex(text, i + 2, 2, out)) {
                        i += 4;
                        continue;
                    }
                    out.append(c).append(e);
                }
                case 'u' -> {
                    if (appendHex(text, i + 2, 4, out)) {
                        i += 6;
                        continue;
                    }
                    out.append(c).append(e);
                }
                case 'U' -> {
                    if (appendHex(text, i + 2, 8, out)) {
                        i += 10;
                        continue;
                    }
                    out.append(c).append(e);
                }
                default -> out.append(c).append(e);
            }
            i += 2;
        }
        return out.toString();
    }

    // returns the index after the continuation, or -1 if the backslash at from - 1 does not start one
    private static int skipLineContinuation(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '\r') {
            i++;
        }
        if (i >= text.length() || text.charAt(i) != '\n') {
            return -1;
        }
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean appendHex(String text, int from, int digits, StringBuilder out) {
        if (from + digits > text.length()) {
            return false;
        }
        int codePoint = 0;
        for (int j = from; j < from + digits; j++) {
            int digit = Character.digit(text.charAt(j), 16);
            if (digit < 0) {
                return false;
            }
            codePoint = codePoint * 16 + digit;
        }
        if (!Character.isValidCodePoint(codePoint)) {
            return false;
        }
        out.appendCodePoint(codePoint);
        return true;
    }
}
