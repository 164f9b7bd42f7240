/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.json;

/**
 * Converts the code point indices used by ANTLR character streams into {@code char} indices of the source string.
 */
final class CodePointOffsets {

    private final String text;
    // null when the text has no supplementary characters and the two kinds of index coincide
    private final int[] charIndexByCodePoint;

    CodePointOffsets(String text) {
        this.text = text;
        int codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            charIndexByCodePoint = null;
        }
        else {
            charIndexByCodePoint = new int[codePoints + 1];
            int charIndex = 0;
            for (int i = 0; i < codePoints; i++) {
                charIndexByCodePoint[i] = charIndex;
                charIndex += Character.charCount(text.codePointAt(charIndex));
            }
            charIndexByCodePoint[codePoints] = text.length();
        }
    }

    int toCharIndex(int codePointIndex) {
        if (charIndexByCodePoint == null) {
            return codePointIndex;
        }
        return charIndexByCodePoint[Math.min(Math.max(codePointIndex, 0), charIndexByCodePoint.length - 1)];
    }

    /**
     * @param line 1-based line
     * @param codePointColumn 0-based column, counted in code points
     */
    int lineColumnToCharIndex(int line, int codePointColumn) {
        int lineStart = 0;
        for (int current = 1; current < line; current++) {
            int newline = text.indexOf('\n', lineStart);
            if (newline < 0) {
                return text.length();
            }
            lineStart = newline + 1;
        }
        try {
            return text.offsetByCodePoints(lineStart, codePointColumn);
        }
        catch (IndexOutOfBoundsException e) {
            return text.length();
        }
    }
}
