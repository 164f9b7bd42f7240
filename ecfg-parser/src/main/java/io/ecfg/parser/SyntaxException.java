/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

/**
 * Thrown when a document does not conform to the grammar it is being parsed with.
 * No partial tree is ever produced alongside this exception.
 */
public class SyntaxException extends RuntimeException {

    private final int offset;
    private final int line;
    private final int column;

    public SyntaxException(String message, int offset, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    /**
     * Creates an exception for a failure at the given offset, working out the line and column from the document.
     * @param document the document being parsed
     * @param offset the char index of the failure
     * @param message description of the failure
     * @return the exception
     */
    public static SyntaxException at(String document, int offset, String message) {
        int clamped = Math.max(0, Math.min(offset, document.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < clamped; i++) {
            if (document.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SyntaxException(message, clamped, line, clamped - lineStart + 1);
    }

    /**
     * @return the char index into the document at which parsing failed
     */
    public int offset() {
        return offset;
    }

    /**
     * @return the 1-based line of the failure
     */
    public int line() {
        return line;
    }

    /**
     * @return the 1-based column of the failure
     */
    public int column() {
        return column;
    }
}
