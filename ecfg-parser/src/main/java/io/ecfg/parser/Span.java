/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

import java.util.Objects;

/**
 * A piece of source text together with the offset at which it starts in the parsed document.
 * Offsets are {@code char} indices into the document string.
 *
 * @param text the exact source text
 * @param offset index of the first char of {@code text} within the document
 */
public record Span(String text, int offset) {

    public Span {
        Objects.requireNonNull(text);
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, was " + offset);
        }
    }

    /**
     * @return the index just after the last char of this span
     */
    public int end() {
        return offset + text.length();
    }
}
