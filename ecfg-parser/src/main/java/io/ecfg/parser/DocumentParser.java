/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

/**
 * Parses one document into a {@link RawNode} tree.
 * Instances hold per-parse state and must not be shared between threads.
 */
public interface DocumentParser {

    /**
     * Parses the whole of the given text.
     * @param text the document
     * @return the root node
     * @throws SyntaxException if the text is not a well-formed document
     */
    RawNode parse(String text);
}
