/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

/**
 * A parsing expression. Matching either consumes input and returns the position after the match,
 * or returns {@link #NO_MATCH} leaving the state's captures as they were.
 */
@FunctionalInterface
public interface Rule {

    int NO_MATCH = -1;

    /**
     * @param state the parse in progress
     * @param pos where to start matching
     * @return the position after the match, or {@link #NO_MATCH}
     */
    int match(ParseState state, int pos);
}
