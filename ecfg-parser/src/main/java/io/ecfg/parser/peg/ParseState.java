/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

import java.util.ArrayList;
import java.util.List;

import io.ecfg.parser.RawNode;

/**
 * The mutable state of a single parse: the input, the captures made so far and the farthest point
 * at which a terminal failed, used to report syntax errors.
 */
public final class ParseState {

    private final String text;
    private final List<Capture> captures = new ArrayList<>();
    private int farthestFailure;

    public ParseState(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int mark() {
        return captures.size();
    }

    /**
     * Discards the captures made since the given mark.
     */
    public void reset(int mark) {
        if (mark < captures.size()) {
            captures.subList(mark, captures.size()).clear();
        }
    }

    public List<Capture> capturesSince(int mark) {
        return List.copyOf(captures.subList(mark, captures.size()));
    }

    public void add(Capture capture) {
        captures.add(capture);
    }

    public void add(RawNode node) {
        captures.add(Capture.of(node));
    }

    public void addAll(List<Capture> replayed) {
        captures.addAll(replayed);
    }

    public void failedAt(int pos) {
        if (pos > farthestFailure) {
            farthestFailure = pos;
        }
    }

    public int farthestFailure() {
        return farthestFailure;
    }
}
