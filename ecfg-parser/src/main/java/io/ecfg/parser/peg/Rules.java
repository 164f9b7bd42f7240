/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;

import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.EmptyNode;
import io.ecfg.parser.RawNode.IgnoreNode;
import io.ecfg.parser.RawNode.MapNode;
import io.ecfg.parser.RawNode.PairNode;
import io.ecfg.parser.RawNode.ScalarNode;
import io.ecfg.parser.RawNode.SeqNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;

import static io.ecfg.parser.peg.Rule.NO_MATCH;

/**
 * Parsing expression combinators. Choice is ordered and repetition is greedy without backtracking,
 * so the order in which alternatives are listed is significant.
 */
public final class Rules {

    private static final Rule NOTHING = (state, pos) -> pos;

    private Rules() {
    }

    /**
     * Matches the given text exactly.
     */
    public static Rule literal(String expected) {
        return (state, pos) -> {
            if (state.text().startsWith(expected, pos)) {
                return pos + expected.length();
            }
            state.failedAt(pos);
            return NO_MATCH;
        };
    }

    /**
     * Matches any one of the given (BMP) chars.
     */
    public static Rule anyOf(String chars) {
        return (state, pos) -> {
            if (pos < state.length() && chars.indexOf(state.text().charAt(pos)) >= 0) {
                return pos + 1;
            }
            state.failedAt(pos);
            return NO_MATCH;
        };
    }

    /**
     * Matches one code point accepted by the predicate. Surrogate pairs count as a single code point.
     */
    public static Rule codePoint(IntPredicate accepted) {
        return (state, pos) -> {
            if (pos < state.length()) {
                int cp = state.text().codePointAt(pos);
                if (accepted.test(cp)) {
                    return pos + Character.charCount(cp);
                }
            }
            state.failedAt(pos);
            return NO_MATCH;
        };
    }

    public static Rule range(int first, int last) {
        return codePoint(cp -> cp >= first && cp <= last);
    }

    /**
     * Succeeds without consuming input.
     */
    public static Rule nothing() {
        return NOTHING;
    }

    /**
     * Never matches.
     */
    public static Rule fail() {
        return (state, pos) -> {
            state.failedAt(pos);
            return NO_MATCH;
        };
    }

    public static Rule endOfInput() {
        return (state, pos) -> {
            if (pos == state.length()) {
                return pos;
            }
            state.failedAt(pos);
            return NO_MATCH;
        };
    }

    /**
     * Succeeds without consuming at the start of the input or right after a line feed.
     */
    public static Rule startOfLine() {
        return (state, pos) -> pos == 0 || state.text().charAt(pos - 1) == '\n' ? pos : NO_MATCH;
    }

    /**
     * Succeeds without consuming when the code point before the position is accepted by the predicate.
     */
    public static Rule behind(IntPredicate accepted) {
        return (state, pos) -> pos > 0 && accepted.test(state.text().codePointBefore(pos)) ? pos : NO_MATCH;
    }

    public static Rule seq(Rule... rules) {
        return (state, pos) -> {
            int mark = state.mark();
            int current = pos;
            for (Rule rule : rules) {
                current = rule.match(state, current);
                if (current == NO_MATCH) {
                    state.reset(mark);
                    return NO_MATCH;
                }
            }
            return current;
        };
    }

    /**
     * Ordered choice: the first alternative that matches wins.
     */
    public static Rule firstOf(Rule... alternatives) {
        return (state, pos) -> {
            for (Rule alternative : alternatives) {
                int end = alternative.match(state, pos);
                if (end != NO_MATCH) {
                    return end;
                }
            }
            return NO_MATCH;
        };
    }

    /**
     * Greedy repetition. An iteration that consumes nothing ends the repetition.
     * @param min the minimum number of matches
     * @param max the maximum number of matches, or a negative number for no maximum
     */
    public static Rule repeat(Rule rule, int min, int max) {
        return (state, pos) -> {
            int mark = state.mark();
            int current = pos;
            int count = 0;
            while (max < 0 || count < max) {
                int end = rule.match(state, current);
                if (end == NO_MATCH) {
                    break;
                }
                count++;
                if (end == current) {
                    break;
                }
                current = end;
            }
            if (count < min) {
                state.reset(mark);
                return NO_MATCH;
            }
            return current;
        };
    }

    public static Rule zeroOrMore(Rule rule) {
        return repeat(rule, 0, -1);
    }

    public static Rule oneOrMore(Rule rule) {
        return repeat(rule, 1, -1);
    }

    public static Rule times(Rule rule, int count) {
        return repeat(rule, count, count);
    }

    public static Rule optional(Rule rule) {
        return repeat(rule, 0, 1);
    }

    /**
     * Positive lookahead. Never consumes input or keeps captures.
     */
    public static Rule ahead(Rule rule) {
        return (state, pos) -> {
            int mark = state.mark();
            int end = rule.match(state, pos);
            state.reset(mark);
            return end == NO_MATCH ? NO_MATCH : pos;
        };
    }

    /**
     * Negative lookahead. Never consumes input or keeps captures.
     */
    public static Rule notAhead(Rule rule) {
        return (state, pos) -> {
            int mark = state.mark();
            int end = rule.match(state, pos);
            state.reset(mark);
            return end == NO_MATCH ? pos : NO_MATCH;
        };
    }

    /**
     * Counts the spaces at the current position and, when there are at least {@code min},
     * matches the rule built for that count starting at the same position.
     * This lets a rule fix an indentation level that is only known once the input is seen.
     */
    public static Rule indented(int min, IntFunction<Rule> body) {
        return (state, pos) -> {
            int spaces = 0;
            while (pos + spaces < state.length() && state.text().charAt(pos + spaces) == ' ') {
                spaces++;
            }
            if (spaces < min) {
                state.failedAt(pos + spaces);
                return NO_MATCH;
            }
            return body.apply(spaces).match(state, pos);
        };
    }

    /**
     * Captures the matched text as a scalar of the given kind, discarding any captures made inside it.
     */
    public static Rule scalar(ScalarKind kind, Rule rule) {
        return text(rule, span -> new ScalarNode(kind, span));
    }

    /**
     * Captures the matched text as content that can never be a string.
     */
    public static Rule ignore(Rule rule) {
        return text(rule, IgnoreNode::new);
    }

    /**
     * Captures an empty node without consuming input.
     */
    public static Rule empty() {
        return (state, pos) -> {
            state.add(new EmptyNode(pos));
            return pos;
        };
    }

    public static Rule mapping(Rule rule) {
        return group(rule, (captures, pos) -> {
            List<PairNode> pairs = new ArrayList<>();
            for (RawNode node : nodes(captures)) {
                if (node instanceof PairNode pair) {
                    pairs.add(pair);
                }
                else if (!(node instanceof IgnoreNode || node instanceof EmptyNode)) {
                    throw new IllegalStateException("Mapping contains a non-pair node " + node);
                }
            }
            return Capture.of(new MapNode(pairs));
        });
    }

    public static Rule sequence(Rule rule) {
        return group(rule, (captures, pos) -> Capture.of(new SeqNode(nodes(captures))));
    }

    /**
     * Builds a pair from the key and value captured inside the rule. A missing key or value is empty.
     */
    public static Rule pair(Rule rule) {
        return group(rule, (captures, pos) -> {
            RawNode key = new EmptyNode(pos);
            RawNode value = new EmptyNode(pos);
            for (Capture capture : captures) {
                if (capture.role() == Capture.Role.KEY) {
                    key = capture.node();
                }
                else if (capture.role() == Capture.Role.VALUE) {
                    value = capture.node();
                }
            }
            return Capture.of(new PairNode(key, value));
        });
    }

    public static Rule key(Rule rule) {
        return group(rule, (captures, pos) -> new Capture(Capture.Role.KEY, select(captures, pos)));
    }

    public static Rule value(Rule rule) {
        return group(rule, (captures, pos) -> new Capture(Capture.Role.VALUE, select(captures, pos)));
    }

    /**
     * Picks the node that carries content from those captured for a key or value:
     * the last one that is neither ignored nor empty, falling back to an empty node, then to an ignored one.
     */
    static RawNode select(List<Capture> captures, int pos) {
        RawNode empty = null;
        RawNode ignored = null;
        RawNode chosen = null;
        for (RawNode node : nodes(captures)) {
            if (node instanceof EmptyNode) {
                empty = empty == null ? node : empty;
            }
            else if (node instanceof IgnoreNode) {
                ignored = node;
            }
            else {
                chosen = node;
            }
        }
        if (chosen != null) {
            return chosen;
        }
        if (empty != null) {
            return empty;
        }
        return ignored != null ? ignored : new EmptyNode(pos);
    }

    private static List<RawNode> nodes(List<Capture> captures) {
        List<RawNode> nodes = new ArrayList<>(captures.size());
        for (Capture capture : captures) {
            if (capture.role() == Capture.Role.NODE) {
                nodes.add(capture.node());
            }
        }
        return nodes;
    }

    private static Rule text(Rule rule, Function<Span, RawNode> factory) {
        return (state, pos) -> {
            int mark = state.mark();
            int end = rule.match(state, pos);
            if (end == NO_MATCH) {
                return NO_MATCH;
            }
            state.reset(mark);
            state.add(factory.apply(new Span(state.text().substring(pos, end), pos)));
            return end;
        };
    }

    @FunctionalInterface
    private interface Grouping {
        Capture build(List<Capture> captures, int pos);
    }

    private static Rule group(Rule rule, Grouping grouping) {
        return (state, pos) -> {
            int mark = state.mark();
            int end = rule.match(state, pos);
            if (end == NO_MATCH) {
                return NO_MATCH;
            }
            List<Capture> inner = state.capturesSince(mark);
            state.reset(mark);
            state.add(grouping.build(inner, pos));
            return end;
        };
    }
}
