/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import io.ecfg.parser.RawNode;
import io.ecfg.parser.SyntaxException;

import static io.ecfg.parser.peg.Rule.NO_MATCH;

/**
 * Base class for grammars written with {@link Rules}.
 * <p>
 * Productions are declared as methods returning {@link #rule(String, Supplier) named rules}. A named rule is
 * created once per name and parameter values for the lifetime of the grammar instance, its definition is
 * only evaluated when it is first matched (so productions may refer to themselves), and its results are
 * memoized per input position. A grammar instance is therefore good for a single parse.
 * </p>
 */
public abstract class PegGrammar {

    private final Map<List<Object>, NamedRule> rules = new HashMap<>();
    private boolean used;

    protected final Rule rule(String name, Supplier<Rule> definition) {
        return named(List.of(name), definition);
    }

    protected final Rule rule(String name, Object parameter, Supplier<Rule> definition) {
        return named(List.of(name, parameter), definition);
    }

    protected final Rule rule(String name, Object first, Object second, Supplier<Rule> definition) {
        return named(List.of(name, first, second), definition);
    }

    private Rule named(List<Object> key, Supplier<Rule> definition) {
        return rules.computeIfAbsent(key, k -> new NamedRule(definition));
    }

    /**
     * Matches the root rule against the whole text.
     * @return the nodes captured at the top level
     * @throws SyntaxException if the root rule does not match all of the text
     */
    protected final List<RawNode> parseFully(Rule root, String text) {
        if (used) {
            throw new IllegalStateException("A grammar instance can only be used for a single parse");
        }
        used = true;
        ParseState state = new ParseState(text);
        int end = root.match(state, 0);
        if (end != text.length()) {
            int offset = Math.max(end, state.farthestFailure());
            throw SyntaxException.at(text, offset, describe(text, offset));
        }
        List<RawNode> nodes = new ArrayList<>();
        for (Capture capture : state.capturesSince(0)) {
            nodes.add(capture.node());
        }
        return nodes;
    }

    private static String describe(String text, int offset) {
        if (offset >= text.length()) {
            return "Unexpected end of input";
        }
        int cp = text.codePointAt(offset);
        if (Character.isISOControl(cp) || Character.isWhitespace(cp)) {
            return String.format("Unexpected character U+%04X", cp);
        }
        return "Unexpected character '" + new String(Character.toChars(cp)) + "'";
    }

    private static final class NamedRule implements Rule {

        private record Result(int end, List<Capture> captures) {
        }

        private final Supplier<Rule> definition;
        private final Map<Integer, Result> results = new HashMap<>();
        private Rule body;

        private NamedRule(Supplier<Rule> definition) {
            this.definition = definition;
        }

        @Override
        public int match(ParseState state, int pos) {
            Result result = results.get(pos);
            if (result != null) {
                state.addAll(result.captures());
                return result.end();
            }
            if (body == null) {
                body = definition.get();
            }
            int mark = state.mark();
            int end = body.match(state, pos);
            results.put(pos, new Result(end, end == NO_MATCH ? List.of() : state.capturesSince(mark)));
            return end;
        }
    }
}
