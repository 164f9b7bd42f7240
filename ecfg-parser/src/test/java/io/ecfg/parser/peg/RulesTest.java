/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.EmptyNode;
import io.ecfg.parser.RawNode.IgnoreNode;
import io.ecfg.parser.RawNode.MapNode;
import io.ecfg.parser.RawNode.PairNode;
import io.ecfg.parser.RawNode.ScalarNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;

import static io.ecfg.parser.peg.Rule.NO_MATCH;
import static io.ecfg.parser.peg.Rules.ahead;
import static io.ecfg.parser.peg.Rules.anyOf;
import static io.ecfg.parser.peg.Rules.behind;
import static io.ecfg.parser.peg.Rules.empty;
import static io.ecfg.parser.peg.Rules.endOfInput;
import static io.ecfg.parser.peg.Rules.firstOf;
import static io.ecfg.parser.peg.Rules.ignore;
import static io.ecfg.parser.peg.Rules.indented;
import static io.ecfg.parser.peg.Rules.key;
import static io.ecfg.parser.peg.Rules.literal;
import static io.ecfg.parser.peg.Rules.mapping;
import static io.ecfg.parser.peg.Rules.notAhead;
import static io.ecfg.parser.peg.Rules.oneOrMore;
import static io.ecfg.parser.peg.Rules.optional;
import static io.ecfg.parser.peg.Rules.pair;
import static io.ecfg.parser.peg.Rules.range;
import static io.ecfg.parser.peg.Rules.repeat;
import static io.ecfg.parser.peg.Rules.scalar;
import static io.ecfg.parser.peg.Rules.seq;
import static io.ecfg.parser.peg.Rules.startOfLine;
import static io.ecfg.parser.peg.Rules.times;
import static io.ecfg.parser.peg.Rules.value;
import static io.ecfg.parser.peg.Rules.zeroOrMore;
import static org.assertj.core.api.Assertions.assertThat;

class RulesTest {

    private static int match(Rule rule, String text) {
        return rule.match(new ParseState(text), 0);
    }

    @Test
    void literalMatchesExactText() {
        assertThat(match(literal("abc"), "abcd")).isEqualTo(3);
        assertThat(match(literal("abc"), "ab")).isEqualTo(NO_MATCH);
    }

    @Test
    void codePointRulesConsumeSupplementaryCharsWhole() {
        assertThat(match(range(0x10000, 0x10FFFF), "😀")).isEqualTo(2);
        assertThat(match(anyOf("xy"), "y")).isEqualTo(1);
    }

    @Test
    void firstOfTakesFirstMatchingAlternative() {
        Rule rule = firstOf(literal("a"), literal("ab"));
        assertThat(match(rule, "ab")).isEqualTo(1);
    }

    @Test
    void seqFailsAsAWhole() {
        ParseState state = new ParseState("ab");
        Rule rule = seq(scalar(ScalarKind.PLAIN, literal("a")), literal("c"));
        assertThat(rule.match(state, 0)).isEqualTo(NO_MATCH);
        assertThat(state.mark()).isZero();
    }

    @Test
    void repeatHonoursBounds() {
        assertThat(match(repeat(literal("a"), 2, 3), "aaaa")).isEqualTo(3);
        assertThat(match(repeat(literal("a"), 2, 3), "a")).isEqualTo(NO_MATCH);
        assertThat(match(times(literal("a"), 2), "aaa")).isEqualTo(2);
        assertThat(match(zeroOrMore(literal("a")), "b")).isZero();
        assertThat(match(oneOrMore(literal("a")), "b")).isEqualTo(NO_MATCH);
        assertThat(match(optional(literal("a")), "b")).isZero();
    }

    @Test
    void repeatStopsOnZeroWidthMatch() {
        assertThat(match(zeroOrMore(optional(literal("a"))), "aab")).isEqualTo(2);
    }

    @Test
    void lookaheadConsumesNothing() {
        assertThat(match(ahead(literal("a")), "a")).isZero();
        assertThat(match(notAhead(literal("a")), "a")).isEqualTo(NO_MATCH);
        assertThat(match(notAhead(literal("a")), "b")).isZero();
    }

    @Test
    void positionalRules() {
        ParseState state = new ParseState("a\nb");
        assertThat(startOfLine().match(state, 2)).isEqualTo(2);
        assertThat(startOfLine().match(state, 1)).isEqualTo(NO_MATCH);
        assertThat(behind(cp -> cp == 'a').match(state, 1)).isEqualTo(1);
        assertThat(behind(cp -> cp == 'a').match(state, 0)).isEqualTo(NO_MATCH);
        assertThat(endOfInput().match(state, 3)).isEqualTo(3);
    }

    @Test
    void indentedPassesLeadingSpaceCount() {
        Rule rule = indented(1, n -> seq(times(literal(" "), n), literal("x")));
        assertThat(match(rule, "   x")).isEqualTo(4);
        assertThat(match(rule, "x")).isEqualTo(NO_MATCH);
    }

    @Test
    void capturesScalarWithSpan() {
        ParseState state = new ParseState("  abc");
        int end = scalar(ScalarKind.PLAIN, oneOrMore(range('a', 'z'))).match(state, 2);
        assertThat(end).isEqualTo(5);
        assertThat(state.capturesSince(0)).containsExactly(Capture.of(new ScalarNode(ScalarKind.PLAIN, new Span("abc", 2))));
    }

    @Test
    void buildsPairsIntoMapping() {
        Rule entry = pair(seq(key(scalar(ScalarKind.PLAIN, literal("k"))), literal(":"), value(scalar(ScalarKind.PLAIN, literal("v")))));
        Rule rule = mapping(seq(entry, zeroOrMore(seq(literal(","), entry))));
        ParseState state = new ParseState("k:v,k:v");
        assertThat(rule.match(state, 0)).isEqualTo(7);
        RawNode k = new ScalarNode(ScalarKind.PLAIN, new Span("k", 0));
        RawNode v = new ScalarNode(ScalarKind.PLAIN, new Span("v", 2));
        RawNode k2 = new ScalarNode(ScalarKind.PLAIN, new Span("k", 4));
        RawNode v2 = new ScalarNode(ScalarKind.PLAIN, new Span("v", 6));
        assertThat(state.capturesSince(0)).containsExactly(Capture.of(new MapNode(List.of(new PairNode(k, v), new PairNode(k2, v2)))));
    }

    @Test
    void pairWithoutValueHasEmptyValue() {
        ParseState state = new ParseState("k");
        pair(key(scalar(ScalarKind.PLAIN, literal("k")))).match(state, 0);
        assertThat(state.capturesSince(0)).singleElement()
                .extracting(Capture::node)
                .isEqualTo(new PairNode(new ScalarNode(ScalarKind.PLAIN, new Span("k", 0)), new EmptyNode(0)));
    }

    @Test
    void selectPrefersContentOverPropertiesAndEmptyNodes() {
        RawNode ignored = new IgnoreNode(new Span("!!str", 0));
        RawNode scalar = new ScalarNode(ScalarKind.PLAIN, new Span("c", 6));
        RawNode empty = new EmptyNode(3);
        assertThat(Rules.select(List.of(Capture.of(ignored), Capture.of(scalar)), 0)).isEqualTo(scalar);
        assertThat(Rules.select(List.of(Capture.of(ignored), Capture.of(empty)), 0)).isEqualTo(empty);
        assertThat(Rules.select(List.of(Capture.of(ignored)), 0)).isEqualTo(ignored);
        assertThat(Rules.select(List.of(), 4)).isEqualTo(new EmptyNode(4));
    }

    @Test
    void ignoreReplacesInnerCaptures() {
        ParseState state = new ParseState("ab");
        ignore(seq(scalar(ScalarKind.PLAIN, literal("a")), empty(), literal("b"))).match(state, 0);
        assertThat(state.capturesSince(0)).containsExactly(Capture.of(new IgnoreNode(new Span("ab", 0))));
    }
}
