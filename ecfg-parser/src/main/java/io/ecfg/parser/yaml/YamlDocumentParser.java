/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.yaml;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ecfg.parser.DocumentParser;
import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.EmptyNode;
import io.ecfg.parser.RawNode.ScalarNode;
import io.ecfg.parser.RawNode.SeqNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;
import io.ecfg.parser.peg.ParseState;
import io.ecfg.parser.peg.PegGrammar;
import io.ecfg.parser.peg.Rule;

import static io.ecfg.parser.peg.Rule.NO_MATCH;
import static io.ecfg.parser.peg.Rules.ahead;
import static io.ecfg.parser.peg.Rules.anyOf;
import static io.ecfg.parser.peg.Rules.behind;
import static io.ecfg.parser.peg.Rules.codePoint;
import static io.ecfg.parser.peg.Rules.empty;
import static io.ecfg.parser.peg.Rules.endOfInput;
import static io.ecfg.parser.peg.Rules.fail;
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
import static io.ecfg.parser.peg.Rules.repeat;
import static io.ecfg.parser.peg.Rules.scalar;
import static io.ecfg.parser.peg.Rules.seq;
import static io.ecfg.parser.peg.Rules.sequence;
import static io.ecfg.parser.peg.Rules.startOfLine;
import static io.ecfg.parser.peg.Rules.times;
import static io.ecfg.parser.peg.Rules.value;
import static io.ecfg.parser.peg.Rules.zeroOrMore;

/**
 * A YAML 1.2 parser built from the numbered YAML 1.2 productions.
 * <p>
 * Productions are parameterised by indentation {@code n} and {@link Context context} {@code c} and are named after the
 * YAML 1.2 productions. Scalars are captured with their exact source text; tags, anchors, aliases and empty
 * nodes are captured as content that is never a string. A stream of several documents yields a sequence of them.
 * </p>
 */
public final class YamlDocumentParser extends PegGrammar implements DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(YamlDocumentParser.class);

    // [1]-[66] characters, line breaks, white space and comments

    private final Rule nbChar = codePoint(Chars::isNbChar);
    private final Rule nsChar = codePoint(Chars::isNsChar);
    private final Rule nbJson = codePoint(Chars::isJson);
    private final Rule sWhite = anyOf(" \t");
    private final Rule sSpace = literal(" ");
    private final Rule bBreak = firstOf(literal("\r\n"), literal("\r"), literal("\n"));
    private final Rule bChar = anyOf("\r\n");
    private final Rule byteOrderMark = codePoint(cp -> cp == Chars.BYTE_ORDER_MARK);
    private final Rule nsDecDigit = codePoint(Chars::isDecDigit);
    private final Rule nsHexDigit = codePoint(Chars::isHexDigit);
    private final Rule nsWordChar = codePoint(Chars::isWordChar);
    private final Rule nsUriChar = firstOf(seq(literal("%"), nsHexDigit, nsHexDigit), codePoint(Chars::isUriChar));
    private final Rule nsTagChar = firstOf(seq(literal("%"), nsHexDigit, nsHexDigit), codePoint(Chars::isTagChar));
    private final Rule nsAnchorChar = codePoint(Chars::isAnchorChar);
    private final Rule sSeparateInLine = firstOf(oneOrMore(sWhite), startOfLine());
    private final Rule cNbCommentText = seq(literal("#"), zeroOrMore(nbChar));
    private final Rule bComment = firstOf(bBreak, endOfInput());
    private final Rule sBComment = seq(optional(seq(sSeparateInLine, optional(cNbCommentText))), bComment);
    private final Rule lComment = seq(sSeparateInLine, optional(cNbCommentText), bComment);
    private final Rule sLComments = seq(firstOf(sBComment, startOfLine()), zeroOrMore(lComment));

    @Override
    public RawNode parse(String text) {
        List<RawNode> documents = parseFully(lYamlStream(), text);
        LOGGER.debug("Parsed YAML stream of {} chars into {} document(s)", text.length(), documents.size());
        if (documents.isEmpty()) {
            return new EmptyNode(0);
        }
        return documents.size() == 1 ? documents.get(0) : new SeqNode(documents);
    }

    // indentation

    private Rule sIndent(int n) {
        return n < 0 ? fail() : times(sSpace, n);
    }

    private Rule sIndentLessThan(int n) {
        return n <= 0 ? fail() : repeat(sSpace, 0, n - 1);
    }

    private Rule sIndentLessOrEqual(int n) {
        return n < 0 ? fail() : repeat(sSpace, 0, n);
    }

    private Rule sLinePrefix(int n, Context c) {
        if (c.isKey()) {
            throw new IllegalArgumentException("No line prefix in context " + c);
        }
        return c.isBlock() ? sIndent(n) : sFlowLinePrefix(n);
    }

    private Rule sFlowLinePrefix(int n) {
        return rule("s-flow-line-prefix", n, () -> seq(sIndent(n), optional(sSeparateInLine)));
    }

    // line folding

    private Rule lEmpty(int n, Context c) {
        return rule("l-empty", n, c, () -> seq(firstOf(sLinePrefix(n, c), sIndentLessThan(n)), bBreak));
    }

    private Rule bLFolded(int n, Context c) {
        Rule trimmed = seq(bBreak, oneOrMore(lEmpty(n, c)));
        return rule("b-l-folded", n, c, () -> firstOf(trimmed, bBreak));
    }

    private Rule sFlowFolded(int n) {
        return rule("s-flow-folded", n, () -> seq(optional(sSeparateInLine), bLFolded(n, Context.FLOW_IN), sFlowLinePrefix(n)));
    }

    // separation

    private Rule sSeparate(int n, Context c) {
        return c.isKey() ? sSeparateInLine : sSeparateLines(n);
    }

    private Rule sSeparateLines(int n) {
        return rule("s-separate-lines", n, () -> firstOf(seq(sLComments, sFlowLinePrefix(n)), sSeparateInLine));
    }

    // [82]-[95] directives

    private Rule lDirective() {
        return rule("l-directive", () -> seq(literal("%"),
                firstOf(nsYamlDirective(), nsTagDirective(), nsReservedDirective()),
                sLComments));
    }

    private Rule nsReservedDirective() {
        Rule word = oneOrMore(nsChar);
        return seq(word, zeroOrMore(seq(sSeparateInLine, word)));
    }

    private Rule nsYamlDirective() {
        return seq(literal("YAML"), sSeparateInLine, oneOrMore(nsDecDigit), literal("."), oneOrMore(nsDecDigit));
    }

    private Rule nsTagDirective() {
        Rule localPrefix = seq(literal("!"), zeroOrMore(nsUriChar));
        Rule globalPrefix = seq(nsTagChar, zeroOrMore(nsUriChar));
        return seq(literal("TAG"), sSeparateInLine, cTagHandle(), sSeparateInLine, firstOf(localPrefix, globalPrefix));
    }

    private Rule cTagHandle() {
        return rule("c-tag-handle", () -> firstOf(
                seq(literal("!"), oneOrMore(nsWordChar), literal("!")),
                literal("!!"),
                literal("!")));
    }

    // [96]-[104] node properties and aliases

    private Rule cNsProperties(int n, Context c) {
        return rule("c-ns-properties", n, c, () -> ignore(firstOf(
                seq(cNsTagProperty(), optional(seq(sSeparate(n, c), cNsAnchorProperty()))),
                seq(cNsAnchorProperty(), optional(seq(sSeparate(n, c), cNsTagProperty()))))));
    }

    private Rule cNsTagProperty() {
        return rule("c-ns-tag-property", () -> firstOf(
                seq(literal("!<"), oneOrMore(nsUriChar), literal(">")),
                seq(cTagHandle(), oneOrMore(nsTagChar)),
                literal("!")));
    }

    private Rule cNsAnchorProperty() {
        return seq(literal("&"), oneOrMore(nsAnchorChar));
    }

    private Rule cNsAliasNode() {
        return rule("c-ns-alias-node", () -> ignore(seq(literal("*"), oneOrMore(nsAnchorChar))));
    }

    private Rule eNode() {
        return empty();
    }

    // [107]-[116] double-quoted scalars

    private Rule cNsEscChar() {
        return rule("c-ns-esc-char", () -> seq(literal("\\"), firstOf(
                anyOf("0abt\tnvfre \"/\\N_LP"),
                seq(literal("x"), times(nsHexDigit, 2)),
                seq(literal("u"), times(nsHexDigit, 4)),
                seq(literal("U"), times(nsHexDigit, 8)))));
    }

    private Rule nbDoubleChar() {
        return rule("nb-double-char", () -> firstOf(cNsEscChar(), codePoint(cp -> Chars.isJson(cp) && cp != '\\' && cp != '"')));
    }

    private Rule nsDoubleChar() {
        return rule("ns-double-char", () -> seq(notAhead(sWhite), nbDoubleChar()));
    }

    private Rule cDoubleQuoted(int n, Context c) {
        return rule("c-double-quoted", n, c, () -> scalar(ScalarKind.DOUBLE_QUOTED,
                seq(literal("\""), nbDoubleText(n, c), literal("\""))));
    }

    private Rule nbDoubleText(int n, Context c) {
        return c.isKey() ? zeroOrMore(nbDoubleChar()) : nbDoubleMultiLine(n);
    }

    private Rule sDoubleEscaped(int n) {
        return seq(zeroOrMore(sWhite), literal("\\"), bBreak, zeroOrMore(lEmpty(n, Context.FLOW_IN)), sFlowLinePrefix(n));
    }

    private Rule nbNsDoubleInLine() {
        return rule("nb-ns-double-in-line", () -> zeroOrMore(seq(zeroOrMore(sWhite), nsDoubleChar())));
    }

    private Rule sDoubleBreak(int n) {
        return rule("s-double-break", n, () -> firstOf(sDoubleEscaped(n), sFlowFolded(n)));
    }

    // a continuation line that carries content
    private Rule sDoubleNextLine(int n) {
        return rule("s-double-next-line", n, () -> seq(sDoubleBreak(n), nsDoubleChar(), nbNsDoubleInLine()));
    }

    private Rule nbDoubleMultiLine(int n) {
        return rule("nb-double-multi-line", n, () -> seq(nbNsDoubleInLine(), zeroOrMore(sDoubleNextLine(n)),
                firstOf(sDoubleBreak(n), zeroOrMore(sWhite))));
    }

    // [117]-[125] single-quoted scalars

    private Rule nbSingleChar() {
        return rule("nb-single-char", () -> firstOf(literal("''"), codePoint(cp -> Chars.isJson(cp) && cp != '\'')));
    }

    private Rule nsSingleChar() {
        return rule("ns-single-char", () -> seq(notAhead(sWhite), nbSingleChar()));
    }

    private Rule cSingleQuoted(int n, Context c) {
        return rule("c-single-quoted", n, c, () -> scalar(ScalarKind.SINGLE_QUOTED,
                seq(literal("'"), nbSingleText(n, c), literal("'"))));
    }

    private Rule nbSingleText(int n, Context c) {
        return c.isKey() ? zeroOrMore(nbSingleChar()) : nbSingleMultiLine(n);
    }

    private Rule nbNsSingleInLine() {
        return rule("nb-ns-single-in-line", () -> zeroOrMore(seq(zeroOrMore(sWhite), nsSingleChar())));
    }

    private Rule sSingleNextLine(int n) {
        return rule("s-single-next-line", n, () -> seq(sFlowFolded(n), nsSingleChar(), nbNsSingleInLine()));
    }

    private Rule nbSingleMultiLine(int n) {
        return rule("nb-single-multi-line", n, () -> seq(nbNsSingleInLine(), zeroOrMore(sSingleNextLine(n)),
                firstOf(sFlowFolded(n), zeroOrMore(sWhite))));
    }

    // [126]-[135] plain scalars

    private Rule nsPlainSafe(Context c) {
        return switch (c) {
            case FLOW_IN, FLOW_KEY -> codePoint(cp -> Chars.isNsChar(cp) && !Chars.isFlowIndicator(cp));
            default -> nsChar;
        };
    }

    private Rule nsPlainFirst(Context c) {
        return rule("ns-plain-first", c, () -> firstOf(
                codePoint(cp -> Chars.isNsChar(cp) && !Chars.isIndicator(cp)),
                seq(anyOf("?:-"), ahead(nsPlainSafe(c)))));
    }

    private Rule nsPlainChar(Context c) {
        return rule("ns-plain-char", c, () -> firstOf(
                seq(notAhead(anyOf(":#")), nsPlainSafe(c)),
                seq(behind(Chars::isNsChar), literal("#")),
                seq(literal(":"), ahead(nsPlainSafe(c)))));
    }

    private Rule nbNsPlainInLine(Context c) {
        return rule("nb-ns-plain-in-line", c, () -> zeroOrMore(seq(zeroOrMore(sWhite), nsPlainChar(c))));
    }

    private Rule nsPlainOneLine(Context c) {
        return rule("ns-plain-one-line", c, () -> seq(nsPlainFirst(c), nbNsPlainInLine(c)));
    }

    private Rule sNsPlainNextLine(int n, Context c) {
        return rule("s-ns-plain-next-line", n, c, () -> seq(sFlowFolded(n), notAhead(cForbidden()), nsPlainChar(c), nbNsPlainInLine(c)));
    }

    private Rule nsPlain(int n, Context c) {
        return rule("ns-plain", n, c, () -> scalar(ScalarKind.PLAIN, c.isKey()
                ? nsPlainOneLine(c)
                : seq(nsPlainOneLine(c), zeroOrMore(sNsPlainNextLine(n, c)))));
    }

    // [136]-[150] flow collections

    private Rule cFlowSequence(int n, Context c) {
        return rule("c-flow-sequence", n, c, () -> sequence(seq(literal("["), optional(sSeparate(n, c)),
                optional(nsSFlowSeqEntries(n, c.inFlow())), literal("]"))));
    }

    private Rule nsSFlowSeqEntries(int n, Context c) {
        return rule("ns-s-flow-seq-entries", n, c, () -> seq(nsFlowSeqEntry(n, c), optional(sSeparate(n, c)),
                zeroOrMore(seq(literal(","), optional(sSeparate(n, c)), nsFlowSeqEntry(n, c), optional(sSeparate(n, c)))),
                optional(seq(literal(","), optional(sSeparate(n, c))))));
    }

    private Rule nsFlowSeqEntry(int n, Context c) {
        return rule("ns-flow-seq-entry", n, c, () -> firstOf(mapping(nsFlowPair(n, c)), nsFlowNode(n, c)));
    }

    private Rule cFlowMapping(int n, Context c) {
        return rule("c-flow-mapping", n, c, () -> mapping(seq(literal("{"), optional(sSeparate(n, c)),
                optional(nsSFlowMapEntries(n, c.inFlow())), literal("}"))));
    }

    private Rule nsSFlowMapEntries(int n, Context c) {
        return rule("ns-s-flow-map-entries", n, c, () -> seq(nsFlowMapEntry(n, c), optional(sSeparate(n, c)),
                zeroOrMore(seq(literal(","), optional(sSeparate(n, c)), nsFlowMapEntry(n, c), optional(sSeparate(n, c)))),
                optional(seq(literal(","), optional(sSeparate(n, c))))));
    }

    private Rule nsFlowMapEntry(int n, Context c) {
        return rule("ns-flow-map-entry", n, c, () -> firstOf(
                seq(literal("?"), sSeparate(n, c), nsFlowMapExplicitEntry(n, c)),
                nsFlowMapImplicitEntry(n, c)));
    }

    private Rule nsFlowMapExplicitEntry(int n, Context c) {
        return rule("ns-flow-map-explicit-entry", n, c, () -> firstOf(
                nsFlowMapImplicitEntry(n, c),
                pair(seq(key(eNode()), value(eNode())))));
    }

    private Rule nsFlowMapImplicitEntry(int n, Context c) {
        return rule("ns-flow-map-implicit-entry", n, c, () -> firstOf(
                nsFlowMapYamlKeyEntry(n, c),
                cNsFlowMapEmptyKeyEntry(n, c),
                cNsFlowMapJsonKeyEntry(n, c)));
    }

    private Rule nsFlowMapYamlKeyEntry(int n, Context c) {
        return rule("ns-flow-map-yaml-key-entry", n, c, () -> pair(seq(
                key(nsFlowYamlNode(n, c)),
                value(firstOf(seq(optional(sSeparate(n, c)), cNsFlowMapSeparateValue(n, c)), eNode())))));
    }

    private Rule cNsFlowMapEmptyKeyEntry(int n, Context c) {
        return rule("c-ns-flow-map-empty-key-entry", n, c, () -> pair(seq(
                key(eNode()),
                value(cNsFlowMapSeparateValue(n, c)))));
    }

    private Rule cNsFlowMapSeparateValue(int n, Context c) {
        return rule("c-ns-flow-map-separate-value", n, c, () -> seq(literal(":"), notAhead(nsPlainSafe(c)),
                firstOf(seq(sSeparate(n, c), nsFlowNode(n, c)), eNode())));
    }

    private Rule cNsFlowMapJsonKeyEntry(int n, Context c) {
        return rule("c-ns-flow-map-json-key-entry", n, c, () -> pair(seq(
                key(cFlowJsonNode(n, c)),
                value(firstOf(seq(optional(sSeparate(n, c)), cNsFlowMapAdjacentValue(n, c)), eNode())))));
    }

    private Rule cNsFlowMapAdjacentValue(int n, Context c) {
        return rule("c-ns-flow-map-adjacent-value", n, c, () -> seq(literal(":"),
                firstOf(seq(optional(sSeparate(n, c)), nsFlowNode(n, c)), eNode())));
    }

    private Rule nsFlowPair(int n, Context c) {
        return rule("ns-flow-pair", n, c, () -> firstOf(
                seq(literal("?"), sSeparate(n, c), nsFlowMapExplicitEntry(n, c)),
                nsFlowPairEntry(n, c)));
    }

    private Rule nsFlowPairEntry(int n, Context c) {
        return rule("ns-flow-pair-entry", n, c, () -> firstOf(
                pair(seq(key(nsSImplicitYamlKey(Context.FLOW_KEY)), value(cNsFlowMapSeparateValue(n, c)))),
                cNsFlowMapEmptyKeyEntry(n, c),
                pair(seq(key(cSImplicitJsonKey(Context.FLOW_KEY)), value(cNsFlowMapAdjacentValue(n, c))))));
    }

    private Rule nsSImplicitYamlKey(Context c) {
        return rule("ns-s-implicit-yaml-key", c, () -> seq(nsFlowYamlNode(0, c), optional(sSeparateInLine)));
    }

    private Rule cSImplicitJsonKey(Context c) {
        return rule("c-s-implicit-json-key", c, () -> seq(cFlowJsonNode(0, c), optional(sSeparateInLine)));
    }

    // [156]-[161] flow nodes

    private Rule cFlowJsonContent(int n, Context c) {
        return rule("c-flow-json-content", n, c, () -> firstOf(
                cFlowSequence(n, c), cFlowMapping(n, c), cSingleQuoted(n, c), cDoubleQuoted(n, c)));
    }

    private Rule nsFlowContent(int n, Context c) {
        return rule("ns-flow-content", n, c, () -> firstOf(nsPlain(n, c), cFlowJsonContent(n, c)));
    }

    private Rule nsFlowYamlNode(int n, Context c) {
        return rule("ns-flow-yaml-node", n, c, () -> firstOf(
                cNsAliasNode(),
                nsPlain(n, c),
                seq(cNsProperties(n, c), firstOf(seq(sSeparate(n, c), nsPlain(n, c)), eNode()))));
    }

    private Rule cFlowJsonNode(int n, Context c) {
        return rule("c-flow-json-node", n, c, () -> seq(
                optional(seq(cNsProperties(n, c), sSeparate(n, c))),
                cFlowJsonContent(n, c)));
    }

    private Rule nsFlowNode(int n, Context c) {
        return rule("ns-flow-node", n, c, () -> firstOf(
                cNsAliasNode(),
                nsFlowContent(n, c),
                seq(cNsProperties(n, c), firstOf(seq(sSeparate(n, c), nsFlowContent(n, c)), eNode()))));
    }

    // [162]-[182] block scalars

    private Rule cLLiteral(int n) {
        return rule("c-l+literal", n, () -> new BlockScalarRule('|', ScalarKind.BLOCK_LITERAL, n));
    }

    private Rule cLFolded(int n) {
        return rule("c-l+folded", n, () -> new BlockScalarRule('>', ScalarKind.BLOCK_FOLDED, n));
    }

    /**
     * Literal and folded content match the same lines; they only differ in how the text is decoded.
     */
    private Rule lBlockContent(int n) {
        return rule("l-block-content", n, () -> {
            Rule textLine = seq(zeroOrMore(lEmpty(n, Context.BLOCK_IN)), notAhead(cForbidden()), sIndent(n), oneOrMore(nbChar));
            Rule emptyLines = zeroOrMore(seq(sIndentLessOrEqual(n), bBreak));
            return seq(optional(seq(textLine, zeroOrMore(seq(bBreak, textLine)), bComment)), emptyLines);
        });
    }

    private Rule lTrailComments(int n) {
        return rule("l-trail-comments", n, () -> seq(sIndentLessThan(n), cNbCommentText, bComment, zeroOrMore(lComment)));
    }

    /**
     * Matches a block scalar header, works out the content indentation and then matches the content at that
     * indentation. Trailing comment lines are matched but left out of the captured scalar.
     */
    private final class BlockScalarRule implements Rule {

        private final char indicator;
        private final ScalarKind kind;
        private final int n;

        BlockScalarRule(char indicator, ScalarKind kind, int n) {
            this.indicator = indicator;
            this.kind = kind;
            this.n = n;
        }

        @Override
        public int match(ParseState state, int pos) {
            String text = state.text();
            if (pos >= text.length() || text.charAt(pos) != indicator) {
                state.failedAt(pos);
                return NO_MATCH;
            }
            int p = pos + 1;
            int indentationIndicator = 0;
            boolean chomping = false;
            for (int i = 0; i < 2 && p < text.length(); i++) {
                char modifier = text.charAt(p);
                if (indentationIndicator == 0 && modifier >= '1' && modifier <= '9') {
                    indentationIndicator = modifier - '0';
                    p++;
                }
                else if (!chomping && (modifier == '+' || modifier == '-')) {
                    chomping = true;
                    p++;
                }
                else {
                    break;
                }
            }
            int contentStart = sBComment.match(state, p);
            if (contentStart == NO_MATCH) {
                return NO_MATCH;
            }
            int indentation = indentationIndicator > 0 ? n + indentationIndicator : detectIndentation(text, contentStart);
            int contentEnd = lBlockContent(indentation).match(state, contentStart);
            if (contentEnd == NO_MATCH) {
                return NO_MATCH;
            }
            int end = optional(lTrailComments(indentation)).match(state, contentEnd);
            state.add(new ScalarNode(kind, new Span(text.substring(pos, contentEnd), pos), indentation));
            return end;
        }

        // the indentation of the first non-blank line, which must exceed the parent's
        private int detectIndentation(String text, int from) {
            int lineStart = from;
            while (lineStart < text.length()) {
                int spaces = 0;
                while (lineStart + spaces < text.length() && text.charAt(lineStart + spaces) == ' ') {
                    spaces++;
                }
                int next = lineStart + spaces;
                if (next < text.length() && text.charAt(next) != '\n' && text.charAt(next) != '\r') {
                    return Math.max(spaces, n + 1);
                }
                int newline = text.indexOf('\n', next);
                if (newline < 0) {
                    break;
                }
                lineStart = newline + 1;
            }
            return Math.max(0, n + 1);
        }
    }

    // [183]-[201] block collections

    private Rule lBlockSequence(int n) {
        return rule("l+block-sequence", n, () -> indented(n + 1, this::blockSequenceAt));
    }

    private Rule blockSequenceAt(int m) {
        return rule("block-sequence-at", m, () -> sequence(oneOrMore(seq(sIndent(m), cLBlockSeqEntry(m)))));
    }

    private Rule cLBlockSeqEntry(int n) {
        return rule("c-l-block-seq-entry", n, () -> seq(literal("-"), notAhead(nsChar), sLBlockIndented(n, Context.BLOCK_IN)));
    }

    private Rule sLBlockIndented(int n, Context c) {
        return rule("s-l+block-indented", n, c, () -> firstOf(
                indented(0, m -> seq(sIndent(m), firstOf(nsLCompactSequence(n + 1 + m), nsLCompactMapping(n + 1 + m)))),
                sLBlockNode(n, c),
                seq(eNode(), sLComments)));
    }

    private Rule nsLCompactSequence(int n) {
        return rule("ns-l-compact-sequence", n, () -> sequence(seq(cLBlockSeqEntry(n), zeroOrMore(seq(sIndent(n), cLBlockSeqEntry(n))))));
    }

    private Rule lBlockMapping(int n) {
        return rule("l+block-mapping", n, () -> indented(n + 1, this::blockMappingAt));
    }

    private Rule blockMappingAt(int m) {
        return rule("block-mapping-at", m, () -> mapping(oneOrMore(seq(sIndent(m), nsLBlockMapEntry(m)))));
    }

    private Rule nsLBlockMapEntry(int n) {
        return rule("ns-l-block-map-entry", n, () -> firstOf(cLBlockMapExplicitEntry(n), nsLBlockMapImplicitEntry(n)));
    }

    private Rule cLBlockMapExplicitEntry(int n) {
        return rule("c-l-block-map-explicit-entry", n, () -> pair(seq(
                key(seq(literal("?"), sLBlockIndented(n, Context.BLOCK_OUT))),
                value(firstOf(seq(sIndent(n), literal(":"), sLBlockIndented(n, Context.BLOCK_OUT)), eNode())))));
    }

    private Rule nsLBlockMapImplicitEntry(int n) {
        return rule("ns-l-block-map-implicit-entry", n, () -> pair(seq(
                key(firstOf(nsSBlockMapImplicitKey(), eNode())),
                value(cLBlockMapImplicitValue(n)))));
    }

    private Rule nsSBlockMapImplicitKey() {
        return rule("ns-s-block-map-implicit-key", () -> firstOf(
                cSImplicitJsonKey(Context.BLOCK_KEY),
                nsSImplicitYamlKey(Context.BLOCK_KEY)));
    }

    private Rule cLBlockMapImplicitValue(int n) {
        return rule("c-l-block-map-implicit-value", n, () -> seq(literal(":"),
                firstOf(sLBlockNode(n, Context.BLOCK_OUT), seq(eNode(), sLComments))));
    }

    private Rule nsLCompactMapping(int n) {
        return rule("ns-l-compact-mapping", n, () -> mapping(seq(nsLBlockMapEntry(n), zeroOrMore(seq(sIndent(n), nsLBlockMapEntry(n))))));
    }

    // [196]-[201] block nodes

    private Rule sLBlockNode(int n, Context c) {
        return rule("s-l+block-node", n, c, () -> firstOf(sLBlockInBlock(n, c), sLFlowInBlock(n)));
    }

    private Rule sLFlowInBlock(int n) {
        return rule("s-l+flow-in-block", n, () -> seq(
                sSeparate(n + 1, Context.FLOW_OUT), nsFlowNode(n + 1, Context.FLOW_OUT), sLComments));
    }

    private Rule sLBlockInBlock(int n, Context c) {
        return rule("s-l+block-in-block", n, c, () -> firstOf(sLBlockScalar(n, c), sLBlockCollection(n, c)));
    }

    private Rule sLBlockScalar(int n, Context c) {
        return rule("s-l+block-scalar", n, c, () -> seq(
                sSeparate(n + 1, c),
                optional(seq(cNsProperties(n + 1, c), sSeparate(n + 1, c))),
                firstOf(cLLiteral(n), cLFolded(n))));
    }

    private Rule sLBlockCollection(int n, Context c) {
        int seqSpaces = c == Context.BLOCK_OUT ? n - 1 : n;
        return rule("s-l+block-collection", n, c, () -> seq(
                optional(seq(sSeparate(n + 1, c), cNsProperties(n + 1, c))),
                sLComments,
                firstOf(lBlockSequence(seqSpaces), lBlockMapping(n))));
    }

    // [202]-[211] documents and streams

    private Rule cForbidden() {
        return rule("c-forbidden", () -> seq(startOfLine(), firstOf(literal("---"), literal("...")),
                firstOf(bChar, sWhite, endOfInput())));
    }

    private Rule lDocumentPrefix() {
        return rule("l-document-prefix", () -> seq(optional(byteOrderMark), zeroOrMore(lComment)));
    }

    private Rule lDocumentSuffix() {
        return rule("l-document-suffix", () -> seq(literal("..."), sLComments));
    }

    private Rule lBareDocument() {
        return rule("l-bare-document", () -> sLBlockNode(-1, Context.BLOCK_IN));
    }

    private Rule lExplicitDocument() {
        return rule("l-explicit-document", () -> seq(literal("---"),
                firstOf(lBareDocument(), seq(eNode(), sLComments))));
    }

    private Rule lDirectiveDocument() {
        return rule("l-directive-document", () -> seq(oneOrMore(lDirective()), lExplicitDocument()));
    }

    private Rule lAnyDocument() {
        return rule("l-any-document", () -> firstOf(lDirectiveDocument(), lExplicitDocument(), lBareDocument()));
    }

    private Rule lYamlStream() {
        return rule("l-yaml-stream", () -> seq(
                zeroOrMore(lDocumentPrefix()),
                optional(lAnyDocument()),
                zeroOrMore(firstOf(
                        seq(oneOrMore(lDocumentSuffix()), zeroOrMore(lDocumentPrefix()), optional(lAnyDocument())),
                        seq(zeroOrMore(lDocumentPrefix()), optional(lExplicitDocument())))),
                endOfInput()));
    }
}
