/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.toml;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ecfg.parser.DocumentParser;
import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.MapNode;
import io.ecfg.parser.RawNode.PairNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.peg.PegGrammar;
import io.ecfg.parser.peg.Rule;

import static io.ecfg.parser.peg.Rules.anyOf;
import static io.ecfg.parser.peg.Rules.codePoint;
import static io.ecfg.parser.peg.Rules.endOfInput;
import static io.ecfg.parser.peg.Rules.firstOf;
import static io.ecfg.parser.peg.Rules.ignore;
import static io.ecfg.parser.peg.Rules.key;
import static io.ecfg.parser.peg.Rules.literal;
import static io.ecfg.parser.peg.Rules.mapping;
import static io.ecfg.parser.peg.Rules.notAhead;
import static io.ecfg.parser.peg.Rules.oneOrMore;
import static io.ecfg.parser.peg.Rules.optional;
import static io.ecfg.parser.peg.Rules.pair;
import static io.ecfg.parser.peg.Rules.range;
import static io.ecfg.parser.peg.Rules.scalar;
import static io.ecfg.parser.peg.Rules.seq;
import static io.ecfg.parser.peg.Rules.sequence;
import static io.ecfg.parser.peg.Rules.times;
import static io.ecfg.parser.peg.Rules.value;
import static io.ecfg.parser.peg.Rules.zeroOrMore;

/**
 * A TOML 1.0 parser following the TOML 1.0 ABNF grammar.
 * <p>
 * The result is a single mapping holding every key/value pair of the document in source order, whichever table it
 * belongs to. Table headers, booleans, numbers and dates are captured as content that is never a string. A dotted key
 * is represented by its last segment.
 * </p>
 */
public final class TomlDocumentParser extends PegGrammar implements DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TomlDocumentParser.class);

    private final Rule wschar = anyOf(" \t");
    private final Rule ws = zeroOrMore(wschar);
    private final Rule newline = firstOf(literal("\n"), literal("\r\n"));
    private final Rule digit = range('0', '9');
    private final Rule hexDigit = codePoint(cp -> (cp >= '0' && cp <= '9') || (cp >= 'a' && cp <= 'f') || (cp >= 'A' && cp <= 'F'));
    private final Rule comment = seq(literal("#"), zeroOrMore(codePoint(cp -> cp == 0x09 || (cp >= 0x20 && cp <= 0x7E) || isNonAscii(cp))));
    private final Rule wsCommentNewline = zeroOrMore(firstOf(wschar, seq(optional(comment), newline)));

    @Override
    public RawNode parse(String text) {
        List<PairNode> pairs = new ArrayList<>();
        for (RawNode node : parseFully(toml(), text)) {
            if (node instanceof PairNode pair) {
                pairs.add(pair);
            }
        }
        LOGGER.debug("Parsed TOML document of {} chars into {} key/value pair(s)", text.length(), pairs.size());
        return new MapNode(pairs);
    }

    private static boolean isNonAscii(int cp) {
        return (cp >= 0x80 && cp <= 0xD7FF) || (cp >= 0xE000 && cp <= 0x10FFFF);
    }

    private static boolean isBasicUnescaped(int cp) {
        return cp == ' ' || cp == '\t' || cp == 0x21 || (cp >= 0x23 && cp <= 0x5B) || (cp >= 0x5D && cp <= 0x7E) || isNonAscii(cp);
    }

    private static boolean isLiteralChar(int cp) {
        return cp == 0x09 || (cp >= 0x20 && cp <= 0x26) || (cp >= 0x28 && cp <= 0x7E) || isNonAscii(cp);
    }

    private Rule toml() {
        return rule("toml", () -> seq(expression(), zeroOrMore(seq(newline, expression())), endOfInput()));
    }

    private Rule expression() {
        return rule("expression", () -> firstOf(
                seq(ws, keyval(), ws, optional(comment)),
                seq(ws, table(), ws, optional(comment)),
                seq(ws, optional(comment))));
    }

    // key/value pairs

    private Rule keyval() {
        return rule("keyval", () -> pair(seq(key(dottedKey()), ws, literal("="), ws, value(val()))));
    }

    private Rule dottedKey() {
        return rule("key", () -> seq(simpleKey(), zeroOrMore(seq(ws, literal("."), ws, simpleKey()))));
    }

    private Rule simpleKey() {
        return rule("simple-key", () -> firstOf(
                basicString(),
                literalString(),
                scalar(ScalarKind.UNQUOTED_STRING, oneOrMore(codePoint(cp -> (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z')
                        || (cp >= '0' && cp <= '9') || cp == '-' || cp == '_')))));
    }

    private Rule val() {
        return rule("val", () -> firstOf(string(), bool(), array(), inlineTable(), dateTime(), floatValue(), integer()));
    }

    // strings

    private Rule string() {
        return rule("string", () -> firstOf(mlBasicString(), basicString(), mlLiteralString(), literalString()));
    }

    private Rule escaped() {
        return rule("escaped", () -> seq(literal("\\"), firstOf(
                anyOf("\"\\bfnrt"),
                seq(literal("u"), times(hexDigit, 4)),
                seq(literal("U"), times(hexDigit, 8)))));
    }

    private Rule basicString() {
        return rule("basic-string", () -> scalar(ScalarKind.DOUBLE_QUOTED, seq(literal("\""),
                zeroOrMore(firstOf(escaped(), codePoint(TomlDocumentParser::isBasicUnescaped))),
                literal("\""))));
    }

    private Rule mlBasicString() {
        return rule("ml-basic-string", () -> {
            Rule delimiter = literal("\"\"\"");
            Rule escapedNewline = seq(literal("\\"), ws, newline, zeroOrMore(firstOf(wschar, newline)));
            Rule content = firstOf(escaped(), escapedNewline, codePoint(TomlDocumentParser::isBasicUnescaped), newline, literal("\""));
            // up to two quotes may directly precede the closing delimiter
            Rule closing = seq(delimiter, notAhead(literal("\"")));
            return scalar(ScalarKind.TOML_MULTILINE_BASIC, seq(delimiter, optional(newline),
                    zeroOrMore(seq(notAhead(closing), content)),
                    delimiter));
        });
    }

    private Rule literalString() {
        return rule("literal-string", () -> scalar(ScalarKind.SINGLE_QUOTED, seq(literal("'"),
                zeroOrMore(codePoint(TomlDocumentParser::isLiteralChar)),
                literal("'"))));
    }

    private Rule mlLiteralString() {
        return rule("ml-literal-string", () -> {
            Rule delimiter = literal("'''");
            Rule content = firstOf(codePoint(TomlDocumentParser::isLiteralChar), newline, literal("'"));
            Rule closing = seq(delimiter, notAhead(literal("'")));
            return scalar(ScalarKind.TOML_MULTILINE_LITERAL, seq(delimiter, optional(newline),
                    zeroOrMore(seq(notAhead(closing), content)),
                    delimiter));
        });
    }

    // other values

    private Rule bool() {
        return rule("boolean", () -> ignore(firstOf(literal("true"), literal("false"))));
    }

    private Rule array() {
        return rule("array", () -> {
            Rule values = seq(wsCommentNewline, val(), wsCommentNewline,
                    zeroOrMore(seq(literal(","), wsCommentNewline, val(), wsCommentNewline)),
                    optional(literal(",")));
            return sequence(seq(literal("["), optional(values), wsCommentNewline, literal("]")));
        });
    }

    private Rule inlineTable() {
        return rule("inline-table", () -> mapping(seq(literal("{"), ws,
                optional(seq(keyval(), zeroOrMore(seq(ws, literal(","), ws, keyval())))),
                ws, literal("}"))));
    }

    private Rule dateTime() {
        return rule("date-time", () -> {
            Rule fullDate = seq(times(digit, 4), literal("-"), times(digit, 2), literal("-"), times(digit, 2));
            Rule partialTime = seq(times(digit, 2), literal(":"), times(digit, 2), literal(":"), times(digit, 2),
                    optional(seq(literal("."), oneOrMore(digit))));
            Rule timeOffset = firstOf(anyOf("Zz"), seq(anyOf("+-"), times(digit, 2), literal(":"), times(digit, 2)));
            Rule timeDelim = anyOf("Tt ");
            return ignore(firstOf(
                    seq(fullDate, timeDelim, partialTime, timeOffset),
                    seq(fullDate, timeDelim, partialTime),
                    fullDate,
                    partialTime));
        });
    }

    private Rule unsignedDecInt() {
        return rule("unsigned-dec-int", () -> firstOf(
                seq(range('1', '9'), oneOrMore(firstOf(digit, seq(literal("_"), digit)))),
                digit));
    }

    private Rule decInt() {
        return rule("dec-int", () -> seq(optional(anyOf("+-")), unsignedDecInt()));
    }

    private Rule zeroPrefixableInt() {
        return rule("zero-prefixable-int", () -> seq(digit, zeroOrMore(firstOf(digit, seq(literal("_"), digit)))));
    }

    private Rule floatValue() {
        return rule("float", () -> {
            Rule exp = seq(anyOf("eE"), optional(anyOf("+-")), zeroPrefixableInt());
            Rule frac = seq(literal("."), zeroPrefixableInt());
            Rule special = seq(optional(anyOf("+-")), firstOf(literal("inf"), literal("nan")));
            return ignore(firstOf(seq(decInt(), firstOf(exp, seq(frac, optional(exp)))), special));
        });
    }

    private Rule integer() {
        return rule("integer", () -> ignore(firstOf(
                prefixedInt("0x", hexDigit),
                prefixedInt("0o", range('0', '7')),
                prefixedInt("0b", range('0', '1')),
                decInt())));
    }

    private static Rule prefixedInt(String prefix, Rule digitRule) {
        return seq(literal(prefix), digitRule, zeroOrMore(firstOf(digitRule, seq(literal("_"), digitRule))));
    }

    // tables

    private Rule table() {
        return rule("table", () -> ignore(firstOf(
                seq(literal("["), ws, dottedKey(), ws, literal("]")),
                seq(literal("[["), ws, dottedKey(), ws, literal("]]")))));
    }
}
