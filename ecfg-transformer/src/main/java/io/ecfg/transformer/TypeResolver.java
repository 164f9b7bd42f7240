/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import io.ecfg.parser.RawNode;
import io.ecfg.parser.ScalarKind;

/**
 * Builds a {@link TypedNode} tree from a parsed {@link RawNode} tree, deciding which plain scalars are strings.
 */
public final class TypeResolver {

    /**
     * Patterns of the YAML core schema for plain scalars that denote something other than a string.
     */
    enum NonStringPattern {
        BOOL("yes|Yes|YES|no|No|NO|true|True|TRUE|false|False|FALSE|on|On|ON|off|Off|OFF"),
        FLOAT("[-+]?(?:[0-9][0-9_]*)\\.[0-9_]*(?:[eE][-+][0-9]+)?"
                + "|[-+]?(?:[0-9][0-9_]*)?\\.[0-9_]+(?:[eE][-+][0-9]+)?"
                + "|[-+]?[0-9][0-9_]*(?::[0-5]?[0-9])+\\.[0-9_]*"
                + "|[-+]?\\.(?:inf|Inf|INF)"
                + "|\\.(?:nan|NaN|NAN)"),
        INT("[-+]?0b[0-1_]+"
                + "|[-+]?0[0-7_]+"
                + "|[-+]?(?:0|[1-9][0-9_]*)"
                + "|[-+]?0x[0-9a-fA-F_]+"
                + "|[-+]?[1-9][0-9_]*(?::[0-5]?[0-9])+"),
        MERGE("<<"),
        NULL("~|null|Null|NULL| "),
        TIMESTAMP("[0-9][0-9][0-9][0-9]-[0-9][0-9]-[0-9][0-9]"
                + "|[0-9][0-9][0-9][0-9]-[0-9][0-9]?-[0-9][0-9]?(?:[Tt]|[ \\t]+)[0-9][0-9]?:[0-9][0-9]:[0-9][0-9](?:\\.[0-9]*)?"
                + "(?:[ \\t]*(?:Z|[-+][0-9][0-9]?(?::[0-9][0-9])?))?"),
        VALUE("=");

        private final Pattern pattern;

        NonStringPattern(String regex) {
            this.pattern = Pattern.compile("(?:" + regex + ")");
        }

        boolean matches(String plain) {
            return pattern.matcher(plain).matches();
        }

        static boolean anyMatches(String plain) {
            for (NonStringPattern candidate : values()) {
                if (candidate.matches(plain)) {
                    return true;
                }
            }
            return false;
        }
    }

    private TypeResolver() {
    }

    /**
     * @param node the root of a parsed document
     * @return the equivalent typed tree
     */
    public static TypedNode build(RawNode node) {
        if (node instanceof RawNode.MapNode map) {
            List<TypedNode.PairNode> pairs = new ArrayList<>(map.pairs().size());
            for (RawNode.PairNode pair : map.pairs()) {
                pairs.add(buildPair(pair));
            }
            return new TypedNode.MapNode(pairs);
        }
        else if (node instanceof RawNode.SeqNode seq) {
            List<TypedNode> items = new ArrayList<>(seq.items().size());
            for (RawNode item : seq.items()) {
                items.add(build(item));
            }
            return new TypedNode.SeqNode(items);
        }
        else if (node instanceof RawNode.PairNode pair) {
            return buildPair(pair);
        }
        else if (node instanceof RawNode.ScalarNode scalar) {
            return buildScalar(scalar);
        }
        else if (node instanceof RawNode.IgnoreNode || node instanceof RawNode.EmptyNode) {
            return TypedNode.Ignore.INSTANCE;
        }
        throw new IllegalStateException("Unexpected node " + node);
    }

    private static TypedNode.PairNode buildPair(RawNode.PairNode pair) {
        return new TypedNode.PairNode(build(pair.key()), build(pair.value()));
    }

    private static TypedNode buildScalar(RawNode.ScalarNode scalar) {
        if (scalar.kind() == ScalarKind.PLAIN && NonStringPattern.anyMatches(scalar.span().text())) {
            return TypedNode.Ignore.INSTANCE;
        }
        return new TypedNode.StringScalar(scalar.kind(), scalar.span(), scalar.indentation());
    }
}
