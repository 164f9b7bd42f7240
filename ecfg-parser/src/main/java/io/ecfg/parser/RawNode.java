/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

import java.util.List;
import java.util.Objects;

/**
 * A node of the tree produced by a {@link DocumentParser}.
 * Scalars keep their exact source text and position so they can be decoded and rewritten later.
 */
public sealed interface RawNode {

    /**
     * A mapping, in source order.
     * @param pairs the entries
     */
    record MapNode(List<PairNode> pairs) implements RawNode {
        public MapNode {
            pairs = List.copyOf(pairs);
        }
    }

    /**
     * A sequence, in source order.
     * @param items the items
     */
    record SeqNode(List<RawNode> items) implements RawNode {
        public SeqNode {
            items = List.copyOf(items);
        }
    }

    /**
     * A key/value entry of a mapping.
     * @param key the key node
     * @param value the value node
     */
    record PairNode(RawNode key, RawNode value) implements RawNode {
        public PairNode {
            Objects.requireNonNull(key);
            Objects.requireNonNull(value);
        }
    }

    /**
     * A scalar that might denote a string.
     * @param kind how the scalar was written
     * @param span the source text, including any quotes, block header and trailing empty lines
     * @param indentation the content indentation of a block scalar as resolved by the parser, or -1 when not applicable
     */
    record ScalarNode(ScalarKind kind, Span span, int indentation) implements RawNode {
        public ScalarNode {
            Objects.requireNonNull(kind);
            Objects.requireNonNull(span);
        }

        public ScalarNode(ScalarKind kind, Span span) {
            this(kind, span, -1);
        }

        /**
         * @return the logical string value of this scalar
         */
        public String value() {
            return kind.decode(span.text(), indentation);
        }
    }

    /**
     * Content that can never be a string: numbers, booleans, null, dates, table headers, tags, anchors and aliases.
     * @param span the source text
     */
    record IgnoreNode(Span span) implements RawNode {
    }

    /**
     * A node with no content, such as the value of {@code key:}.
     * @param offset where the node would have been
     */
    record EmptyNode(int offset) implements RawNode {
    }
}
