/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.List;
import java.util.Objects;

import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;

/**
 * A document tree in which every scalar has been resolved to either a string or something to ignore.
 */
public sealed interface TypedNode {

    record MapNode(List<PairNode> pairs) implements TypedNode {
        public MapNode {
            pairs = List.copyOf(pairs);
        }
    }

    record SeqNode(List<TypedNode> items) implements TypedNode {
        public SeqNode {
            items = List.copyOf(items);
        }
    }

    record PairNode(TypedNode key, TypedNode value) implements TypedNode {
        public PairNode {
            Objects.requireNonNull(key);
            Objects.requireNonNull(value);
        }
    }

    /**
     * A scalar known to denote a string.
     * @param kind how the scalar was written
     * @param span its exact source text and position
     * @param indentation the resolved content indentation of a block scalar, or -1
     */
    record StringScalar(ScalarKind kind, Span span, int indentation) implements TypedNode {

        public StringScalar {
            Objects.requireNonNull(kind);
            Objects.requireNonNull(span);
        }

        public String value() {
            return kind.decode(span.text(), indentation);
        }

        /**
         * @return the index in the document of the first char to replace when rewriting this scalar
         */
        public int startIndex() {
            return span.offset();
        }

        /**
         * @return the index in the document just after the last char to replace when rewriting this scalar
         */
        public int endIndex() {
            return span.offset() + kind.rewriteLength(span.text());
        }
    }

    /**
     * Content that never yields anything to transform.
     */
    enum Ignore implements TypedNode {
        INSTANCE
    }
}
