/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a {@link TypedNode} tree in source order and collects the string scalars to transform.
 * The value of a pair whose key is a string starting with {@code _} is left alone, down to the next nested mapping.
 */
public final class SliceCollector {

    static final String SUPPRESSION_PREFIX = "_";

    private final List<EncryptableSlice> slices = new ArrayList<>();

    private SliceCollector() {
    }

    /**
     * @param root the typed document
     * @return the eligible slices, ordered by position and never overlapping
     * @throws IllegalStateException if the tree yields slices out of source order
     */
    public static List<EncryptableSlice> collect(TypedNode root) {
        SliceCollector collector = new SliceCollector();
        collector.visit(root, false);
        return List.copyOf(collector.slices);
    }

    private void visit(TypedNode node, boolean suppressed) {
        if (node instanceof TypedNode.MapNode map) {
            for (TypedNode.PairNode pair : map.pairs()) {
                visit(pair, false);
            }
        }
        else if (node instanceof TypedNode.SeqNode seq) {
            for (TypedNode item : seq.items()) {
                visit(item, suppressed);
            }
        }
        else if (node instanceof TypedNode.PairNode pair) {
            visit(pair.value(), suppresses(pair.key()));
        }
        else if (node instanceof TypedNode.StringScalar scalar) {
            if (!suppressed) {
                append(new EncryptableSlice(scalar.startIndex(), scalar.endIndex(), scalar.value()));
            }
        }
        else if (node != TypedNode.Ignore.INSTANCE) {
            throw new IllegalStateException("Unexpected node " + node);
        }
    }

    private static boolean suppresses(TypedNode key) {
        return key instanceof TypedNode.StringScalar scalar && scalar.value().startsWith(SUPPRESSION_PREFIX);
    }

    private void append(EncryptableSlice slice) {
        if (!slices.isEmpty()) {
            EncryptableSlice previous = slices.get(slices.size() - 1);
            if (slice.startIndex() < previous.endIndex()) {
                throw new IllegalStateException("Slice " + slice.startIndex() + ".." + slice.endIndex()
                        + " overlaps or precedes slice " + previous.startIndex() + ".." + previous.endIndex());
            }
        }
        slices.add(slice);
    }
}
