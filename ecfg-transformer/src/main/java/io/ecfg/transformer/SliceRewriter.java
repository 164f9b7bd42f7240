/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splices transformed values into the original text in a single forward pass.
 * Text outside the slices is copied unchanged.
 */
public final class SliceRewriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SliceRewriter.class);

    private SliceRewriter() {
    }

    /**
     * Rewrites failing fast.
     * @param text the original document
     * @param slices the slices of {@code text} to replace, ordered and non-overlapping
     * @param fn the function applied to each decoded value
     * @return the rewritten document
     */
    public static String rewrite(String text, List<EncryptableSlice> slices, UnaryOperator<String> fn) {
        return rewrite(text, slices, fn, OnFailure.FAIL_FAST).output();
    }

    /**
     * @param text the original document
     * @param slices the slices of {@code text} to replace, ordered and non-overlapping
     * @param fn the function applied to each decoded value
     * @param onFailure what to do when {@code fn} throws
     * @return the rewritten document and any failures
     */
    public static TransformResult rewrite(String text, List<EncryptableSlice> slices, UnaryOperator<String> fn, OnFailure onFailure) {
        StringBuilder out = new StringBuilder(text.length());
        List<SliceFailure> failures = new ArrayList<>();
        int prev = 0;
        for (EncryptableSlice slice : slices) {
            if (slice.startIndex() < prev || slice.endIndex() > text.length()) {
                throw new IllegalArgumentException("Slice " + slice.startIndex() + ".." + slice.endIndex()
                        + " is out of order or outside the document");
            }
            out.append(text, prev, slice.startIndex());
            try {
                String replacement = fn.apply(slice.value());
                out.append(StringLiterals.quote(replacement));
            }
            catch (RuntimeException e) {
                if (onFailure == OnFailure.FAIL_FAST) {
                    throw e;
                }
                LOGGER.warn("Leaving value at {}..{} untouched: {}", slice.startIndex(), slice.endIndex(), e.getMessage());
                failures.add(new SliceFailure(slice, e));
                out.append(text, slice.startIndex(), slice.endIndex());
            }
            LOGGER.trace("Rewrote slice {}..{}", slice.startIndex(), slice.endIndex());
            prev = slice.endIndex();
        }
        out.append(text, prev, text.length());
        return new TransformResult(out.toString(), failures);
    }
}
