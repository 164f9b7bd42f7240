/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ecfg.parser.Grammar;
import io.ecfg.parser.RawNode;
import io.ecfg.parser.SyntaxException;

/**
 * Applies a string function to every eligible string value of a document, leaving every other byte untouched.
 * Each rewritten value is emitted as a double-quoted literal whatever its original style.
 */
public final class Transformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Transformer.class);

    private Transformer() {
    }

    /**
     * Transforms a document, failing on the first value {@code fn} cannot handle.
     * @param input the document text
     * @param grammar its format
     * @param fn the function applied to each eligible value
     * @return the rewritten document
     * @throws SyntaxException if {@code input} is not a well-formed document
     */
    public static String transform(String input, Grammar grammar, UnaryOperator<String> fn) {
        return transform(input, grammar, fn, OnFailure.FAIL_FAST).output();
    }

    /**
     * @param input the document text
     * @param grammar its format
     * @param fn the function applied to each eligible value
     * @param onFailure what to do when {@code fn} throws
     * @return the rewritten document and any failures
     * @throws SyntaxException if {@code input} is not a well-formed document
     */
    public static TransformResult transform(String input, Grammar grammar, UnaryOperator<String> fn, OnFailure onFailure) {
        Objects.requireNonNull(fn);
        Objects.requireNonNull(onFailure);
        List<EncryptableSlice> slices = slices(input, grammar);
        TransformResult result = SliceRewriter.rewrite(input, slices, fn, onFailure);
        LOGGER.debug("Transformed {} of {} values in {} document", slices.size() - result.failures().size(), slices.size(), grammar);
        return result;
    }

    /**
     * Lists the values of a document that {@link #transform} would rewrite.
     * @param input the document text
     * @param grammar its format
     * @return the eligible slices, in document order
     * @throws SyntaxException if {@code input} is not a well-formed document
     */
    public static List<EncryptableSlice> slices(String input, Grammar grammar) {
        Objects.requireNonNull(input);
        Objects.requireNonNull(grammar);
        RawNode raw = grammar.parse(input);
        List<EncryptableSlice> slices = SliceCollector.collect(TypeResolver.build(raw));
        LOGGER.debug("Found {} eligible values in {} document of {} chars", slices.size(), grammar, input.length());
        return slices;
    }
}
