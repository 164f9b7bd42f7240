/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of transforming a document.
 *
 * @param output the rewritten document
 * @param failures the values left untouched because their transformation failed, in document order
 */
public record TransformResult(String output, List<SliceFailure> failures) {

    public TransformResult {
        Objects.requireNonNull(output);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
