/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.Objects;

/**
 * A value that could not be transformed.
 *
 * @param slice the slice whose transformation failed
 * @param exception what the transform function threw
 */
public record SliceFailure(EncryptableSlice slice, RuntimeException exception) {

    public SliceFailure {
        Objects.requireNonNull(slice);
        Objects.requireNonNull(exception);
    }
}
