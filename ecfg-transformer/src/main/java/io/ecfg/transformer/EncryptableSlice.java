/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.Objects;

/**
 * A range of the original document holding a string scalar that is eligible for transformation.
 *
 * @param startIndex index of the first char to replace
 * @param endIndex index just after the last char to replace
 * @param value the decoded value of the scalar
 */
public record EncryptableSlice(int startIndex, int endIndex, String value) {

    public EncryptableSlice {
        Objects.requireNonNull(value);
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException("Invalid slice range [" + startIndex + ", " + endIndex + ")");
        }
    }
}
