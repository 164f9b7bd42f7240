/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

/**
 * What to do when the transformation of a single value fails.
 * <ul>
 *     <li>{@link #FAIL_FAST} the exception propagates and no output is produced.</li>
 *     <li>{@link #CONTINUE} the value keeps its original text and the failure is reported in the {@link TransformResult}.</li>
 * </ul>
 */
public enum OnFailure {
    FAIL_FAST,
    CONTINUE
}
