/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.runtime;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.ecfg.parser.Grammar;
import io.ecfg.transformer.OnFailure;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The configuration of an {@link Ecfg}.
 *
 * @param onFailure what to do when a single value cannot be encrypted or decrypted, {@link OnFailure#FAIL_FAST} if absent
 * @param grammar the format of every document, overriding the format given per call, if present
 */
@JsonPropertyOrder({ "onFailure", "grammar" })
public record EcfgConfig(@Nullable OnFailure onFailure,
                         @Nullable Grammar grammar) {

    public static final EcfgConfig DEFAULT = new EcfgConfig(null, null);

    public EcfgConfig {
        if (onFailure == null) {
            onFailure = OnFailure.FAIL_FAST;
        }
    }
}
