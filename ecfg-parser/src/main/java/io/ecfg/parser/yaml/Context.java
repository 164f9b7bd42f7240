/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.yaml;

/**
 * The contexts that YAML productions are parameterised by, alongside the indentation level.
 */
enum Context {
    BLOCK_OUT,
    BLOCK_IN,
    BLOCK_KEY,
    FLOW_OUT,
    FLOW_IN,
    FLOW_KEY;

    /**
     * The context of the entries of a flow collection appearing in this context.
     */
    Context inFlow() {
        return switch (this) {
            case FLOW_OUT, FLOW_IN, BLOCK_OUT, BLOCK_IN -> FLOW_IN;
            case BLOCK_KEY, FLOW_KEY -> FLOW_KEY;
        };
    }

    boolean isKey() {
        return this == BLOCK_KEY || this == FLOW_KEY;
    }

    boolean isBlock() {
        return this == BLOCK_OUT || this == BLOCK_IN;
    }
}
