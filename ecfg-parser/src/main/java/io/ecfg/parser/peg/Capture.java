/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.peg;

import java.util.Objects;

import io.ecfg.parser.RawNode;

/**
 * A node produced while matching, tagged with the role it plays in an enclosing pair.
 * @param role the role
 * @param node the node
 */
public record Capture(Role role, RawNode node) {

    public enum Role {
        NODE,
        KEY,
        VALUE
    }

    public Capture {
        Objects.requireNonNull(role);
        Objects.requireNonNull(node);
    }

    public static Capture of(RawNode node) {
        return new Capture(Role.NODE, node);
    }
}
