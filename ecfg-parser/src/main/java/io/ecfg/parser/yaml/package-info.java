/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * YAML 1.2 parser built on the packrat combinators of {@link io.ecfg.parser.peg}.
 */
package io.ecfg.parser.yaml;
