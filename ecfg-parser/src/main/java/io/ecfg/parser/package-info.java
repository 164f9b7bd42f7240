/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Parsers that turn YAML, JSON and TOML documents into position-tagged {@link io.ecfg.parser.RawNode} trees.
 * <p>
 * Scalars keep their exact source text so that they can be decoded with {@link io.ecfg.parser.ScalarKind}
 * and later replaced without disturbing the rest of the document.
 */
package io.ecfg.parser;
