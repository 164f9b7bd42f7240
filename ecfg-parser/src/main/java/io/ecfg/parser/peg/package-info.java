/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * A small parsing expression grammar toolkit: {@linkplain io.ecfg.parser.peg.Rules combinators},
 * memoized parametric {@linkplain io.ecfg.parser.peg.PegGrammar productions} and node capture.
 */
package io.ecfg.parser.peg;
