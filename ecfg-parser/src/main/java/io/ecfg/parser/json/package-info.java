/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * JSON parser generated by ANTLR from {@code Json.g4}.
 */
package io.ecfg.parser.json;
