/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Selects the string values of a parsed document and rewrites them in place.
 * <p>
 * {@link io.ecfg.transformer.Transformer} is the entry point. A document is parsed, its plain scalars are resolved
 * to strings or non-strings by {@link io.ecfg.transformer.TypeResolver}, the eligible values are collected by
 * {@link io.ecfg.transformer.SliceCollector} and then spliced back by {@link io.ecfg.transformer.SliceRewriter}.
 */
package io.ecfg.transformer;
