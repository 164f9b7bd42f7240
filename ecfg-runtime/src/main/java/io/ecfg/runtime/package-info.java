/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Entry point for encrypting and decrypting configuration documents, see {@link io.ecfg.runtime.Ecfg}.
 */
package io.ecfg.runtime;
