/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * The {@code EJ[1:...]} encryption envelope.
 * <p>
 * Values are sealed with a NaCl-compatible box ({@link io.ecfg.crypto.CurveBox}) from a fresh ephemeral key to
 * the recipient's public key. Keys are exchanged as lowercase hex, see {@link io.ecfg.crypto.KeyEncoding}.
 */
package io.ecfg.crypto;
