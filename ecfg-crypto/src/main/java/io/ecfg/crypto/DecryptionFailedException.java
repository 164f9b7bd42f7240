/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

/**
 * Thrown when a box fails authentication, because of a wrong key or a corrupted message.
 */
public class DecryptionFailedException extends CryptoException {

    public DecryptionFailedException(String message) {
        super(message);
    }

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
