/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

/**
 * Represents problems encrypting or decrypting a value.
 */
public class CryptoException extends RuntimeException {
    public CryptoException() {
    }

    public CryptoException(Throwable cause) {
        super(cause);
    }

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
