/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

/**
 * Thrown when a value to decrypt is not a well-formed {@code EJ[...]} message.
 * This often means the value was never encrypted.
 */
public class InvalidMessageFormatException extends CryptoException {

    public InvalidMessageFormatException(String message) {
        super(message);
    }

    public InvalidMessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
