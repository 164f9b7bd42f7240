/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import java.util.function.UnaryOperator;

/**
 * Decrypts values produced by an {@link Encrypter} for our public key.
 */
public class Decrypter implements UnaryOperator<String> {

    private final byte[] privateKey;

    /**
     * @param privateKeyHex our private key, in hex
     * @throws IllegalArgumentException if the key is not 32 bytes of hex
     */
    public Decrypter(String privateKeyHex) {
        this.privateKey = KeyEncoding.keyFromBase16(privateKeyHex, "private key");
    }

    /**
     * @param message an {@code EJ[...]} message
     * @return the plaintext
     * @throws InvalidMessageFormatException if {@code message} is malformed
     * @throws DecryptionFailedException if the message was not encrypted for this key, has been tampered with
     *     or does not hold UTF-8 text
     */
    @Override
    public String apply(String message) {
        BoxedMessage boxed = BoxedMessage.parse(message);
        CurveBox box = CurveBox.forOpening(boxed.publicKey(), privateKey);
        return Utf8.decode(box.open(boxed.nonce(), boxed.ciphertext()));
    }
}
