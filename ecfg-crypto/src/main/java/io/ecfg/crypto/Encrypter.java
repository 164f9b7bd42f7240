/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import java.security.SecureRandom;
import java.util.function.UnaryOperator;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * Encrypts values to the holder of a private key.
 * Every call uses a new ephemeral key pair and a new random nonce, so equal plaintexts give different messages.
 */
public class Encrypter implements UnaryOperator<String> {

    private final byte[] peerPublicKey;
    private final SecureRandom random;

    /**
     * @param peerPublicKeyHex the public key of the party who will decrypt, in hex
     * @throws IllegalArgumentException if the key is not 32 bytes of hex
     */
    public Encrypter(String peerPublicKeyHex) {
        this(peerPublicKeyHex, new SecureRandom());
    }

    Encrypter(String peerPublicKeyHex, SecureRandom random) {
        this.peerPublicKey = KeyEncoding.keyFromBase16(peerPublicKeyHex, "public key");
        this.random = random;
    }

    /**
     * @param plaintext the value
     * @return an {@code EJ[...]} message
     * @throws IllegalArgumentException if {@code plaintext} is not well-formed Unicode text
     */
    @Override
    public String apply(String plaintext) {
        X25519PrivateKeyParameters ephemeral = new X25519PrivateKeyParameters(random);
        byte[] nonce = new byte[CurveBox.NONCE_LENGTH];
        random.nextBytes(nonce);
        CurveBox box = new CurveBox(peerPublicKey, ephemeral.getEncoded());
        byte[] ciphertext = box.seal(nonce, Utf8.encode(plaintext));
        return new BoxedMessage(BoxedMessage.VERSION, ephemeral.generatePublicKey().getEncoded(), nonce, ciphertext).format();
    }
}
