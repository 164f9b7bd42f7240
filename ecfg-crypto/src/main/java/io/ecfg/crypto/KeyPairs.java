/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import java.security.SecureRandom;

import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * Generates key pairs for use with {@link Encrypter} and {@link Decrypter}.
 */
public final class KeyPairs {

    private KeyPairs() {
    }

    public static HexKeyPair generate() {
        return generate(new SecureRandom());
    }

    public static HexKeyPair generate(SecureRandom random) {
        X25519PrivateKeyParameters privateKey = new X25519PrivateKeyParameters(random);
        return new HexKeyPair(
                KeyEncoding.rawToBase16(privateKey.generatePublicKey().getEncoded()),
                KeyEncoding.rawToBase16(privateKey.getEncoded()));
    }

    /**
     * @param privateKeyHex a private key
     * @return the matching public key
     */
    public static String publicKeyOf(String privateKeyHex) {
        byte[] raw = KeyEncoding.keyFromBase16(privateKeyHex, "private key");
        return KeyEncoding.rawToBase16(new X25519PrivateKeyParameters(raw, 0).generatePublicKey().getEncoded());
    }
}
