/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import java.util.Objects;

/**
 * A Curve25519 key pair in hex form.
 *
 * @param publicKey the public key, to be shared with anyone encrypting values
 * @param privateKey the private key, needed to decrypt values
 */
public record HexKeyPair(String publicKey, String privateKey) {

    public HexKeyPair {
        Objects.requireNonNull(publicKey);
        Objects.requireNonNull(privateKey);
    }

    @Override
    public String toString() {
        return "HexKeyPair[publicKey=" + publicKey + ", privateKey=***]";
    }
}
