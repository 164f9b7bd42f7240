/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import org.bouncycastle.util.encoders.Hex;

/**
 * Converts keys between raw bytes and the lowercase hexadecimal form in which they are shared.
 */
public final class KeyEncoding {

    public static final int KEY_LENGTH = 32;

    private KeyEncoding() {
    }

    /**
     * @param raw bytes
     * @return lowercase hex, two digits per byte
     */
    public static String rawToBase16(byte[] raw) {
        return Hex.toHexString(raw);
    }

    /**
     * @param hex an even number of hex digits, in either case
     * @return the bytes
     * @throws IllegalArgumentException if {@code hex} has odd length or a non-hex character
     */
    public static byte[] base16ToRaw(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string is null");
        }
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("hex string has odd length " + hex.length());
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("invalid hex character '" + hex.charAt(i) + "' at index " + i);
            }
        }
        return Hex.decode(hex);
    }

    /**
     * Decodes a hex key, checking it has the length of a Curve25519 key.
     * @param hex the key
     * @param what description of the key for error messages
     * @return the key bytes
     * @throws IllegalArgumentException if the key is not valid hex or not 32 bytes
     */
    public static byte[] keyFromBase16(String hex, String what) {
        byte[] raw = base16ToRaw(hex);
        if (raw.length != KEY_LENGTH) {
            throw new IllegalArgumentException(what + " must be " + KEY_LENGTH + " bytes, was " + raw.length);
        }
        return raw;
    }
}
