/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An encrypted value in its textual form {@code EJ[1:<public key>:<nonce>:<box>]},
 * each field being standard padded base64.
 *
 * @param version the format version, currently always {@value #VERSION}
 * @param publicKey the ephemeral public key of the sender
 * @param nonce the box nonce
 * @param ciphertext the box
 */
public record BoxedMessage(int version, byte[] publicKey, byte[] nonce, byte[] ciphertext) {

    public static final int VERSION = 1;

    private static final Pattern MESSAGE_PATTERN = Pattern.compile("EJ\\[([0-9]+):([^:\\]]*):([^:\\]]*):([^:\\]]*)\\]");

    public BoxedMessage {
        publicKey = publicKey.clone();
        nonce = nonce.clone();
        ciphertext = ciphertext.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] ciphertext() {
        return ciphertext.clone();
    }

    public String format() {
        Base64.Encoder encoder = Base64.getEncoder();
        return "EJ[" + version
                + ":" + encoder.encodeToString(publicKey)
                + ":" + encoder.encodeToString(nonce)
                + ":" + encoder.encodeToString(ciphertext)
                + "]";
    }

    /**
     * @param message the whole text of an encrypted value
     * @return the parsed message
     * @throws InvalidMessageFormatException if {@code message} is not a well-formed version 1 message
     */
    public static BoxedMessage parse(String message) {
        Matcher matcher = MESSAGE_PATTERN.matcher(message);
        if (!matcher.matches()) {
            throw new InvalidMessageFormatException("Value is not an EJ[...] message: " + abbreviate(message));
        }
        int version;
        try {
            version = Integer.parseInt(matcher.group(1));
        }
        catch (NumberFormatException e) {
            throw new InvalidMessageFormatException("Unsupported message version " + abbreviate(matcher.group(1)), e);
        }
        if (version != VERSION) {
            throw new InvalidMessageFormatException("Unsupported message version " + version);
        }
        byte[] publicKey = decode(matcher.group(2), "public key");
        byte[] nonce = decode(matcher.group(3), "nonce");
        byte[] ciphertext = decode(matcher.group(4), "ciphertext");
        if (publicKey.length != KeyEncoding.KEY_LENGTH) {
            throw new InvalidMessageFormatException("Message public key must be " + KeyEncoding.KEY_LENGTH + " bytes, was " + publicKey.length);
        }
        if (nonce.length != CurveBox.NONCE_LENGTH) {
            throw new InvalidMessageFormatException("Message nonce must be " + CurveBox.NONCE_LENGTH + " bytes, was " + nonce.length);
        }
        return new BoxedMessage(version, publicKey, nonce, ciphertext);
    }

    private static byte[] decode(String field, String what) {
        try {
            return Base64.getDecoder().decode(field);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidMessageFormatException("Message " + what + " is not valid base64", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 16 ? text : text.substring(0, 16) + "...";
    }
}
