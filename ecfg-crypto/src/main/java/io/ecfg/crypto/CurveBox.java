/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.crypto;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.engines.Salsa20Engine;
import org.bouncycastle.crypto.engines.XSalsa20Engine;
import org.bouncycastle.crypto.macs.Poly1305;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.Pack;

/**
 * Public-key authenticated encryption compatible with NaCl's {@code crypto_box}:
 * an X25519 key agreement, hashed with HSalsa20, keys XSalsa20 with a Poly1305 authenticator.
 * <p>
 * A box is the 16-byte authenticator followed by the ciphertext, which is as long as the plaintext.
 */
public final class CurveBox {

    public static final int NONCE_LENGTH = 24;
    public static final int TAG_LENGTH = 16;

    private static final int[] SIGMA = { 0x61707865, 0x3320646e, 0x79622d32, 0x6b206574 };
    private static final int POLY1305_KEY_LENGTH = 32;

    private final byte[] sharedKey;

    /**
     * @param publicKey the other party's public key
     * @param privateKey our private key
     * @throws CryptoException if the public key is a low-order point
     */
    public CurveBox(byte[] publicKey, byte[] privateKey) {
        if (publicKey.length != KeyEncoding.KEY_LENGTH || privateKey.length != KeyEncoding.KEY_LENGTH) {
            throw new IllegalArgumentException("Keys must be " + KeyEncoding.KEY_LENGTH + " bytes");
        }
        this.sharedKey = hsalsa20(agree(publicKey, privateKey), new byte[16]);
    }

    /**
     * Creates a box for opening a message from a sender whose public key came with the message.
     * A sender key that cannot be agreed with means the message cannot be decrypted.
     * @param senderPublicKey the public key carried by the message
     * @param privateKey our private key
     * @throws DecryptionFailedException if the sender key is a low-order point
     */
    public static CurveBox forOpening(byte[] senderPublicKey, byte[] privateKey) {
        try {
            return new CurveBox(senderPublicKey, privateKey);
        }
        catch (CryptoException e) {
            throw new DecryptionFailedException("Message public key is not usable", e);
        }
    }

    /**
     * Encrypts and authenticates.
     * @param nonce 24 bytes never used before with this pair of keys
     * @param plaintext the message
     * @return the box
     */
    public byte[] seal(byte[] nonce, byte[] plaintext) {
        XSalsa20Engine cipher = newCipher(nonce);
        byte[] polyKey = keystream(cipher, POLY1305_KEY_LENGTH);
        byte[] box = new byte[TAG_LENGTH + plaintext.length];
        cipher.processBytes(plaintext, 0, plaintext.length, box, TAG_LENGTH);
        authenticate(polyKey, box, TAG_LENGTH, plaintext.length, box, 0);
        return box;
    }

    /**
     * Verifies and decrypts.
     * @param nonce the nonce the box was sealed with
     * @param box the box
     * @return the message
     * @throws DecryptionFailedException if the box does not authenticate
     */
    public byte[] open(byte[] nonce, byte[] box) {
        if (box.length < TAG_LENGTH) {
            throw new DecryptionFailedException("Box of " + box.length + " bytes is shorter than its authenticator");
        }
        XSalsa20Engine cipher = newCipher(nonce);
        byte[] polyKey = keystream(cipher, POLY1305_KEY_LENGTH);
        int length = box.length - TAG_LENGTH;
        byte[] tag = new byte[TAG_LENGTH];
        authenticate(polyKey, box, TAG_LENGTH, length, tag, 0);
        if (!Arrays.constantTimeAreEqual(TAG_LENGTH, tag, 0, box, 0)) {
            throw new DecryptionFailedException("Message failed authentication");
        }
        byte[] plaintext = new byte[length];
        cipher.processBytes(box, TAG_LENGTH, length, plaintext, 0);
        return plaintext;
    }

    private XSalsa20Engine newCipher(byte[] nonce) {
        if (nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("Nonce must be " + NONCE_LENGTH + " bytes, was " + nonce.length);
        }
        XSalsa20Engine cipher = new XSalsa20Engine();
        cipher.init(true, new ParametersWithIV(new KeyParameter(sharedKey), nonce));
        return cipher;
    }

    private static byte[] keystream(XSalsa20Engine cipher, int length) {
        byte[] out = new byte[length];
        cipher.processBytes(new byte[length], 0, length, out, 0);
        return out;
    }

    private static void authenticate(byte[] polyKey, byte[] in, int inOff, int length, byte[] out, int outOff) {
        Poly1305 mac = new Poly1305();
        mac.init(new KeyParameter(polyKey));
        mac.update(in, inOff, length);
        mac.doFinal(out, outOff);
    }

    static byte[] agree(byte[] publicKey, byte[] privateKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(new X25519PrivateKeyParameters(privateKey, 0));
        byte[] shared = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(new X25519PublicKeyParameters(publicKey, 0), shared, 0);
        }
        catch (IllegalStateException e) {
            throw new CryptoException("Key agreement failed", e);
        }
        return shared;
    }

    static byte[] hsalsa20(byte[] key, byte[] nonce) {
        int[] state = new int[16];
        state[0] = SIGMA[0];
        state[5] = SIGMA[1];
        state[10] = SIGMA[2];
        state[15] = SIGMA[3];
        for (int i = 0; i < 4; i++) {
            state[1 + i] = Pack.littleEndianToInt(key, 4 * i);
            state[6 + i] = Pack.littleEndianToInt(nonce, 4 * i);
            state[11 + i] = Pack.littleEndianToInt(key, 16 + 4 * i);
        }
        int[] x = new int[16];
        // salsaCore adds the input back in, which HSalsa20 does not
        Salsa20Engine.salsaCore(20, state, x);
        int[] out = {
                x[0] - state[0], x[5] - state[5], x[10] - state[10], x[15] - state[15],
                x[6] - state[6], x[7] - state[7], x[8] - state[8], x[9] - state[9]
        };
        return Pack.intToLittleEndian(out);
    }
}
