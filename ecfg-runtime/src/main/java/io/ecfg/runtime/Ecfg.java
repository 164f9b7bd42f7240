/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.runtime;

import java.util.Objects;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ecfg.crypto.Decrypter;
import io.ecfg.crypto.Encrypter;
import io.ecfg.crypto.HexKeyPair;
import io.ecfg.crypto.KeyPairs;
import io.ecfg.parser.Grammar;
import io.ecfg.transformer.TransformResult;
import io.ecfg.transformer.Transformer;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Encrypts and decrypts the string values of configuration documents.
 * <p>
 * Encryption only needs the recipient's public key, so documents can be updated by anyone holding it.
 * Values of keys starting with {@code _} are left in plaintext.
 */
public class Ecfg {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ecfg.class);

    private final EcfgConfig config;

    public Ecfg() {
        this(EcfgConfig.DEFAULT);
    }

    public Ecfg(EcfgConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public EcfgConfig config() {
        return config;
    }

    public static HexKeyPair generateKeyPair() {
        return KeyPairs.generate();
    }

    /**
     * Encrypts every eligible value of a document.
     * @param document the document text
     * @param grammar its format, or null to use the configured one
     * @param publicKeyHex the recipient's public key
     * @return the encrypted document
     */
    public TransformResult encrypt(String document, @Nullable Grammar grammar, String publicKeyHex) {
        return transform("encrypt", document, resolve(grammar), new Encrypter(publicKeyHex));
    }

    /**
     * Encrypts every eligible value of a document, working out its format from its file name.
     * @param document the document text
     * @param fileName the name of the file the document was read from
     * @param publicKeyHex the recipient's public key
     * @return the encrypted document
     */
    public TransformResult encryptByFileName(String document, String fileName, String publicKeyHex) {
        return transform("encrypt", document, forFileName(fileName), new Encrypter(publicKeyHex));
    }

    /**
     * Decrypts every eligible value of a document.
     * @param document the document text
     * @param grammar its format, or null to use the configured one
     * @param privateKeyHex our private key
     * @return the decrypted document
     */
    public TransformResult decrypt(String document, @Nullable Grammar grammar, String privateKeyHex) {
        return transform("decrypt", document, resolve(grammar), new Decrypter(privateKeyHex));
    }

    public TransformResult decryptByFileName(String document, String fileName, String privateKeyHex) {
        return transform("decrypt", document, forFileName(fileName), new Decrypter(privateKeyHex));
    }

    private TransformResult transform(String operation, String document, Grammar grammar, UnaryOperator<String> fn) {
        TransformResult result = Transformer.transform(document, grammar, fn, config.onFailure());
        if (result.hasFailures()) {
            LOGGER.warn("Failed to {} {} values of {} document", operation, result.failures().size(), grammar);
        }
        return result;
    }

    private Grammar resolve(@Nullable Grammar grammar) {
        if (config.grammar() != null) {
            return config.grammar();
        }
        if (grammar == null) {
            throw new IllegalConfigurationException("No document format was given and none is configured");
        }
        return grammar;
    }

    private Grammar forFileName(String fileName) {
        return config.grammar() != null ? config.grammar() : Grammar.forFileName(fileName);
    }
}
