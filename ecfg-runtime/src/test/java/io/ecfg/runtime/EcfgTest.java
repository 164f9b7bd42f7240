/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.runtime;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.ecfg.crypto.DecryptionFailedException;
import io.ecfg.crypto.HexKeyPair;
import io.ecfg.crypto.InvalidMessageFormatException;
import io.ecfg.parser.Grammar;
import io.ecfg.transformer.OnFailure;
import io.ecfg.transformer.TransformResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EcfgTest {

    private static final String YAML = """
            # database
            _public_key: abc
            db:
              user: admin
              password: hunter2
              port: 5432
            """;

    private HexKeyPair keys;
    private Ecfg ecfg;

    @BeforeEach
    void setUp() {
        keys = Ecfg.generateKeyPair();
        ecfg = new Ecfg();
    }

    @Test
    void defaultsToFailFast() {
        assertThat(ecfg.config().onFailure()).isEqualTo(OnFailure.FAIL_FAST);
    }

    @Test
    void encryptsOnlyEligibleValues() {
        TransformResult encrypted = ecfg.encrypt(YAML, Grammar.YAML, keys.publicKey());

        assertThat(encrypted.hasFailures()).isFalse();
        assertThat(encrypted.output())
                .startsWith("# database\n_public_key: abc\ndb:\n  user: \"EJ[1:")
                .contains("  password: \"EJ[1:")
                .endsWith("  port: 5432\n")
                .doesNotContain("admin")
                .doesNotContain("hunter2");
    }

    @Test
    void decryptRestoresValues() {
        String encrypted = ecfg.encrypt(YAML, Grammar.YAML, keys.publicKey()).output();

        TransformResult decrypted = ecfg.decrypt(encrypted, Grammar.YAML, keys.privateKey());

        assertThat(decrypted.output()).isEqualTo("""
                # database
                _public_key: abc
                db:
                  user: "admin"
                  password: "hunter2"
                  port: 5432
                """);
    }

    @Test
    void formatFollowsFileName() {
        String json = "{\"_public_key\": \"abc\", \"secret\": \"s3cr3t\", \"n\": 1}";

        String encrypted = ecfg.encryptByFileName(json, "secrets.json", keys.publicKey()).output();

        assertThat(encrypted).startsWith("{\"_public_key\": \"abc\", \"secret\": \"EJ[1:").endsWith("\", \"n\": 1}");
        assertThat(ecfg.decryptByFileName(encrypted, "secrets.json", keys.privateKey()).output()).isEqualTo(json);
    }

    @Test
    void tomlRoundTrip() {
        String toml = "[db]\npassword = 'hunter2'\nport = 5432\n";

        String encrypted = ecfg.encryptByFileName(toml, "app.toml", keys.publicKey()).output();

        assertThat(ecfg.decrypt(encrypted, Grammar.TOML, keys.privateKey()).output()).isEqualTo("[db]\npassword = \"hunter2\"\nport = 5432\n");
    }

    @Test
    void unknownFileNameIsRejected() {
        assertThatThrownBy(() -> ecfg.encryptByFileName(YAML, "secrets.ini", keys.publicKey()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("secrets.ini");
    }

    @Test
    void missingFormatIsAConfigurationError() {
        assertThatThrownBy(() -> ecfg.encrypt(YAML, null, keys.publicKey()))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("No document format was given and none is configured");
    }

    @Test
    void configuredFormatWins() {
        var configured = new Ecfg(new EcfgConfig(null, Grammar.JSON));
        String json = "{\"a\": \"b\"}";

        assertThat(configured.encrypt(json, null, keys.publicKey()).output()).startsWith("{\"a\": \"EJ[1:");
        assertThat(configured.encrypt(json, Grammar.TOML, keys.publicKey()).output()).startsWith("{\"a\": \"EJ[1:");
        assertThat(configured.encryptByFileName(json, "config.yaml", keys.publicKey()).output()).startsWith("{\"a\": \"EJ[1:");
    }

    @Test
    void wrongKeyFailsFast() {
        String encrypted = ecfg.encrypt(YAML, Grammar.YAML, keys.publicKey()).output();
        String otherKey = Ecfg.generateKeyPair().privateKey();

        assertThatThrownBy(() -> ecfg.decrypt(encrypted, Grammar.YAML, otherKey)).isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void plaintextFailsFast() {
        assertThatThrownBy(() -> ecfg.decrypt(YAML, Grammar.YAML, keys.privateKey())).isInstanceOf(InvalidMessageFormatException.class);
    }

    @Test
    void continueLeavesUndecryptableValuesInPlace() {
        var lenient = new Ecfg(new EcfgConfig(OnFailure.CONTINUE, null));
        String partlyEncrypted = "a: plain\nb: " + lenient.encrypt("x: secret\n", Grammar.YAML, keys.publicKey()).output().substring(3);

        TransformResult result = lenient.decrypt(partlyEncrypted, Grammar.YAML, keys.privateKey());

        assertThat(result.output()).isEqualTo("a: plain\nb: \"secret\"\n");
        assertThat(result.failures()).singleElement()
                .satisfies(failure -> assertThat(failure.exception()).isInstanceOf(InvalidMessageFormatException.class));
    }
}
