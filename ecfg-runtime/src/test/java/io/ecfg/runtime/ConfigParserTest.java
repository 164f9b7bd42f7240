/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.runtime;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.ecfg.parser.Grammar;
import io.ecfg.transformer.OnFailure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void emptyMappingGivesDefaults() {
        EcfgConfig config = configParser.parseConfiguration("{}");

        assertThat(config).isEqualTo(EcfgConfig.DEFAULT);
        assertThat(config.onFailure()).isEqualTo(OnFailure.FAIL_FAST);
        assertThat(config.grammar()).isNull();
    }

    @Test
    void nullDocumentGivesDefaults() {
        assertThat(configParser.parseConfiguration("null")).isEqualTo(EcfgConfig.DEFAULT);
    }

    @Test
    void parsesAllProperties() {
        EcfgConfig config = configParser.parseConfiguration("""
                onFailure: CONTINUE
                grammar: YAML
                """);

        assertThat(config).isEqualTo(new EcfgConfig(OnFailure.CONTINUE, Grammar.YAML));
    }

    @Test
    void parsesFromStream() throws IOException {
        try (InputStream in = ConfigParserTest.class.getResourceAsStream("/ecfg-config.yaml")) {
            assertThat(configParser.parseConfiguration(in)).isEqualTo(new EcfgConfig(OnFailure.CONTINUE, Grammar.TOML));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "onFailure: CONTINUE\nverbose: true\n",
            "grammar: XML\n",
            "onFailure: CONTINUE\nonFailure: FAIL_FAST\n",
            "onFailure: [CONTINUE]\n"
    })
    void rejectsInvalidConfiguration(String yaml) {
        assertThatThrownBy(() -> configParser.parseConfiguration(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Couldn't parse configuration");
    }

    @Test
    void yamlRoundTrips() {
        var config = new EcfgConfig(OnFailure.CONTINUE, Grammar.JSON);

        String yaml = configParser.toYaml(config);

        assertThat(yaml).contains("onFailure").contains("CONTINUE").contains("grammar").contains("JSON");
        assertThat(configParser.parseConfiguration(yaml)).isEqualTo(config);
    }

    @Test
    void unsetGrammarIsNotWritten() {
        assertThat(configParser.toYaml(EcfgConfig.DEFAULT)).doesNotContain("grammar");
    }
}
