/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.transformer;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.ecfg.parser.Grammar;
import io.ecfg.parser.SyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class TransformerTest {

    private static final UnaryOperator<String> BRACKET = s -> "<" + s + ">";

    private static List<String> values(String input, Grammar grammar) {
        return Transformer.slices(input, grammar).stream().map(EncryptableSlice::value).toList();
    }

    @Test
    void jsonStringValueIsRewritten() {
        String input = "{\"a\": \"b\"}";

        assertThat(Transformer.slices(input, Grammar.JSON)).containsExactly(new EncryptableSlice(6, 9, "b"));
        assertThat(Transformer.transform(input, Grammar.JSON, String::toUpperCase)).isEqualTo("{\"a\": \"B\"}");
    }

    @Test
    void yamlScalarsOfEveryStyleBecomeDoubleQuoted() {
        assertThat(Transformer.transform("a: b\nc: 'd'\ne: |\n  asdf\n", Grammar.YAML, UnaryOperator.identity()))
                .isEqualTo("a: \"b\"\nc: \"d\"\ne: \"asdf\\n\"\n");
    }

    @Test
    void crlfAfterBlockScalarIsKept() {
        assertThat(Transformer.transform("c: |\r\n  d\r\n  e\r\nf: g\r\n", Grammar.YAML, UnaryOperator.identity()))
                .isEqualTo("c: \"d\\ne\\n\"\r\nf: \"g\"\r\n");
    }

    @Test
    void suppressedValueIsLeftAlone() {
        String input = "_b: !!str c";

        assertThat(Transformer.slices(input, Grammar.YAML)).isEmpty();
        assertThat(Transformer.transform(input, Grammar.YAML, BRACKET)).isEqualTo(input);
    }

    @Test
    void tomlMultiLineStringDropsLeadingNewline() {
        String input = "d = \"\"\"\nasdf\n\"\"\"";

        assertThat(Transformer.slices(input, Grammar.TOML)).containsExactly(new EncryptableSlice(4, 17, "asdf\n"));
        assertThat(Transformer.transform(input, Grammar.TOML, UnaryOperator.identity())).isEqualTo("d = \"asdf\\n\"");
    }

    @Test
    void yamlLayoutOutsideStringsIsPreserved() {
        String input = """
                # service settings
                port: 8080  # public
                name: web
                list: [a, 1, true]
                _key: abc
                """;

        assertThat(Transformer.transform(input, Grammar.YAML, BRACKET)).isEqualTo("""
                # service settings
                port: 8080  # public
                name: "<web>"
                list: ["<a>", 1, true]
                _key: abc
                """);
    }

    @Test
    void tomlLayoutOutsideStringsIsPreserved() {
        String input = """
                [server]
                host = 'example.com' # where
                port = 80
                tags = ["x", 2]
                """;

        assertThat(Transformer.transform(input, Grammar.TOML, BRACKET)).isEqualTo("""
                [server]
                host = "<example.com>" # where
                port = 80
                tags = ["<x>", 2]
                """);
    }

    static Stream<Arguments> identityTransformIsIdempotent() {
        return Stream.of(
                argumentSet("YAML", Grammar.YAML, "a: b\nc: [\"d\", 1]\ne: >\n  folded\n  text\n"),
                argumentSet("JSON", Grammar.JSON, "{\"a\": [\"b\", {\"c\": \"d\\u00e9\"}], \"n\": null}"),
                argumentSet("TOML", Grammar.TOML, "a = \"b\"\n[t]\nc = ['d', 1]\n"));
    }

    @ParameterizedTest
    @MethodSource
    void identityTransformIsIdempotent(Grammar grammar, String input) {
        String once = Transformer.transform(input, grammar, UnaryOperator.identity());
        String twice = Transformer.transform(once, grammar, UnaryOperator.identity());

        assertThat(twice).isEqualTo(once);
        assertThat(values(once, grammar)).isEqualTo(values(input, grammar));
    }

    @Test
    void continueReportsEveryFailure() {
        UnaryOperator<String> failOnB = s -> {
            if (s.startsWith("b")) {
                throw new IllegalArgumentException("no b allowed");
            }
            return s.toUpperCase();
        };

        TransformResult result = Transformer.transform("- a\n- b1\n- b2\n- c\n", Grammar.YAML, failOnB, OnFailure.CONTINUE);

        assertThat(result.output()).isEqualTo("- \"A\"\n- b1\n- b2\n- \"C\"\n");
        assertThat(result.failures()).extracting(failure -> failure.slice().value()).containsExactly("b1", "b2");
    }

    @Test
    void malformedDocumentIsRejected() {
        assertThatThrownBy(() -> Transformer.transform("{\"a\": ", Grammar.JSON, BRACKET)).isInstanceOf(SyntaxException.class);
    }
}
