/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.params.provider.Arguments.argumentSet;

class ScalarKindTest {

    static Stream<Arguments> decodes() {
        return Stream.of(
                argumentSet("plain", ScalarKind.PLAIN, "hello world", "hello world"),
                argumentSet("plain folded over lines", ScalarKind.PLAIN, "hello\n  world", "hello world"),
                argumentSet("plain with empty line", ScalarKind.PLAIN, "hello\n\n  world", "hello\nworld"),
                argumentSet("plain keeps backslashes", ScalarKind.PLAIN, "a\\nb", "a\\nb"),
                argumentSet("unquoted key", ScalarKind.UNQUOTED_STRING, "bare-key_1", "bare-key_1"),
                argumentSet("double quoted", ScalarKind.DOUBLE_QUOTED, "\"b\"", "b"),
                argumentSet("double quoted empty", ScalarKind.DOUBLE_QUOTED, "\"\"", ""),
                argumentSet("double quoted escapes", ScalarKind.DOUBLE_QUOTED, "\"a\\tb\\n\\\"c\\\"\\\\\"", "a\tb\n\"c\"\\"),
                argumentSet("double quoted hex escapes", ScalarKind.DOUBLE_QUOTED, "\"\\x41\\u00e9\\U0001F600\"", "Aé\uD83D\uDE00"),
                argumentSet("double quoted folded", ScalarKind.DOUBLE_QUOTED, "\"a\n  b\"", "a b"),
                argumentSet("double quoted escaped break", ScalarKind.DOUBLE_QUOTED, "\"a\\\n  b\"", "ab"),
                argumentSet("single quoted", ScalarKind.SINGLE_QUOTED, "'d'", "d"),
                argumentSet("single quoted doubled quote", ScalarKind.SINGLE_QUOTED, "'it''s'", "it's"),
                argumentSet("single quoted keeps backslashes", ScalarKind.SINGLE_QUOTED, "'a\\nb'", "a\\nb"),
                argumentSet("single quoted folded", ScalarKind.SINGLE_QUOTED, "'a\n\n  b'", "a\nb"),
                argumentSet("toml multi-line basic", ScalarKind.TOML_MULTILINE_BASIC, "\"\"\"\nasdf\n\"\"\"", "asdf\n"),
                argumentSet("toml multi-line basic without leading newline", ScalarKind.TOML_MULTILINE_BASIC, "\"\"\"a\\tb\"\"\"", "a\tb"),
                argumentSet("toml multi-line basic continuation", ScalarKind.TOML_MULTILINE_BASIC, "\"\"\"\nThe quick \\\n    brown fox\"\"\"",
                        "The quick brown fox"),
                argumentSet("toml multi-line literal", ScalarKind.TOML_MULTILINE_LITERAL, "'''\nC:\\path\n'''", "C:\\path\n"),
                argumentSet("block literal", ScalarKind.BLOCK_LITERAL, "|\n  asdf\n", "asdf\n"),
                argumentSet("block folded", ScalarKind.BLOCK_FOLDED, ">\n  a\n  b\n", "a b\n"));
    }

    @ParameterizedTest
    @MethodSource
    void decodes(ScalarKind kind, String source, String expected) {
        assertThat(kind.decode(source)).isEqualTo(expected);
    }

    @Test
    void blockScalarUsesGivenIndentation() {
        assertThat(ScalarKind.BLOCK_LITERAL.decode("|\n    a\n", 2)).isEqualTo("  a\n");
    }

    @Test
    void flowScalarsAreRewrittenWhole() {
        assertThat(ScalarKind.DOUBLE_QUOTED.rewriteLength("\"abc\"")).isEqualTo(5);
        assertThat(ScalarKind.PLAIN.rewriteLength("abc")).isEqualTo(3);
    }

    @Test
    void blockScalarRewriteStopsAtLastContentLine() {
        assertThat(ScalarKind.BLOCK_LITERAL.rewriteLength("|\n  asdf\n")).isEqualTo(8);
        assertThat(ScalarKind.BLOCK_FOLDED.rewriteLength(">+\n  a\n\n  b\n\n\n")).isEqualTo(11);
    }

    @Test
    void rejectsUndelimitedText() {
        assertThatThrownBy(() -> ScalarKind.TOML_MULTILINE_LITERAL.decode("''"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
