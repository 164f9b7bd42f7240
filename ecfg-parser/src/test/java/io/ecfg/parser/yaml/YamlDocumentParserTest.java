/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.yaml;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.EmptyNode;
import io.ecfg.parser.RawNode.IgnoreNode;
import io.ecfg.parser.RawNode.MapNode;
import io.ecfg.parser.RawNode.PairNode;
import io.ecfg.parser.RawNode.ScalarNode;
import io.ecfg.parser.RawNode.SeqNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;
import io.ecfg.parser.SyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlDocumentParserTest {

    private static RawNode parse(String text) {
        return new YamlDocumentParser().parse(text);
    }

    private static ScalarNode plain(String text, int offset) {
        return new ScalarNode(ScalarKind.PLAIN, new Span(text, offset));
    }

    private static PairNode pair(RawNode key, RawNode value) {
        return new PairNode(key, value);
    }

    @Test
    void parsesMappingOfScalarStyles() {
        RawNode root = parse("a: b\nc: 'd'\ne: |\n  asdf\n");

        assertThat(root).isEqualTo(new MapNode(List.of(
                pair(plain("a", 0), plain("b", 3)),
                pair(plain("c", 5), new ScalarNode(ScalarKind.SINGLE_QUOTED, new Span("'d'", 8))),
                pair(plain("e", 12), new ScalarNode(ScalarKind.BLOCK_LITERAL, new Span("|\n  asdf\n", 15), 2)))));
        MapNode map = (MapNode) root;
        assertThat(map.pairs()).extracting(p -> ((ScalarNode) p.value()).value()).containsExactly("b", "d", "asdf\n");
    }

    @Test
    void tagIsIgnoredInFavourOfContent() {
        RawNode root = parse("_b: !!str c");

        assertThat(root).isEqualTo(new MapNode(List.of(pair(plain("_b", 0), plain("c", 10)))));
    }

    @Test
    void anchorsAndAliases() {
        RawNode root = parse("a: &x foo\nb: *x\n");

        assertThat(root).isEqualTo(new MapNode(List.of(
                pair(plain("a", 0), plain("foo", 6)),
                pair(plain("b", 10), new IgnoreNode(new Span("*x", 13))))));
    }

    @Test
    void missingValueIsEmpty() {
        assertThat(parse("a:\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 0), new EmptyNode(2)))));
    }

    @Test
    void parsesBlockSequence() {
        assertThat(parse("- a\n- 'b'\n")).isEqualTo(new SeqNode(List.of(
                plain("a", 2),
                new ScalarNode(ScalarKind.SINGLE_QUOTED, new Span("'b'", 6)))));
    }

    @Test
    void parsesNestedBlockMapping() {
        assertThat(parse("a:\n  b: c\n")).isEqualTo(new MapNode(List.of(
                pair(plain("a", 0), new MapNode(List.of(pair(plain("b", 5), plain("c", 8))))))));
    }

    @Test
    void parsesFlowCollections() {
        assertThat(parse("{a: b, c: [d, 1]}")).isEqualTo(new MapNode(List.of(
                pair(plain("a", 1), plain("b", 4)),
                pair(plain("c", 7), new SeqNode(List.of(plain("d", 11), plain("1", 14)))))));
    }

    @Test
    void commentsAreNotContent() {
        assertThat(parse("# top\na: b # trailing\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 6), plain("b", 9)))));
    }

    @Test
    void hashInsidePlainScalarIsContent() {
        assertThat(parse("a: b#c\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 0), plain("b#c", 3)))));
    }

    @Test
    void multiLinePlainScalarKeepsSourceText() {
        RawNode root = parse("a: hello\n  world\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.span()).isEqualTo(new Span("hello\n  world", 3));
        assertThat(value.value()).isEqualTo("hello world");
    }

    @Test
    void multiLineDoubleQuotedScalar() {
        RawNode root = parse("a: \"x\n  y\"\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.kind()).isEqualTo(ScalarKind.DOUBLE_QUOTED);
        assertThat(value.value()).isEqualTo("x y");
    }

    @Test
    void foldedBlockScalarEndsBeforeNextKey() {
        RawNode root = parse("key: >-\n  folded\n  text\n\nnext: x\n");

        MapNode map = (MapNode) root;
        assertThat(map.pairs()).hasSize(2);
        ScalarNode value = (ScalarNode) map.pairs().get(0).value();
        assertThat(value).isEqualTo(new ScalarNode(ScalarKind.BLOCK_FOLDED, new Span(">-\n  folded\n  text\n\n", 5), 2));
        assertThat(value.value()).isEqualTo("folded text");
        assertThat(map.pairs().get(1)).isEqualTo(pair(plain("next", 25), plain("x", 31)));
    }

    @Test
    void streamOfDocumentsIsSequence() {
        assertThat(parse("---\na: 1\n---\nb: 2\n")).isEqualTo(new SeqNode(List.of(
                new MapNode(List.of(pair(plain("a", 4), plain("1", 7)))),
                new MapNode(List.of(pair(plain("b", 13), plain("2", 16)))))));
    }

    @Test
    void yamlDirectiveBeforeDocument() {
        assertThat(parse("%YAML 1.2\n---\na: b\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 14), plain("b", 17)))));
    }

    @Test
    void tagDirectiveBeforeDocument() {
        assertThat(parse("%TAG ! tag:example.com,2000:\n---\na: b\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 33), plain("b", 36)))));
    }

    @Test
    void explicitKeyEntry() {
        assertThat(parse("? a\n: b\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 2), plain("b", 6)))));
    }

    @Test
    void compactNestedSequence() {
        assertThat(parse("- - e\n")).isEqualTo(new SeqNode(List.of(new SeqNode(List.of(plain("e", 4))))));
    }

    @ParameterizedTest
    @ValueSource(strings = { "|-2", "|2-" })
    void indentationIndicatorWithChomping(String header) {
        RawNode root = parse("a: " + header + "\n   x\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value).isEqualTo(new ScalarNode(ScalarKind.BLOCK_LITERAL, new Span(header + "\n   x\n", 3), 2));
        assertThat(value.value()).isEqualTo(" x");
    }

    @Test
    void foldedKeepWithIndentationIndicator() {
        RawNode root = parse("a: >+1\n  x\n\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.indentation()).isEqualTo(1);
        assertThat(value.value()).isEqualTo(" x\n\n");
    }

    @Test
    void documentEndMarkerIsNotContent() {
        assertThat(parse("a: b\n...\n")).isEqualTo(new MapNode(List.of(pair(plain("a", 0), plain("b", 3)))));
    }

    @Test
    void trailingCommaInFlowSequence() {
        assertThat(parse("[x, y,]")).isEqualTo(new SeqNode(List.of(plain("x", 1), plain("y", 4))));
    }

    @Test
    void trailingCommaInFlowMapping() {
        assertThat(parse("{p: q,}")).isEqualTo(new MapNode(List.of(pair(plain("p", 1), plain("q", 4)))));
    }

    @Test
    void singlePairInFlowSequenceIsMapping() {
        assertThat(parse("[a: b]")).isEqualTo(new SeqNode(List.of(new MapNode(List.of(pair(plain("a", 1), plain("b", 4)))))));
    }

    @Test
    void quotedKeyInFlowMapping() {
        assertThat(parse("{\"_k\": v, k: w}")).isEqualTo(new MapNode(List.of(
                pair(new ScalarNode(ScalarKind.DOUBLE_QUOTED, new Span("\"_k\"", 1)), plain("v", 7)),
                pair(plain("k", 10), plain("w", 13)))));
    }

    @Test
    void literalBlockScalarWithCrlfBreaks() {
        RawNode root = parse("c: |\r\n  d\r\n  e\r\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.span()).isEqualTo(new Span("|\r\n  d\r\n  e\r\n", 3));
        assertThat(value.value()).isEqualTo("d\ne\n");
    }

    @Test
    void foldedBlockScalarWithCrlfBreaks() {
        RawNode root = parse("c: >\r\n  d\r\n  e\r\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.value()).isEqualTo("d e\n");
    }

    @Test
    void largeFlowSequence() {
        String text = IntStream.range(0, 10_000).mapToObj(i -> "x" + i).collect(Collectors.joining(", ", "a: [", "]\n"));

        SeqNode items = (SeqNode) ((MapNode) parse(text)).pairs().get(0).value();
        assertThat(items.items()).hasSize(10_000);
        assertThat(items.items().get(9_999)).isEqualTo(plain("x9999", text.lastIndexOf("x9999")));
    }

    @Test
    void largeFlowMapping() {
        String text = IntStream.range(0, 10_000).mapToObj(i -> "k" + i + ": v" + i).collect(Collectors.joining(", ", "{", "}\n"));

        MapNode map = (MapNode) parse(text);
        assertThat(map.pairs()).hasSize(10_000);
        assertThat(map.pairs().get(9_999)).isEqualTo(pair(plain("k9999", text.lastIndexOf("k9999")), plain("v9999", text.lastIndexOf("v9999"))));
    }

    @Test
    void doubleQuotedScalarOverManyLines() {
        List<String> words = IntStream.range(0, 10_000).mapToObj(i -> "w" + i).toList();

        RawNode root = parse("a: \"" + String.join("\n  ", words) + "\"\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.value()).isEqualTo(String.join(" ", words));
    }

    @Test
    void singleQuotedScalarOverManyLines() {
        List<String> words = IntStream.range(0, 10_000).mapToObj(i -> "w" + i).toList();

        RawNode root = parse("a: '" + String.join("\n  ", words) + "'\n");

        ScalarNode value = (ScalarNode) ((MapNode) root).pairs().get(0).value();
        assertThat(value.value()).isEqualTo(String.join(" ", words));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "# only a comment\n", "\n\n" })
    void documentWithoutContentIsEmpty(String text) {
        assertThat(parse(text)).isEqualTo(new EmptyNode(0));
    }

    @Test
    void unterminatedFlowSequenceIsSyntaxError() {
        assertThatThrownBy(() -> parse("a: [b\n"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> assertThat(e.offset()).isGreaterThanOrEqualTo(3));
    }
}
