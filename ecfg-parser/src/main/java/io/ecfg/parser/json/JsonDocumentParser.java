/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.json;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.ecfg.parser.DocumentParser;
import io.ecfg.parser.RawNode;
import io.ecfg.parser.RawNode.IgnoreNode;
import io.ecfg.parser.RawNode.MapNode;
import io.ecfg.parser.RawNode.PairNode;
import io.ecfg.parser.RawNode.ScalarNode;
import io.ecfg.parser.RawNode.SeqNode;
import io.ecfg.parser.ScalarKind;
import io.ecfg.parser.Span;
import io.ecfg.parser.SyntaxException;

/**
 * A JSON parser built on the ANTLR {@code Json} grammar.
 * Strings become double-quoted scalars; numbers, booleans and null are ignored.
 */
public final class JsonDocumentParser implements DocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocumentParser.class);

    @Override
    public RawNode parse(String text) {
        var offsets = new CodePointOffsets(Objects.requireNonNull(text));
        var parser = parserFor(text, offsets);
        var jsonContext = parser.json();
        var builder = new TreeBuilder(offsets);
        new ParseTreeWalker().walk(builder, jsonContext);
        RawNode root = builder.root();
        LOGGER.debug("Parsed JSON document of {} chars", text.length());
        return root;
    }

    static JsonParser parserFor(String text, CodePointOffsets offsets) {
        var errorListener = new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e) {
                int offset = offendingSymbol instanceof Token token && token.getStartIndex() >= 0
                        ? offsets.toCharIndex(token.getStartIndex())
                        : offsets.lineColumnToCharIndex(line, charPositionInLine);
                throw SyntaxException.at(text, offset, "Invalid JSON: " + msg);
            }
        };
        var lexer = new JsonLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);
        var parser = new JsonParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser;
    }

    /**
     * Builds the raw tree bottom up: each collection and pair collects the nodes of its children in a frame.
     */
    private static class TreeBuilder extends JsonBaseListener {

        private final CodePointOffsets offsets;
        private final Deque<List<RawNode>> frames = new ArrayDeque<>();

        TreeBuilder(CodePointOffsets offsets) {
            this.offsets = offsets;
            frames.push(new ArrayList<>());
        }

        RawNode root() {
            List<RawNode> top = frames.peek();
            if (frames.size() != 1 || top == null || top.size() != 1) {
                throw new IllegalStateException("JSON tree was not fully built");
            }
            return top.get(0);
        }

        @Override
        public void visitErrorNode(ErrorNode node) {
            Token symbol = node.getSymbol();
            throw new SyntaxException("Invalid JSON: unexpected " + node.getText(), offsets.toCharIndex(symbol.getStartIndex()),
                    symbol.getLine(), symbol.getCharPositionInLine() + 1);
        }

        @Override
        public void enterObject(JsonParser.ObjectContext ctx) {
            frames.push(new ArrayList<>());
        }

        @Override
        public void exitObject(JsonParser.ObjectContext ctx) {
            List<PairNode> pairs = new ArrayList<>();
            for (RawNode node : frames.pop()) {
                pairs.add((PairNode) node);
            }
            append(new MapNode(pairs));
        }

        @Override
        public void enterArray(JsonParser.ArrayContext ctx) {
            frames.push(new ArrayList<>());
        }

        @Override
        public void exitArray(JsonParser.ArrayContext ctx) {
            append(new SeqNode(frames.pop()));
        }

        @Override
        public void enterPair(JsonParser.PairContext ctx) {
            frames.push(new ArrayList<>());
        }

        @Override
        public void exitPair(JsonParser.PairContext ctx) {
            List<RawNode> value = frames.pop();
            append(new PairNode(new ScalarNode(ScalarKind.DOUBLE_QUOTED, span(ctx.STRING().getSymbol())), value.get(0)));
        }

        @Override
        public void exitValue(JsonParser.ValueContext ctx) {
            if (ctx.STRING() != null) {
                append(new ScalarNode(ScalarKind.DOUBLE_QUOTED, span(ctx.STRING().getSymbol())));
            }
            else if (ctx.NUMBER() != null) {
                append(new IgnoreNode(span(ctx.NUMBER().getSymbol())));
            }
            else if (ctx.LITERAL() != null) {
                append(new IgnoreNode(span(ctx.LITERAL().getSymbol())));
            }
            // objects and arrays appended themselves on exit
        }

        private void append(RawNode node) {
            Objects.requireNonNull(frames.peek()).add(node);
        }

        private Span span(Token token) {
            return new Span(token.getText(), offsets.toCharIndex(token.getStartIndex()));
        }
    }
}
