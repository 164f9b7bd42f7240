/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

import java.util.Locale;
import java.util.function.Supplier;

import io.ecfg.parser.json.JsonDocumentParser;
import io.ecfg.parser.toml.TomlDocumentParser;
import io.ecfg.parser.yaml.YamlDocumentParser;

/**
 * The document formats that can be parsed.
 */
public enum Grammar {
    YAML(YamlDocumentParser::new, ".yaml", ".yml"),
    JSON(JsonDocumentParser::new, ".json"),
    TOML(TomlDocumentParser::new, ".toml");

    private final Supplier<DocumentParser> parserFactory;
    private final String[] extensions;

    Grammar(Supplier<DocumentParser> parserFactory, String... extensions) {
        this.parserFactory = parserFactory;
        this.extensions = extensions;
    }

    /**
     * @return a new parser, for the exclusive use of the caller
     */
    public DocumentParser newParser() {
        return parserFactory.get();
    }

    /**
     * Parses the given text with a fresh parser for this grammar.
     * @param text the document
     * @return the root node
     * @throws SyntaxException if the text is not a well-formed document
     */
    public RawNode parse(String text) {
        return newParser().parse(text);
    }

    /**
     * Picks the grammar from a file name's extension.
     * @param fileName a file name or path
     * @return the grammar
     * @throws IllegalArgumentException if the extension is not recognised
     */
    public static Grammar forFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (Grammar grammar : values()) {
            for (String extension : grammar.extensions) {
                if (lower.endsWith(extension)) {
                    return grammar;
                }
            }
        }
        throw new IllegalArgumentException("Cannot determine document format of '" + fileName + "'");
    }
}
