/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser;

/**
 * How a scalar was written in its source document.
 * Each kind knows how to turn its exact source text into the logical string value
 * and how much of that text a rewrite should replace.
 */
public enum ScalarKind {

    /**
     * A YAML plain scalar. Its type is decided later by matching it against the core schema.
     */
    PLAIN {
        @Override
        public String decode(String source, int indentation) {
            return LineFolding.fold(source, false);
        }
    },

    /**
     * A bare TOML key. Always a string.
     */
    UNQUOTED_STRING {
        @Override
        public String decode(String source, int indentation) {
            return source;
        }
    },

    DOUBLE_QUOTED {
        @Override
        public String decode(String source, int indentation) {
            return Escapes.unescape(LineFolding.fold(stripDelimiters(source, 1), true), false);
        }
    },

    SINGLE_QUOTED {
        @Override
        public String decode(String source, int indentation) {
            return LineFolding.fold(stripDelimiters(source, 1), false).replace("''", "'");
        }
    },

    /**
     * TOML {@code """..."""}.
     */
    TOML_MULTILINE_BASIC {
        @Override
        public String decode(String source, int indentation) {
            return Escapes.unescape(dropLeadingNewline(stripDelimiters(source, 3)), true);
        }
    },

    /**
     * TOML {@code '''...'''}.
     */
    TOML_MULTILINE_LITERAL {
        @Override
        public String decode(String source, int indentation) {
            return dropLeadingNewline(stripDelimiters(source, 3));
        }
    },

    /**
     * YAML {@code |} block scalar.
     */
    BLOCK_LITERAL {
        @Override
        public String decode(String source, int indentation) {
            return BlockScalars.literal(source, indentation);
        }

        @Override
        public int rewriteLength(String source) {
            return BlockScalars.contentEnd(source);
        }
    },

    /**
     * YAML {@code >} block scalar.
     */
    BLOCK_FOLDED {
        @Override
        public String decode(String source, int indentation) {
            return BlockScalars.folded(source, indentation);
        }

        @Override
        public int rewriteLength(String source) {
            return BlockScalars.contentEnd(source);
        }
    };

    /**
     * Computes the logical value of a scalar of this kind.
     * @param source the exact source text of the scalar
     * @param indentation the resolved content indentation for block scalars, or -1 to work it out from the source
     * @return the decoded value
     */
    public abstract String decode(String source, int indentation);

    /**
     * Decodes a scalar whose indentation, if any, should be worked out from its source.
     * @param source the exact source text of the scalar
     * @return the decoded value
     */
    public String decode(String source) {
        return decode(source, -1);
    }

    /**
     * The number of leading chars of the source text a rewrite replaces.
     * Block scalars leave their trailing line breaks and blank lines in place.
     * @param source the exact source text of the scalar
     * @return the length to replace
     */
    public int rewriteLength(String source) {
        return source.length();
    }

    static String stripDelimiters(String source, int width) {
        if (source.length() < 2 * width) {
            throw new IllegalArgumentException("Scalar text too short to be delimited: " + source.length() + " chars");
        }
        return source.substring(width, source.length() - width);
    }

    static String dropLeadingNewline(String content) {
        if (content.startsWith("\r\n")) {
            return content.substring(2);
        }
        if (content.startsWith("\n")) {
            return content.substring(1);
        }
        return content;
    }
}
