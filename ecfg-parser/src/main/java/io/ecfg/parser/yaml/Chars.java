/*
 * Copyright ecfg Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ecfg.parser.yaml;

/**
 * Character classes of the YAML 1.2 grammar, as predicates over code points.
 */
final class Chars {

    static final String INDICATORS = "-?:,[]{}#&*!|>'\"%@`";
    static final String FLOW_INDICATORS = ",[]{}";
    static final String URI_PUNCTUATION = "#;/?:@&=+$,_.!~*'()[]";
    static final int BYTE_ORDER_MARK = 0xFEFF;

    private Chars() {
    }

    static boolean isPrintable(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0x7E)
                || cp == 0x85
                || (cp >= 0xA0 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    static boolean isBreak(int cp) {
        return cp == '\n' || cp == '\r';
    }

    static boolean isWhite(int cp) {
        return cp == ' ' || cp == '\t';
    }

    static boolean isNbChar(int cp) {
        return isPrintable(cp) && !isBreak(cp) && cp != BYTE_ORDER_MARK;
    }

    static boolean isNsChar(int cp) {
        return isNbChar(cp) && !isWhite(cp);
    }

    static boolean isJson(int cp) {
        return cp == 0x9 || (cp >= 0x20 && cp <= 0x10FFFF);
    }

    static boolean isIndicator(int cp) {
        return cp < 0x80 && INDICATORS.indexOf(cp) >= 0;
    }

    static boolean isFlowIndicator(int cp) {
        return cp < 0x80 && FLOW_INDICATORS.indexOf(cp) >= 0;
    }

    static boolean isDecDigit(int cp) {
        return cp >= '0' && cp <= '9';
    }

    static boolean isHexDigit(int cp) {
        return isDecDigit(cp) || (cp >= 'a' && cp <= 'f') || (cp >= 'A' && cp <= 'F');
    }

    static boolean isWordChar(int cp) {
        return isDecDigit(cp) || (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '-';
    }

    static boolean isUriChar(int cp) {
        return isWordChar(cp) || (cp < 0x80 && URI_PUNCTUATION.indexOf(cp) >= 0);
    }

    static boolean isTagChar(int cp) {
        return isUriChar(cp) && cp != '!' && !isFlowIndicator(cp);
    }

    static boolean isAnchorChar(int cp) {
        return isNsChar(cp) && !isFlowIndicator(cp);
    }
}
