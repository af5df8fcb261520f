package org.pragmatica.pywrap.parser;

import org.pragmatica.pywrap.cst.CstLeaf;
import org.pragmatica.pywrap.cst.TokenKind;

/**
 * Token produced by {@link PyTokenizer}. Line is one-based, column zero-based; both point at the
 * first character of the value.
 */
public record PyToken(TokenKind kind, String value, String prefix, int line, int column) {
    public CstLeaf toLeaf() {
        return CstLeaf.leaf(kind, value, prefix);
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }
}
