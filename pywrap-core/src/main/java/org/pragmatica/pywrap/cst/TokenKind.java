package org.pragmatica.pywrap.cst;

/**
 * Kinds of leaf tokens in the concrete syntax tree.
 */
public enum TokenKind {
    NAME,
    NUMBER,
    STRING,
    OPERATOR,
    COMMA,
    DOT,
    COLON,
    NEWLINE,
    INDENT,
    DEDENT,
    LPAR,
    RPAR,
    LSQB,
    RSQB,
    LBRACE,
    RBRACE,
    ENDMARKER;

    public boolean isOpeningBracket() {
        return this == LPAR || this == LSQB || this == LBRACE;
    }

    public boolean isClosingBracket() {
        return this == RPAR || this == RSQB || this == RBRACE;
    }

    /**
     * Statement terminators: a physical newline ending a logical line, or the colon opening a block.
     */
    public boolean isTerminator() {
        return this == NEWLINE || this == COLON;
    }
}
